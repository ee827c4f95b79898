package org.coursesched.scoring;

import org.coursesched.data.ScheduleCandidate;

@FunctionalInterface
public interface PenaltyHook {
    double apply(ScheduleCandidate candidate);
}
