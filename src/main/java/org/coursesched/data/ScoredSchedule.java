package org.coursesched.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class ScoredSchedule {
    private final ScheduleCandidate candidate;
    private final double score;
}
