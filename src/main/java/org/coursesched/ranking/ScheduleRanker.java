package org.coursesched.ranking;

import lombok.RequiredArgsConstructor;
import org.coursesched.data.ScheduleCandidate;
import org.coursesched.data.ScoredSchedule;
import org.coursesched.scoring.ScheduleScorer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@RequiredArgsConstructor
public class ScheduleRanker {
    private final ScheduleScorer scorer;
    private final int maxSchedules;

    /**
     * Best {@code maxSchedules} candidates by descending score. The sort is stable, so equal scores keep
     * the order in which the candidates were generated.
     */
    public List<ScoredSchedule> rank(List<ScheduleCandidate> candidates) {
        final var scored = new ArrayList<ScoredSchedule>(candidates.size());
        for (final var candidate : candidates) {
            scored.add(new ScoredSchedule(candidate, scorer.score(candidate)));
        }
        scored.sort(Comparator.comparingDouble(ScoredSchedule::getScore).reversed());
        return List.copyOf(scored.subList(0, Math.min(maxSchedules, scored.size())));
    }
}
