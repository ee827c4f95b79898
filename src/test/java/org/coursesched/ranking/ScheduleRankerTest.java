package org.coursesched.ranking;

import org.coursesched.data.MeetingTime;
import org.coursesched.data.ScheduleCandidate;
import org.coursesched.data.ScoredSchedule;
import org.coursesched.data.ScoringWeights;
import org.coursesched.data.Weekday;
import org.coursesched.scoring.ScheduleScorer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.coursesched.TestRecords.course;
import static org.coursesched.TestRecords.section;
import static org.junit.jupiter.api.Assertions.*;

class ScheduleRankerTest {

    private static List<ScheduleCandidate> candidates() {
        final var course = course("CSCI1200");
        final var result = new ArrayList<ScheduleCandidate>();
        for (var hour = 7; hour < 13; hour++) {
            result.add(new ScheduleCandidate(List.of(section(course, "S" + hour,
                    new MeetingTime(Weekday.MONDAY, hour * 60, hour * 60 + 50),
                    new MeetingTime(Weekday.WEDNESDAY, hour * 60, hour * 60 + 50),
                    new MeetingTime(Weekday.FRIDAY, hour * 60, hour * 60 + 50)))));
        }
        return result;
    }

    @Test
    void sortsDescendingAndTruncates() {
        final var ranked = new ScheduleRanker(new ScheduleScorer(new ScoringWeights()), 3).rank(candidates());

        assertEquals(3, ranked.size());
        for (var i = 1; i < ranked.size(); i++) {
            assertTrue(ranked.get(i - 1).getScore() >= ranked.get(i).getScore());
        }
        assertEquals("[S10]", ranked.get(0).getCandidate().toString());
    }

    @Test
    void tiesKeepGenerationOrder() {
        final var ranked = new ScheduleRanker(new ScheduleScorer(new ScoringWeights()), 10).rank(candidates());

        // 10:00, 11:00 and 12:00 starts all score the same
        assertEquals(List.of("[S10]", "[S11]", "[S12]", "[S9]", "[S8]", "[S7]"),
                ranked.stream().map(ScoredSchedule::getCandidate).map(Object::toString).toList());
    }

    @Test
    void returnsEverythingWhenFewerThanLimit() {
        assertTrue(new ScheduleRanker(new ScheduleScorer(new ScoringWeights()), 5).rank(List.of()).isEmpty());
    }
}
