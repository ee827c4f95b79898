package org.coursesched.data;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MeetingTimeTest {

    @Test
    void overlapIsSymmetric() {
        final var times = List.of(
                MeetingTime.of(Weekday.MONDAY, "0900", "0950"),
                MeetingTime.of(Weekday.MONDAY, "0930", "1020"),
                MeetingTime.of(Weekday.MONDAY, "0950", "1040"),
                MeetingTime.of(Weekday.MONDAY, "0800", "1200"),
                MeetingTime.of(Weekday.TUESDAY, "0900", "0950"));
        for (final var a : times) {
            for (final var b : times) {
                assertEquals(a.overlaps(b), b.overlaps(a), a + " vs " + b);
            }
        }
    }

    @Test
    void adjacentMeetingsDoNotConflict() {
        final var first = MeetingTime.of(Weekday.MONDAY, "0900", "1000");
        final var second = MeetingTime.of(Weekday.MONDAY, "1000", "1050");
        assertFalse(first.overlaps(second));
        assertFalse(second.overlaps(first));
    }

    @Test
    void partialAndContainedOverlapsConflict() {
        final var base = MeetingTime.of(Weekday.WEDNESDAY, "0900", "0950");
        assertTrue(base.overlaps(MeetingTime.of(Weekday.WEDNESDAY, "0930", "1020")));
        assertTrue(base.overlaps(MeetingTime.of(Weekday.WEDNESDAY, "0910", "0920")));
        assertTrue(base.overlaps(MeetingTime.of(Weekday.WEDNESDAY, "0800", "1200")));
        assertTrue(base.overlaps(base));
    }

    @Test
    void differentDaysNeverConflict() {
        assertFalse(MeetingTime.of(Weekday.MONDAY, "0900", "0950")
                .overlaps(MeetingTime.of(Weekday.FRIDAY, "0900", "0950")));
    }

    @Test
    void rejectsEmptyOrInvertedInterval() {
        assertThrows(IllegalArgumentException.class, () -> new MeetingTime(Weekday.MONDAY, 600, 600));
        assertThrows(IllegalArgumentException.class, () -> new MeetingTime(Weekday.MONDAY, 700, 600));
    }

    @Test
    void formatsForLogs() {
        assertEquals("Thu 14:00-15:20", MeetingTime.of(Weekday.THURSDAY, "1400", "1520").toString());
        assertEquals(80, MeetingTime.of(Weekday.THURSDAY, "1400", "1520").getDurationMinutes());
    }

    @Test
    void resolvesWeekdayNames() {
        assertEquals(Weekday.FRIDAY, Weekday.fromName("Friday"));
        assertEquals(Weekday.TUESDAY, Weekday.fromName(" tue "));
        assertThrows(IllegalArgumentException.class, () -> Weekday.fromName("Saturday"));
    }
}
