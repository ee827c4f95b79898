package org.coursesched.export;

import org.coursesched.data.MeetingView;
import org.coursesched.data.ScheduleView;
import org.coursesched.data.SectionView;
import org.coursesched.exceptions.ScheduleExportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CalendarExporterTest {
    private static final LocalDate TERM_START = LocalDate.of(2026, 1, 8);
    private static final LocalDate TERM_END = LocalDate.of(2026, 4, 22);

    private final CalendarExporter exporter = new CalendarExporter(
            "America/New_York", Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC));

    private static ScheduleView schedule() {
        return new ScheduleView(97.5, List.of(new SectionView("40001", "CSCI1200", "DATA STRUCTURES", List.of(
                new MeetingView("Monday", "1000", "1150"),
                new MeetingView("Thursday", "1000", "1150")))));
    }

    private static Map<String, SectionMetadata> metadata() {
        return Map.of("40001", new SectionMetadata("40001", TERM_START, TERM_END, "DCC 308"));
    }

    @Test
    void buildsRecurringEventPerMeeting() {
        final var calendar = exporter.buildCalendar("Schedule 1", schedule(), TERM_START, TERM_END, metadata());

        assertTrue(calendar.startsWith("BEGIN:VCALENDAR\r\nVERSION:2.0\r\n"));
        assertTrue(calendar.endsWith("END:VCALENDAR\r\n"));
        assertTrue(calendar.contains("X-WR-CALNAME:Schedule 1\r\n"));
        assertEquals(2, calendar.split("BEGIN:VEVENT", -1).length - 1);
        assertTrue(calendar.contains("SUMMARY:CSCI1200 DATA STRUCTURES\r\n"));
        assertTrue(calendar.contains("DTSTAMP:20260101T120000Z\r\n"));
        assertTrue(calendar.contains("DTSTART;TZID=America/New_York:20260112T100000\r\n"));
        assertTrue(calendar.contains("DTEND;TZID=America/New_York:20260112T115000\r\n"));
        assertTrue(calendar.contains("RRULE:FREQ=WEEKLY;BYDAY=MO;UNTIL=20260420T115000\r\n"));
        assertTrue(calendar.contains("DTSTART;TZID=America/New_York:20260108T100000\r\n"));
        assertTrue(calendar.contains("RRULE:FREQ=WEEKLY;BYDAY=TH;UNTIL=20260416T115000\r\n"));
        assertTrue(calendar.contains("LOCATION:DCC 308\r\n"));
        assertTrue(calendar.contains("DESCRIPTION:CRN: 40001\r\n"));
    }

    @Test
    void eventIdsAreStable() {
        final var first = exporter.buildCalendar("Schedule 1", schedule(), TERM_START, TERM_END, metadata());
        final var second = exporter.buildCalendar("Schedule 1", schedule(), TERM_START, TERM_END, Map.of());
        final var uid = first.lines().filter(l -> l.startsWith("UID:")).findFirst().orElseThrow();
        assertTrue(second.contains(uid));
        assertFalse(second.contains("LOCATION:"));
    }

    @Test
    void shortTermStillProducesOneOccurrence() {
        final var event = exporter.buildEvent("Schedule 1", schedule().getSections().get(0),
                new MeetingView("Monday", "1000", "1150"), TERM_START, LocalDate.of(2026, 1, 9), null);
        assertTrue(event.contains("RRULE:FREQ=WEEKLY;BYDAY=MO;UNTIL=20260112T115000"));
    }

    @Test
    void derivesTermBoundsFromSectionsInOutput() {
        final Map<String, SectionMetadata> metadata = Map.of(
                "40001", new SectionMetadata("40001", LocalDate.of(2026, 1, 12), LocalDate.of(2026, 4, 22), null),
                "40002", new SectionMetadata("40002", LocalDate.of(2026, 1, 8), LocalDate.of(2026, 4, 29), null),
                "99999", new SectionMetadata("99999", LocalDate.of(2025, 9, 1), LocalDate.of(2026, 12, 1), null));
        final var schedules = Map.of("Schedule 1", new ScheduleView(1.0, List.of(
                new SectionView("40001", "CSCI1200", "DS", List.of()),
                new SectionView("40002", "MATH1020", "CALC", List.of()))));

        final var bounds = CalendarExporter.deriveTermBounds(schedules, metadata);

        assertEquals(LocalDate.of(2026, 1, 8), bounds[0]);
        assertEquals(LocalDate.of(2026, 4, 29), bounds[1]);
    }

    @Test
    void writesOneFilePerSchedule(@TempDir Path tempDir) throws Exception {
        final var schedules = new LinkedHashMap<String, ScheduleView>();
        schedules.put("Schedule 1", schedule());
        schedules.put("Schedule 2", schedule());

        final var written = exporter.export(schedules, tempDir.resolve("ics"), null, null, metadata());

        assertEquals(List.of(tempDir.resolve("ics/schedule_1.ics"), tempDir.resolve("ics/schedule_2.ics")), written);
        assertTrue(Files.readString(written.get(1)).contains("X-WR-CALNAME:Schedule 2"));
    }

    @Test
    void failsWithoutTermBounds(@TempDir Path tempDir) {
        final var schedules = Map.of("Schedule 1", schedule());
        assertThrows(ScheduleExportException.class,
                () -> exporter.export(schedules, tempDir, null, null, Map.of()));
    }

    @Test
    void escapesReservedCharactersInText() {
        final var section = new SectionView("40001", "CSCI1200", "DATA STRUCTURES; LAB, A\\B", List.of());
        final var event = exporter.buildEvent("Schedule 1", section, new MeetingView("Monday", "1000", "1150"),
                TERM_START, TERM_END, new SectionMetadata("40001", TERM_START, TERM_END, "Low Center, Room 1"));

        assertTrue(event.contains("SUMMARY:CSCI1200 DATA STRUCTURES\\; LAB\\, A\\\\B"));
        assertTrue(event.contains("LOCATION:Low Center\\, Room 1"));
        assertEquals("line\\nbreak", CalendarExporter.escapeText("line\nbreak"));
    }
}
