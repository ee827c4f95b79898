package org.coursesched.export;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.data.MeetingView;
import org.coursesched.data.ScheduleView;
import org.coursesched.data.SectionView;
import org.coursesched.data.Weekday;
import org.coursesched.exceptions.ScheduleExportException;
import org.coursesched.utils.FileUtils;
import org.coursesched.utils.TimeUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@Slf4j
@RequiredArgsConstructor
public class CalendarExporter {
    private static final String LINE_END = "\r\n";
    private static final String PRODUCT_ID = "-//coursesched//Schedule Export//EN";
    private static final DateTimeFormatter ICS_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private final String timezone;
    private final Clock clock;

    public CalendarExporter(String timezone) {
        this(timezone, Clock.systemUTC());
    }

    public List<Path> export(Map<String, ScheduleView> schedules,
                             Path outputDirectory,
                             LocalDate termStart,
                             LocalDate termEnd,
                             Map<String, SectionMetadata> metadata) {
        if (termStart == null || termEnd == null) {
            final var derived = deriveTermBounds(schedules, metadata);
            if (termStart == null) termStart = derived[0];
            if (termEnd == null) termEnd = derived[1];
        }
        if (termStart == null || termEnd == null) {
            throw new ScheduleExportException("Unable to determine term start/end; configure termStart and termEnd.");
        }

        final var written = new ArrayList<Path>();
        try {
            FileUtils.ensureDirectory(outputDirectory);
            for (final var entry : schedules.entrySet()) {
                final var path = outputDirectory.resolve(fileName(entry.getKey()));
                Files.writeString(path, buildCalendar(entry.getKey(), entry.getValue(), termStart, termEnd, metadata), StandardCharsets.UTF_8);
                log.info("Wrote {}", path);
                written.add(path);
            }
        } catch (Exception e) {
            log.error("Failed to save calendars to " + outputDirectory.toAbsolutePath(), e);
            throw new ScheduleExportException("Failed to save calendars to " + outputDirectory.toAbsolutePath(), e);
        }
        return written;
    }

    public String buildCalendar(String label,
                                ScheduleView schedule,
                                LocalDate termStart,
                                LocalDate termEnd,
                                Map<String, SectionMetadata> metadata) {
        final var lines = new ArrayList<String>();
        lines.add("BEGIN:VCALENDAR");
        lines.add("VERSION:2.0");
        lines.add("PRODID:" + PRODUCT_ID);
        lines.add("X-WR-CALNAME:" + escapeText(label));
        for (final var section : schedule.getSections()) {
            for (final var meeting : section.getMeetings()) {
                lines.addAll(buildEvent(label, section, meeting, termStart, termEnd, metadata.get(section.getId())));
            }
        }
        lines.add("END:VCALENDAR");
        return String.join(LINE_END, lines) + LINE_END;
    }

    List<String> buildEvent(String label,
                            SectionView section,
                            MeetingView meeting,
                            LocalDate termStart,
                            LocalDate termEnd,
                            SectionMetadata sectionMetadata) {
        final var day = Weekday.fromName(meeting.getDayName());
        final var begin = toLocalTime(meeting.getBegin());
        final var end = toLocalTime(meeting.getEnd());

        final var firstDate = termStart.with(TemporalAdjusters.nextOrSame(day.getDayOfWeek()));
        var lastDate = termEnd.with(TemporalAdjusters.previousOrSame(day.getDayOfWeek()));
        if (lastDate.isBefore(firstDate)) lastDate = firstDate;

        final var crn = section.getId() == null ? "" : section.getId().trim();
        final var uidSeed = label + "-" + crn + "-" + meeting.getDayName() + "-" + meeting.getBegin() + "-" + meeting.getEnd();
        final var summary = (nullToEmpty(section.getCourseCode()) + " " + nullToEmpty(section.getTitle())).trim();

        final var lines = new ArrayList<String>();
        lines.add("BEGIN:VEVENT");
        lines.add("UID:" + UUID.nameUUIDFromBytes(uidSeed.getBytes(StandardCharsets.UTF_8)));
        lines.add("SUMMARY:" + escapeText(summary));
        lines.add("DTSTAMP:" + LocalDateTime.now(clock.withZone(ZoneOffset.UTC)).format(ICS_DATE_TIME) + "Z");
        lines.add("DTSTART;TZID=" + timezone + ":" + LocalDateTime.of(firstDate, begin).format(ICS_DATE_TIME));
        lines.add("DTEND;TZID=" + timezone + ":" + LocalDateTime.of(firstDate, end).format(ICS_DATE_TIME));
        lines.add("RRULE:FREQ=WEEKLY;BYDAY=" + day.getRruleCode() + ";UNTIL=" + LocalDateTime.of(lastDate, end).format(ICS_DATE_TIME));
        if (sectionMetadata != null && sectionMetadata.getLocation() != null) {
            lines.add("LOCATION:" + escapeText(sectionMetadata.getLocation()));
        }
        if (!crn.isEmpty()) {
            lines.add("DESCRIPTION:CRN: " + crn);
        }
        lines.add("END:VEVENT");
        return lines;
    }

    /**
     * Earliest start and latest end date among the sections present in the schedules; either may be null.
     */
    public static LocalDate[] deriveTermBounds(Map<String, ScheduleView> schedules, Map<String, SectionMetadata> metadata) {
        final var crns = schedules.values().stream()
                .flatMap(schedule -> schedule.getSections().stream())
                .map(SectionView::getId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        final var sections = crns.stream().map(metadata::get).filter(Objects::nonNull).toList();
        final var start = sections.stream().map(SectionMetadata::getStartDate).filter(Objects::nonNull).min(LocalDate::compareTo).orElse(null);
        final var end = sections.stream().map(SectionMetadata::getEndDate).filter(Objects::nonNull).max(LocalDate::compareTo).orElse(null);
        return new LocalDate[]{start, end};
    }

    static String fileName(String label) {
        return label.toLowerCase(Locale.ROOT).replace(' ', '_') + ".ics";
    }

    private static LocalTime toLocalTime(String hhmm) {
        final var minutes = TimeUtils.hhmmToMinutes(hhmm);
        return LocalTime.of(minutes / 60, minutes % 60);
    }

    static String escapeText(String value) {
        return value.replace("\\", "\\\\")
                .replace(";", "\\;")
                .replace(",", "\\,")
                .replace("\r\n", "\\n")
                .replace("\n", "\\n");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
