package org.coursesched.normalizers;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.data.Catalog;
import org.coursesched.data.MeetingTime;
import org.coursesched.data.OptimizationOptions;

import java.util.List;

import static org.coursesched.normalizers.RawRecords.COURSE_TITLE;
import static org.coursesched.normalizers.RawRecords.SEATS_AVAILABLE;
import static org.coursesched.normalizers.RawRecords.SUBJECT;
import static org.coursesched.normalizers.RawRecords.SUBJECT_COURSE;

@Slf4j
@RequiredArgsConstructor
public class CatalogNormalizer {
    private final OptimizationOptions options;

    public Catalog normalize(List<JsonNode> records) {
        final var catalog = new Catalog();
        var skipped = 0;

        for (final var record : records) {
            final var outcome = readSection(record);
            if (!outcome.isProduced()) {
                log.debug("Skipping section {}: {}", RawRecords.crn(record), outcome.getSkipReason());
                skipped++;
                continue;
            }
            final var section = outcome.getValue();
            catalog.getOrCreate(section.getCode(), section.getSubject(), section.getTitle(), section.getCredits())
                    .addSection(section.getCrn(), section.getMeetingTimes());
        }

        log.info("Normalized {} records into {} courses with {} sections ({} skipped).",
                records.size(), catalog.size(), catalog.getSectionCount(), skipped);
        return catalog;
    }

    Outcome<SectionRecord> readSection(JsonNode record) {
        if (record == null || !record.isObject()) {
            return Outcome.skipped("record is not an object");
        }

        final var seats = RawRecords.number(record, SEATS_AVAILABLE, 0.0);
        if (seats < options.getMinSeatsAvailable()) {
            return Outcome.skipped("only " + (long) seats + " seats available");
        }

        final var subject = RawRecords.text(record, SUBJECT);
        if (!options.getIncludeSubjects().isEmpty() && (subject == null || !options.getIncludeSubjects().contains(subject))) {
            return Outcome.skipped("subject " + subject + " not included");
        }
        if (subject != null && options.getExcludeSubjects().contains(subject)) {
            return Outcome.skipped("subject " + subject + " excluded");
        }

        final var code = RawRecords.text(record, SUBJECT_COURSE);
        if (code == null) {
            return Outcome.skipped("missing course code");
        }

        final var meetingTimes = MeetingTimeExtractor.extract(record);
        if (meetingTimes.isEmpty()) {
            return Outcome.skipped("no valid meeting times for " + code);
        }

        final var title = RawRecords.text(record, COURSE_TITLE);
        return Outcome.produced(new SectionRecord(
                subject,
                code,
                title == null ? "" : title,
                CreditCalculator.credits(record),
                RawRecords.crn(record),
                meetingTimes));
    }

    @Getter
    @RequiredArgsConstructor
    static final class SectionRecord {
        private final String subject;
        private final String code;
        private final String title;
        private final double credits;
        private final String crn;
        private final List<MeetingTime> meetingTimes;
    }
}
