package org.coursesched.export;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.normalizers.RawRecords;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.coursesched.normalizers.RawRecords.BEGIN_TIME;
import static org.coursesched.normalizers.RawRecords.BUILDING;
import static org.coursesched.normalizers.RawRecords.BUILDING_DESCRIPTION;
import static org.coursesched.normalizers.RawRecords.END_DATE;
import static org.coursesched.normalizers.RawRecords.ROOM;
import static org.coursesched.normalizers.RawRecords.START_DATE;

@Slf4j
@UtilityClass
public class SectionMetadataReader {
    private static final DateTimeFormatter RECORD_DATE_FORMATTER = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    /**
     * CRN to metadata for every record carrying a CRN. The first meeting block with a begin time is
     * preferred, falling back to the first block.
     */
    public static Map<String, SectionMetadata> read(List<JsonNode> records) {
        final var result = new LinkedHashMap<String, SectionMetadata>();
        for (final var record : records) {
            final var crn = RawRecords.crn(record);
            if (crn.isEmpty()) continue;

            final var blocks = RawRecords.meetingBlocks(record);
            final var block = blocks.stream()
                    .filter(b -> RawRecords.text(b, BEGIN_TIME) != null)
                    .findFirst()
                    .orElse(blocks.isEmpty() ? null : blocks.get(0));

            result.put(crn, new SectionMetadata(
                    crn,
                    parseDate(RawRecords.text(block, START_DATE)),
                    parseDate(RawRecords.text(block, END_DATE)),
                    location(block)));
        }
        return result;
    }

    private static String location(JsonNode block) {
        var building = RawRecords.text(block, BUILDING_DESCRIPTION);
        if (building == null) building = RawRecords.text(block, BUILDING);
        final var location = Stream.of(building, RawRecords.text(block, ROOM))
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "));
        return location.isEmpty() ? null : location;
    }

    private static LocalDate parseDate(String value) {
        if (value == null) return null;
        try {
            return LocalDate.parse(value, RECORD_DATE_FORMATTER);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparsable section date {}", value);
            return null;
        }
    }
}
