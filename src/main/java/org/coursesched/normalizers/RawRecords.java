package org.coursesched.normalizers;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

@UtilityClass
public class RawRecords {
    public static final String SUBJECT = "subject";
    public static final String SUBJECT_COURSE = "subjectCourse";
    public static final String COURSE_TITLE = "courseTitle";
    public static final String CREDIT_HOURS = "creditHours";
    public static final String SEATS_AVAILABLE = "seatsAvailable";
    public static final String COURSE_REFERENCE_NUMBER = "courseReferenceNumber";
    public static final String MEETINGS_FACULTY = "meetingsFaculty";
    public static final String MEETING_TIME = "meetingTime";
    public static final String BEGIN_TIME = "beginTime";
    public static final String END_TIME = "endTime";
    public static final String CREDIT_HOUR_SESSION = "creditHourSession";
    public static final String START_DATE = "startDate";
    public static final String END_DATE = "endDate";
    public static final String BUILDING = "building";
    public static final String BUILDING_DESCRIPTION = "buildingDescription";
    public static final String ROOM = "room";

    /** Returns the trimmed text of a scalar field, or {@code null} when missing, null or blank. */
    public static String text(JsonNode node, String field) {
        if (node == null) return null;
        final var value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        final var text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    /** Numeric field value, accepting numbers and numeric strings; {@code defaultValue} otherwise. */
    public static double number(JsonNode node, String field, double defaultValue) {
        if (node == null) return defaultValue;
        final var value = node.get(field);
        if (value == null || value.isNull()) return defaultValue;
        if (value.isNumber()) return value.asDouble();
        if (value.isTextual()) {
            try {
                final var parsed = Double.parseDouble(value.asText().trim());
                return Double.isFinite(parsed) ? parsed : defaultValue;
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static boolean flag(JsonNode node, String field) {
        if (node == null) return false;
        final var value = node.get(field);
        return value != null && value.asBoolean(false);
    }

    /** The {@code meetingTime} object of every meeting block, {@code null} where a block carries none. */
    public static List<JsonNode> meetingBlocks(JsonNode record) {
        final var result = new ArrayList<JsonNode>();
        final var blocks = record == null ? null : record.get(MEETINGS_FACULTY);
        if (blocks == null || !blocks.isArray()) return result;
        for (final var block : blocks) {
            final var meetingTime = block == null ? null : block.get(MEETING_TIME);
            result.add(meetingTime != null && meetingTime.isObject() ? meetingTime : null);
        }
        return result;
    }

    public static String crn(JsonNode record) {
        final var crn = text(record, COURSE_REFERENCE_NUMBER);
        return crn == null ? "" : crn;
    }
}
