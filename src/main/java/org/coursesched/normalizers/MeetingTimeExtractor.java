package org.coursesched.normalizers;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.data.MeetingTime;
import org.coursesched.data.Weekday;
import org.coursesched.utils.TimeUtils;

import java.util.ArrayList;
import java.util.List;

import static org.coursesched.normalizers.RawRecords.BEGIN_TIME;
import static org.coursesched.normalizers.RawRecords.END_TIME;

@Slf4j
@UtilityClass
public class MeetingTimeExtractor {

    public static List<MeetingTime> extract(JsonNode record) {
        final var result = new ArrayList<MeetingTime>();
        for (final var block : RawRecords.meetingBlocks(record)) {
            final var outcome = readBlock(block);
            if (outcome.isProduced()) {
                result.addAll(outcome.getValue());
            } else {
                log.debug("Skipping meeting block of section {}: {}", RawRecords.crn(record), outcome.getSkipReason());
            }
        }
        return result;
    }

    /**
     * One meeting time per day flag set in the block, all sharing the block's begin and end.
     */
    public static Outcome<List<MeetingTime>> readBlock(JsonNode block) {
        final var begin = RawRecords.text(block, BEGIN_TIME);
        final var end = RawRecords.text(block, END_TIME);
        if (begin == null || end == null) {
            return Outcome.skipped("missing begin or end time");
        }

        final int beginMinutes;
        final int endMinutes;
        try {
            beginMinutes = TimeUtils.hhmmToMinutes(begin);
            endMinutes = TimeUtils.hhmmToMinutes(end);
        } catch (IllegalArgumentException e) {
            return Outcome.skipped("invalid time format " + begin + "-" + end);
        }
        if (beginMinutes >= endMinutes) {
            return Outcome.skipped("non-positive duration " + begin + "-" + end);
        }

        final var meetingTimes = new ArrayList<MeetingTime>();
        for (final var day : Weekday.values()) {
            if (RawRecords.flag(block, day.getFlagKey())) {
                meetingTimes.add(new MeetingTime(day, beginMinutes, endMinutes));
            }
        }
        return Outcome.produced(meetingTimes);
    }
}
