package org.coursesched.data;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.coursesched.utils.TimeUtils;

/**
 * One weekly recurring block on a single weekday, in minutes since midnight.
 */
@Getter
@EqualsAndHashCode
public final class MeetingTime {
    private final Weekday day;
    private final int beginTime;
    private final int endTime;

    public MeetingTime(Weekday day, int beginTime, int endTime) {
        if (day == null) throw new IllegalArgumentException("Meeting day is required");
        if (beginTime >= endTime) {
            throw new IllegalArgumentException("Meeting must begin before it ends: " + beginTime + " >= " + endTime);
        }
        this.day = day;
        this.beginTime = beginTime;
        this.endTime = endTime;
    }

    public static MeetingTime of(Weekday day, String begin, String end) {
        return new MeetingTime(day, TimeUtils.hhmmToMinutes(begin), TimeUtils.hhmmToMinutes(end));
    }

    /**
     * Half-open overlap test: a block ending at 10:00 does not conflict with one starting at 10:00.
     */
    public boolean overlaps(MeetingTime other) {
        if (day != other.day) return false;
        return !(endTime <= other.beginTime || beginTime >= other.endTime);
    }

    public int getDurationMinutes() {
        return endTime - beginTime;
    }

    @Override
    public String toString() {
        return day.getShortName() + " " + TimeUtils.minutesToHhColonMm(beginTime) + "-" + TimeUtils.minutesToHhColonMm(endTime);
    }
}
