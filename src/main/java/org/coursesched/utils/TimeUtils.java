package org.coursesched.utils;

import lombok.experimental.UtilityClass;

@UtilityClass
public class TimeUtils {
    public static final int MINUTES_IN_DAY = 24 * 60;

    /**
     * Parses a 24-hour {@code HHMM} string such as {@code 0930} into minutes since midnight.
     *
     * @throws IllegalArgumentException when the value is not four digits or not a valid time of day
     */
    public static int hhmmToMinutes(String hhmm) {
        if (hhmm == null) throw new IllegalArgumentException("Time is missing");
        final var value = hhmm.trim();
        if (value.length() != 4) throw new IllegalArgumentException("Invalid time format: " + hhmm);
        for (var i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) throw new IllegalArgumentException("Invalid time format: " + hhmm);
        }
        final var hours = Integer.parseInt(value.substring(0, 2));
        final var minutes = Integer.parseInt(value.substring(2));
        if (hours > 23 || minutes > 59) throw new IllegalArgumentException("Invalid time of day: " + hhmm);
        return hours * 60 + minutes;
    }

    public static String minutesToHhmm(int minutes) {
        return String.format("%02d%02d", minutes / 60, minutes % 60);
    }

    public static String minutesToHhColonMm(int minutes) {
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }
}
