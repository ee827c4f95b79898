package org.coursesched.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.DayOfWeek;
import java.util.Locale;

@Getter
@RequiredArgsConstructor
public enum Weekday {
    MONDAY("monday", "Mon", "Monday", "MO", DayOfWeek.MONDAY),
    TUESDAY("tuesday", "Tue", "Tuesday", "TU", DayOfWeek.TUESDAY),
    WEDNESDAY("wednesday", "Wed", "Wednesday", "WE", DayOfWeek.WEDNESDAY),
    THURSDAY("thursday", "Thu", "Thursday", "TH", DayOfWeek.THURSDAY),
    FRIDAY("friday", "Fri", "Friday", "FR", DayOfWeek.FRIDAY);

    /** Day flag key inside a raw meeting block. */
    private final String flagKey;
    private final String shortName;
    private final String longName;
    private final String rruleCode;
    private final DayOfWeek dayOfWeek;

    public static Weekday fromName(String name) {
        final var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (final var day : values()) {
            if (day.flagKey.equals(normalized) || day.shortName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return day;
            }
        }
        throw new IllegalArgumentException("Unknown day name: " + name);
    }
}
