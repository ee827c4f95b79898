package org.coursesched.data;

import lombok.Getter;

import java.util.List;

@Getter
public final class Section {
    private final String crn;
    private final List<MeetingTime> meetingTimes;
    private final Course course;

    Section(String crn, List<MeetingTime> meetingTimes, Course course) {
        if (meetingTimes.isEmpty()) throw new IllegalArgumentException("Section " + crn + " has no meeting times");
        this.crn = crn;
        this.meetingTimes = List.copyOf(meetingTimes);
        this.course = course;
    }

    public boolean conflictsWith(Section other) {
        for (final var mine : meetingTimes) {
            for (final var theirs : other.meetingTimes) {
                if (mine.overlaps(theirs)) return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Section(" + crn + ", times=" + meetingTimes + ", course=" + course.getCode() + ")";
    }
}
