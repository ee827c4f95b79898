package org.coursesched.data;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
@RequiredArgsConstructor
public final class Course {
    private final String subject;
    private final String code;
    private final String title;
    private final double credits;
    @Getter(AccessLevel.NONE)
    private final List<Section> sections = new ArrayList<>();

    public Section addSection(String crn, List<MeetingTime> meetingTimes) {
        final var section = new Section(crn, meetingTimes, this);
        sections.add(section);
        return section;
    }

    public List<Section> getSections() {
        return Collections.unmodifiableList(sections);
    }

    public boolean hasSections() {
        return !sections.isEmpty();
    }

    @Override
    public String toString() {
        return "Course(course=" + code + ", title=" + title + ", credits=" + credits + ")";
    }
}
