package org.coursesched.data;

import lombok.Getter;

import java.util.List;

@Getter
public final class ScheduleCandidate {
    private final List<Section> sections;

    public ScheduleCandidate(List<Section> sections) {
        this.sections = List.copyOf(sections);
    }

    public List<MeetingTime> getMeetingTimes() {
        return sections.stream()
                .flatMap(section -> section.getMeetingTimes().stream())
                .toList();
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    @Override
    public String toString() {
        return sections.stream().map(Section::getCrn).toList().toString();
    }
}
