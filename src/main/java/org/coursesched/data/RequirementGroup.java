package org.coursesched.data;

import lombok.Getter;

import java.util.List;

@Getter
public final class RequirementGroup {
    private final List<Course> courses;

    public RequirementGroup(List<Course> courses) {
        this.courses = List.copyOf(courses);
    }

    @Override
    public String toString() {
        return courses.stream().map(Course::getCode).toList().toString();
    }
}
