package org.coursesched.data;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class Catalog {
    private final Map<String, Course> courses = new LinkedHashMap<>();

    public Course getOrCreate(String code, String subject, String title, double credits) {
        return courses.computeIfAbsent(code, c -> new Course(subject, c, title, credits));
    }

    public Optional<Course> find(String code) {
        return Optional.ofNullable(courses.get(code));
    }

    public Collection<Course> getCourses() {
        return Collections.unmodifiableCollection(courses.values());
    }

    public List<Course> getCoursesOfSubject(String subject) {
        return courses.values().stream()
                .filter(course -> subject.equals(course.getSubject()))
                .toList();
    }

    public int getSectionCount() {
        return courses.values().stream().mapToInt(course -> course.getSections().size()).sum();
    }

    public int size() {
        return courses.size();
    }
}
