package org.coursesched.resolvers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.data.Catalog;
import org.coursesched.data.Course;
import org.coursesched.data.CourseSlate;
import org.coursesched.data.Requirement;
import org.coursesched.data.RequirementGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
public class RequirementResolver {
    public static final String ELECTIVE_REQUIREMENT_NAME = "electives";

    private final Catalog catalog;

    public List<Requirement> resolve(Map<String, List<List<String>>> requirementsSpec, String electiveSubject) {
        final var requirements = new ArrayList<Requirement>();
        for (final var entry : requirementsSpec.entrySet()) {
            requirements.add(resolveRequirement(entry.getKey(), entry.getValue()));
        }
        if (electiveSubject != null && !electiveSubject.isBlank()) {
            requirements.add(resolveElectives(electiveSubject));
        }
        return requirements;
    }

    Requirement resolveRequirement(String name, List<List<String>> groups) {
        final var concreteGroups = new ArrayList<RequirementGroup>();
        for (final var group : groups) {
            final var courses = resolveGroup(group);
            if (courses == null) {
                log.debug("Requirement {}: dropping group {} with unavailable courses", name, group);
                continue;
            }
            concreteGroups.add(new RequirementGroup(courses));
        }
        if (concreteGroups.isEmpty()) {
            log.info("Requirement {} cannot be satisfied by the catalog.", name);
        }
        return new Requirement(name, concreteGroups);
    }

    Requirement resolveElectives(String electiveSubject) {
        final var groups = catalog.getCoursesOfSubject(electiveSubject).stream()
                .filter(Course::hasSections)
                .map(course -> new RequirementGroup(List.of(course)))
                .toList();
        if (groups.isEmpty()) {
            log.info("No {} elective courses with sections found.", electiveSubject);
        }
        return new Requirement(ELECTIVE_REQUIREMENT_NAME, groups);
    }

    /** Null when the group is empty or any code has no course with sections. */
    private List<Course> resolveGroup(List<String> codes) {
        if (codes.isEmpty()) return null;
        final var courses = new ArrayList<Course>(codes.size());
        for (final var code : codes) {
            final var course = catalog.find(code).filter(Course::hasSections);
            if (course.isEmpty()) return null;
            courses.add(course.get());
        }
        return courses;
    }

    /**
     * Cartesian product of the requirements' groups, one group per requirement, flattened in requirement
     * order. Empty as soon as one requirement has no group left.
     */
    public static List<CourseSlate> buildSlates(List<Requirement> requirements) {
        if (requirements.isEmpty()) return List.of();

        List<List<Course>> combinations = new ArrayList<>();
        combinations.add(List.of());
        for (final var requirement : requirements) {
            if (!requirement.isSatisfiable()) {
                log.info("Requirement {} has no concrete group; no schedules possible.", requirement.getName());
                return List.of();
            }
            final var extended = new ArrayList<List<Course>>(combinations.size() * requirement.getGroups().size());
            for (final var group : requirement.getGroups()) {
                for (final var combination : combinations) {
                    final var courses = new ArrayList<Course>(combination.size() + group.getCourses().size());
                    courses.addAll(combination);
                    courses.addAll(group.getCourses());
                    extended.add(courses);
                }
            }
            combinations = extended;
        }
        return combinations.stream().map(CourseSlate::new).toList();
    }
}
