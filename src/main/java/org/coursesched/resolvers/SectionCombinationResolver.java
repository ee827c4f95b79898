package org.coursesched.resolvers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.data.CourseSlate;
import org.coursesched.data.ScheduleCandidate;
import org.coursesched.data.Section;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates conflict-free section assignments for a course slate. Partial schedules are extended
 * course by course and an extension is admitted only when the new section conflicts with none already
 * chosen, so the frontier never holds a conflicting partial schedule.
 */
@Slf4j
@RequiredArgsConstructor
public class SectionCombinationResolver {
    /** 0 means unlimited. */
    private final int maxFrontierSize;

    public SectionCombinationResolver() {
        this(0);
    }

    public List<ScheduleCandidate> generate(List<CourseSlate> slates) {
        final var result = new ArrayList<ScheduleCandidate>();
        for (final var slate : slates) {
            result.addAll(generate(slate));
        }
        return result;
    }

    public List<ScheduleCandidate> generate(CourseSlate slate) {
        List<List<Section>> frontier = new ArrayList<>();
        frontier.add(List.of());
        var truncated = false;

        for (final var course : slate.getCourses()) {
            if (!course.hasSections()) {
                log.warn("Course {} in slate {} has no sections.", course.getCode(), slate);
                return List.of();
            }

            final var extended = new ArrayList<List<Section>>();
            for (final var partial : frontier) {
                for (final var section : course.getSections()) {
                    if (!conflictsWithAny(section, partial)) {
                        final var next = new ArrayList<Section>(partial.size() + 1);
                        next.addAll(partial);
                        next.add(section);
                        extended.add(next);
                    }
                }
            }

            if (extended.isEmpty()) {
                log.debug("Slate {} has no conflict-free assignment past {}.", slate, course.getCode());
                return List.of();
            }
            if (maxFrontierSize > 0 && extended.size() > maxFrontierSize) {
                if (!truncated) {
                    log.warn("Slate {}: partial schedules exceed {}, truncating.", slate, maxFrontierSize);
                    truncated = true;
                }
                frontier = new ArrayList<>(extended.subList(0, maxFrontierSize));
            } else {
                frontier = extended;
            }
        }

        return frontier.stream().map(ScheduleCandidate::new).toList();
    }

    private static boolean conflictsWithAny(Section section, List<Section> chosen) {
        for (final var existing : chosen) {
            if (section.conflictsWith(existing)) return true;
        }
        return false;
    }
}
