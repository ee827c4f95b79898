package org.coursesched.data;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.coursesched.exceptions.InvalidConfigurationException;
import org.coursesched.scoring.PenaltyHook;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-run optimizer settings. {@link #copy()} is taken at the start of every run so callers may keep
 * mutating their instance without affecting a run in progress.
 */
@Getter
@Setter
@ToString
@Accessors(chain = true)
public class OptimizationOptions {
    public static final String DEFAULT_ELECTIVE_SUBJECT = "INQR";
    public static final int DEFAULT_MAX_SCHEDULES = 25;
    public static final int DEFAULT_MIN_SEATS_AVAILABLE = 1;

    private Map<String, List<List<String>>> requirementsSpec = defaultRequirementsSpec();
    private String electiveSubject = DEFAULT_ELECTIVE_SUBJECT;
    private int maxSchedules = DEFAULT_MAX_SCHEDULES;
    private int minSeatsAvailable = DEFAULT_MIN_SEATS_AVAILABLE;
    private Set<String> includeSubjects = Set.of();
    private Set<String> excludeSubjects = Set.of();
    /** Upper bound on partial schedules kept per slate; 0 means unlimited. */
    private int maxFrontierSize = 0;
    private ScoringWeights scoring = new ScoringWeights();
    @ToString.Exclude
    private List<PenaltyHook> penalties = List.of();

    public static Map<String, List<List<String>>> defaultRequirementsSpec() {
        final var spec = new LinkedHashMap<String, List<List<String>>>();
        spec.put("cs_requirement", List.of(List.of("CSCI1200")));
        spec.put("math_requirement", List.of(List.of("MATH1020")));
        spec.put("biol_requirement", List.of(List.of("BIOL1010", "BIOL1015"), List.of("BIOL1010", "BIOL1016")));
        return copySpec(spec);
    }

    public OptimizationOptions copy() {
        return new OptimizationOptions()
                .setRequirementsSpec(copySpec(requirementsSpec))
                .setElectiveSubject(electiveSubject)
                .setMaxSchedules(maxSchedules)
                .setMinSeatsAvailable(minSeatsAvailable)
                .setIncludeSubjects(includeSubjects == null ? Set.of() : Set.copyOf(includeSubjects))
                .setExcludeSubjects(excludeSubjects == null ? Set.of() : Set.copyOf(excludeSubjects))
                .setMaxFrontierSize(maxFrontierSize)
                .setScoring(scoring == null ? new ScoringWeights() : scoring.copy())
                .setPenalties(penalties == null ? List.of() : List.copyOf(penalties));
    }

    public void validate() {
        if (maxSchedules <= 0) {
            throw new InvalidConfigurationException("maxSchedules must be positive, got " + maxSchedules);
        }
        if (minSeatsAvailable < 0) {
            throw new InvalidConfigurationException("minSeatsAvailable must not be negative, got " + minSeatsAvailable);
        }
        if (maxFrontierSize < 0) {
            throw new InvalidConfigurationException("maxFrontierSize must not be negative, got " + maxFrontierSize);
        }
        if (scoring.getActiveDayIdealMin() > scoring.getActiveDayIdealMax()) {
            throw new InvalidConfigurationException("Ideal active day range is inverted: "
                    + scoring.getActiveDayIdealMin() + ".." + scoring.getActiveDayIdealMax());
        }
        requireFinite("earlyLatePenaltyPerMinute", scoring.getEarlyLatePenaltyPerMinute());
        requireFinite("activeDayBonus", scoring.getActiveDayBonus());
        requireFinite("activeDayPenaltyPerDay", scoring.getActiveDayPenaltyPerDay());
        requireFinite("distributionWeight", scoring.getDistributionWeight());
        requireFinite("idleTimePenalty", scoring.getIdleTimePenalty());
        requireFinite("spanPenalty", scoring.getSpanPenalty());
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidConfigurationException("Scoring weight " + name + " must be finite, got " + value);
        }
    }

    private static Map<String, List<List<String>>> copySpec(Map<String, List<List<String>>> spec) {
        final var result = new LinkedHashMap<String, List<List<String>>>();
        if (spec == null) return result;
        for (final var entry : spec.entrySet()) {
            final var groups = new ArrayList<List<String>>();
            for (final var group : entry.getValue()) {
                groups.add(new ArrayList<>(group));
            }
            result.put(entry.getKey(), groups);
        }
        return result;
    }
}
