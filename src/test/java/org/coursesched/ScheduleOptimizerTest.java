package org.coursesched;

import com.fasterxml.jackson.databind.JsonNode;
import org.coursesched.data.OptimizationOptions;
import org.coursesched.data.ScheduleView;
import org.coursesched.data.SectionView;
import org.coursesched.exceptions.InvalidConfigurationException;
import org.coursesched.scoring.PenaltyHook;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.coursesched.TestRecords.block;
import static org.coursesched.TestRecords.record;
import static org.coursesched.TestRecords.records;
import static org.junit.jupiter.api.Assertions.*;

class ScheduleOptimizerTest {
    private final ScheduleOptimizer optimizer = new ScheduleOptimizer();

    private static OptimizationOptions options(Map<String, List<List<String>>> spec) {
        return new OptimizationOptions().setRequirementsSpec(spec).setElectiveSubject("");
    }

    private static Map<String, List<List<String>>> spec(String... requirementCodes) {
        final var spec = new LinkedHashMap<String, List<List<String>>>();
        for (final var code : requirementCodes) {
            spec.put(code, List.of(List.of(code)));
        }
        return spec;
    }

    private static List<String> ids(ScheduleView schedule) {
        return schedule.getSections().stream().map(SectionView::getId).toList();
    }

    @Test
    void picksOnlyConflictFreeCombination() {
        final var result = optimizer.optimize(records(
                        record("CSCI", "CSCI1100", "A1", 5, block("0900", "0950", "monday")),
                        record("MATH", "MATH1010", "B1", 5, block("0930", "1020", "monday")),
                        record("MATH", "MATH1010", "B2", 5, block("0900", "0950", "tuesday"))),
                options(spec("CSCI1100", "MATH1010")));

        assertEquals(1, result.size());
        assertEquals(List.of("A1", "B2"), ids(result.get("Schedule 1")));
    }

    @Test
    void defaultRequirementsWithElectives() {
        final var result = optimizer.optimize(records(
                record("CSCI", "CSCI1200", "100", 5, block("1000", "1050", "monday", "thursday")),
                record("CSCI", "CSCI1200", "101", 5, block("1400", "1550", "tuesday", "friday")),
                record("MATH", "MATH1020", "200", 5, block("1200", "1350", "monday", "thursday")),
                record("BIOL", "BIOL1010", "300", 5, block("1000", "1150", "tuesday", "friday")),
                record("BIOL", "BIOL1015", "310", 5, block("1500", "1650", "wednesday")),
                record("BIOL", "BIOL1016", "320", 0, block("1500", "1650", "thursday")),
                record("INQR", "INQR1110", "400", 5, block("1600", "1750", "thursday")),
                record("INQR", "INQR1300", "410", 5, block("1000", "1150", "wednesday")),
                record("HIST", "HIST2000", "500", 5, block("1000", "1150", "wednesday"))));

        assertFalse(result.isEmpty());
        assertTrue(result.size() <= 25);
        for (final var schedule : result.values()) {
            final var codes = schedule.getSections().stream().map(SectionView::getCourseCode).toList();
            assertEquals(List.of("CSCI1200", "MATH1020", "BIOL1010", "BIOL1015"), codes.subList(0, 4));
            assertTrue(codes.get(4).startsWith("INQR"));
        }
        assertScoresNonIncreasing(result);
    }

    @Test
    void unsatisfiableRequirementGivesEmptyResult() {
        final var spec = spec("CSCI1100");
        spec.put("lab", List.of(List.of("BIOL1010", "BIOL1015")));

        final var result = optimizer.optimize(records(
                        record("CSCI", "CSCI1100", "1", 5, block("0900", "0950", "monday")),
                        record("BIOL", "BIOL1010", "2", 5, block("0900", "0950", "tuesday"))),
                options(spec));

        assertTrue(result.isEmpty());
    }

    @Test
    void respectsMaxSchedules() {
        final var catalog = new ArrayList<JsonNode>();
        for (var hour = 8; hour < 17; hour++) {
            final var time = String.format("%02d00", hour);
            final var end = String.format("%02d50", hour);
            catalog.add(record("CSCI", "CSCI1100", "C" + hour, 5, block(time, end, "monday", "wednesday")));
            catalog.add(record("MATH", "MATH1010", "M" + hour, 5, block(time, end, "tuesday", "thursday")));
        }

        final var result = optimizer.optimize(catalog, options(spec("CSCI1100", "MATH1010")).setMaxSchedules(4));

        assertEquals(4, result.size());
        assertEquals(List.of("Schedule 1", "Schedule 2", "Schedule 3", "Schedule 4"), new ArrayList<>(result.keySet()));
        assertScoresNonIncreasing(result);
    }

    @Test
    void invalidMaxSchedulesFailsBeforeSearch() {
        final var hookCalls = new int[1];
        final PenaltyHook countingHook = candidate -> {
            hookCalls[0]++;
            return 0;
        };
        final var options = options(spec("CSCI1100")).setMaxSchedules(0).setPenalties(List.of(countingHook));
        final var catalog = records(record("CSCI", "CSCI1100", "1", 5, block("0900", "0950", "monday")));

        assertThrows(InvalidConfigurationException.class, () -> optimizer.optimize(catalog, options));
        assertEquals(0, hookCalls[0]);
    }

    @Test
    void callerOptionsAreNotModified() {
        final var options = new OptimizationOptions();
        optimizer.optimize(List.of(), options);
        assertEquals(new OptimizationOptions().getRequirementsSpec(), options.getRequirementsSpec());
    }

    @Test
    void hooksInfluenceRanking() {
        final var catalog = records(
                record("CSCI", "CSCI1100", "MON", 5, block("1000", "1050", "monday", "wednesday", "friday")),
                record("CSCI", "CSCI1100", "TUE", 5, block("1000", "1050", "tuesday", "wednesday", "thursday")));
        final PenaltyHook avoidMonday = candidate -> candidate.getSections().get(0).getCrn().equals("MON") ? -50 : 0;

        final var plain = optimizer.optimize(catalog, options(spec("CSCI1100")));
        final var hooked = optimizer.optimize(catalog, options(spec("CSCI1100")).setPenalties(List.of(avoidMonday)));

        assertEquals(List.of("MON"), ids(plain.get("Schedule 1")));
        assertEquals(List.of("TUE"), ids(hooked.get("Schedule 1")));
    }

    private static void assertScoresNonIncreasing(Map<String, ScheduleView> result) {
        final var scores = result.values().stream().map(ScheduleView::getScore).toList();
        for (var i = 1; i < scores.size(); i++) {
            assertTrue(scores.get(i - 1) >= scores.get(i), "scores out of order: " + scores);
        }
    }
}
