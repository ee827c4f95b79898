package org.coursesched;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.data.OptimizationOptions;
import org.coursesched.data.ScheduleView;
import org.coursesched.normalizers.CatalogNormalizer;
import org.coursesched.ranking.ResultAssembler;
import org.coursesched.ranking.ScheduleRanker;
import org.coursesched.resolvers.RequirementResolver;
import org.coursesched.resolvers.SectionCombinationResolver;
import org.coursesched.scoring.ScheduleScorer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class ScheduleOptimizer {

    public Map<String, ScheduleView> optimize(List<JsonNode> records) {
        return optimize(records, new OptimizationOptions());
    }

    public Map<String, ScheduleView> optimize(List<JsonNode> records, OptimizationOptions options) {
        final var opts = options.copy();
        opts.validate();

        final var catalog = new CatalogNormalizer(opts).normalize(records);

        final var requirements = new RequirementResolver(catalog).resolve(opts.getRequirementsSpec(), opts.getElectiveSubject());
        final var slates = RequirementResolver.buildSlates(requirements);
        log.info("Course slates to evaluate: {}", slates.size());
        if (slates.isEmpty()) return new LinkedHashMap<>();

        final var candidates = new SectionCombinationResolver(opts.getMaxFrontierSize()).generate(slates);
        log.info("Conflict-free schedules found: {}", candidates.size());
        if (candidates.isEmpty()) return new LinkedHashMap<>();

        final var scorer = new ScheduleScorer(opts.getScoring(), opts.getPenalties());
        final var ranked = new ScheduleRanker(scorer, opts.getMaxSchedules()).rank(candidates);
        return ResultAssembler.assemble(ranked);
    }
}
