package dev.screener.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of screening every candidate against one target.
 *
 * @param targetId     target identifier
 * @param requirements required and preferred skills of the target
 * @param ranked       every result, ranked
 * @param shortlist    ranked results at or above the threshold, at most top-k of them
 * @param explanations rationale per candidate id
 */
public record ScreeningReport(
        String targetId,
        RequirementSplit requirements,
        List<ScoringResult> ranked,
        List<ScoringResult> shortlist,
        Map<String, String> explanations) {

    public static ScreeningReport empty(String targetId, RequirementSplit requirements) {
        return new ScreeningReport(targetId, requirements, List.of(), List.of(), Map.of());
    }
}
