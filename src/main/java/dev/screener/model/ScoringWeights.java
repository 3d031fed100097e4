package dev.screener.model;

import dev.screener.exception.InvalidScoringInputException;
import dev.screener.exception.InvalidScoringInputException.Condition;

import java.util.Map;
import java.util.Set;

/**
 * Weights of the three scoring signals, normalized to sum to 1.0.
 */
public record ScoringWeights(double skillMatch, double semanticSimilarity, double experience) {

    public static final String SKILL_MATCH = "skill_match";
    public static final String SEMANTIC_SIMILARITY = "semantic_similarity";
    public static final String EXPERIENCE = "experience";

    private static final Set<String> SIGNALS = Set.of(SKILL_MATCH, SEMANTIC_SIMILARITY, EXPERIENCE);
    private static final double EPSILON = 1e-9;

    public ScoringWeights {
        double total = skillMatch + semanticSimilarity + experience;
        if (Math.abs(total - 1.0) > EPSILON) {
            throw new InvalidScoringInputException(Condition.INVALID_WEIGHTS,
                    "Weights must be normalized, sum was " + total + "; use ScoringWeights.of(...)");
        }
    }

    public static ScoringWeights defaults() {
        return of(0.4, 0.4, 0.2);
    }

    /**
     * Validate raw weights and rescale them to sum to 1.0.
     *
     * @throws InvalidScoringInputException if a weight is negative or not finite, or all are zero
     */
    public static ScoringWeights of(double skillMatch, double semanticSimilarity, double experience) {
        requireValid(SKILL_MATCH, skillMatch);
        requireValid(SEMANTIC_SIMILARITY, semanticSimilarity);
        requireValid(EXPERIENCE, experience);
        double total = skillMatch + semanticSimilarity + experience;
        if (total <= 0) {
            throw new InvalidScoringInputException(Condition.INVALID_WEIGHTS, "Weights sum to zero");
        }
        return new ScoringWeights(skillMatch / total, semanticSimilarity / total, experience / total);
    }

    /**
     * Build weights from signal names. Missing signals weigh zero.
     *
     * @throws InvalidScoringInputException on an unknown signal name or an invalid weight set
     */
    public static ScoringWeights fromMap(Map<String, ? extends Number> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new InvalidScoringInputException(Condition.INVALID_WEIGHTS, "No weights given");
        }
        for (String signal : weights.keySet()) {
            if (!SIGNALS.contains(signal)) {
                throw new InvalidScoringInputException(Condition.INVALID_WEIGHTS,
                        "Unknown scoring signal '" + signal + "', expected one of " + SIGNALS);
            }
        }
        return of(value(weights, SKILL_MATCH), value(weights, SEMANTIC_SIMILARITY), value(weights, EXPERIENCE));
    }

    private static double value(Map<String, ? extends Number> weights, String signal) {
        Number weight = weights.get(signal);
        return weight != null ? weight.doubleValue() : 0.0;
    }

    private static void requireValid(String signal, double weight) {
        if (weight < 0 || !Double.isFinite(weight)) {
            throw new InvalidScoringInputException(Condition.INVALID_WEIGHTS,
                    "Weight for " + signal + " must be a non-negative number, got " + weight);
        }
    }
}
