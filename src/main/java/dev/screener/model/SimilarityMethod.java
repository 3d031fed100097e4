package dev.screener.model;

import dev.screener.exception.InvalidScoringInputException;
import dev.screener.exception.InvalidScoringInputException.Condition;

import java.util.Arrays;
import java.util.Locale;

/**
 * Vector similarity measures available to the semantic signal.
 */
public enum SimilarityMethod {
    COSINE,
    DOT,
    EUCLIDEAN;

    /**
     * Look up a method by its configured name, case-insensitively.
     *
     * @throws InvalidScoringInputException for an unknown name
     */
    public static SimilarityMethod fromName(String name) {
        if (name != null) {
            String key = name.trim().toUpperCase(Locale.ROOT);
            for (SimilarityMethod method : values()) {
                if (method.name().equals(key)) {
                    return method;
                }
            }
        }
        throw new InvalidScoringInputException(Condition.UNKNOWN_SIMILARITY_METHOD,
                "Unknown similarity method: " + name + ", expected one of " + Arrays.toString(values()));
    }
}
