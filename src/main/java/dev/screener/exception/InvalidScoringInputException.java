package dev.screener.exception;

import lombok.Getter;

/**
 * Raised when scoring input fails a precondition check.
 * Carries the offending condition so callers can map it to their own error types.
 */
@Getter
public class InvalidScoringInputException extends IllegalArgumentException {

    private final Condition condition;

    public InvalidScoringInputException(Condition condition, String message) {
        super(message);
        this.condition = condition;
    }

    public enum Condition {
        DIMENSION_MISMATCH,
        EMPTY_EMBEDDING,
        UNKNOWN_SIMILARITY_METHOD,
        INVALID_WEIGHTS,
        NEGATIVE_EXPERIENCE
    }
}
