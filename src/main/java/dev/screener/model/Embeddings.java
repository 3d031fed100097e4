package dev.screener.model;

import dev.screener.exception.InvalidScoringInputException;
import dev.screener.exception.InvalidScoringInputException.Condition;

final class Embeddings {

    private Embeddings() {
    }

    static void requireNonEmpty(double[] embedding, String owner) {
        if (embedding == null || embedding.length == 0) {
            throw new InvalidScoringInputException(Condition.EMPTY_EMBEDDING, "Embedding missing for " + owner);
        }
    }
}
