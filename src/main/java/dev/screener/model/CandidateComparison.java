package dev.screener.model;

/**
 * Signed per-signal differences between two scored candidates (first minus second).
 */
public record CandidateComparison(
        double skillMatchDiff,
        double semanticDiff,
        double experienceDiff,
        double overallDiff,
        Recommendation recommendation) {

    public enum Recommendation {
        FIRST,
        SECOND,
        TIE
    }
}
