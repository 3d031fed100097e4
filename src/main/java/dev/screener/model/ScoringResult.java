package dev.screener.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Scores of one candidate against one target.
 * Immutable apart from the rank, which the ranking stage writes exactly once.
 */
@Getter
@ToString
public class ScoringResult {

    private final String candidateId;
    private final String candidateName;
    private final ContactInfo contact;
    private final String targetId;
    private final double skillMatchScore;
    private final double semanticSimilarityScore;
    private final double experienceScore;
    private final double overallScore;
    private final List<String> matchedSkills;

    private int rank;

    @Builder(toBuilder = true)
    public ScoringResult(String candidateId, String candidateName, ContactInfo contact, String targetId,
                         double skillMatchScore, double semanticSimilarityScore, double experienceScore,
                         double overallScore, List<String> matchedSkills) {
        this.candidateId = candidateId;
        this.candidateName = candidateName;
        this.contact = contact != null ? contact : ContactInfo.none();
        this.targetId = targetId;
        this.skillMatchScore = skillMatchScore;
        this.semanticSimilarityScore = semanticSimilarityScore;
        this.experienceScore = experienceScore;
        this.overallScore = overallScore;
        this.matchedSkills = matchedSkills != null ? List.copyOf(matchedSkills) : List.of();
    }

    /**
     * Name to show for this candidate, falling back to the id.
     */
    public String getDisplayName() {
        return candidateName != null ? candidateName : candidateId;
    }

    public boolean isRanked() {
        return rank > 0;
    }

    /**
     * Record the 1-based position of this result in its ranking.
     *
     * @throws IllegalStateException if a rank was already assigned
     */
    public void assignRank(int position) {
        if (position < 1) {
            throw new IllegalArgumentException("Rank must be positive, got " + position);
        }
        if (rank > 0) {
            throw new IllegalStateException("Result for candidate " + candidateId + " already ranked at " + rank);
        }
        this.rank = position;
    }
}
