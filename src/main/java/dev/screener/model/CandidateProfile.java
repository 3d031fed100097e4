package dev.screener.model;

import dev.screener.exception.InvalidScoringInputException;
import dev.screener.exception.InvalidScoringInputException.Condition;

import java.util.Objects;

/**
 * A candidate as seen by the scoring engine.
 *
 * @param id              caller-assigned identifier
 * @param skills          canonical skills extracted from the candidate's document
 * @param experienceYears years of experience, never negative
 * @param embedding       vector produced by the external embedding model
 */
public record CandidateProfile(
        String id,
        ExtractedSkillSet skills,
        double experienceYears,
        double[] embedding) {

    public CandidateProfile {
        Objects.requireNonNull(id, "id");
        skills = skills != null ? skills : ExtractedSkillSet.empty();
        if (experienceYears < 0 || Double.isNaN(experienceYears)) {
            throw new InvalidScoringInputException(Condition.NEGATIVE_EXPERIENCE,
                    "Experience years must be non-negative, got " + experienceYears + " for candidate " + id);
        }
        Embeddings.requireNonEmpty(embedding, "candidate " + id);
        embedding = embedding.clone();
    }

    @Override
    public double[] embedding() {
        return embedding.clone();
    }
}
