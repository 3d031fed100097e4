package dev.screener.model;

import dev.screener.exception.InvalidScoringInputException;
import dev.screener.exception.InvalidScoringInputException.Condition;

import java.util.Objects;

/**
 * The requirement profile candidates are ranked against.
 *
 * @param id                      caller-assigned identifier
 * @param requiredSkills          canonical skills the target asks for; may be empty
 * @param requiredExperienceYears required years, or null when the target states none
 * @param embedding               vector produced by the external embedding model
 */
public record TargetProfile(
        String id,
        ExtractedSkillSet requiredSkills,
        Double requiredExperienceYears,
        double[] embedding) {

    public TargetProfile {
        Objects.requireNonNull(id, "id");
        requiredSkills = requiredSkills != null ? requiredSkills : ExtractedSkillSet.empty();
        if (requiredExperienceYears != null
                && (requiredExperienceYears < 0 || requiredExperienceYears.isNaN())) {
            throw new InvalidScoringInputException(Condition.NEGATIVE_EXPERIENCE,
                    "Required experience must be non-negative, got " + requiredExperienceYears + " for target " + id);
        }
        Embeddings.requireNonEmpty(embedding, "target " + id);
        embedding = embedding.clone();
    }

    @Override
    public double[] embedding() {
        return embedding.clone();
    }
}
