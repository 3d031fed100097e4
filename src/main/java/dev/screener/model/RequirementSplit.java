package dev.screener.model;

/**
 * Skills a target lists as required versus merely preferred.
 */
public record RequirementSplit(ExtractedSkillSet required, ExtractedSkillSet preferred) {

    public static RequirementSplit allRequired(ExtractedSkillSet skills) {
        return new RequirementSplit(skills, ExtractedSkillSet.empty());
    }
}
