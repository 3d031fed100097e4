package dev.screener.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Buckets used when grouping a skill set for display.
 */
@Getter
@RequiredArgsConstructor
public enum SkillCategory {
    LANGUAGES("languages"),
    FRAMEWORKS("frameworks"),
    DATABASES("databases"),
    CLOUD("cloud"),
    TOOLING("tooling"),
    SOFT_SKILLS("soft-skills"),
    OTHER("other");

    private final String label;
}
