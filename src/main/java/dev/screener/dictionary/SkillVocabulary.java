package dev.screener.dictionary;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of canonical skill identifiers.
 * Every entry is lower-case, trimmed and non-empty.
 */
public final class SkillVocabulary {

    private static final Set<String> DEFAULT_SKILLS = Set.of(
            // Programming languages
            "python", "java", "javascript", "typescript", "c++", "c#", "ruby", "go", "rust",
            "php", "swift", "kotlin", "scala", "r", "matlab", "sql", "html", "css",
            // Frameworks and libraries
            "react", "angular", "vue", "django", "flask", "spring", "nodejs", "express",
            "tensorflow", "pytorch", "keras", "pandas", "numpy", "scikit-learn",
            // Databases
            "mysql", "postgresql", "mongodb", "redis", "cassandra", "oracle", "sqlite",
            "dynamodb", "elasticsearch",
            // Cloud and DevOps
            "aws", "azure", "gcp", "docker", "kubernetes", "jenkins", "ci/cd", "terraform",
            "ansible", "git", "github", "gitlab",
            // Data science and ML
            "machine learning", "deep learning", "nlp", "computer vision", "data analysis",
            "data science", "statistics", "data visualization", "tableau", "power bi",
            // Soft skills
            "leadership", "communication", "teamwork", "problem solving", "critical thinking",
            "project management", "agile", "scrum", "collaboration",
            // Other technical
            "api", "rest", "graphql", "microservices", "testing", "debugging",
            "linux", "unix", "shell scripting", "networking", "security");

    private final Set<String> skills;

    private SkillVocabulary(Set<String> skills) {
        this.skills = Collections.unmodifiableSet(skills);
    }

    /**
     * Vocabulary holding only the built-in skill dictionary.
     */
    public static SkillVocabulary defaults() {
        return withCustom(Set.of());
    }

    /**
     * Built-in dictionary extended with custom entries. Blank entries are dropped.
     */
    public static SkillVocabulary withCustom(Collection<String> customSkills) {
        Set<String> merged = new TreeSet<>();
        DEFAULT_SKILLS.forEach(skill -> addCanonical(merged, skill));
        if (customSkills != null) {
            customSkills.forEach(skill -> addCanonical(merged, skill));
        }
        return new SkillVocabulary(merged);
    }

    /**
     * Vocabulary made only of the given entries, without the built-in dictionary.
     */
    public static SkillVocabulary of(Collection<String> skills) {
        Set<String> entries = new TreeSet<>();
        skills.forEach(skill -> addCanonical(entries, skill));
        return new SkillVocabulary(entries);
    }

    private static void addCanonical(Set<String> target, String skill) {
        if (skill == null) {
            return;
        }
        String canonical = skill.toLowerCase(Locale.ROOT).trim();
        if (!canonical.isEmpty()) {
            target.add(canonical);
        }
    }

    public boolean contains(String skill) {
        return skill != null && skills.contains(skill);
    }

    /**
     * Entries in alphabetical order.
     */
    public Set<String> entries() {
        return skills;
    }

    public int size() {
        return skills.size();
    }
}
