package dev.screener.extraction;

import dev.screener.model.SkillCategory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups skills into fixed display buckets.
 */
@Component
public class SkillCategorizer {

    private static final Map<SkillCategory, Set<String>> MEMBERSHIP = new EnumMap<>(Map.of(
            SkillCategory.LANGUAGES, Set.of("python", "java", "javascript", "typescript", "c++", "c#",
                    "ruby", "go", "rust", "php", "swift", "kotlin", "scala", "r"),
            SkillCategory.FRAMEWORKS, Set.of("react", "angular", "vue", "django", "flask", "spring",
                    "nodejs", "express", "tensorflow", "pytorch", "keras"),
            SkillCategory.DATABASES, Set.of("mysql", "postgresql", "mongodb", "redis", "cassandra",
                    "oracle", "sqlite", "dynamodb", "elasticsearch"),
            SkillCategory.CLOUD, Set.of("aws", "azure", "gcp", "docker", "kubernetes", "terraform", "ansible"),
            SkillCategory.TOOLING, Set.of("git", "github", "gitlab", "jenkins", "ci/cd", "linux", "unix"),
            SkillCategory.SOFT_SKILLS, Set.of("leadership", "communication", "teamwork", "problem solving",
                    "critical thinking", "project management", "agile", "scrum")));

    /**
     * Partition skills into categories, keeping input order inside each bucket.
     *
     * @return categories in declaration order; empty buckets are omitted
     */
    public Map<SkillCategory, List<String>> categorize(Iterable<String> skills) {
        Map<SkillCategory, List<String>> buckets = new EnumMap<>(SkillCategory.class);
        if (skills == null) {
            return buckets;
        }
        for (String skill : skills) {
            buckets.computeIfAbsent(categoryOf(skill), k -> new ArrayList<>()).add(skill);
        }
        buckets.replaceAll((category, members) -> Collections.unmodifiableList(members));
        return Collections.unmodifiableMap(buckets);
    }

    public SkillCategory categoryOf(String skill) {
        for (Map.Entry<SkillCategory, Set<String>> entry : MEMBERSHIP.entrySet()) {
            if (entry.getValue().contains(skill)) {
                return entry.getKey();
            }
        }
        return SkillCategory.OTHER;
    }
}
