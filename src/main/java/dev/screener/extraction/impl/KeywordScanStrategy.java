package dev.screener.extraction.impl;

import dev.screener.dictionary.SkillVocabulary;
import dev.screener.extraction.SkillExtractionStrategy;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Matches every vocabulary entry against the full text.
 * Entries must not touch a word character on either side, so "java" never
 * matches inside "javascript" while "c++" and "ci/cd" still match.
 */
@Order(1)
@Component
public class KeywordScanStrategy implements SkillExtractionStrategy {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "keyword";
    }

    @Override
    public Set<String> extract(String text, SkillVocabulary vocabulary) {
        Set<String> matched = new HashSet<>();
        for (String skill : vocabulary.entries()) {
            if (containsSkill(text, skill)) {
                matched.add(skill);
            }
        }
        return matched;
    }

    /**
     * Check if text contains the skill bounded by non-word characters.
     */
    static boolean containsSkill(String text, String skill) {
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(skill,
                k -> Pattern.compile("(?<!\\w)" + Pattern.quote(k) + "(?!\\w)",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        return pattern.matcher(text).find();
    }
}
