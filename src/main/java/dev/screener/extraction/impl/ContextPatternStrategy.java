package dev.screener.extraction.impl;

import dev.screener.dictionary.SkillVocabulary;
import dev.screener.extraction.SkillExtractionStrategy;
import dev.screener.extraction.VocabularyMatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks up the object of phrases like "experienced in X" or "knowledge of X".
 * X runs up to the next comma or full stop.
 */
@Order(3)
@Component
@RequiredArgsConstructor
public class ContextPatternStrategy implements SkillExtractionStrategy {

    private static final List<Pattern> CONTEXT_PATTERNS = List.of(
            Pattern.compile("(?:proficient|skilled|experienced|expert)\\s+(?:in|with)\\s+([^,.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:knowledge|understanding)\\s+of\\s+([^,.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:working\\s+)?(?:experience|exposure)\\s+(?:with|in)\\s+([^,.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("strong\\s+(?:background|foundation)\\s+in\\s+([^,.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("hands-on\\s+(?:experience\\s+)?(?:with|in)\\s+([^,.]+)", Pattern.CASE_INSENSITIVE));

    private final VocabularyMatcher vocabularyMatcher;

    @Override
    public String getName() {
        return "context";
    }

    @Override
    public Set<String> extract(String text, SkillVocabulary vocabulary) {
        Set<String> skills = new HashSet<>();
        for (Pattern pattern : CONTEXT_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                skills.addAll(vocabularyMatcher.matchSpan(matcher.group(1), vocabulary));
            }
        }
        return skills;
    }
}
