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
 * Reads lists that follow section headers such as "Skills:" or "Proficient in:".
 * The captured span ends at the next full stop.
 */
@Order(2)
@Component
@RequiredArgsConstructor
public class SectionScanStrategy implements SkillExtractionStrategy {

    private static final List<Pattern> SECTION_PATTERNS = List.of(
            Pattern.compile("(?:technical\\s+)?skills?(?:\\s+and\\s+technologies)?[:\\s]+([^.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:core\\s+)?competencies[:\\s]+([^.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("technologies[:\\s]+([^.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("expertise[:\\s]+([^.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("proficient\\s+in[:\\s]+([^.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("experienced\\s+(?:in|with)[:\\s]+([^.]+)", Pattern.CASE_INSENSITIVE));

    private final VocabularyMatcher vocabularyMatcher;

    @Override
    public String getName() {
        return "section";
    }

    @Override
    public Set<String> extract(String text, SkillVocabulary vocabulary) {
        Set<String> skills = new HashSet<>();
        for (Pattern pattern : SECTION_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                skills.addAll(vocabularyMatcher.matchSpan(matcher.group(1), vocabulary));
            }
        }
        return skills;
    }
}
