package dev.screener.extraction;

import dev.screener.dictionary.SkillNormalizer;
import dev.screener.dictionary.SkillVocabulary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks captured text spans against the vocabulary, as whole tokens and word by word.
 */
@Component
@RequiredArgsConstructor
public class VocabularyMatcher {

    /** Single words shorter than this only count when they form a whole token. */
    static final int MIN_WORD_LENGTH = 3;

    private static final Pattern SPAN_DELIMITERS = Pattern.compile("[,;|•\\n\\t]");
    private static final Pattern WORD_DELIMITERS = Pattern.compile("\\s+");

    private final SkillNormalizer normalizer;

    /**
     * Split a captured span on list delimiters and match every token.
     */
    public Set<String> matchSpan(String span, SkillVocabulary vocabulary) {
        Set<String> skills = new HashSet<>();
        if (span == null || span.isBlank()) {
            return skills;
        }
        for (String token : SPAN_DELIMITERS.split(span)) {
            skills.addAll(matchPhrase(token, vocabulary));
        }
        return skills;
    }

    /**
     * Match a single token as a whole phrase, then each of its words.
     */
    public Set<String> matchPhrase(String phrase, SkillVocabulary vocabulary) {
        Set<String> skills = new HashSet<>();
        if (phrase == null || phrase.isBlank()) {
            return skills;
        }
        String whole = lookup(phrase, vocabulary);
        if (whole != null) {
            skills.add(whole);
        }
        for (String word : WORD_DELIMITERS.split(phrase.trim())) {
            String skill = lookup(word, vocabulary);
            if (skill != null && skill.length() >= MIN_WORD_LENGTH) {
                skills.add(skill);
            }
        }
        return skills;
    }

    private String lookup(String token, SkillVocabulary vocabulary) {
        String literal = token.toLowerCase(Locale.ROOT).trim();
        if (vocabulary.contains(literal)) {
            return literal;
        }
        String canonical = normalizer.normalize(token);
        return vocabulary.contains(canonical) ? canonical : null;
    }
}
