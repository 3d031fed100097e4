package dev.screener.extraction;

import dev.screener.dictionary.SkillVocabulary;

import java.util.Set;

/**
 * One independent way of finding skills in text.
 * Implementations are pure: same text and vocabulary, same result.
 */
public interface SkillExtractionStrategy {

    /**
     * Get the name of this strategy (e.g., "keyword", "section")
     */
    String getName();

    /**
     * Find canonical vocabulary skills in the text.
     *
     * @param text       cleaned document text, never blank
     * @param vocabulary skills that may be reported
     * @return vocabulary entries found, possibly empty
     */
    Set<String> extract(String text, SkillVocabulary vocabulary);
}
