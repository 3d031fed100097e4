package dev.screener.extraction.impl;

import dev.screener.dictionary.SkillVocabulary;
import dev.screener.extraction.SkillExtractionStrategy;
import dev.screener.extraction.VocabularyMatcher;
import dev.screener.metrics.ScreenerMetrics;
import dev.screener.nlp.Annotations;
import dev.screener.nlp.TextAnnotator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks named entities and noun phrases from the configured {@link TextAnnotator}.
 * Contributes nothing when the annotator is unavailable or fails.
 */
@Slf4j
@Order(4)
@Component
@RequiredArgsConstructor
public class EntityPhraseStrategy implements SkillExtractionStrategy {

    private final TextAnnotator textAnnotator;
    private final VocabularyMatcher vocabularyMatcher;
    private final ScreenerMetrics metrics;

    @Override
    public String getName() {
        return "entity";
    }

    @Override
    public Set<String> extract(String text, SkillVocabulary vocabulary) {
        if (!textAnnotator.isAvailable()) {
            log.debug("Annotator '{}' unavailable - skipping entity/phrase scan", textAnnotator.getName());
            return Set.of();
        }

        Annotations annotations;
        try {
            annotations = textAnnotator.annotate(text);
        } catch (RuntimeException e) {
            log.warn("Annotator '{}' failed: {} - continuing without entity/phrase scan",
                    textAnnotator.getName(), e.getMessage());
            metrics.recordAnnotatorFallback();
            return Set.of();
        }

        Set<String> skills = new HashSet<>();
        annotations.entities().forEach(entity -> skills.addAll(vocabularyMatcher.matchPhrase(entity, vocabulary)));
        annotations.nounPhrases().forEach(phrase -> skills.addAll(vocabularyMatcher.matchPhrase(phrase, vocabulary)));
        return skills;
    }
}
