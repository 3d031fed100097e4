package dev.screener.extraction;

import dev.screener.dictionary.SkillVocabulary;
import dev.screener.dictionary.TextCleaner;
import dev.screener.metrics.ScreenerMetrics;
import dev.screener.model.ExtractedSkillSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs every registered {@link SkillExtractionStrategy} over a document and
 * unions their results into one sorted skill set.
 */
@Slf4j
@Service
public class SkillExtractor {

    private final List<SkillExtractionStrategy> strategies;
    private final SkillVocabulary vocabulary;
    private final TextCleaner textCleaner;
    private final ScreenerMetrics metrics;

    public SkillExtractor(List<SkillExtractionStrategy> strategies, SkillVocabulary vocabulary,
                          TextCleaner textCleaner, ScreenerMetrics metrics) {
        this.strategies = List.copyOf(strategies);
        this.vocabulary = vocabulary;
        this.textCleaner = textCleaner;
        this.metrics = metrics;
        log.info("Skill extractor ready: {} strategies, {} vocabulary entries",
                this.strategies.size(), vocabulary.size());
    }

    /**
     * Extract skills using the configured vocabulary.
     */
    public ExtractedSkillSet extract(String text) {
        return extract(text, vocabulary);
    }

    /**
     * Extract skills from text.
     *
     * @param text       raw document text, may contain markup
     * @param vocabulary skills that may be reported
     * @return sorted, deduplicated skills; empty for blank input
     */
    public ExtractedSkillSet extract(String text, SkillVocabulary vocabulary) {
        if (text == null || text.isBlank()) {
            return ExtractedSkillSet.empty();
        }
        String cleaned = textCleaner.clean(text);

        Set<String> skills = new HashSet<>();
        for (SkillExtractionStrategy strategy : strategies) {
            Set<String> found = metrics.getStrategyTimer(strategy.getName())
                    .record(() -> strategy.extract(cleaned, vocabulary));
            if (found != null) {
                log.debug("Strategy '{}' found {} skills", strategy.getName(), found.size());
                skills.addAll(found);
            }
        }

        ExtractedSkillSet result = ExtractedSkillSet.of(skills);
        metrics.recordExtraction(result.size());
        return result;
    }

    public SkillVocabulary getVocabulary() {
        return vocabulary;
    }
}
