package dev.screener.extraction.impl;

import dev.screener.dictionary.SkillVocabulary;
import dev.screener.extraction.ExtractionFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SectionScanStrategyTest {

    private SectionScanStrategy strategy;
    private SkillVocabulary vocabulary;

    @BeforeEach
    void setUp() {
        strategy = new SectionScanStrategy(ExtractionFixtures.vocabularyMatcher());
        vocabulary = SkillVocabulary.defaults();
    }

    @Test
    @DisplayName("Should normalize aliased tokens in a skills list")
    void shouldNormalizeTokens() {
        assertThat(strategy.extract("Skills: JS, Node", vocabulary))
                .containsExactlyInAnyOrder("javascript", "nodejs");
    }

    @Test
    @DisplayName("Should accept short skills only as whole tokens")
    void shouldGuardShortWords() {
        assertThat(strategy.extract("Technical skills: R, Go", vocabulary))
                .containsExactlyInAnyOrder("r", "go");
        assertThat(strategy.extract("Expertise: statistics in r", vocabulary))
                .containsExactly("statistics");
    }

    @Test
    @DisplayName("Should stop the section at the next full stop")
    void shouldStopAtFullStop() {
        assertThat(strategy.extract("Core competencies: Scrum, Agile. Hobbies: Python", vocabulary))
                .containsExactlyInAnyOrder("scrum", "agile");
    }

    @Test
    @DisplayName("Should return nothing without a header")
    void shouldIgnoreUnheadedText() {
        assertThat(strategy.extract("Python Java Docker", vocabulary)).isEmpty();
    }
}
