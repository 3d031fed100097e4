package dev.screener.extraction.impl;

import dev.screener.dictionary.SkillVocabulary;
import dev.screener.extraction.ExtractionFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContextPatternStrategyTest {

    private ContextPatternStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new ContextPatternStrategy(ExtractionFixtures.vocabularyMatcher());
    }

    @Test
    @DisplayName("Should read skills after experience phrases")
    void shouldReadContextPhrases() {
        assertThat(strategy.extract(
                "I am experienced with docker and kubernetes, plus hands-on with terraform.",
                SkillVocabulary.defaults()))
                .containsExactlyInAnyOrder("docker", "kubernetes", "terraform");
    }

    @Test
    @DisplayName("Should resolve aliases after knowledge phrases")
    void shouldResolveAliases() {
        assertThat(strategy.extract("Good knowledge of TS", SkillVocabulary.defaults()))
                .containsExactly("typescript");
    }

    @Test
    @DisplayName("Should match multi-word skills as a whole phrase")
    void shouldMatchWholePhrase() {
        assertThat(strategy.extract("Strong background in machine learning", SkillVocabulary.defaults()))
                .containsExactly("machine learning");
    }
}
