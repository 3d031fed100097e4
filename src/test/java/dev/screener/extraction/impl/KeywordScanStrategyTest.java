package dev.screener.extraction.impl;

import dev.screener.dictionary.SkillVocabulary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordScanStrategyTest {

    private final KeywordScanStrategy strategy = new KeywordScanStrategy();

    @Test
    @DisplayName("Should find symbol skills case-insensitively")
    void shouldFindSymbolSkills() {
        assertThat(strategy.extract("C++ and C# developer, CI/CD pipelines", SkillVocabulary.defaults()))
                .containsExactlyInAnyOrder("c++", "c#", "ci/cd");
    }

    @ParameterizedTest(name = "''{1}'' in ''{0}'' -> {2}")
    @CsvSource({
            "'JavaScript developer', java, false",
            "'Java developer', java, true",
            "'Go/Rust', go, true",
            "'Google Cloud', go, false",
            "'R, Python', r, true",
            "'Ruby', r, false",
            "'machine  learning', machine learning, false",
            "'Machine Learning engineer', machine learning, true"
    })
    void shouldRespectBoundaries(String text, String skill, boolean expected) {
        assertThat(KeywordScanStrategy.containsSkill(text, skill)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should have a stable name")
    void shouldExposeName() {
        assertThat(strategy.getName()).isEqualTo("keyword");
    }
}
