package dev.screener.nlp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedTextAnnotatorTest {

    private final RuleBasedTextAnnotator annotator = new RuleBasedTextAnnotator();

    @Test
    @DisplayName("Should find capitalized runs as entities")
    void shouldFindEntities() {
        Annotations annotations = annotator.annotate("Built services with Spring Boot and PostgreSQL on AWS.");

        assertThat(annotations.entities()).contains("Spring Boot", "PostgreSQL", "AWS");
    }

    @Test
    @DisplayName("Should split noun phrases on function words and punctuation")
    void shouldFindNounPhrases() {
        Annotations annotations = annotator.annotate("Deep learning for computer vision, data analysis.");

        assertThat(annotations.nounPhrases()).containsExactly("Deep learning", "computer vision", "data analysis");
    }

    @Test
    @DisplayName("Should cap noun phrases at four words")
    void shouldCapPhraseLength() {
        Annotations annotations = annotator.annotate("distributed scalable reliable resilient cloud platform");

        assertThat(annotations.nounPhrases()).containsExactly(
                "distributed scalable reliable resilient", "cloud platform");
    }

    @Test
    @DisplayName("Should report availability")
    void shouldBeAvailable() {
        assertThat(annotator.isAvailable()).isTrue();
        assertThat(annotator.getName()).isEqualTo("rule-based");
        assertThat(annotator.annotate(" ")).isEqualTo(Annotations.none());
    }
}
