package dev.screener.dictionary;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextCleanerTest {

    private TextCleaner textCleaner;

    @BeforeEach
    void setUp() {
        textCleaner = new TextCleaner();
    }

    @Test
    @DisplayName("Should strip tags while keeping list items apart")
    void shouldStripMarkup() {
        String cleaned = textCleaner.clean("<ul><li>Python</li><li>Java</li></ul>");

        assertThat(cleaned)
                .doesNotContain("<")
                .contains("Python")
                .contains("Java")
                .doesNotContain("PythonJava");
    }

    @Test
    @DisplayName("Should decode entities in markup")
    void shouldDecodeEntities() {
        assertThat(textCleaner.clean("<p>Python &amp; Django</p>")).contains("Python & Django");
    }

    @Test
    @DisplayName("Should leave plain text untouched")
    void shouldPassPlainTextThrough() {
        String text = "Skills: Python, Java\nTools: Git";

        assertThat(textCleaner.clean(text)).isEqualTo(text);
    }

    @Test
    @DisplayName("Should remove URLs and e-mail addresses")
    void shouldRemoveUrlsAndEmails() {
        String cleaned = textCleaner.clean("Code at https://github.com/jane, mail jane@example.com");

        assertThat(cleaned)
                .doesNotContain("github.com")
                .doesNotContain("@")
                .contains("Code at");
    }

    @Test
    @DisplayName("Should return empty string for blank input")
    void shouldHandleBlank() {
        assertThat(textCleaner.clean(null)).isEmpty();
        assertThat(textCleaner.clean("  \n ")).isEmpty();
    }
}
