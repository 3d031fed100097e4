package dev.screener.extraction;

import dev.screener.model.ContactInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContactInfoExtractorTest {

    private final ContactInfoExtractor extractor = new ContactInfoExtractor();

    @Test
    @DisplayName("Should find e-mail, phone and profile links")
    void shouldExtractAllContacts() {
        ContactInfo contact = extractor.extract("""
                Jane Roe
                jane.roe@example.com | +1 (555) 123-4567
                LinkedIn.com/in/Jane-Roe  github.com/janeroe
                """);

        assertThat(contact.email()).isEqualTo("jane.roe@example.com");
        assertThat(contact.phone()).isEqualTo("+1 (555) 123-4567");
        assertThat(contact.linkedin()).isEqualTo("linkedin.com/in/jane-roe");
        assertThat(contact.github()).isEqualTo("github.com/janeroe");
    }

    @Test
    @DisplayName("Should keep only the first e-mail address")
    void shouldTakeFirstEmail() {
        ContactInfo contact = extractor.extract("Reach me at first@example.com or second@example.org");

        assertThat(contact.email()).isEqualTo("first@example.com");
    }

    @Test
    @DisplayName("Should leave fields null when nothing is found")
    void shouldReturnNullsWithoutContacts() {
        ContactInfo contact = extractor.extract("Skills: Python, Django");

        assertThat(contact).isEqualTo(ContactInfo.none());
    }

    @Test
    @DisplayName("Should handle blank text")
    void shouldHandleBlank() {
        assertThat(extractor.extract(null)).isEqualTo(ContactInfo.none());
        assertThat(extractor.extract("   ")).isEqualTo(ContactInfo.none());
    }

    @Test
    @DisplayName("Should replace the found e-mail with a supplied one")
    void shouldPreferSuppliedEmail() {
        ContactInfo found = extractor.extract("old@example.com github.com/dev");

        assertThat(found.preferEmail("new@example.com").email()).isEqualTo("new@example.com");
        assertThat(found.preferEmail(" ").email()).isEqualTo("old@example.com");
        assertThat(found.preferEmail("new@example.com").github()).isEqualTo("github.com/dev");
    }
}
