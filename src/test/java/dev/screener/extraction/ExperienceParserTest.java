package dev.screener.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ExperienceParserTest {

    private final ExperienceParser parser = new ExperienceParser();

    @ParameterizedTest(name = "''{0}'' -> {1}")
    @CsvSource({
            "'5+ years of experience in Java', 5.0",
            "'Experience of 3 years with Python', 3.0",
            "'2.5 yrs experience', 2.5",
            "'8 years professional software development', 8.0",
            "'7 years industry, 2 years of experience leading teams', 7.0"
    })
    void shouldParseYears(String text, double expected) {
        assertThat(parser.yearsOfExperience(text)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should return zero when no figure is stated")
    void shouldDefaultToZero() {
        assertThat(parser.yearsOfExperience("Passionate engineer with a love of clean code")).isZero();
        assertThat(parser.yearsOfExperience(null)).isZero();
    }
}
