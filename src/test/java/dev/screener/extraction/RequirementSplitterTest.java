package dev.screener.extraction;

import dev.screener.model.RequirementSplit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequirementSplitterTest {

    private RequirementSplitter splitter;

    @BeforeEach
    void setUp() {
        splitter = ExtractionFixtures.requirementSplitter(ExtractionFixtures.extractor());
    }

    @Test
    @DisplayName("Should split required and nice-to-have sections")
    void shouldSplitSections() {
        RequirementSplit split = splitter.splitRequirements(
                "Required: Python, Django. Nice to have: Docker, AWS.");

        assertThat(split.required().asList()).containsExactly("django", "python");
        assertThat(split.preferred().asList()).containsExactly("aws", "docker");
    }

    @Test
    @DisplayName("Should recognize must-have and bonus phrasing")
    void shouldRecognizeAlternativeHeaders() {
        RequirementSplit split = splitter.splitRequirements(
                "Must have: Java and Spring. Bonus: Kubernetes.");

        assertThat(split.required().asList()).containsExactly("java", "spring");
        assertThat(split.preferred().asList()).containsExactly("kubernetes");
    }

    @Test
    @DisplayName("Should keep a skill listed under both headers in both sets")
    void shouldKeepSkillInBothSets() {
        RequirementSplit split = splitter.splitRequirements("Required: Python. Preferred: Python, Go.");

        assertThat(split.required().asList()).containsExactly("python");
        assertThat(split.preferred().asList()).containsExactly("go", "python");
    }

    @Test
    @DisplayName("Should resolve aliases listed under a header")
    void shouldResolveAliasesInSections() {
        RequirementSplit split = splitter.splitRequirements("Required: JS, TS. Nice to have: Docker.");

        assertThat(split.required().asList()).containsExactly("javascript", "typescript");
        assertThat(split.preferred().asList()).containsExactly("docker");
    }

    @Test
    @DisplayName("Should not end a section at the dot inside node.js")
    void shouldKeepDottedAliasInSection() {
        RequirementSplit split = splitter.splitRequirements("Required: JS, TS, Node.js. Nice to have: Docker.");

        assertThat(split.required().asList()).containsExactly("javascript", "nodejs", "typescript");
        assertThat(split.preferred().asList()).containsExactly("docker");
    }

    @Test
    @DisplayName("Should end a bulleted section at the next header")
    void shouldStopSectionAtNextHeader() {
        RequirementSplit split = splitter.splitRequirements(
                "Requirements:\n- Python\n- Django\nNice to have:\n- AWS");

        assertThat(split.required().asList()).containsExactly("django", "python");
        assertThat(split.preferred().asList()).containsExactly("aws");
    }

    @Test
    @DisplayName("Should treat all skills as required when no header is present")
    void shouldFallBackToAllRequired() {
        RequirementSplit split = splitter.splitRequirements("We build APIs with Python and Docker.");

        assertThat(split.required().asList()).containsExactly("docker", "python");
        assertThat(split.preferred().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should return empty split for blank text")
    void shouldHandleBlank() {
        RequirementSplit split = splitter.splitRequirements("  ");

        assertThat(split.required().isEmpty()).isTrue();
        assertThat(split.preferred().isEmpty()).isTrue();
    }
}
