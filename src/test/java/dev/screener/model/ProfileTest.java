package dev.screener.model;

import dev.screener.exception.InvalidScoringInputException;
import dev.screener.exception.InvalidScoringInputException.Condition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileTest {

    @Nested
    @DisplayName("CandidateProfile")
    class CandidateProfileTests {

        @Test
        @DisplayName("Should reject negative experience")
        void shouldRejectNegativeExperience() {
            assertThatThrownBy(() -> new CandidateProfile("c1", ExtractedSkillSet.empty(), -1, new double[]{1.0}))
                    .isInstanceOf(InvalidScoringInputException.class)
                    .extracting("condition").isEqualTo(Condition.NEGATIVE_EXPERIENCE);
        }

        @Test
        @DisplayName("Should reject an empty embedding")
        void shouldRejectEmptyEmbedding() {
            assertThatThrownBy(() -> new CandidateProfile("c1", ExtractedSkillSet.empty(), 1, new double[0]))
                    .isInstanceOf(InvalidScoringInputException.class)
                    .extracting("condition").isEqualTo(Condition.EMPTY_EMBEDDING);
        }

        @Test
        @DisplayName("Should not share the embedding array")
        void shouldCopyEmbedding() {
            double[] embedding = {1.0, 2.0};
            CandidateProfile profile = new CandidateProfile("c1", null, 2, embedding);
            embedding[0] = 9.0;
            profile.embedding()[1] = 9.0;

            assertThat(profile.embedding()).containsExactly(1.0, 2.0);
            assertThat(profile.skills().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("TargetProfile")
    class TargetProfileTests {

        @Test
        @DisplayName("Should allow a missing experience requirement")
        void shouldAllowNullExperience() {
            TargetProfile target = new TargetProfile("t1", ExtractedSkillSet.of("python"), null, new double[]{1, 0, 0});

            assertThat(target.requiredExperienceYears()).isNull();
            assertThat(target.embedding()).hasSize(3);
        }

        @Test
        @DisplayName("Should reject negative experience requirement")
        void shouldRejectNegativeRequirement() {
            assertThatThrownBy(() -> new TargetProfile("t1", null, -2.0, new double[]{1}))
                    .isInstanceOf(InvalidScoringInputException.class)
                    .extracting("condition").isEqualTo(Condition.NEGATIVE_EXPERIENCE);
        }

        @Test
        @DisplayName("Should reject a missing embedding")
        void shouldRejectMissingEmbedding() {
            assertThatThrownBy(() -> new TargetProfile("t1", null, null, null))
                    .isInstanceOf(InvalidScoringInputException.class)
                    .extracting("condition").isEqualTo(Condition.EMPTY_EMBEDDING);
        }
    }

    @Test
    @DisplayName("Should resolve similarity methods case-insensitively")
    void shouldResolveSimilarityMethod() {
        assertThat(SimilarityMethod.fromName(" Cosine ")).isEqualTo(SimilarityMethod.COSINE);
        assertThatThrownBy(() -> SimilarityMethod.fromName("manhattan"))
                .isInstanceOf(InvalidScoringInputException.class)
                .extracting("condition").isEqualTo(Condition.UNKNOWN_SIMILARITY_METHOD);
    }
}
