package dev.screener.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One target and the candidates to rank against it.
 * Embeddings are produced upstream and supplied with each document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreeningRequest {

    private TargetDocument target;

    @Builder.Default
    private List<CandidateDocument> candidates = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TargetDocument {
        private String id;
        private String title;
        private String text;
        private Double requiredExperienceYears; // null when the posting states none
        private double[] embedding;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CandidateDocument {
        private String id;
        private String name; // falls back to the e-mail found in the text
        private String email;
        private String text;
        private Double experienceYears; // parsed from text when absent
        private double[] embedding;
    }
}
