package dev.screener.service;

import dev.screener.config.ScoringConfig;
import dev.screener.exception.InvalidScoringInputException;
import dev.screener.exception.InvalidScoringInputException.Condition;
import dev.screener.model.CandidateProfile;
import dev.screener.model.ExtractedSkillSet;
import dev.screener.model.ScoringResult;
import dev.screener.model.ScoringWeights;
import dev.screener.model.SimilarityMethod;
import dev.screener.model.TargetProfile;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the skill-match, semantic-similarity and experience signals of a
 * candidate against a target and blends them into one overall score.
 * Stateless after construction and safe to call from many threads.
 */
@Slf4j
@Service
public class ScoringService {

    private static final double COVERAGE_WEIGHT = 0.7;
    private static final double JACCARD_WEIGHT = 0.3;
    private static final double EXCESS_YEARS_PER_BONUS_UNIT = 5.0;
    private static final double MAX_EXCESS_BONUS = 0.2;

    @Getter
    private final ScoringWeights weights;
    @Getter
    private final SimilarityMethod similarityMethod;
    private final double maxYears;

    public ScoringService(ScoringConfig scoringConfig) {
        Map<String, Double> configured = scoringConfig.getWeights();
        this.weights = configured == null || configured.isEmpty()
                ? ScoringWeights.defaults()
                : ScoringWeights.fromMap(configured);
        this.similarityMethod = SimilarityMethod.fromName(scoringConfig.getSimilarityMethod());
        if (scoringConfig.getMaxYears() <= 0) {
            throw new IllegalArgumentException("scoring.max-years must be positive, got " + scoringConfig.getMaxYears());
        }
        this.maxYears = scoringConfig.getMaxYears();
        log.info("Scoring weights: skill_match={}, semantic_similarity={}, experience={} (similarity: {})",
                weights.skillMatch(), weights.semanticSimilarity(), weights.experience(), similarityMethod);
    }

    /**
     * Result of the skill-match signal.
     */
    public record SkillMatch(double score, List<String> matchedSkills) {
    }

    /**
     * Score a candidate with the configured weights.
     */
    public ScoringResult score(CandidateProfile candidate, TargetProfile target) {
        return score(candidate, target, weights);
    }

    /**
     * Score a candidate against a target.
     *
     * @param candidate candidate profile
     * @param target    target profile
     * @param weights   normalized signal weights
     * @return unranked result with every score in [0, 1]
     * @throws InvalidScoringInputException if the embeddings differ in dimensionality
     */
    public ScoringResult score(CandidateProfile candidate, TargetProfile target, ScoringWeights weights) {
        SkillMatch skillMatch = calculateSkillMatch(candidate.skills(), target.requiredSkills());
        double semantic = calculateSemanticSimilarity(candidate.embedding(), target.embedding());
        double experience = calculateExperienceScore(candidate.experienceYears(), target.requiredExperienceYears());
        double overall = calculateOverallScore(skillMatch.score(), semantic, experience, weights);

        log.debug("Candidate '{}' vs target '{}': skill={}, semantic={}, experience={}, overall={}",
                candidate.id(), target.id(), skillMatch.score(), semantic, experience, overall);

        return ScoringResult.builder()
                .candidateId(candidate.id())
                .targetId(target.id())
                .skillMatchScore(skillMatch.score())
                .semanticSimilarityScore(semantic)
                .experienceScore(experience)
                .overallScore(overall)
                .matchedSkills(skillMatch.matchedSkills())
                .build();
    }

    /**
     * Blend requirement coverage with Jaccard overlap, favoring coverage.
     * A target without required skills gives full marks and no matches.
     */
    public SkillMatch calculateSkillMatch(ExtractedSkillSet candidateSkills, ExtractedSkillSet requiredSkills) {
        if (requiredSkills == null || requiredSkills.isEmpty()) {
            return new SkillMatch(1.0, List.of());
        }
        Set<String> candidate = candidateSkills != null ? candidateSkills.asSet() : Set.of();
        Set<String> required = requiredSkills.asSet();

        Set<String> matched = new TreeSet<>(candidate);
        matched.retainAll(required);
        Set<String> union = new HashSet<>(candidate);
        union.addAll(required);

        double coverage = (double) matched.size() / required.size();
        double jaccard = (double) matched.size() / union.size();
        double score = COVERAGE_WEIGHT * coverage + JACCARD_WEIGHT * jaccard;
        return new SkillMatch(clamp(score), List.copyOf(matched));
    }

    public double calculateSemanticSimilarity(double[] candidateEmbedding, double[] targetEmbedding) {
        return calculateSemanticSimilarity(candidateEmbedding, targetEmbedding, similarityMethod);
    }

    /**
     * Similarity of two embeddings mapped onto [0, 1].
     * Cosine and dot product are rescaled from [-1, 1]; a zero-magnitude vector has no
     * direction and scores 0. Euclidean distance d maps to 1 / (1 + d).
     *
     * @throws InvalidScoringInputException if the vectors differ in length
     */
    public double calculateSemanticSimilarity(double[] a, double[] b, SimilarityMethod method) {
        if (a == null || b == null || a.length == 0 || b.length == 0) {
            throw new InvalidScoringInputException(Condition.EMPTY_EMBEDDING, "Embeddings must not be empty");
        }
        if (a.length != b.length) {
            throw new InvalidScoringInputException(Condition.DIMENSION_MISMATCH,
                    "Embedding dimensions differ: " + a.length + " vs " + b.length);
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        double squaredDistance = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
            double diff = a[i] - b[i];
            squaredDistance += diff * diff;
        }

        switch (method) {
            case COSINE:
                if (normA == 0 || normB == 0) {
                    return 0.0;
                }
                return rescale(dot / (Math.sqrt(normA) * Math.sqrt(normB)));
            case DOT:
                if (normA == 0 || normB == 0) {
                    return 0.0;
                }
                return rescale(dot);
            case EUCLIDEAN:
                return 1.0 / (1.0 + Math.sqrt(squaredDistance));
            default:
                throw new InvalidScoringInputException(Condition.UNKNOWN_SIMILARITY_METHOD,
                        "Unsupported similarity method: " + method);
        }
    }

    public double calculateExperienceScore(double candidateYears, Double requiredYears) {
        return calculateExperienceScore(candidateYears, requiredYears, maxYears);
    }

    /**
     * Experience signal.
     * <ul>
     *   <li>no requirement: candidate years over {@code maxYears}, capped at 1</li>
     *   <li>requirement met: 1, the excess-years bonus is capped away by the ceiling</li>
     *   <li>requirement missed: linear shortfall, candidate years over required years</li>
     * </ul>
     */
    public double calculateExperienceScore(double candidateYears, Double requiredYears, double maxYears) {
        if (candidateYears < 0) {
            throw new InvalidScoringInputException(Condition.NEGATIVE_EXPERIENCE,
                    "Experience years must be non-negative, got " + candidateYears);
        }
        if (requiredYears == null) {
            return Math.min(candidateYears / maxYears, 1.0);
        }
        if (candidateYears >= requiredYears) {
            double bonus = Math.min((candidateYears - requiredYears) / EXCESS_YEARS_PER_BONUS_UNIT, MAX_EXCESS_BONUS);
            return Math.min(1.0 + bonus, 1.0);
        }
        return candidateYears / requiredYears;
    }

    /**
     * Weighted sum of the three signals.
     */
    public double calculateOverallScore(double skillScore, double semanticScore, double experienceScore,
                                        ScoringWeights weights) {
        double overall = weights.skillMatch() * skillScore
                + weights.semanticSimilarity() * semanticScore
                + weights.experience() * experienceScore;
        return clamp(overall);
    }

    private static double rescale(double similarity) {
        return clamp((Math.max(-1.0, Math.min(1.0, similarity)) + 1.0) / 2.0);
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
