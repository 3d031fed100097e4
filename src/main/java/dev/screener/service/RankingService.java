package dev.screener.service;

import dev.screener.config.ScoringConfig;
import dev.screener.model.CandidateComparison;
import dev.screener.model.CandidateComparison.Recommendation;
import dev.screener.model.ScoringResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders scored candidates, cuts shortlists and explains individual results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RankingService {

    private static final Comparator<ScoringResult> BY_OVERALL_DESC =
            Comparator.comparingDouble(ScoringResult::getOverallScore).reversed();

    private static final int EXPLAINED_SKILLS = 5;
    private static final double TIE_MARGIN = 0.05;

    private final ScoringConfig scoringConfig;

    /**
     * Sort results by overall score, highest first, and assign 1-based ranks.
     * The sort is stable: equal scores keep their input order. Must be called once,
     * on the complete result set for a target.
     *
     * @param results every result for one target
     * @return the same results in ranked order
     * @throws IllegalStateException if any result already carries a rank
     */
    public List<ScoringResult> rank(List<ScoringResult> results) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }
        for (ScoringResult result : results) {
            if (result.isRanked()) {
                throw new IllegalStateException("Result for candidate " + result.getCandidateId()
                        + " is already ranked at " + result.getRank());
            }
        }

        List<ScoringResult> sorted = new ArrayList<>(results);
        sorted.sort(BY_OVERALL_DESC);
        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).assignRank(i + 1);
        }

        log.debug("Ranked {} candidates, top score {}", sorted.size(), sorted.get(0).getOverallScore());
        return List.copyOf(sorted);
    }

    public List<ScoringResult> filterByThreshold(List<ScoringResult> results) {
        return filterByThreshold(results, getThreshold());
    }

    /**
     * Keep results scoring at or above the threshold, in their current order. Ranks are untouched.
     */
    public List<ScoringResult> filterByThreshold(List<ScoringResult> results, double threshold) {
        if (results == null) {
            return List.of();
        }
        return results.stream()
                .filter(result -> result.getOverallScore() >= threshold)
                .toList();
    }

    public List<ScoringResult> topK(List<ScoringResult> results) {
        return topK(results, scoringConfig.getTopK());
    }

    /**
     * The k best results by overall score, sorted independently of any earlier ranking.
     */
    public List<ScoringResult> topK(List<ScoringResult> results, int k) {
        if (results == null || k <= 0) {
            return List.of();
        }
        return results.stream()
                .sorted(BY_OVERALL_DESC)
                .limit(k)
                .toList();
    }

    /**
     * Human-readable rationale, one clause per signal plus the first matched skills.
     */
    public String explain(ScoringResult result) {
        List<String> parts = new ArrayList<>();

        double skillPct = result.getSkillMatchScore() * 100;
        if (skillPct >= 80) {
            parts.add(format("Excellent skill match (%.0f%%)", skillPct));
        } else if (skillPct >= 60) {
            parts.add(format("Good skill match (%.0f%%)", skillPct));
        } else if (skillPct >= 40) {
            parts.add(format("Moderate skill match (%.0f%%)", skillPct));
        } else {
            parts.add(format("Limited skill match (%.0f%%)", skillPct));
        }

        double semanticPct = result.getSemanticSimilarityScore() * 100;
        if (semanticPct >= 75) {
            parts.add(format("Strong semantic alignment (%.0f%%)", semanticPct));
        } else if (semanticPct >= 50) {
            parts.add(format("Moderate semantic alignment (%.0f%%)", semanticPct));
        } else {
            parts.add(format("Weak semantic alignment (%.0f%%)", semanticPct));
        }

        double experiencePct = result.getExperienceScore() * 100;
        if (experiencePct >= 100) {
            parts.add("Meets or exceeds experience requirements");
        } else if (experiencePct >= 75) {
            parts.add("Close to experience requirements");
        } else {
            parts.add("Below experience requirements");
        }

        List<String> matched = result.getMatchedSkills();
        if (!matched.isEmpty()) {
            String skillList = String.join(", ", matched.subList(0, Math.min(EXPLAINED_SKILLS, matched.size())));
            if (matched.size() > EXPLAINED_SKILLS) {
                skillList += " (+" + (matched.size() - EXPLAINED_SKILLS) + " more)";
            }
            parts.add("Matched skills: " + skillList);
        }

        return String.join(" | ", parts);
    }

    /**
     * Compare two results signal by signal. Overall differences within 0.05 are a tie.
     */
    public CandidateComparison compare(ScoringResult first, ScoringResult second) {
        double overallDiff = first.getOverallScore() - second.getOverallScore();
        Recommendation recommendation;
        if (overallDiff > TIE_MARGIN) {
            recommendation = Recommendation.FIRST;
        } else if (overallDiff < -TIE_MARGIN) {
            recommendation = Recommendation.SECOND;
        } else {
            recommendation = Recommendation.TIE;
        }
        return new CandidateComparison(
                first.getSkillMatchScore() - second.getSkillMatchScore(),
                first.getSemanticSimilarityScore() - second.getSemanticSimilarityScore(),
                first.getExperienceScore() - second.getExperienceScore(),
                overallDiff,
                recommendation);
    }

    /**
     * Get the configured score threshold.
     */
    public double getThreshold() {
        return scoringConfig.getThreshold();
    }

    private static String format(String template, double value) {
        return String.format(Locale.ROOT, template, value);
    }
}
