package dev.screener;

import dev.screener.extraction.SkillCategorizer;
import dev.screener.model.ScoringResult;
import dev.screener.model.ScreeningReport;
import dev.screener.model.ScreeningRequest;
import dev.screener.service.ScreeningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Runs the configured screening batch and logs the ranked report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final ScreeningService screeningService;
  private final ScreeningRequest screeningRequest;
  private final SkillCategorizer skillCategorizer;

  /**
   * Screens the configured batch.
   *
   * @return Number of shortlisted candidates
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Resume Screener Starting");
    log.info(SEPARATOR);

    if (screeningRequest.getTarget() == null) {
      log.warn("No screening target configured - nothing to do");
      return 0;
    }

    try {
      ScreeningReport report = screeningService.screen(screeningRequest).block();
      if (report == null) {
        return 0;
      }

      log.info(SEPARATOR);
      log.info("Ranking for target {}", report.targetId());
      skillCategorizer.categorize(report.requirements().required())
          .forEach((category, skills) -> log.info("  required {}: {}", category.getLabel(), skills));
      for (ScoringResult result : report.ranked()) {
        log.info("  #{} {} [{}] (overall: {})", result.getRank(), result.getDisplayName(),
            result.getCandidateId(), formatScore(result.getOverallScore()));
        if (result.getContact().email() != null) {
          log.info("     contact: {}", result.getContact().email());
        }
        log.info("     {}", report.explanations().get(result.getCandidateId()));
      }
      log.info("Shortlisted: {}", report.shortlist().size());
      log.info(SEPARATOR);

      return report.shortlist().size();
    } catch (Exception e) {
      log.error("Screening failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Screening execution failed", e);
    }
  }

  static String formatScore(double score) {
    return String.format(Locale.ROOT, "%.4f", score);
  }
}
