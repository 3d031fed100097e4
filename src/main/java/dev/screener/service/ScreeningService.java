package dev.screener.service;

import dev.screener.extraction.ContactInfoExtractor;
import dev.screener.extraction.ExperienceParser;
import dev.screener.extraction.RequirementSplitter;
import dev.screener.extraction.SkillExtractor;
import dev.screener.metrics.ScreenerMetrics;
import dev.screener.model.CandidateProfile;
import dev.screener.model.ContactInfo;
import dev.screener.model.ExtractedSkillSet;
import dev.screener.model.RequirementSplit;
import dev.screener.model.ScoringResult;
import dev.screener.model.ScreeningReport;
import dev.screener.model.ScreeningRequest;
import dev.screener.model.ScreeningRequest.CandidateDocument;
import dev.screener.model.ScreeningRequest.TargetDocument;
import dev.screener.model.TargetProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Main orchestration service: extracts skills, scores every candidate in parallel
 * and ranks the complete result set for one target.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScreeningService {

    private static final String SEPARATOR = "========================================";

    private final SkillExtractor skillExtractor;
    private final RequirementSplitter requirementSplitter;
    private final ExperienceParser experienceParser;
    private final ContactInfoExtractor contactInfoExtractor;
    private final ScoringService scoringService;
    private final RankingService rankingService;
    private final ScreenerMetrics metrics;

    /**
     * Screen all candidates of a request against its target.
     *
     * @param request target and candidates with pre-computed embeddings
     * @return report with ranked results and the shortlist
     */
    public Mono<ScreeningReport> screen(ScreeningRequest request) {
        if (request == null || request.getTarget() == null) {
            return Mono.error(new IllegalArgumentException("Screening request has no target"));
        }

        return Mono.fromCallable(() -> buildTarget(request.getTarget()))
                .flatMap(target -> scoreAll(target, request.getCandidates())
                        .map(results -> buildReport(target, results)));
    }

    private TargetWithRequirements buildTarget(TargetDocument document) {
        log.info(SEPARATOR);
        log.info("Screening against target: {} ({})", document.getId(), document.getTitle());
        log.info(SEPARATOR);

        RequirementSplit requirements = requirementSplitter.splitRequirements(document.getText());
        log.info("Target requires {} skills, prefers {}: {}",
                requirements.required().size(), requirements.preferred().size(), requirements.required());

        TargetProfile profile = new TargetProfile(document.getId(), requirements.required(),
                document.getRequiredExperienceYears(), document.getEmbedding());
        return new TargetWithRequirements(profile, requirements);
    }

    private Mono<List<ScoringResult>> scoreAll(TargetWithRequirements target, List<CandidateDocument> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Mono.just(List.of());
        }
        log.info("Scoring {} candidates", candidates.size());

        // flatMapSequential keeps input order, which the stable ranking relies on for ties
        return Flux.fromIterable(candidates)
                .flatMapSequential(document -> Mono.fromCallable(() -> scoreCandidate(document, target.profile()))
                        .subscribeOn(Schedulers.parallel()))
                .collectList();
    }

    private ScoringResult scoreCandidate(CandidateDocument document, TargetProfile target) {
        ExtractedSkillSet skills = skillExtractor.extract(document.getText());
        double years = document.getExperienceYears() != null
                ? document.getExperienceYears()
                : experienceParser.yearsOfExperience(document.getText());

        CandidateProfile candidate = new CandidateProfile(document.getId(), skills, years, document.getEmbedding());
        ContactInfo contact = contactInfoExtractor.extract(document.getText()).preferEmail(document.getEmail());
        return scoringService.score(candidate, target).toBuilder()
                .candidateName(resolveName(document, contact))
                .contact(contact)
                .build();
    }

    private static String resolveName(CandidateDocument document, ContactInfo contact) {
        if (document.getName() != null && !document.getName().isBlank()) {
            return document.getName();
        }
        return contact.email() != null ? contact.email() : document.getId();
    }

    private ScreeningReport buildReport(TargetWithRequirements target, List<ScoringResult> results) {
        String targetId = target.profile().id();
        metrics.recordCandidatesScored(results.size());

        if (results.isEmpty()) {
            log.info("No candidates to rank for target {}", targetId);
            metrics.updateLastRunStats(0, 0, target.requirements().required().size());
            return ScreeningReport.empty(targetId, target.requirements());
        }

        List<ScoringResult> ranked = rankingService.rank(results);
        List<ScoringResult> shortlist = rankingService.topK(rankingService.filterByThreshold(ranked));

        Map<String, String> explanations = new LinkedHashMap<>();
        ranked.forEach(result -> explanations.put(result.getCandidateId(), rankingService.explain(result)));

        metrics.recordCandidatesShortlisted(shortlist.size());
        metrics.updateLastRunStats(ranked.size(), shortlist.size(), target.requirements().required().size());

        log.info("Shortlisted {} of {} candidates (score >= {})",
                shortlist.size(), ranked.size(), rankingService.getThreshold());

        return new ScreeningReport(targetId, target.requirements(), ranked, shortlist, explanations);
    }

    private record TargetWithRequirements(TargetProfile profile, RequirementSplit requirements) {
    }
}
