package dev.screener.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for extraction, scoring and ranking.
 */
@Component
public class ScreenerMetrics {

    private static final String TAG_STRATEGY = "strategy";
    private final MeterRegistry registry;

    // Counters
    private final Counter documentsProcessedCounter;
    private final Counter skillsExtractedCounter;
    private final Counter candidatesScoredCounter;
    private final Counter candidatesShortlistedCounter;
    private final Counter annotatorFallbacksCounter;

    // Timers (per strategy)
    private final ConcurrentHashMap<String, Timer> strategyTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastRunCandidates = new AtomicInteger(0);
    private final AtomicInteger lastRunShortlisted = new AtomicInteger(0);
    private final AtomicInteger lastRunRequiredSkills = new AtomicInteger(0);

    public ScreenerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.documentsProcessedCounter = Counter.builder("screener_documents_processed_total")
                .description("Total documents run through skill extraction")
                .register(registry);

        this.skillsExtractedCounter = Counter.builder("screener_skills_extracted_total")
                .description("Total canonical skills extracted across documents")
                .register(registry);

        this.candidatesScoredCounter = Counter.builder("screener_candidates_scored_total")
                .description("Total candidate/target pairs scored")
                .register(registry);

        this.candidatesShortlistedCounter = Counter.builder("screener_candidates_shortlisted_total")
                .description("Total candidates at or above the score threshold")
                .register(registry);

        this.annotatorFallbacksCounter = Counter.builder("screener_annotator_fallbacks_total")
                .description("Entity/phrase scans that contributed nothing because annotation failed")
                .register(registry);

        Gauge.builder("screener_last_run_candidates", lastRunCandidates, AtomicInteger::get)
                .description("Candidates ranked in last run")
                .register(registry);

        Gauge.builder("screener_last_run_shortlisted", lastRunShortlisted, AtomicInteger::get)
                .description("Candidates shortlisted in last run")
                .register(registry);

        Gauge.builder("screener_last_run_required_skills", lastRunRequiredSkills, AtomicInteger::get)
                .description("Required skills of the target in last run")
                .register(registry);
    }

    /**
     * Get or create a timer for an extraction strategy.
     */
    public Timer getStrategyTimer(String strategyName) {
        return strategyTimers.computeIfAbsent(strategyName, name ->
                Timer.builder("screener_extraction_strategy_duration")
                        .description("Time spent in one extraction strategy")
                        .tag(TAG_STRATEGY, name)
                        .register(registry)
        );
    }

    /**
     * Record one extracted document and the size of its skill set.
     */
    public void recordExtraction(int skillCount) {
        documentsProcessedCounter.increment();
        skillsExtractedCounter.increment(skillCount);
    }

    public void recordCandidatesScored(int count) {
        candidatesScoredCounter.increment(count);
    }

    public void recordCandidatesShortlisted(int count) {
        candidatesShortlistedCounter.increment(count);
    }

    public void recordAnnotatorFallback() {
        annotatorFallbacksCounter.increment();
    }

    /**
     * Update last run statistics.
     */
    public void updateLastRunStats(int candidates, int shortlisted, int requiredSkills) {
        lastRunCandidates.set(candidates);
        lastRunShortlisted.set(shortlisted);
        lastRunRequiredSkills.set(requiredSkills);
    }
}
