package com.brandinsight.research.service.orchestration;

import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.dto.CandidateCompetitor;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.dto.RunResult;
import com.brandinsight.research.dto.RunStatus;
import com.brandinsight.research.dto.StepError;
import com.brandinsight.research.dto.StepResult;
import com.brandinsight.research.entity.AnalysisRecord;
import com.brandinsight.research.entity.ResearchJob;
import com.brandinsight.research.entity.ResearchJobStatus;
import com.brandinsight.research.exception.ProviderException;
import com.brandinsight.research.exception.ResearchJobNotFoundException;
import com.brandinsight.research.service.analysis.AskAllResult;
import com.brandinsight.research.service.analysis.DeepQuestionService;
import com.brandinsight.research.service.analysis.QuestionContext;
import com.brandinsight.research.service.analysis.QuestionOutcome;
import com.brandinsight.research.service.auxiliary.BrandContextResult;
import com.brandinsight.research.service.auxiliary.BrandContextSearchService;
import com.brandinsight.research.service.auxiliary.ProfileScrapeResult;
import com.brandinsight.research.service.auxiliary.ProfileScrapingService;
import com.brandinsight.research.service.auxiliary.SearchTrendService;
import com.brandinsight.research.service.auxiliary.TrendsResult;
import com.brandinsight.research.service.community.CommunityDetectiveService;
import com.brandinsight.research.service.community.CommunityScanResult;
import com.brandinsight.research.service.discovery.CompetitorDiscoveryService;
import com.brandinsight.research.service.discovery.DiscoveryOutcome;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import com.brandinsight.research.service.quality.DataQualityScorer;
import com.brandinsight.research.service.quality.QualityDataType;
import com.brandinsight.research.store.ResearchStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Research orchestration.
 *
 * Runs BRAND_CONTEXT, DISCOVERY, ANALYSIS, COMMUNITY, PROFILE_SCRAPING and SEARCH_TRENDS in order
 * for one job. Steps already satisfied by persisted data are skipped and tagged
 * {@code <STEP>_SKIPPED_RESUME}. Step failures are collected as {@link StepError}s; the only
 * exception that leaves this class is {@link ResearchJobNotFoundException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchOrchestrationService {

    static final int ANALYSIS_COMPETITOR_CONTEXT = 10;

    private final ResearchStore store;
    private final ResumeCheckpointGate checkpointGate;
    private final BrandContextSearchService brandContextService;
    private final CompetitorDiscoveryService discoveryService;
    private final DeepQuestionService questionService;
    private final CommunityDetectiveService communityService;
    private final ProfileScrapingService profileScrapingService;
    private final SearchTrendService searchTrendService;
    private final DataQualityScorer qualityScorer;
    private final ConnectorHealthTracker healthTracker;
    private final ResearchProperties properties;
    private final MeterRegistry meterRegistry;

    public RunResult orchestrate(String jobId) {
        ResearchJob job = store.findJob(jobId)
                .orElseThrow(() -> new ResearchJobNotFoundException(jobId));

        Timer.Sample sample = Timer.start(meterRegistry);
        long start = System.currentTimeMillis();
        RunResult result = RunResult.builder()
                .jobId(jobId)
                .startedAt(LocalDateTime.now())
                .build();

        log.info("[Orchestrator] Starting run for job {} (@{})", jobId, job.getHandle());
        updateStatus(jobId, ResearchJobStatus.RUNNING, result);

        ResearchContext context = ResearchContext.fromJob(job);
        CheckpointSnapshot checkpoint = checkpointGate.evaluate(jobId);

        context = runBrandContext(context, checkpoint, result);
        runDiscovery(context, checkpoint, result);
        List<CandidateCompetitor> competitors = loadCompetitors(jobId, result);
        result.setCompetitors(competitors);

        runAnalysis(context, competitors, checkpoint, result);
        result.setAnalysisRecords(loadAnalyses(jobId, result));

        runCommunity(context, checkpoint, result);
        runProfileScraping(context, competitors, checkpoint, result);
        runSearchTrends(context, checkpoint, result);

        List<String> degraded = healthTracker.degradedNames();
        result.setDegradedConnectors(new ArrayList<>(degraded));
        for (String connector : degraded) {
            result.getWarnings().add("Connector degraded: " + connector);
        }

        RunStatus status = result.getErrors().isEmpty() ? RunStatus.COMPLETE : RunStatus.PARTIAL;
        result.setStatus(status);
        updateStatus(jobId, status == RunStatus.COMPLETE ? ResearchJobStatus.COMPLETED : ResearchJobStatus.PARTIAL, result);
        result.setDurationMs(System.currentTimeMillis() - start);

        sample.stop(Timer.builder("research.run.duration")
                .description("Research orchestration run duration")
                .tag("status", status.name())
                .register(meterRegistry));

        log.info("[Orchestrator] Run for job {} finished {} in {}ms: competitors={}, answers={}, errors={}, layers={}",
                jobId, status, result.getDurationMs(), competitors.size(), result.getAnalysisRecords().size(),
                result.getErrors().size(), result.getLayersUsed());
        return result;
    }

    private ResearchContext runBrandContext(ResearchContext context, CheckpointSnapshot checkpoint, RunResult result) {
        ResearchStep step = ResearchStep.BRAND_CONTEXT;
        if (skipIfDone(step, checkpoint, result)) {
            if (!context.hasWebResearch()) {
                String stored = guarded(step, () -> brandContextService.summaryFromStore(context.jobId()), result);
                return stored != null ? context.withWebResearchSummary(stored) : context;
            }
            return context;
        }

        StepResult<BrandContextResult> outcome = runStep(step, () -> brandContextService.gather(context));
        record(step, outcome, result);
        return outcome.getValue()
                .map(BrandContextResult::summary)
                .filter(summary -> !context.hasWebResearch())
                .map(context::withWebResearchSummary)
                .orElse(context);
    }

    private void runDiscovery(ResearchContext context, CheckpointSnapshot checkpoint, RunResult result) {
        ResearchStep step = ResearchStep.DISCOVERY;
        if (skipIfDone(step, checkpoint, result)) {
            return;
        }

        StepResult<DiscoveryOutcome> outcome = runStep(step, () -> discoveryService.discover(context));
        record(step, outcome, result);
        outcome.getValue().ifPresent(discovery -> {
            result.getLayersUsed().addAll(discovery.layersUsed());
            result.getWarnings().addAll(discovery.warnings());
            recordErrors(step, discovery.errors(), result);
            result.getQualityReports().add(qualityScorer.score("discovery", discovery.mergedCandidates(),
                    QualityDataType.COMPETITOR, properties.getDiscovery().getMinCandidates()));

            for (CandidateCompetitor candidate : discovery.candidates()) {
                try {
                    store.upsertCompetitor(candidate.toEntity(context.jobId()));
                } catch (RuntimeException e) {
                    recordErrors(step, List.of(new StepError(step.name(), "PERSISTENCE", e.getMessage())), result);
                    log.warn("[Orchestrator] Could not persist competitors for job {}: {}", context.jobId(), e.getMessage());
                    break;
                }
            }
        });
    }

    private void runAnalysis(ResearchContext context, List<CandidateCompetitor> competitors,
                             CheckpointSnapshot checkpoint, RunResult result) {
        ResearchStep step = ResearchStep.ANALYSIS;
        if (skipIfDone(step, checkpoint, result)) {
            return;
        }

        List<String> competitorHandles = competitors.stream()
                .limit(ANALYSIS_COMPETITOR_CONTEXT)
                .map(CandidateCompetitor::handle)
                .toList();
        QuestionContext questionContext = QuestionContext.from(context, competitorHandles,
                properties.getAnalysis().getContextExcerptChars());

        StepResult<AskAllResult> outcome = runStep(step,
                () -> questionService.askAllQuestions(context.jobId(), questionContext));
        record(step, outcome, result);
        outcome.getValue().ifPresent(all -> {
            List<StepError> failures = new ArrayList<>();
            for (QuestionOutcome failed : all.failures()) {
                failures.add(new StepError(step.name(), failed.questionType().name(), failed.error()));
            }
            recordErrors(step, failures, result);
        });
    }

    private void runCommunity(ResearchContext context, CheckpointSnapshot checkpoint, RunResult result) {
        ResearchStep step = ResearchStep.COMMUNITY;
        if (skipIfDone(step, checkpoint, result)) {
            return;
        }

        StepResult<CommunityScanResult> outcome = runStep(step, () -> communityService.scan(context));
        record(step, outcome, result);
        outcome.getValue().ifPresent(scan -> {
            result.setCommunityScan(scan);
            recordErrors(step, scan.errors(), result);
            if (scan.linksCollected() == 0) {
                result.getWarnings().add("No community discussions mention " + context.displayName());
            }
        });
    }

    private void runProfileScraping(ResearchContext context, List<CandidateCompetitor> competitors,
                                    CheckpointSnapshot checkpoint, RunResult result) {
        ResearchStep step = ResearchStep.PROFILE_SCRAPING;
        if (skipIfDone(step, checkpoint, result)) {
            return;
        }

        StepResult<ProfileScrapeResult> outcome = runStep(step,
                () -> profileScrapingService.scrape(context, competitors));
        record(step, outcome, result);
        outcome.getValue().ifPresent(scrape -> {
            recordErrors(step, scrape.errors(), result);
            result.getQualityReports().add(scrape.quality());
        });
    }

    private void runSearchTrends(ResearchContext context, CheckpointSnapshot checkpoint, RunResult result) {
        ResearchStep step = ResearchStep.SEARCH_TRENDS;
        if (skipIfDone(step, checkpoint, result)) {
            return;
        }
        StepResult<TrendsResult> outcome = runStep(step, () -> searchTrendService.analyze(context));
        record(step, outcome, result);
    }

    private boolean skipIfDone(ResearchStep step, CheckpointSnapshot checkpoint, RunResult result) {
        if (!checkpoint.isDone(step)) {
            return false;
        }
        log.info("[Orchestrator] Skipping {} for job {}: {} records already stored (threshold {})",
                step, result.getJobId(), checkpoint.countOf(step), checkpoint.thresholds().get(step));
        result.getLayersUsed().add(step.skipTag());
        meterRegistry.counter("research.step.skipped", "step", step.name()).increment();
        return true;
    }

    private <T> StepResult<T> runStep(ResearchStep step, Supplier<T> action) {
        try {
            return StepResult.success(action.get());
        } catch (RuntimeException e) {
            String source = e instanceof ProviderException pe && pe.getConnector() != null
                    ? pe.getConnector()
                    : step.name();
            log.warn("[Orchestrator] Step {} failed: {}", step, e.getMessage());
            return StepResult.failure(new StepError(step.name(), source, e.getMessage()));
        }
    }

    private void record(ResearchStep step, StepResult<?> outcome, RunResult result) {
        recordErrors(step, outcome.getErrors(), result);
    }

    private void recordErrors(ResearchStep step, List<StepError> errors, RunResult result) {
        if (errors.isEmpty()) {
            return;
        }
        result.getErrors().addAll(errors);
        meterRegistry.counter("research.step.errors", "step", step.name()).increment(errors.size());
    }

    private <T> T guarded(ResearchStep step, Supplier<T> action, RunResult result) {
        StepResult<T> outcome = runStep(step, action);
        record(step, outcome, result);
        return outcome.getValue().orElse(null);
    }

    private List<CandidateCompetitor> loadCompetitors(String jobId, RunResult result) {
        List<CandidateCompetitor> competitors = guarded(ResearchStep.DISCOVERY,
                () -> store.findCompetitors(jobId).stream().map(CandidateCompetitor::fromEntity).toList(),
                result);
        return competitors == null ? new ArrayList<>() : new ArrayList<>(competitors);
    }

    private List<AnalysisRecord> loadAnalyses(String jobId, RunResult result) {
        List<AnalysisRecord> records = guarded(ResearchStep.ANALYSIS,
                () -> questionService.getAnsweredQuestions(jobId), result);
        return records == null ? new ArrayList<>() : new ArrayList<>(records);
    }

    private void updateStatus(String jobId, ResearchJobStatus status, RunResult result) {
        try {
            store.updateJobStatus(jobId, status);
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Could not set job {} to {}: {}", jobId, status, e.getMessage());
            result.getWarnings().add("Status update to " + status + " failed: " + e.getMessage());
        }
    }
}
