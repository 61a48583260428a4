package com.brandinsight.research.service.discovery;

import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.dto.CandidateCompetitor;
import com.brandinsight.research.dto.ResearchContext;
import com.brandinsight.research.dto.StepError;
import com.brandinsight.research.exception.ProviderException;
import com.brandinsight.research.service.health.ConnectorHealthTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layered competitor discovery.
 *
 * Layer order:
 * 1. Direct platform search - exact profile URLs, strongest signal
 * 2. Keyword search - always runs, cheap and additive
 * 3. Legacy discovery script - only while below the minimum candidate count
 * 4. Browser automation - only while still below the minimum
 *
 * Each layer is isolated: a failure becomes a {@link StepError} and the next layer runs.
 * Candidates are merged first-writer-wins on (platform, handle), then validated and sorted.
 * An empty result is returned as-is; nothing is synthesized.
 */
@Service
@Slf4j
public class CompetitorDiscoveryService {

    static final String STEP = "DISCOVERY";
    static final String VALIDATION_SOURCE = "CANDIDATE_VALIDATION";

    private final List<DiscoveryLayerProvider> layers;
    private final CandidateValidator validator;
    private final ConnectorHealthTracker healthTracker;
    private final ResearchProperties properties;

    public CompetitorDiscoveryService(List<DiscoveryLayerProvider> layers,
                                      CandidateValidator validator,
                                      ConnectorHealthTracker healthTracker,
                                      ResearchProperties properties) {
        this.layers = layers.stream()
                .sorted(Comparator.comparingInt(provider -> provider.layer().ordinal()))
                .toList();
        this.validator = validator;
        this.healthTracker = healthTracker;
        this.properties = properties;
    }

    public DiscoveryOutcome discover(ResearchContext context) {
        ResearchProperties.Discovery config = properties.getDiscovery();
        List<StepError> errors = new ArrayList<>();
        List<String> layersUsed = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, CandidateCompetitor> merged = new LinkedHashMap<>();

        log.info("[Discovery] Starting for @{} ({} layers, minimum {})",
                context.cleanHandle(), layers.size(), config.getMinCandidates());

        for (DiscoveryLayerProvider provider : layers) {
            String layerName = provider.layer().name();
            if (provider.layer().isFallbackOnly() && merged.size() >= config.getMinCandidates()) {
                log.debug("[Discovery] Skipping {}: already have {} candidates", layerName, merged.size());
                continue;
            }

            String connector = provider.connectorName();
            try {
                List<CandidateCompetitor> found = provider.discover(context, config.getResultLimit());
                healthTracker.markOk(connector);

                int added = 0;
                for (CandidateCompetitor candidate : found) {
                    if (merged.putIfAbsent(candidate.identityKey(), candidate) == null) {
                        added++;
                    }
                }
                if (!found.isEmpty()) {
                    layersUsed.add(layerName);
                }
                log.info("[Discovery] {} returned {} candidates ({} new, {} total)",
                        layerName, found.size(), added, merged.size());

            } catch (RuntimeException e) {
                String failedConnector = e instanceof ProviderException pe && pe.getConnector() != null
                        ? pe.getConnector()
                        : connector;
                healthTracker.markDegraded(failedConnector, e.getMessage());
                errors.add(new StepError(STEP, layerName, e.getMessage()));
                log.warn("[Discovery] {} failed: {}", layerName, e.getMessage());
            }
        }

        List<CandidateCompetitor> mergedList = List.copyOf(merged.values());
        List<CandidateCompetitor> validated = validate(mergedList, context, errors);

        if (validated.isEmpty()) {
            warnings.add("Low candidate count: no competitors found for @" + context.cleanHandle());
            log.warn("[Discovery] No competitors survived for @{}", context.cleanHandle());
        } else if (validated.size() < config.getMinCandidates()) {
            warnings.add(String.format("Low candidate count: %d of %d expected",
                    validated.size(), config.getMinCandidates()));
        }

        log.info("[Discovery] Complete for @{}: merged={}, validated={}, layers={}, errors={}",
                context.cleanHandle(), mergedList.size(), validated.size(), layersUsed, errors.size());
        return new DiscoveryOutcome(validated, mergedList, List.copyOf(layersUsed), List.copyOf(errors), List.copyOf(warnings));
    }

    private List<CandidateCompetitor> validate(List<CandidateCompetitor> merged, ResearchContext context,
                                               List<StepError> errors) {
        if (merged.isEmpty()) {
            return List.of();
        }
        List<CandidateCompetitor> accepted = new ArrayList<>();
        try {
            double minConfidence = properties.getDiscovery().getMinConfidence();
            for (CandidateValidationResult result : validator.validateBatch(merged, context.niche(), context.handle())) {
                if (result.valid() && result.confidence() >= minConfidence) {
                    accepted.add(result.candidate().withScore(result.confidence()));
                } else {
                    log.debug("[Discovery] Rejected @{}: {} ({})",
                            result.candidate().handle(), result.reason(), result.confidence());
                }
            }
        } catch (RuntimeException e) {
            log.warn("[Discovery] Validation failed, keeping unvalidated candidates: {}", e.getMessage());
            errors.add(new StepError(STEP, VALIDATION_SOURCE, e.getMessage()));
            accepted = new ArrayList<>(merged);
        }

        // List.sort is stable, so equal scores keep merge order
        accepted.sort(Comparator.comparingDouble(CandidateCompetitor::relevanceScore).reversed());
        return List.copyOf(accepted);
    }
}
