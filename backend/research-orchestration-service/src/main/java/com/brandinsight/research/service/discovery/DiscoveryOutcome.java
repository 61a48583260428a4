package com.brandinsight.research.service.discovery;

import com.brandinsight.research.dto.CandidateCompetitor;
import com.brandinsight.research.dto.StepError;

import java.util.List;

/**
 * @param candidates       validated candidates, sorted by score descending
 * @param mergedCandidates deduplicated layer output before validation, in merge order
 * @param layersUsed       layers that contributed at least one candidate
 */
public record DiscoveryOutcome(
        List<CandidateCompetitor> candidates,
        List<CandidateCompetitor> mergedCandidates,
        List<String> layersUsed,
        List<StepError> errors,
        List<String> warnings
) {
    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
