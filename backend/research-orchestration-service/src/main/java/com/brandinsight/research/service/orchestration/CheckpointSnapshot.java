package com.brandinsight.research.service.orchestration;

import java.util.Map;
import java.util.Set;

/**
 * Persisted counts per step at the start of a run.
 *
 * @param counts -1 when the count could not be read
 */
public record CheckpointSnapshot(
        Map<ResearchStep, Long> counts,
        Map<ResearchStep, Integer> thresholds,
        Set<ResearchStep> completedSteps
) {
    public boolean isDone(ResearchStep step) {
        return completedSteps.contains(step);
    }

    public long countOf(ResearchStep step) {
        return counts.getOrDefault(step, -1L);
    }
}
