package com.brandinsight.research.service.community;

import com.brandinsight.research.dto.StepError;

import java.util.List;

/**
 * Counters of one community scan.
 *
 * @param linksCollected results that passed both gates (at most 5 per query)
 * @param filteredOut    results rejected by the domain or brand-mention gate
 */
public record CommunityScanResult(
        int queriesRun,
        int linksCollected,
        int insightsSaved,
        int skippedExisting,
        int filteredOut,
        int failedQueries,
        List<StepError> errors
) {
}
