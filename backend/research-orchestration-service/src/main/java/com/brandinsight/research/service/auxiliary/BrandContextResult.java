package com.brandinsight.research.service.auxiliary;

/**
 * @param summary web research excerpt built from the leading result snippets
 */
public record BrandContextResult(
        int resultsFound,
        int resultsSaved,
        int failedQueries,
        String summary
) {
}
