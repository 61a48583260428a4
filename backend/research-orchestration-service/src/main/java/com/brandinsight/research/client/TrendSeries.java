package com.brandinsight.research.client;

import java.util.List;

/**
 * Interest summary for one keyword over the lookup window.
 */
public record TrendSeries(
        String keyword,
        double averageInterest,
        int peakInterest,
        List<String> relatedQueries
) {
}
