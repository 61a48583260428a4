package com.brandinsight.research.service.quality;

import java.util.List;

/**
 * @param score    0-100
 * @param reliable score >= 70
 */
public record QualityScoreReport(
        String source,
        double score,
        List<String> issues,
        List<String> warnings,
        boolean reliable
) {
}
