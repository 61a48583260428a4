package com.brandinsight.research.service.auxiliary;

import com.brandinsight.research.dto.StepError;
import com.brandinsight.research.service.quality.QualityScoreReport;

import java.util.List;

public record ProfileScrapeResult(
        int attempted,
        int scraped,
        List<StepError> errors,
        QualityScoreReport quality
) {
}
