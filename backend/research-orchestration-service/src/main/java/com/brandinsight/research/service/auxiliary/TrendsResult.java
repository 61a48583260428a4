package com.brandinsight.research.service.auxiliary;

import java.util.List;

public record TrendsResult(
        List<String> keywords,
        int saved,
        int skippedExisting
) {
}
