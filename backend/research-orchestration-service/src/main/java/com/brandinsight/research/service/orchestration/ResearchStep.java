package com.brandinsight.research.service.orchestration;

import com.brandinsight.research.config.ResearchProperties;
import com.brandinsight.research.store.RecordType;

/**
 * Orchestration steps in execution order, each with the record type its checkpoint counts.
 */
public enum ResearchStep {
    BRAND_CONTEXT(RecordType.RAW_SEARCH_RESULT),
    DISCOVERY(RecordType.COMPETITOR),
    ANALYSIS(RecordType.ANALYSIS_ANSWER),
    COMMUNITY(RecordType.COMMUNITY_INSIGHT),
    PROFILE_SCRAPING(RecordType.SOCIAL_PROFILE),
    SEARCH_TRENDS(RecordType.SEARCH_TREND);

    private final RecordType recordType;

    ResearchStep(RecordType recordType) {
        this.recordType = recordType;
    }

    public RecordType getRecordType() {
        return recordType;
    }

    /**
     * Entry appended to layersUsed when the step is skipped on resume
     */
    public String skipTag() {
        return name() + "_SKIPPED_RESUME";
    }

    public int threshold(ResearchProperties.Checkpoint checkpoint) {
        return switch (this) {
            case BRAND_CONTEXT -> checkpoint.getBrandContext();
            case DISCOVERY -> checkpoint.getDiscovery();
            case ANALYSIS -> checkpoint.getAnalysis();
            case COMMUNITY -> checkpoint.getCommunity();
            case PROFILE_SCRAPING -> checkpoint.getProfileScraping();
            case SEARCH_TRENDS -> checkpoint.getSearchTrends();
        };
    }
}
