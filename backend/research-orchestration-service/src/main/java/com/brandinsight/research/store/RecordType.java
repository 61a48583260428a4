package com.brandinsight.research.store;

/**
 * Persisted output types counted by the resume checkpoint.
 */
public enum RecordType {
    RAW_SEARCH_RESULT,
    COMPETITOR,
    /** Only answered catalog rows are counted; CUSTOM answers are excluded */
    ANALYSIS_ANSWER,
    COMMUNITY_INSIGHT,
    SOCIAL_PROFILE,
    SEARCH_TREND
}
