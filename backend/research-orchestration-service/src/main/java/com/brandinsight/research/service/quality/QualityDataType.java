package com.brandinsight.research.service.quality;

/**
 * Declared record family of a scored batch. Decides which field checks apply.
 */
public enum QualityDataType {
    COMPETITOR("competitor"),
    POST("post"),
    PROFILE("profile"),
    INSIGHT("insight"),
    GENERIC("generic");

    private final String label;

    QualityDataType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
