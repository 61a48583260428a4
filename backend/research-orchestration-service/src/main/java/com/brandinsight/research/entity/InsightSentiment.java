package com.brandinsight.research.entity;

public enum InsightSentiment {
    POSITIVE,
    NEUTRAL,
    NEGATIVE,
    MIXED
}
