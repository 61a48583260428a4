package com.brandinsight.research.entity;

public enum ResearchJobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED
}
