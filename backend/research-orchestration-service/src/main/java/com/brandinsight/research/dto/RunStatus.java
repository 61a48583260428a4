package com.brandinsight.research.dto;

public enum RunStatus {
    /** Every step ran or was skipped on resume without errors */
    COMPLETE,
    /** At least one step-local error was recorded */
    PARTIAL
}
