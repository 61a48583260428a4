package com.brandinsight.research.entity;

public enum CompetitorType {
    DIRECT,
    INDIRECT,
    DISCOVERED,
    SUGGESTED;

    /**
     * Lenient parse for values reported by external tools. Unknown values become SUGGESTED.
     */
    public static CompetitorType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SUGGESTED;
        }
        for (CompetitorType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return SUGGESTED;
    }
}
