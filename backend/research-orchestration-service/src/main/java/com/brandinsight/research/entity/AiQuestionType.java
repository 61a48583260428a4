package com.brandinsight.research.entity;

import java.util.Arrays;
import java.util.List;

/**
 * Analysis dimensions. Every type except CUSTOM belongs to the fixed catalog.
 */
public enum AiQuestionType {
    VALUE_PROPOSITION,
    TARGET_AUDIENCE,
    CONTENT_PILLARS,
    BRAND_VOICE,
    BRAND_PERSONALITY,
    COMPETITOR_ANALYSIS,
    NICHE_POSITION,
    UNIQUE_STRENGTHS,
    CONTENT_OPPORTUNITIES,
    GROWTH_STRATEGY,
    PAIN_POINTS,
    KEY_DIFFERENTIATORS,
    CUSTOM;

    private static final List<AiQuestionType> CATALOG = Arrays.stream(values())
            .filter(type -> type != CUSTOM)
            .toList();

    /**
     * The 12 catalog types in the order they are asked
     */
    public static List<AiQuestionType> catalog() {
        return CATALOG;
    }
}
