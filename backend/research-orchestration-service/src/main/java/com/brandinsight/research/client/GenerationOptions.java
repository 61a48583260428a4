package com.brandinsight.research.client;

/**
 * Model parameters for a single completion request.
 */
public record GenerationOptions(
        String model,
        int maxTokens,
        double temperature
) {
}
