package com.brandinsight.research.client;

public record GenerationResult(
        String text,
        int tokensUsed,
        String model
) {
}
