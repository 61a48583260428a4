package com.brandinsight.research.dto;

/**
 * A step-local failure recorded on the run instead of being thrown.
 *
 * @param step   orchestration step, e.g. DISCOVERY
 * @param source layer, question type or connector that failed
 */
public record StepError(
        String step,
        String source,
        String message
) {
    @Override
    public String toString() {
        return step + "/" + source + ": " + message;
    }
}
