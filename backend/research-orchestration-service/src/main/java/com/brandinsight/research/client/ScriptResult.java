package com.brandinsight.research.client;

/**
 * Captured outcome of a finished subprocess.
 */
public record ScriptResult(
        int exitCode,
        String stdout,
        String stderr,
        long durationMs
) {
    public boolean isSuccess() {
        return exitCode == 0;
    }
}
