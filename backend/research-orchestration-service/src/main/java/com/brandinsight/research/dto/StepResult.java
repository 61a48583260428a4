package com.brandinsight.research.dto;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one orchestration step: a value or the errors that prevented it.
 * A successful step may still carry non-fatal errors (e.g. one failed discovery layer).
 */
public final class StepResult<T> {

    private final T value;
    private final List<StepError> errors;
    private final boolean success;

    private StepResult(T value, List<StepError> errors, boolean success) {
        this.value = value;
        this.errors = List.copyOf(errors);
        this.success = success;
    }

    public static <T> StepResult<T> success(T value) {
        return new StepResult<>(value, List.of(), true);
    }

    public static <T> StepResult<T> success(T value, List<StepError> errors) {
        return new StepResult<>(value, errors, true);
    }

    public static <T> StepResult<T> failure(StepError error) {
        return new StepResult<>(null, List.of(error), false);
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public List<StepError> getErrors() {
        return errors;
    }
}
