package io.stageflow.core.parallel;

import java.util.List;

/**
 * Outcome of one task run by {@link ParallelTaskRunner}. Workers build these instead of writing to
 * the shared {@code ExecutionContext}.
 *
 * @param items    items the task processed, usually 0 or 1
 * @param warnings warnings raised by the task
 * @param errors   errors raised by the task; non-empty means the task failed
 * @param payload  caller-defined result, or {@code null}; echo an identifying key here when results
 *                 need to be matched back to their tasks
 * @param <R> payload type
 */
public record TaskResult<R>(int items, List<String> warnings, List<String> errors, R payload) {

    public TaskResult {
        if (items < 0) {
            throw new IllegalArgumentException("items must not be negative, got: " + items);
        }
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /** One processed item, no warnings. */
    public static <R> TaskResult<R> success(R payload) {
        return new TaskResult<>(1, List.of(), List.of(), payload);
    }

    public static <R> TaskResult<R> successWithWarnings(R payload, List<String> warnings) {
        return new TaskResult<>(1, warnings, List.of(), payload);
    }

    /** Nothing processed, one error. */
    public static <R> TaskResult<R> failure(String error) {
        return new TaskResult<>(0, List.of(), List.of(error), null);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
