package io.stageflow.core.parallel;

import io.stageflow.core.model.ExecutionContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Order-independent fold of many {@link TaskResult}s: counts are summed, warnings and errors are
 * concatenated in completion order, and every raw result is kept. Successful when no error was
 * recorded.
 *
 * <p>
 * Warning/error order follows task completion, not task submission. Compare them as multisets.
 */
public record AggregateResult<R>(
        long itemsProcessed, List<String> warnings, List<String> errors, List<TaskResult<R>> results) {

    public AggregateResult {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
        results = List.copyOf(results);
    }

    public static <R> AggregateResult<R> empty() {
        return new AggregateResult<>(0, List.of(), List.of(), List.of());
    }

    public boolean success() {
        return errors.isEmpty();
    }

    /** Number of tasks whose result carried at least one error. */
    public long failedTasks() {
        return results.stream().filter(r -> !r.isSuccess()).count();
    }

    /** Non-null payloads in result order. */
    public List<R> payloads() {
        List<R> payloads = new ArrayList<>();
        for (TaskResult<R> r : results) {
            if (r.payload() != null) {
                payloads.add(r.payload());
            }
        }
        return payloads;
    }

    /** Combines two aggregates as if their tasks had been run as one batch. */
    public AggregateResult<R> merge(AggregateResult<R> other) {
        return new Builder<R>().addAll(this).addAll(other).build();
    }

    /**
     * Adds counts, warnings and errors to the context. Call this from the unit's own thread after
     * the pool has drained, never from a worker.
     */
    public void foldInto(ExecutionContext context) {
        context.addItems(itemsProcessed);
        warnings.forEach(context::addWarning);
        errors.forEach(context::addError);
    }

    /** Mutable accumulator used by the runner; confined to one thread. */
    static final class Builder<R> {

        private long items;
        private final List<String> warnings = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private final List<TaskResult<R>> results = new ArrayList<>();

        Builder<R> add(TaskResult<R> result) {
            items += result.items();
            warnings.addAll(result.warnings());
            errors.addAll(result.errors());
            results.add(result);
            return this;
        }

        Builder<R> addAll(AggregateResult<R> aggregate) {
            items += aggregate.itemsProcessed();
            warnings.addAll(aggregate.warnings());
            errors.addAll(aggregate.errors());
            results.addAll(aggregate.results());
            return this;
        }

        /** Records an error that does not belong to any single task (e.g. interruption). */
        Builder<R> addError(String error) {
            errors.add(error);
            return this;
        }

        AggregateResult<R> build() {
            return new AggregateResult<>(items, warnings, errors, results);
        }
    }
}
