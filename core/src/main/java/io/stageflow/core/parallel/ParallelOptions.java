package io.stageflow.core.parallel;

import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.spi.UnitConfig;

/**
 * How a unit wants its batch executed.
 *
 * @param parallel   use the worker pool; {@code false} runs tasks sequentially on the caller thread
 * @param maxWorkers upper bound on pool threads, at least 1
 * @param batchSize  tasks handed to a worker per submission, at least 1
 */
public record ParallelOptions(boolean parallel, int maxWorkers, int batchSize) {

    public static final String PARALLEL_KEY = "parallel";
    public static final String MAX_WORKERS_KEY = "max-workers";
    public static final String BATCH_SIZE_KEY = "batch-size";
    static final int DEFAULT_MAX_WORKERS = 4;

    public ParallelOptions {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got: " + maxWorkers);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got: " + batchSize);
        }
    }

    public static ParallelOptions sequential() {
        return new ParallelOptions(false, 1, 1);
    }

    public static ParallelOptions pooled(int maxWorkers) {
        return new ParallelOptions(true, maxWorkers, 1);
    }

    /**
     * Resolves options for one unit invocation. A {@code parallel} key in the unit's own config wins
     * when present; otherwise the global flag recorded in the context applies. {@code max-workers}
     * defaults to {@code min(4, availableProcessors)}; values below 1 are raised to 1.
     */
    public static ParallelOptions from(UnitConfig config, ExecutionContext context) {
        boolean parallel = config.getOptionalBoolean(PARALLEL_KEY).orElse(context.isParallel());
        int maxWorkers = Math.max(1, config.getInt(MAX_WORKERS_KEY, defaultMaxWorkers()));
        int batchSize = Math.max(1, config.getInt(BATCH_SIZE_KEY, 1));
        return new ParallelOptions(parallel, maxWorkers, batchSize);
    }

    static int defaultMaxWorkers() {
        return Math.max(1, Math.min(DEFAULT_MAX_WORKERS, Runtime.getRuntime().availableProcessors()));
    }
}
