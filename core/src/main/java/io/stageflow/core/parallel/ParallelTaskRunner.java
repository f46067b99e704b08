package io.stageflow.core.parallel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a homogeneous list of tasks against one worker function and folds the outcomes into a
 * single {@link AggregateResult}.
 *
 * <p>
 * The pooled path uses a fixed pool of at most {@code maxWorkers} threads and blocks until every
 * submitted task has completed or failed. A worker that throws (an exception or an {@link Error}
 * other than a {@link VirtualMachineError}) is recorded as one failed task; sibling tasks, including
 * those in the same batch, are unaffected. The sequential path produces the same aggregate (counts,
 * warnings and errors as multisets, success flag) in submission order.
 *
 * <p>
 * Workers receive only their task. They must report through the returned {@link TaskResult} and
 * must not mutate shared run state.
 */
public final class ParallelTaskRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelTaskRunner.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private ParallelTaskRunner() {
        // utility class
    }

    /** Runs the tasks pooled or sequentially, as {@code options} says. */
    public static <T, R> AggregateResult<R> run(
            List<T> tasks, Function<? super T, TaskResult<R>> worker, ParallelOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        if (options.parallel()) {
            return runPool(tasks, worker, options.maxWorkers(), options.batchSize());
        }
        return runSequential(tasks, worker);
    }

    /** Runs every task on the calling thread, in order. */
    public static <T, R> AggregateResult<R> runSequential(List<T> tasks, Function<? super T, TaskResult<R>> worker) {
        Objects.requireNonNull(tasks, "tasks must not be null");
        Objects.requireNonNull(worker, "worker must not be null");
        AggregateResult.Builder<R> builder = new AggregateResult.Builder<>();
        for (T task : tasks) {
            builder.add(runTask(task, worker));
        }
        return builder.build();
    }

    /**
     * Runs the tasks on a bounded worker pool.
     *
     * @param tasks      tasks to run; an empty list returns immediately without starting threads
     * @param worker     function applied to each task
     * @param maxWorkers maximum number of pool threads, at least 1
     * @param batchSize  number of tasks a worker takes per submission, at least 1
     * @return the aggregate over all tasks, in completion order
     */
    public static <T, R> AggregateResult<R> runPool(
            List<T> tasks, Function<? super T, TaskResult<R>> worker, int maxWorkers, int batchSize) {
        Objects.requireNonNull(tasks, "tasks must not be null");
        Objects.requireNonNull(worker, "worker must not be null");
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got: " + maxWorkers);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got: " + batchSize);
        }
        if (tasks.isEmpty()) {
            return AggregateResult.empty();
        }

        List<List<T>> batches = partition(tasks, batchSize);
        int threads = Math.min(maxWorkers, batches.size());
        LOG.info("Starting parallel execution: workers={}, tasks={}, batches={}", threads, tasks.size(), batches.size());

        ExecutorService executor = Executors.newFixedThreadPool(threads, workerThreadFactory());
        CompletionService<List<TaskResult<R>>> completion = new ExecutorCompletionService<>(executor);
        Map<Future<List<TaskResult<R>>>, List<T>> submitted = new HashMap<>();
        AggregateResult.Builder<R> builder = new AggregateResult.Builder<>();
        try {
            for (List<T> batch : batches) {
                submitted.put(completion.submit(() -> runBatch(batch, worker)), batch);
            }
            int progressStep = Math.max(1, batches.size() / 10);
            for (int done = 1; done <= batches.size(); done++) {
                Future<List<TaskResult<R>>> future = completion.take();
                collect(future, submitted.get(future), builder);
                if (done % progressStep == 0) {
                    LOG.debug("Progress: {}/{} batches completed", done, batches.size());
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            builder.addError("Parallel execution interrupted before all " + tasks.size() + " tasks completed");
            LOG.warn("Parallel execution interrupted; outstanding tasks cancelled");
        } finally {
            executor.shutdown();
        }

        AggregateResult<R> aggregate = builder.build();
        LOG.info(
                "Parallel execution completed: items={}, errors={}, warnings={}",
                aggregate.itemsProcessed(),
                aggregate.errors().size(),
                aggregate.warnings().size());
        return aggregate;
    }

    private static <T, R> List<TaskResult<R>> runBatch(List<T> batch, Function<? super T, TaskResult<R>> worker) {
        List<TaskResult<R>> results = new ArrayList<>(batch.size());
        for (T task : batch) {
            results.add(runTask(task, worker));
        }
        return results;
    }

    private static <T, R> TaskResult<R> runTask(T task, Function<? super T, TaskResult<R>> worker) {
        try {
            TaskResult<R> result = worker.apply(task);
            if (result == null) {
                return TaskResult.failure("Worker returned no result for task " + task);
            }
            return result;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            String error = "Worker failed on task " + task + ": " + e.getMessage();
            LOG.error(error, e);
            return TaskResult.failure(error);
        }
    }

    private static <T, R> void collect(
            Future<List<TaskResult<R>>> future, List<T> batch, AggregateResult.Builder<R> builder)
            throws InterruptedException {
        try {
            future.get().forEach(builder::add);
        } catch (ExecutionException e) {
            // runTask contains worker failures, so only VM errors end up here; fail the whole batch
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Worker batch aborted", cause);
            for (T task : batch) {
                builder.add(TaskResult.failure("Worker failed on task " + task + ": " + cause));
            }
        }
    }

    private static <T> List<List<T>> partition(List<T> tasks, int batchSize) {
        List<List<T>> batches = new ArrayList<>((tasks.size() + batchSize - 1) / batchSize);
        for (int from = 0; from < tasks.size(); from += batchSize) {
            batches.add(List.copyOf(tasks.subList(from, Math.min(tasks.size(), from + batchSize))));
        }
        return batches;
    }

    private static ThreadFactory workerThreadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "stageflow-worker-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
