package io.stageflow.core.parallel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.spi.UnitConfig;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ParallelTaskRunnerTest {

    private static final List<Integer> FIVE = List.of(1, 2, 3, 4, 5);

    /** Fails task 3, warns on even tasks, otherwise doubles. */
    private static final Function<Integer, TaskResult<Integer>> WORKER = n -> {
        if (n == 3) {
            return TaskResult.failure("task 3 rejected");
        }
        if (n % 2 == 0) {
            return TaskResult.successWithWarnings(n * 2, List.of("even " + n));
        }
        return TaskResult.success(n * 2);
    };

    @Nested
    @DisplayName("pooled execution")
    class Pooled {

        @Test
        @DisplayName("one failing task out of five: four items, one error, unsuccessful")
        void oneFailureAmongFive() {
            AggregateResult<Integer> aggregate = ParallelTaskRunner.runPool(FIVE, WORKER, 2, 1);

            assertThat(aggregate.itemsProcessed()).isEqualTo(4);
            assertThat(aggregate.errors()).containsExactly("task 3 rejected");
            assertThat(aggregate.success()).isFalse();
            assertThat(aggregate.failedTasks()).isEqualTo(1);
            assertThat(aggregate.payloads()).containsExactlyInAnyOrder(2, 4, 8, 10);
        }

        @Test
        @DisplayName("a worker that throws is contained to its own task")
        void throwingWorkerIsContained() {
            AggregateResult<Integer> aggregate = ParallelTaskRunner.runPool(
                    FIVE,
                    n -> {
                        if (n == 2) {
                            throw new IllegalStateException("disk gone");
                        }
                        return TaskResult.success(n);
                    },
                    3,
                    1);

            assertThat(aggregate.itemsProcessed()).isEqualTo(4);
            assertThat(aggregate.errors()).containsExactly("Worker failed on task 2: disk gone");
        }

        @Test
        void nullResultCountsAsFailure() {
            AggregateResult<Integer> aggregate = ParallelTaskRunner.runPool(List.of(1), n -> null, 1, 1);

            assertThat(aggregate.errors()).containsExactly("Worker returned no result for task 1");
        }

        @Test
        void usesAtMostMaxWorkersThreads() {
            Set<String> threads = ConcurrentHashMap.newKeySet();
            List<Integer> tasks = IntStream.range(0, 40).boxed().toList();

            AggregateResult<Integer> aggregate = ParallelTaskRunner.runPool(
                    tasks,
                    n -> {
                        threads.add(Thread.currentThread().getName());
                        return TaskResult.success(n);
                    },
                    2,
                    3);

            assertThat(aggregate.itemsProcessed()).isEqualTo(40);
            assertThat(threads).hasSizeBetween(1, 2).allMatch(name -> name.startsWith("stageflow-worker-"));
        }

        @Test
        void emptyInputReturnsEmptyAggregate() {
            AggregateResult<Integer> aggregate = ParallelTaskRunner.runPool(List.of(), WORKER, 4, 1);

            assertThat(aggregate.itemsProcessed()).isZero();
            assertThat(aggregate.success()).isTrue();
            assertThat(aggregate.results()).isEmpty();
        }

        @Test
        void rejectsNonPositiveBounds() {
            assertThatThrownBy(() -> ParallelTaskRunner.runPool(FIVE, WORKER, 0, 1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maxWorkers");
            assertThatThrownBy(() -> ParallelTaskRunner.runPool(FIVE, WORKER, 1, 0))
                    .hasMessageContaining("batchSize");
        }
    }

    @Nested
    @DisplayName("sequential and pooled runs agree")
    class Equivalence {

        @Test
        void sameCountsWarningsAndErrors() {
            AggregateResult<Integer> sequential = ParallelTaskRunner.runSequential(FIVE, WORKER);
            AggregateResult<Integer> pooled = ParallelTaskRunner.runPool(FIVE, WORKER, 4, 2);

            assertThat(pooled.itemsProcessed()).isEqualTo(sequential.itemsProcessed());
            assertThat(pooled.warnings()).containsExactlyInAnyOrderElementsOf(sequential.warnings());
            assertThat(pooled.errors()).containsExactlyInAnyOrderElementsOf(sequential.errors());
            assertThat(pooled.success()).isEqualTo(sequential.success());
        }

        @Test
        void sequentialKeepsSubmissionOrder() {
            AggregateResult<Integer> sequential = ParallelTaskRunner.runSequential(FIVE, WORKER);

            assertThat(sequential.warnings()).containsExactly("even 2", "even 4");
            assertThat(sequential.payloads()).containsExactly(2, 4, 8, 10);
        }

        @Test
        @DisplayName("a worker throwing an Error fails only its own task, pooled in one batch or sequential")
        void workerErrorIsContainedOnBothPaths() {
            Function<Integer, TaskResult<Integer>> assertingWorker = n -> {
                if (n == 3) {
                    throw new AssertionError("bad item");
                }
                return TaskResult.success(n);
            };

            AggregateResult<Integer> pooled = ParallelTaskRunner.runPool(FIVE, assertingWorker, 2, 5);
            AggregateResult<Integer> sequential = ParallelTaskRunner.runSequential(FIVE, assertingWorker);

            for (AggregateResult<Integer> aggregate : List.of(pooled, sequential)) {
                assertThat(aggregate.itemsProcessed()).isEqualTo(4);
                assertThat(aggregate.errors()).containsExactly("Worker failed on task 3: bad item");
                assertThat(aggregate.failedTasks()).isEqualTo(1);
                assertThat(aggregate.success()).isFalse();
            }
            assertThat(pooled.payloads()).containsExactlyInAnyOrder(1, 2, 4, 5);
        }

        @Test
        void runPicksPathFromOptions() {
            AggregateResult<Integer> viaOptions =
                    ParallelTaskRunner.run(FIVE, WORKER, ParallelOptions.pooled(2));
            AggregateResult<Integer> viaSequential =
                    ParallelTaskRunner.run(FIVE, WORKER, ParallelOptions.sequential());

            assertThat(viaOptions.itemsProcessed()).isEqualTo(viaSequential.itemsProcessed());
        }
    }

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        @Test
        @DisplayName("merging two halves equals one run over the whole")
        void mergeIsAdditive() {
            AggregateResult<Integer> whole = ParallelTaskRunner.runSequential(FIVE, WORKER);
            AggregateResult<Integer> merged = ParallelTaskRunner.runSequential(FIVE.subList(0, 2), WORKER)
                    .merge(ParallelTaskRunner.runSequential(FIVE.subList(2, 5), WORKER));

            assertThat(merged.itemsProcessed()).isEqualTo(whole.itemsProcessed());
            assertThat(merged.warnings()).isEqualTo(whole.warnings());
            assertThat(merged.errors()).isEqualTo(whole.errors());
            assertThat(merged.results()).hasSize(5);
        }

        @Test
        void foldIntoAddsToContext() {
            ExecutionContext context = new ExecutionContext("p");
            context.incrementItems();

            ParallelTaskRunner.runPool(FIVE, WORKER, 2, 1).foldInto(context);

            assertThat(context.itemsProcessed()).isEqualTo(5);
            assertThat(context.warnings()).containsExactlyInAnyOrder("even 2", "even 4");
            assertThat(context.errors()).containsExactly("task 3 rejected");
        }
    }

    @Nested
    @DisplayName("options resolution")
    class Options {

        @Test
        void unitFlagOverridesGlobalFlag() {
            ExecutionContext context = new ExecutionContext("p");
            context.metadata().put(ExecutionContext.PARALLEL, true);

            ParallelOptions options =
                    ParallelOptions.from(new UnitConfig("u", Map.of("parallel", false)), context);

            assertThat(options.parallel()).isFalse();
        }

        @Test
        void globalFlagAppliesWhenUnitIsSilent() {
            ExecutionContext context = new ExecutionContext("p");
            context.metadata().put(ExecutionContext.PARALLEL, true);

            ParallelOptions options = ParallelOptions.from(new UnitConfig("u", Map.of()), context);

            assertThat(options.parallel()).isTrue();
            assertThat(options.maxWorkers()).isEqualTo(ParallelOptions.defaultMaxWorkers());
            assertThat(options.batchSize()).isEqualTo(1);
        }

        @Test
        void workerCountBelowOneIsRaisedToOne() {
            ParallelOptions options = ParallelOptions.from(
                    new UnitConfig("u", Map.of("max-workers", 0, "batch-size", -5)), new ExecutionContext("p"));

            assertThat(options.maxWorkers()).isEqualTo(1);
            assertThat(options.batchSize()).isEqualTo(1);
        }

        @Test
        void defaultWorkersIsBoundedByFour() {
            assertThat(ParallelOptions.defaultMaxWorkers()).isBetween(1, 4);
        }
    }
}
