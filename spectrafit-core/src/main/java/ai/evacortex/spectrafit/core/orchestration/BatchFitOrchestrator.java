/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.orchestration;

import ai.evacortex.spectrafit.core.FitResult;
import ai.evacortex.spectrafit.core.FitTask;
import ai.evacortex.spectrafit.core.RunMetadata;
import ai.evacortex.spectrafit.core.engine.FitGateway;
import ai.evacortex.spectrafit.core.exceptions.AllTasksFailedException;
import ai.evacortex.spectrafit.core.exceptions.NativeRoutineException;
import ai.evacortex.spectrafit.core.exceptions.PersistException;
import ai.evacortex.spectrafit.core.storage.AggregatedStore;
import ai.evacortex.spectrafit.core.storage.ResultMerger;
import ai.evacortex.spectrafit.core.storage.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs fit tasks on a bounded worker pool and merges their outcomes once all have finished.
 *
 * <p>Each task goes through the {@link FitGateway} (serialized) and then the {@link ResultSink}
 * (parallel). A task failure is recorded and never stops the others. After the join barrier the
 * {@link ResultMerger} is invoked exactly once with every outcome.</p>
 */
public final class BatchFitOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchFitOrchestrator.class);

    private final FitGateway gateway;
    private final ResultSink sink;
    private final ResultMerger merger;

    public BatchFitOrchestrator(FitGateway gateway, ResultSink sink) {
        this(gateway, sink, new ResultMerger());
    }

    public BatchFitOrchestrator(FitGateway gateway, ResultSink sink, ResultMerger merger) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.merger = Objects.requireNonNull(merger, "merger must not be null");
    }

    public AggregatedStore run(List<FitTask> tasks, int concurrencyLimit) {
        if (tasks.isEmpty()) {
            throw new IllegalArgumentException("No tasks to run");
        }
        return run(tasks, concurrencyLimit, RunCancellation.none(), tasks.get(0).runMetadata());
    }

    /**
     * @throws AllTasksFailedException if at least one task ran and none succeeded
     * @throws ai.evacortex.spectrafit.core.exceptions.MergeSchemaException if results disagree on shape
     */
    public AggregatedStore run(List<FitTask> tasks,
                               int concurrencyLimit,
                               RunCancellation cancellation,
                               RunMetadata runMetadata) {
        Objects.requireNonNull(tasks, "tasks must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1: " + concurrencyLimit);
        }

        log.info("Dispatching {} fit tasks on {} workers", tasks.size(), concurrencyLimit);
        long started = System.nanoTime();
        long waitedBefore = gateway.permit().totalWait(TimeUnit.NANOSECONDS);

        ExecutorService pool = Executors.newFixedThreadPool(concurrencyLimit, workerFactory());
        List<TaskOutcome> outcomes = new ArrayList<>(tasks.size());
        try {
            List<Future<TaskOutcome>> futures = new ArrayList<>(tasks.size());
            for (FitTask task : tasks) {
                futures.add(pool.submit(() -> execute(task, cancellation)));
            }
            outcomes.addAll(awaitAll(tasks, futures, cancellation));
        } finally {
            pool.shutdown();
        }

        AggregatedStore store = merger.merge(outcomes, runMetadata);
        log.info("Run finished in {} ms ({} ms queued on permit '{}'): {} succeeded, {} failed, {} cancelled",
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
                TimeUnit.NANOSECONDS.toMillis(gateway.permit().totalWait(TimeUnit.NANOSECONDS) - waitedBefore),
                gateway.permit().name(), store.size(), store.failures().size(), store.cancelledTaskIds().size());

        if (store.size() == 0 && !store.failures().isEmpty()) {
            throw new AllTasksFailedException(store.failures());
        }
        return store;
    }

    private TaskOutcome execute(FitTask task, RunCancellation cancellation) {
        if (cancellation.isCancelled()) {
            return new TaskOutcome.Cancelled(task.taskId());
        }
        try {
            FitResult result = gateway.fit(task);
            sink.persist(task, result);
            return new TaskOutcome.Success(result);
        } catch (NativeRoutineException e) {
            log.warn("Task {} at {}: {}", task.taskId(), task.coordinate(), e.getMessage());
            return new TaskOutcome.Failed(task.taskId(), FailureKind.NATIVE_ROUTINE, e.code(), e.getMessage());
        } catch (PersistException e) {
            log.warn("Task {} at {}: {}", task.taskId(), task.coordinate(), e.getMessage(), e);
            return new TaskOutcome.Failed(task.taskId(), FailureKind.PERSIST, 0, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Task {} rejected: {}", task.taskId(), e.getMessage());
            return new TaskOutcome.Failed(task.taskId(), FailureKind.INVALID_INPUT, 0, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Task {} failed unexpectedly", task.taskId(), e);
            return new TaskOutcome.Failed(task.taskId(), FailureKind.UNEXPECTED, 0, String.valueOf(e));
        }
    }

    /**
     * Join barrier. Interruption of the waiting thread cancels the run; already dispatched
     * tasks are still awaited so no outcome is lost.
     */
    private static List<TaskOutcome> awaitAll(List<FitTask> tasks,
                                              List<Future<TaskOutcome>> futures,
                                              RunCancellation cancellation) {
        List<TaskOutcome> outcomes = new ArrayList<>(futures.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            Future<TaskOutcome> future = futures.get(i);
            while (true) {
                try {
                    outcomes.add(future.get());
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancellation.cancel();
                } catch (ExecutionException e) {
                    int taskId = tasks.get(i).taskId();
                    log.error("Task {} terminated abnormally", taskId, e.getCause());
                    outcomes.add(new TaskOutcome.Failed(taskId, FailureKind.UNEXPECTED, 0,
                            String.valueOf(e.getCause())));
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return outcomes;
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("spectrafit-worker-" + counter.incrementAndGet());
            return t;
        };
    }
}
