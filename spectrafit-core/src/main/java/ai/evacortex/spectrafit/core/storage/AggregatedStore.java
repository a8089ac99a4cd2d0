/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.storage;

import ai.evacortex.spectrafit.core.FitResult;
import ai.evacortex.spectrafit.core.RunMetadata;
import ai.evacortex.spectrafit.core.orchestration.TaskOutcome;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Consolidated output of a run: every successful result keyed by task id, the failure manifest
 * and the ids of tasks skipped by cancellation.
 *
 * <p>A store is append-only while the merger fills it and read-only once {@link #seal()} has
 * been called. Two stores are equal when they hold the same content, independent of the order
 * in which records were appended.</p>
 */
public final class AggregatedStore {

    private final RunMetadata runMetadata;
    private final NavigableMap<Integer, FitResult> results = new TreeMap<>();
    private final NavigableMap<Integer, TaskOutcome.Failed> failures = new TreeMap<>();
    private final NavigableSet<Integer> cancelled = new TreeSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean sealed = false;

    AggregatedStore(RunMetadata runMetadata) {
        this.runMetadata = runMetadata;
    }

    void append(FitResult result) {
        lock.writeLock().lock();
        try {
            ensureWritable();
            if (results.putIfAbsent(result.taskId(), result) != null) {
                throw new IllegalStateException("Slot already written: task " + result.taskId());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    void recordFailure(TaskOutcome.Failed failure) {
        lock.writeLock().lock();
        try {
            ensureWritable();
            failures.put(failure.taskId(), failure);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void recordCancelled(int taskId) {
        lock.writeLock().lock();
        try {
            ensureWritable();
            cancelled.add(taskId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void seal() {
        lock.writeLock().lock();
        try {
            sealed = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void ensureWritable() {
        if (sealed) throw new IllegalStateException("Aggregated store is sealed");
    }

    public boolean isSealed() {
        return sealed;
    }

    public RunMetadata runMetadata() {
        return runMetadata;
    }

    public Optional<FitResult> get(int taskId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(results.get(taskId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(int taskId) {
        lock.readLock().lock();
        try {
            return results.containsKey(taskId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return results.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Integer> taskIds() {
        lock.readLock().lock();
        try {
            return List.copyOf(results.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<FitResult> results() {
        lock.readLock().lock();
        try {
            return List.copyOf(results.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TaskOutcome.Failed> failures() {
        lock.readLock().lock();
        try {
            return List.copyOf(failures.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Integer> cancelledTaskIds() {
        lock.readLock().lock();
        try {
            return List.copyOf(cancelled);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregatedStore other)) return false;
        if (!Objects.equals(runMetadata, other.runMetadata)) return false;
        if (!failures().equals(other.failures()) || !cancelledTaskIds().equals(other.cancelledTaskIds())) return false;
        List<FitResult> mine = results();
        List<FitResult> theirs = other.results();
        if (mine.size() != theirs.size()) return false;
        for (int i = 0; i < mine.size(); i++) {
            if (!mine.get(i).sameContent(theirs.get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(runMetadata, failures(), cancelledTaskIds());
        for (FitResult r : results()) {
            h = 31 * h + r.taskId();
            h = 31 * h + Arrays.hashCode(r.fittedParameters());
        }
        return h;
    }

    @Override
    public String toString() {
        return "AggregatedStore[results=" + taskIds() + ", failed=" + failures().size()
                + ", cancelled=" + cancelledTaskIds() + ", sealed=" + sealed + "]";
    }
}
