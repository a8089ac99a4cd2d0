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
import ai.evacortex.spectrafit.core.FitTask;
import ai.evacortex.spectrafit.core.exceptions.PersistException;

/**
 * {@code ResultSink} receives one record per completed task.
 *
 * <p>Implementations are called concurrently from worker threads. Every task id owns exactly one
 * slot; writing the same id twice within a sink's lifetime is an error.</p>
 */
public interface ResultSink {

    /**
     * Persists the result of {@code task}.
     *
     * @param task   the task the result belongs to, for provenance
     * @param result the routine output
     * @throws PersistException if the record cannot be written
     */
    void persist(FitTask task, FitResult result);

    /** A sink that keeps nothing. */
    static ResultSink discarding() {
        return (task, result) -> { };
    }
}
