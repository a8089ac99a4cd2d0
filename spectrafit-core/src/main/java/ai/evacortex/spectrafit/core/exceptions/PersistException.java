/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.exceptions;

public class PersistException extends RuntimeException {

    private final int taskId;

    public PersistException(int taskId, String message, Throwable cause) {
        super("Failed to persist result of task " + taskId + ": " + message, cause);
        this.taskId = taskId;
    }

    public int taskId() {
        return taskId;
    }
}
