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

/**
 * Terminal state of a single task.
 */
public interface TaskOutcome {

    int taskId();

    record Success(FitResult result) implements TaskOutcome {
        @Override
        public int taskId() {
            return result.taskId();
        }
    }

    /**
     * @param code routine status for {@link FailureKind#NATIVE_ROUTINE}, otherwise {@code 0}
     */
    record Failed(int taskId, FailureKind kind, int code, String message) implements TaskOutcome {}

    /** Task never reached the routine because the run was cancelled first. */
    record Cancelled(int taskId) implements TaskOutcome {}
}
