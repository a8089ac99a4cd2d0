/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.exceptions;

import ai.evacortex.spectrafit.core.orchestration.TaskOutcome;

import java.util.List;

/**
 * Raised at the join barrier when two results disagree on a shape they are required to share.
 * The full outcome list stays attached for inspection.
 */
public class MergeSchemaException extends RuntimeException {

    private final List<TaskOutcome> outcomes;

    public MergeSchemaException(String message, List<TaskOutcome> outcomes) {
        super("Result schema mismatch: " + message);
        this.outcomes = List.copyOf(outcomes);
    }

    public List<TaskOutcome> outcomes() {
        return outcomes;
    }
}
