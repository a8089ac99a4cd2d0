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

public class AllTasksFailedException extends RuntimeException {

    private final List<TaskOutcome.Failed> failures;

    public AllTasksFailedException(List<TaskOutcome.Failed> failures) {
        super("All " + failures.size() + " fit tasks failed");
        this.failures = List.copyOf(failures);
    }

    public List<TaskOutcome.Failed> failures() {
        return failures;
    }
}
