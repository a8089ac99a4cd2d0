/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.orchestration;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External stop signal for a run. Once set it stays set; tasks that have not started are
 * skipped, tasks already inside the routine finish normally.
 */
public final class RunCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static RunCancellation none() {
        return new RunCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
