/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.config;

public enum FitMode {
    /** Every selected pixel is fitted on the worker pool and merged into one store. */
    BATCH,
    /** One pixel is fitted synchronously on the calling thread; nothing is persisted. */
    SINGLE
}
