/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.orchestration;

public enum FailureKind {
    NATIVE_ROUTINE,
    PERSIST,
    INVALID_INPUT,
    UNEXPECTED
}
