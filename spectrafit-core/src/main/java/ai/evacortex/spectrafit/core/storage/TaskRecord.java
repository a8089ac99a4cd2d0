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
import ai.evacortex.spectrafit.core.ParameterGuessTable;

/** A persisted per-task record: the result and the guess table it was fitted with. */
public record TaskRecord(FitResult result, ParameterGuessTable guessTable) {}
