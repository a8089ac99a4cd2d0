/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.engine;

/**
 * Normalized routine output for one spectrum.
 *
 * @param fittedSpectrum         {@code [frequency][component]}
 * @param fittedParameters       fitted model parameters
 * @param parameterUncertainties uncertainty per parameter
 */
public record FitOutput(double[][] fittedSpectrum, double[] fittedParameters, double[] parameterUncertainties) {}
