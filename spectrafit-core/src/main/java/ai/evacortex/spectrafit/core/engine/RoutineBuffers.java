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
 * Per-call argument block of the fitting routine, laid out the way the Fortran entry point
 * reads it. Multi-dimensional arrays are flattened in column-major order:
 * <ul>
 *     <li>{@code guessTable}: {@code (15, 3)}</li>
 *     <li>{@code spectrumIn}: {@code (1, nFreq, 4)}; component 0 is the spectrum, 2 the uncertainty</li>
 *     <li>{@code spectrumOut}: {@code (1, nFreq, 2)}</li>
 *     <li>{@code parametersOut}, {@code uncertaintiesOut}: {@code (1, 8)}</li>
 * </ul>
 * A fresh instance is created for every call; the routine writes only the three output arrays.
 */
public record RoutineBuffers(int[] integerInputs,
                             double[] realInputs,
                             double[] guessTable,
                             double[] frequencies,
                             double[] spectrumIn,
                             double[] parametersOut,
                             double[] uncertaintiesOut,
                             double[] spectrumOut) {

    public static final int BUFFER_COUNT = 8;
    public static final int INPUT_COMPONENTS = 4;
    public static final int OUTPUT_COMPONENTS = 2;
    public static final int OUTPUT_PARAMETERS = 8;

    public int frequencyCount() {
        return frequencies.length;
    }
}
