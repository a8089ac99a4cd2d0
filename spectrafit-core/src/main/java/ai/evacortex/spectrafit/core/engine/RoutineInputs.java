/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.engine;

import java.util.Arrays;

/**
 * Integer and real configuration arrays handed to the fitting routine on every call.
 *
 * <p>Integer inputs: parameter count, angular mode, pixel count, frequency count,
 * fitting mode, stokes. The frequency count is rewritten per call on a private copy.</p>
 */
public record RoutineInputs(int[] integerInputs, double[] realInputs) {

    public static final int INTEGER_INPUT_COUNT = 6;
    public static final int REAL_INPUT_COUNT = 6;
    public static final int FREQUENCY_COUNT_SLOT = 3;

    public RoutineInputs {
        if (integerInputs.length != INTEGER_INPUT_COUNT) {
            throw new IllegalArgumentException("Expected " + INTEGER_INPUT_COUNT + " integer inputs, got " + integerInputs.length);
        }
        if (realInputs.length != REAL_INPUT_COUNT) {
            throw new IllegalArgumentException("Expected " + REAL_INPUT_COUNT + " real inputs, got " + realInputs.length);
        }
        integerInputs = integerInputs.clone();
        realInputs = realInputs.clone();
    }

    public static RoutineInputs defaults() {
        return new RoutineInputs(
                new int[]{7, 0, 1, 30, 1, 1},
                new double[]{0.17, 1e-6, 1.0, 4.0, 8.0, 0.015});
    }

    @Override
    public int[] integerInputs() {
        return integerInputs.clone();
    }

    @Override
    public double[] realInputs() {
        return realInputs.clone();
    }

    public RoutineInputs withFrequencyCount(int count) {
        int[] n = integerInputs.clone();
        n[FREQUENCY_COUNT_SLOT] = count;
        return new RoutineInputs(n, realInputs);
    }

    public int frequencyCount() {
        return integerInputs[FREQUENCY_COUNT_SLOT];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RoutineInputs other
                && Arrays.equals(integerInputs, other.integerInputs)
                && Arrays.equals(realInputs, other.realInputs);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(integerInputs) + Arrays.hashCode(realInputs);
    }

    @Override
    public String toString() {
        return "RoutineInputs[n=" + Arrays.toString(integerInputs) + ", r=" + Arrays.toString(realInputs) + "]";
    }
}
