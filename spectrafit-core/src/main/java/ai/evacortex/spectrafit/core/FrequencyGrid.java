/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

import java.util.Arrays;

/**
 * Reference frequencies of a cube in Hz, positive and strictly increasing. Fixed for a run.
 */
public final class FrequencyGrid {

    private static final double HZ_PER_GHZ = 1e9;

    private final double[] hz;

    public FrequencyGrid(double[] hz) {
        if (hz == null || hz.length == 0) {
            throw new IllegalArgumentException("Frequency grid must not be empty");
        }
        if (!(hz[0] > 0)) {
            throw new IllegalArgumentException("Frequencies must be positive, got " + hz[0] + " Hz");
        }
        for (int i = 1; i < hz.length; i++) {
            if (!(hz[i] > hz[i - 1])) {
                throw new IllegalArgumentException("Frequencies must be strictly increasing at index " + i);
            }
        }
        this.hz = hz.clone();
    }

    public int size() {
        return hz.length;
    }

    public double hz(int index) {
        return hz[index];
    }

    public double ghz(int index) {
        return hz[index] / HZ_PER_GHZ;
    }

    public double first() {
        return hz[0];
    }

    public double last() {
        return hz[hz.length - 1];
    }

    public int nearestIndex(double frequencyHz) {
        int best = 0;
        double bestDistance = Math.abs(hz[0] - frequencyHz);
        for (int i = 1; i < hz.length; i++) {
            double d = Math.abs(hz[i] - frequencyHz);
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        return best;
    }

    /**
     * Selects the frequencies nearest to the given bounds; the end bound is inclusive.
     */
    public FrequencySubset subset(double startHz, double endHz) {
        int start = nearestIndex(startHz);
        int end = nearestIndex(endHz) + 1;
        if (end <= start) {
            throw new IllegalArgumentException("End frequency " + endHz + " Hz lies below start frequency " + startHz + " Hz");
        }
        double[] ghz = new double[end - start];
        for (int i = start; i < end; i++) {
            ghz[i - start] = ghz(i);
        }
        return new FrequencySubset(start, end, ghz);
    }

    public FrequencySubset all() {
        return subset(first(), last());
    }

    public double[] toArray() {
        return hz.clone();
    }

    @Override
    public String toString() {
        return "FrequencyGrid" + Arrays.toString(hz);
    }
}
