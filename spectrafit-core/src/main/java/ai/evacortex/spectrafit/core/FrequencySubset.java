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
 * Contiguous frequency range {@code [startIndex, endIndex)} of a {@link FrequencyGrid},
 * together with the selected frequencies in GHz.
 */
public record FrequencySubset(int startIndex, int endIndex, double[] frequenciesGhz) {

    public FrequencySubset {
        if (startIndex < 0 || endIndex <= startIndex) {
            throw new IllegalArgumentException("Empty frequency range [" + startIndex + ", " + endIndex + ")");
        }
        if (frequenciesGhz.length != endIndex - startIndex) {
            throw new IllegalArgumentException("Frequency count does not match range size");
        }
        frequenciesGhz = frequenciesGhz.clone();
    }

    @Override
    public double[] frequenciesGhz() {
        return frequenciesGhz.clone();
    }

    public int size() {
        return endIndex - startIndex;
    }

    public double ghz(int i) {
        return frequenciesGhz[i];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FrequencySubset other
                && startIndex == other.startIndex
                && endIndex == other.endIndex
                && Arrays.equals(frequenciesGhz, other.frequenciesGhz);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * startIndex + endIndex) + Arrays.hashCode(frequenciesGhz);
    }

    @Override
    public String toString() {
        return "FrequencySubset[" + startIndex + ", " + endIndex + ") " + Arrays.toString(frequenciesGhz) + " GHz";
    }
}
