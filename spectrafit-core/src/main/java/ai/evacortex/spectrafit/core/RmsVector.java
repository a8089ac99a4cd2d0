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

/** Inflated background noise, one value per grid frequency. */
public record RmsVector(double[] values) {

    public RmsVector {
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public double at(int frequency) {
        return values[frequency];
    }

    public int size() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RmsVector other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "RmsVector" + Arrays.toString(values);
    }
}
