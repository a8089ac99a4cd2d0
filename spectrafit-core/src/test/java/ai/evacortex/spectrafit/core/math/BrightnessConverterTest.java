/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.math;

import ai.evacortex.spectrafit.core.FluxCube;
import ai.evacortex.spectrafit.core.FrequencyGrid;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BrightnessConverterTest {

    @Test
    void rayleighJeans_knownValue() {
        // 1e6 K at 5 GHz over a 2" x 2" pixel
        double sfu = BrightnessConverter.toSfu(1e6, 5e9, 4.0);
        double omega = 4.0 * Math.pow(Math.PI / (180 * 3600), 2);
        double expected = 2 * 1.380649e-23 * 25e18 * 1e6 * omega / Math.pow(2.99792458e8, 2) / 1e-22;
        assertEquals(expected, sfu, expected * 1e-12);
    }

    @Test
    void inverse_restoresTemperature() {
        double tb = 3.3e6;
        double sfu = BrightnessConverter.toSfu(tb, 7.2e9, 6.25);
        assertEquals(tb, BrightnessConverter.toKelvin(sfu, 7.2e9, 6.25), tb * 1e-12);
    }

    @Test
    void cubeConversion_isPerFrequency() {
        double[][][] tb = {{{1e6}}, {{1e6}}};
        FluxCube out = BrightnessConverter.toFluxCube(new FluxCube(tb), new FrequencyGrid(new double[]{1e9, 2e9}), 4.0);
        assertEquals(4.0 * out.value(0, 0, 0), out.value(1, 0, 0), 1e-9 * out.value(1, 0, 0),
                "Flux scales with the square of the frequency");
    }

    @Test
    void nonPositiveArea_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> BrightnessConverter.toSfu(1, 1e9, 0));
    }
}
