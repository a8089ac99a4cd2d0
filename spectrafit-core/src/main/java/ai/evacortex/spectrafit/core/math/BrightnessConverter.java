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

/**
 * Rayleigh-Jeans conversion between brightness temperature (K) and flux density (sfu):
 * <pre>
 *     S = 2 · k · ν² · Tb · Ω / c²
 * </pre>
 * with Ω the pixel solid angle in steradians and 1 sfu = 1e-22 W m⁻² Hz⁻¹.
 */
public final class BrightnessConverter {

    private static final double BOLTZMANN = 1.380649e-23;     // J/K
    private static final double SPEED_OF_LIGHT = 2.99792458e8; // m/s
    private static final double SFU = 1e-22;                   // W m^-2 Hz^-1
    private static final double ARCSEC2_TO_SR = Math.pow(Math.PI / (180.0 * 3600.0), 2);

    private BrightnessConverter() {}

    public static double toSfu(double brightnessK, double frequencyHz, double pixelAreaArcsec2) {
        return 2.0 * BOLTZMANN * frequencyHz * frequencyHz * brightnessK * solidAngle(pixelAreaArcsec2)
                / (SPEED_OF_LIGHT * SPEED_OF_LIGHT) / SFU;
    }

    public static double toKelvin(double fluxSfu, double frequencyHz, double pixelAreaArcsec2) {
        return fluxSfu * SFU * SPEED_OF_LIGHT * SPEED_OF_LIGHT
                / (2.0 * BOLTZMANN * frequencyHz * frequencyHz * solidAngle(pixelAreaArcsec2));
    }

    public static FluxCube toFluxCube(FluxCube brightness, FrequencyGrid grid, double pixelAreaArcsec2) {
        if (brightness.frequencies() != grid.size()) {
            throw new IllegalArgumentException("Cube and grid frequency counts differ");
        }
        double[][][] data = brightness.toArray();
        for (int f = 0; f < data.length; f++) {
            double nu = grid.hz(f);
            for (double[] row : data[f]) {
                for (int c = 0; c < row.length; c++) {
                    row[c] = toSfu(row[c], nu, pixelAreaArcsec2);
                }
            }
        }
        return new FluxCube(data);
    }

    private static double solidAngle(double pixelAreaArcsec2) {
        if (!(pixelAreaArcsec2 > 0)) {
            throw new IllegalArgumentException("Pixel area must be positive: " + pixelAreaArcsec2);
        }
        return pixelAreaArcsec2 * ARCSEC2_TO_SR;
    }
}
