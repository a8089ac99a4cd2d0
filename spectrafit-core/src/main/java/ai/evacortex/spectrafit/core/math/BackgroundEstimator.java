/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.math;

import ai.evacortex.spectrafit.core.BackgroundRegion;
import ai.evacortex.spectrafit.core.FluxCube;
import ai.evacortex.spectrafit.core.RmsVector;
import ai.evacortex.spectrafit.core.exceptions.InvalidRegionException;

import java.util.Objects;

/**
 * Per-frequency noise from a background sub-rectangle of the cube.
 *
 * <p>For every frequency plane the population standard deviation of the flux values inside the
 * region is taken and multiplied by the inflation factor:</p>
 * <pre>
 *     rms[f] = std(flux[f][rowStart:rowEnd, colStart:colEnd]) · rmsFactor
 * </pre>
 * <p>Region bounds are the fractional coordinates scaled by the plane extent and truncated.</p>
 */
public final class BackgroundEstimator {

    public static final double DEFAULT_RMS_FACTOR = 4.0;

    private BackgroundEstimator() {}

    public static RmsVector estimateRms(FluxCube cube, BackgroundRegion region) {
        return estimateRms(cube, region, DEFAULT_RMS_FACTOR);
    }

    public static RmsVector estimateRms(FluxCube cube, BackgroundRegion region, double rmsFactor) {
        Objects.requireNonNull(cube, "cube must not be null");
        Objects.requireNonNull(region, "region must not be null");

        int rowStart = region.rowStart(cube.rows());
        int rowEnd = region.rowEnd(cube.rows());
        int colStart = region.colStart(cube.cols());
        int colEnd = region.colEnd(cube.cols());
        if (rowEnd <= rowStart || colEnd <= colStart) {
            throw new InvalidRegionException("background region " + region + " covers no pixels of a "
                    + cube.rows() + "x" + cube.cols() + " plane");
        }

        int n = (rowEnd - rowStart) * (colEnd - colStart);
        double[] rms = new double[cube.frequencies()];
        for (int f = 0; f < rms.length; f++) {
            double sum = 0.0;
            for (int r = rowStart; r < rowEnd; r++) {
                for (int c = colStart; c < colEnd; c++) {
                    sum += cube.value(f, r, c);
                }
            }
            double mean = sum / n;
            double sq = 0.0;
            for (int r = rowStart; r < rowEnd; r++) {
                for (int c = colStart; c < colEnd; c++) {
                    double d = cube.value(f, r, c) - mean;
                    sq += d * d;
                }
            }
            rms[f] = Math.sqrt(sq / n) * rmsFactor;
        }
        return new RmsVector(rms);
    }
}
