/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

import ai.evacortex.spectrafit.core.exceptions.InvalidRegionException;

/**
 * Background rectangle as fractions of the spatial extent: {@code [[x0, y0], [x1, y1]]}.
 */
public record BackgroundRegion(double x0, double y0, double x1, double y1) {

    public static final BackgroundRegion DEFAULT = new BackgroundRegion(0.15, 0.75, 0.25, 0.85);

    public BackgroundRegion {
        if (!(0.0 <= x0 && x0 < x1 && x1 <= 1.0)) {
            throw new InvalidRegionException("x range [" + x0 + ", " + x1 + "] must satisfy 0 <= x0 < x1 <= 1");
        }
        if (!(0.0 <= y0 && y0 < y1 && y1 <= 1.0)) {
            throw new InvalidRegionException("y range [" + y0 + ", " + y1 + "] must satisfy 0 <= y0 < y1 <= 1");
        }
    }

    public static BackgroundRegion of(double[][] xy) {
        if (xy == null || xy.length != 2 || xy[0].length != 2 || xy[1].length != 2) {
            throw new InvalidRegionException("expected [[x0, y0], [x1, y1]]");
        }
        return new BackgroundRegion(xy[0][0], xy[0][1], xy[1][0], xy[1][1]);
    }

    public int rowStart(int height) { return (int) (height * y0); }
    public int rowEnd(int height)   { return (int) (height * y1); }
    public int colStart(int width)  { return (int) (width * x0); }
    public int colEnd(int width)    { return (int) (width * x1); }
}
