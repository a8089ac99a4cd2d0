/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.source;

import ai.evacortex.spectrafit.core.PixelCoordinate;
import ai.evacortex.spectrafit.core.WorldPoint;
import ai.evacortex.spectrafit.core.exceptions.InvalidRegionException;

/**
 * Linear pixel/world transform per axis, {@code world = crval + (pixel − crpix) · cdelt},
 * with zero-based pixel indices. World positions map to pixels by truncation toward zero.
 */
public record LinearWcs(double crpixX, double crvalX, double cdeltX,
                        double crpixY, double crvalY, double cdeltY) {

    public LinearWcs {
        if (cdeltX == 0 || cdeltY == 0) {
            throw new IllegalArgumentException("Pixel increments must be non-zero");
        }
    }

    /** Pixel indices equal world coordinates. */
    public static LinearWcs identity() {
        return new LinearWcs(0, 0, 1, 0, 0, 1);
    }

    /** Centered on the middle of a {@code rows × cols} plane with square pixels. */
    public static LinearWcs centered(int rows, int cols, double centerX, double centerY, double arcsecPerPixel) {
        return new LinearWcs((cols - 1) / 2.0, centerX, arcsecPerPixel,
                (rows - 1) / 2.0, centerY, arcsecPerPixel);
    }

    public WorldPoint toWorld(int row, int col) {
        return new WorldPoint(crvalX + (col - crpixX) * cdeltX, crvalY + (row - crpixY) * cdeltY);
    }

    public PixelCoordinate toPixel(double x, double y) {
        int col = truncate(crpixX + (x - crvalX) / cdeltX, x, y);
        int row = truncate(crpixY + (y - crvalY) / cdeltY, x, y);
        return new PixelCoordinate(row, col);
    }

    private static int truncate(double pixel, double x, double y) {
        if (!(pixel > Integer.MIN_VALUE - 1.0 && pixel < Integer.MAX_VALUE + 1.0)) {
            throw new InvalidRegionException("world position (" + x + ", " + y + ") maps to no pixel index");
        }
        return (int) pixel;
    }

    public double pixelAreaArcsec2() {
        return Math.abs(cdeltX * cdeltY);
    }
}
