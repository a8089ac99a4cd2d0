/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.config;

import ai.evacortex.spectrafit.core.CubeSource;
import ai.evacortex.spectrafit.core.PixelCoordinate;

/**
 * Pixel to fit in single mode, given in x/y order either as pixel indices or as world
 * coordinates.
 */
public record TargetCoordinate(double x, double y, boolean world) {

    public static TargetCoordinate pixel(int x, int y) {
        return new TargetCoordinate(x, y, false);
    }

    public static TargetCoordinate world(double x, double y) {
        return new TargetCoordinate(x, y, true);
    }

    public PixelCoordinate resolve(CubeSource transform) {
        if (world) {
            return transform.worldToPixel(x, y);
        }
        return PixelCoordinate.ofXY((int) x, (int) y);
    }
}
