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
 * Explicit fitting region given by two opposite corners in world coordinates.
 */
public record FieldOfView(double x1, double y1, double x2, double y2) {

    public FieldOfView {
        if (!Double.isFinite(x1) || !Double.isFinite(y1) || !Double.isFinite(x2) || !Double.isFinite(y2)) {
            throw new InvalidRegionException("field of view corners must be finite");
        }
        if (x1 == x2 || y1 == y2) {
            throw new InvalidRegionException("field of view has zero width or height");
        }
    }

    public static FieldOfView of(double[][] corners) {
        if (corners == null || corners.length != 2 || corners[0].length != 2 || corners[1].length != 2) {
            throw new InvalidRegionException("expected [[x1, y1], [x2, y2]]");
        }
        return new FieldOfView(corners[0][0], corners[0][1], corners[1][0], corners[1][1]);
    }
}
