/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

/**
 * A spatial pixel position in array order: {@code row} is the Y axis, {@code col} the X axis.
 */
public record PixelCoordinate(int row, int col) {

    public static PixelCoordinate ofXY(int x, int y) {
        return new PixelCoordinate(y, x);
    }
}
