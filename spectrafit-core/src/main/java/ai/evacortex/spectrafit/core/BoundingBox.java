/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

import java.util.Collection;

/**
 * Row/column extent of the saved data region. Upper bounds are clamped to the plane extent,
 * so {@code maxRow} may equal the row count.
 */
public record BoundingBox(int minRow, int maxRow, int minCol, int maxCol) {

    public static BoundingBox padded(Collection<PixelCoordinate> pixels, int margin, int rows, int cols) {
        if (pixels.isEmpty()) {
            throw new IllegalArgumentException("Cannot bound an empty pixel selection");
        }
        int minRow = Integer.MAX_VALUE, maxRow = Integer.MIN_VALUE;
        int minCol = Integer.MAX_VALUE, maxCol = Integer.MIN_VALUE;
        for (PixelCoordinate p : pixels) {
            minRow = Math.min(minRow, p.row());
            maxRow = Math.max(maxRow, p.row());
            minCol = Math.min(minCol, p.col());
            maxCol = Math.max(maxCol, p.col());
        }
        return new BoundingBox(
                Math.max(minRow - margin, 0),
                Math.min(maxRow + margin, rows),
                Math.max(minCol - margin, 0),
                Math.min(maxCol + margin, cols));
    }

    public boolean contains(PixelCoordinate p) {
        return p.row() >= minRow && p.row() <= maxRow && p.col() >= minCol && p.col() <= maxCol;
    }

    public PixelCoordinate center() {
        return new PixelCoordinate((minRow + maxRow) / 2, (minCol + maxCol) / 2);
    }
}
