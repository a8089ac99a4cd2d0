/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Boolean selection over the spatial plane. {@code true} marks a pixel to be fitted.
 */
public final class Mask {

    private final boolean[][] selected;
    private final int rows;
    private final int cols;

    public Mask(boolean[][] selected) {
        this.rows = selected.length;
        this.cols = rows == 0 ? 0 : selected[0].length;
        this.selected = new boolean[rows][];
        for (int r = 0; r < rows; r++) {
            if (selected[r].length != cols) {
                throw new IllegalArgumentException("Ragged mask at row " + r);
            }
            this.selected[r] = selected[r].clone();
        }
    }

    public int rows() { return rows; }
    public int cols() { return cols; }

    public boolean isSelected(int row, int col) {
        return selected[row][col];
    }

    public int selectedCount() {
        int n = 0;
        for (boolean[] row : selected) {
            for (boolean b : row) if (b) n++;
        }
        return n;
    }

    public int size() {
        return rows * cols;
    }

    /** Selected pixels in row-major order; the position in this set is the task id. */
    public PixelSet pixelSet() {
        List<PixelCoordinate> pixels = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (selected[r][c]) pixels.add(new PixelCoordinate(r, c));
            }
        }
        return new PixelSet(pixels);
    }
}
