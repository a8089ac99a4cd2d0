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
 * Flux densities in sfu indexed {@code [frequency][row][col]}. The backing array is copied on
 * construction and never exposed, so a cube is immutable once built.
 */
public final class FluxCube {

    private final double[][][] data;
    private final int frequencies;
    private final int rows;
    private final int cols;

    public FluxCube(double[][][] data) {
        if (data.length == 0 || data[0].length == 0 || data[0][0].length == 0) {
            throw new IllegalArgumentException("Flux cube must have a non-empty shape");
        }
        this.frequencies = data.length;
        this.rows = data[0].length;
        this.cols = data[0][0].length;
        this.data = new double[frequencies][rows][];
        for (int f = 0; f < frequencies; f++) {
            if (data[f].length != rows) {
                throw new IllegalArgumentException("Ragged cube at frequency " + f);
            }
            for (int r = 0; r < rows; r++) {
                if (data[f][r].length != cols) {
                    throw new IllegalArgumentException("Ragged cube at frequency " + f + ", row " + r);
                }
                this.data[f][r] = data[f][r].clone();
            }
        }
    }

    public int frequencies() { return frequencies; }
    public int rows()        { return rows; }
    public int cols()        { return cols; }

    public double value(int frequency, int row, int col) {
        return data[frequency][row][col];
    }

    public double[] spectrum(PixelCoordinate pixel, FrequencySubset subset) {
        if (pixel.row() < 0 || pixel.row() >= rows || pixel.col() < 0 || pixel.col() >= cols) {
            throw new IndexOutOfBoundsException("Pixel " + pixel + " outside " + rows + "x" + cols + " plane");
        }
        double[] out = new double[subset.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = data[subset.startIndex() + i][pixel.row()][pixel.col()];
        }
        return out;
    }

    public double[][][] toArray() {
        double[][][] copy = new double[frequencies][rows][];
        for (int f = 0; f < frequencies; f++) {
            for (int r = 0; r < rows; r++) {
                copy[f][r] = data[f][r].clone();
            }
        }
        return copy;
    }
}
