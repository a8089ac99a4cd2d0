/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Initial guesses and bounds for the model parameters, padded to the fixed row count the
 * fitting routine expects. Each row is {@code (guess, lower, upper)}.
 *
 * <p>Instances are immutable and safe to share across concurrently running tasks. Accessors
 * return copies; the routine receives its own column-major buffer via {@link #toColumnMajor()}.</p>
 */
public final class ParameterGuessTable {

    public static final int ROW_COUNT = 15;
    public static final int COLUMNS = 3;

    private static final double[] PADDING_ROW = {5.0, 0.2, 20.0};

    /** n_nth, B, theta, n_th, delta, E_max, T_e. */
    private static final double[][] DEFAULT_PARAMETERS = {
            {10.0, 0.0001, 2000.0},  // n_nth, 1e7 cm^-3
            {4.0, 0.01, 30.0},       // B, 1e2 G
            {60.0, 22.0, 87.0},      // theta, deg
            {10.0, 0.01, 600.0},     // n_th, 1e9 cm^-3
            {4.5, 1.6, 10.0},        // delta
            {5.0, 0.1, 10.0},        // E_max, MeV
            {5.0, 1.5, 60.0},        // T_e, MK
    };

    private final double[][] rows;
    private final int modelParameters;

    private ParameterGuessTable(double[][] rows, int modelParameters) {
        this.rows = rows;
        this.modelParameters = modelParameters;
    }

    public static ParameterGuessTable defaults() {
        return padded(DEFAULT_PARAMETERS);
    }

    /**
     * Builds a table from the physical parameter rows and pads it to {@link #ROW_COUNT}.
     */
    public static ParameterGuessTable padded(double[][] parameters) {
        if (parameters.length == 0 || parameters.length > ROW_COUNT) {
            throw new IllegalArgumentException("Expected 1.." + ROW_COUNT + " parameter rows, got " + parameters.length);
        }
        double[][] rows = new double[ROW_COUNT][];
        for (int i = 0; i < ROW_COUNT; i++) {
            double[] src = i < parameters.length ? parameters[i] : PADDING_ROW;
            rows[i] = validated(src, i);
        }
        return new ParameterGuessTable(rows, parameters.length);
    }

    @JsonCreator
    public static ParameterGuessTable of(double[][] rows) {
        if (rows.length != ROW_COUNT) {
            throw new IllegalArgumentException("Expected " + ROW_COUNT + " rows, got " + rows.length);
        }
        double[][] copy = new double[ROW_COUNT][];
        int model = ROW_COUNT;
        for (int i = 0; i < ROW_COUNT; i++) {
            copy[i] = validated(rows[i], i);
        }
        for (int i = ROW_COUNT - 1; i >= 0 && Arrays.equals(copy[i], PADDING_ROW); i--) {
            model = i;
        }
        return new ParameterGuessTable(copy, model);
    }

    private static double[] validated(double[] row, int index) {
        if (row.length != COLUMNS) {
            throw new IllegalArgumentException("Row " + index + " must have " + COLUMNS + " values");
        }
        double guess = row[0], lower = row[1], upper = row[2];
        if (!(lower <= guess && guess <= upper)) {
            throw new IllegalArgumentException("Row " + index + ": guess " + guess
                    + " outside [" + lower + ", " + upper + "]");
        }
        return row.clone();
    }

    public int modelParameters() {
        return modelParameters;
    }

    public double guess(int row) { return rows[row][0]; }
    public double lower(int row) { return rows[row][1]; }
    public double upper(int row) { return rows[row][2]; }

    @JsonValue
    public double[][] rows() {
        double[][] copy = new double[ROW_COUNT][];
        for (int i = 0; i < ROW_COUNT; i++) copy[i] = rows[i].clone();
        return copy;
    }

    /** Fortran-ordered {@code (ROW_COUNT, 3)} buffer. */
    public double[] toColumnMajor() {
        double[] out = new double[ROW_COUNT * COLUMNS];
        for (int c = 0; c < COLUMNS; c++) {
            for (int r = 0; r < ROW_COUNT; r++) {
                out[c * ROW_COUNT + r] = rows[r][c];
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParameterGuessTable other && Arrays.deepEquals(rows, other.rows);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(rows);
    }

    @Override
    public String toString() {
        return "ParameterGuessTable" + Arrays.deepToString(rows);
    }
}
