/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

import ai.evacortex.spectrafit.core.engine.FitRoutine;
import ai.evacortex.spectrafit.core.engine.RoutineBuffers;
import ai.evacortex.spectrafit.core.engine.RoutineInputs;
import ai.evacortex.spectrafit.core.source.ArrayCubeSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class FitTestUtils {

    private FitTestUtils() {}

    public static double[][][] constantCube(int freqs, int rows, int cols, double value) {
        double[][][] data = new double[freqs][rows][cols];
        for (double[][] plane : data) {
            for (double[] row : plane) Arrays.fill(row, value);
        }
        return data;
    }

    /** 3×3 plane, two frequencies (1 and 2 GHz), pixel (0,0) = 0 and every other pixel = 1. */
    public static ArrayCubeSource threeByThreeSource() {
        double[][][] data = constantCube(2, 3, 3, 1.0);
        data[0][0][0] = 0.0;
        data[1][0][0] = 0.0;
        return ArrayCubeSource.ofFlux("cube.fits", data, new double[]{1e9, 2e9});
    }

    public static FrequencySubset subset(int nFreq) {
        double[] ghz = new double[nFreq];
        for (int i = 0; i < nFreq; i++) ghz[i] = 1.0 + i;
        return new FrequencySubset(0, nFreq, ghz);
    }

    public static RunMetadata runMetadata(int nFreq) {
        return new RunMetadata("test.fits", subset(nFreq), new BoundingBox(0, 3, 0, 3), new WorldPoint(1.0, 1.0),
                BackgroundRegion.DEFAULT, 4.0, RoutineInputs.defaults());
    }

    /** Task {@code id} whose spectrum is constant {@code id}. */
    public static FitTask task(int id, int nFreq) {
        double[] spectrum = new double[nFreq];
        double[] sigma = new double[nFreq];
        Arrays.fill(spectrum, id);
        Arrays.fill(sigma, 0.5);
        return new FitTask(id, new PixelCoordinate(id / 3, id % 3), subset(nFreq), spectrum, sigma,
                ParameterGuessTable.defaults(), runMetadata(nFreq));
    }

    public static List<FitTask> tasks(int count, int nFreq) {
        List<FitTask> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) out.add(task(i, nFreq));
        return out;
    }

    /**
     * Deterministic stand-in for the native routine: parameter {@code i} is the first spectrum
     * value plus {@code i}, uncertainty {@code i} is {@code 0.1 · i}, and output component
     * {@code k} at frequency {@code f} is {@code (k + 1) · spectrum[f]}.
     */
    public static FitRoutine echoRoutine() {
        return (count, b) -> {
            int n = b.frequencyCount();
            double[] in = b.spectrumIn();
            for (int i = 0; i < RoutineBuffers.OUTPUT_PARAMETERS; i++) {
                b.parametersOut()[i] = in[0] + i;
                b.uncertaintiesOut()[i] = 0.1 * i;
            }
            for (int k = 0; k < RoutineBuffers.OUTPUT_COMPONENTS; k++) {
                for (int f = 0; f < n; f++) {
                    b.spectrumOut()[k * n + f] = (k + 1) * in[f];
                }
            }
            return 0;
        };
    }

    /** Like {@link #echoRoutine()} but returns {@code status} when the first spectrum value equals {@code failOn}. */
    public static FitRoutine failingOn(double failOn, int status) {
        FitRoutine echo = echoRoutine();
        return (count, b) -> b.spectrumIn()[0] == failOn ? status : echo.invoke(count, b);
    }
}
