/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.task;

import ai.evacortex.spectrafit.core.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a pixel selection into independent fit tasks.
 *
 * <p>The uncertainty assigned to each frequency grows towards low frequencies:</p>
 * <pre>
 *     σ[f] = rms[f] + rmsFactor · rms[f] / ν_GHz[f]
 * </pre>
 */
public final class TaskBuilder {

    private TaskBuilder() {}

    public static List<FitTask> buildTasks(FluxCube cube,
                                           RmsVector rms,
                                           PixelSet pixels,
                                           FrequencySubset subset,
                                           ParameterGuessTable guessTable,
                                           RunMetadata runMetadata,
                                           double rmsFactor) {
        Objects.requireNonNull(cube, "cube must not be null");
        Objects.requireNonNull(rms, "rms must not be null");
        Objects.requireNonNull(pixels, "pixel set must not be null");
        Objects.requireNonNull(subset, "frequency subset must not be null");
        Objects.requireNonNull(guessTable, "guess table must not be null");
        if (subset.endIndex() > rms.size()) {
            throw new IllegalArgumentException("Frequency subset " + subset + " exceeds RMS length " + rms.size());
        }

        double[] uncertainty = uncertainty(rms, subset, rmsFactor);
        List<FitTask> tasks = new ArrayList<>(pixels.size());
        for (int taskId = 0; taskId < pixels.size(); taskId++) {
            PixelCoordinate pixel = pixels.get(taskId);
            tasks.add(new FitTask(taskId, pixel, subset, cube.spectrum(pixel, subset), uncertainty,
                    guessTable, runMetadata));
        }
        return tasks;
    }

    public static FitTask buildSingle(FluxCube cube,
                                      RmsVector rms,
                                      PixelCoordinate pixel,
                                      FrequencySubset subset,
                                      ParameterGuessTable guessTable,
                                      RunMetadata runMetadata,
                                      double rmsFactor) {
        return buildTasks(cube, rms, PixelSet.single(pixel), subset, guessTable, runMetadata, rmsFactor).get(0);
    }

    static double[] uncertainty(RmsVector rms, FrequencySubset subset, double rmsFactor) {
        double[] out = new double[subset.size()];
        for (int i = 0; i < out.length; i++) {
            double base = rms.at(subset.startIndex() + i);
            out[i] = base + rmsFactor * base / subset.ghz(i);
        }
        return out;
    }
}
