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
 * One independent unit of work: a single pixel's spectrum with its uncertainty.
 * The guess table is shared across tasks and never modified.
 */
public record FitTask(int taskId,
                      PixelCoordinate coordinate,
                      FrequencySubset frequencySubset,
                      double[] spectrumValues,
                      double[] uncertaintyValues,
                      ParameterGuessTable parameterGuessTable,
                      RunMetadata runMetadata) {

    public FitTask {
        if (spectrumValues.length != frequencySubset.size() || uncertaintyValues.length != frequencySubset.size()) {
            throw new IllegalArgumentException("Task " + taskId + ": spectrum/uncertainty length must equal "
                    + frequencySubset.size());
        }
        spectrumValues = spectrumValues.clone();
        uncertaintyValues = uncertaintyValues.clone();
    }

    @Override
    public double[] spectrumValues() {
        return spectrumValues.clone();
    }

    @Override
    public double[] uncertaintyValues() {
        return uncertaintyValues.clone();
    }
}
