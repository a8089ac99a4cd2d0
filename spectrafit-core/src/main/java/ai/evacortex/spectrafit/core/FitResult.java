/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Output of one successful task.
 *
 * @param fittedSpectrum         model spectrum, {@code [frequency][component]} with two components
 * @param fittedParameters       fitted parameter vector
 * @param parameterUncertainties one uncertainty per fitted parameter
 */
public record FitResult(int taskId,
                        PixelCoordinate coordinate,
                        double[][] fittedSpectrum,
                        double[] fittedParameters,
                        double[] parameterUncertainties,
                        RunMetadata runMetadata) {

    public FitResult {
        Objects.requireNonNull(fittedSpectrum, "fittedSpectrum must not be null");
        Objects.requireNonNull(fittedParameters, "fittedParameters must not be null");
        Objects.requireNonNull(parameterUncertainties, "parameterUncertainties must not be null");
        fittedSpectrum = deepCopy(fittedSpectrum);
        fittedParameters = fittedParameters.clone();
        parameterUncertainties = parameterUncertainties.clone();
    }

    @Override
    public double[][] fittedSpectrum() {
        return deepCopy(fittedSpectrum);
    }

    @Override
    public double[] fittedParameters() {
        return fittedParameters.clone();
    }

    @Override
    public double[] parameterUncertainties() {
        return parameterUncertainties.clone();
    }

    /** Sum of the model components per frequency. */
    public double[] totalSpectrum() {
        double[] total = new double[fittedSpectrum.length];
        for (int f = 0; f < fittedSpectrum.length; f++) {
            for (double v : fittedSpectrum[f]) total[f] += v;
        }
        return total;
    }

    public int spectrumComponents() {
        return fittedSpectrum.length == 0 ? 0 : fittedSpectrum[0].length;
    }

    public boolean sameContent(FitResult other) {
        return other != null
                && taskId == other.taskId
                && coordinate.equals(other.coordinate)
                && Arrays.deepEquals(fittedSpectrum, other.fittedSpectrum)
                && Arrays.equals(fittedParameters, other.fittedParameters)
                && Arrays.equals(parameterUncertainties, other.parameterUncertainties)
                && Objects.equals(runMetadata, other.runMetadata);
    }

    private static double[][] deepCopy(double[][] src) {
        double[][] copy = new double[src.length][];
        for (int i = 0; i < src.length; i++) {
            copy[i] = src[i].clone();
        }
        return copy;
    }
}
