/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.engine;

import ai.evacortex.spectrafit.core.FitResult;
import ai.evacortex.spectrafit.core.FitTask;
import ai.evacortex.spectrafit.core.ParameterGuessTable;
import ai.evacortex.spectrafit.core.exceptions.NativeRoutineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Serialized boundary to the external fitting routine.
 *
 * <p>Marshaling into the routine's column-major buffers and unmarshaling of its outputs run on
 * the calling thread without any lock. Only the routine call itself is made while holding the
 * process-wide {@link NativeCallPermit}, so at most one call is in flight regardless of how many
 * gateways or worker threads exist.</p>
 *
 * <p>Any non-zero status, and any exception or linkage error raised by the routine, surfaces as
 * {@link NativeRoutineException}.</p>
 */
public final class FitGateway {

    private static final Logger log = LoggerFactory.getLogger(FitGateway.class);

    private final FitRoutine routine;
    private final NativeCallPermit permit;

    public FitGateway(FitRoutine routine) {
        this(routine, NativeCallPermit.global());
    }

    FitGateway(FitRoutine routine, NativeCallPermit permit) {
        this.routine = Objects.requireNonNull(routine, "routine must not be null");
        this.permit = Objects.requireNonNull(permit, "permit must not be null");
    }

    public NativeCallPermit permit() {
        return permit;
    }

    public FitResult fit(FitTask task) {
        Objects.requireNonNull(task, "task must not be null");
        RoutineInputs inputs = task.runMetadata() != null && task.runMetadata().routineInputs() != null
                ? task.runMetadata().routineInputs()
                : RoutineInputs.defaults();
        FitOutput out = fit(inputs, task.parameterGuessTable(), task.frequencySubset().frequenciesGhz(),
                task.spectrumValues(), task.uncertaintyValues());
        return new FitResult(task.taskId(), task.coordinate(), out.fittedSpectrum(), out.fittedParameters(),
                out.parameterUncertainties(), task.runMetadata());
    }

    public FitOutput fit(RoutineInputs inputs,
                         ParameterGuessTable guessTable,
                         double[] frequenciesGhz,
                         double[] spectrum,
                         double[] uncertainty) {
        RoutineBuffers buffers = marshal(inputs, guessTable, frequenciesGhz, spectrum, uncertainty);

        int status;
        try (NativeCallPermit.Held ignored = permit.acquire()) {
            status = routine.invoke(RoutineBuffers.BUFFER_COUNT, buffers);
        } catch (RuntimeException | LinkageError e) {
            throw new NativeRoutineException(NativeRoutineException.CODE_INVOCATION_FAILED,
                    "routine raised " + e.getClass().getSimpleName(), e);
        }

        if (status != 0) {
            log.debug("Fitting routine returned status {}", status);
            throw new NativeRoutineException(status, "non-zero status");
        }
        return unmarshal(buffers);
    }

    static RoutineBuffers marshal(RoutineInputs inputs,
                                  ParameterGuessTable guessTable,
                                  double[] frequenciesGhz,
                                  double[] spectrum,
                                  double[] uncertainty) {
        Objects.requireNonNull(inputs, "routine inputs must not be null");
        Objects.requireNonNull(guessTable, "guess table must not be null");
        Objects.requireNonNull(frequenciesGhz, "frequencies must not be null");
        Objects.requireNonNull(spectrum, "spectrum must not be null");
        Objects.requireNonNull(uncertainty, "uncertainty must not be null");

        int nFreq = frequenciesGhz.length;
        if (nFreq == 0) {
            throw new IllegalArgumentException("At least one frequency is required");
        }
        if (spectrum.length != nFreq || uncertainty.length != nFreq) {
            throw new IllegalArgumentException("Spectrum/uncertainty length mismatch: expected " + nFreq
                    + ", got " + spectrum.length + "/" + uncertainty.length);
        }

        // rows are fixed at ParameterGuessTable.ROW_COUNT by construction
        double[] table = guessTable.toColumnMajor();

        RoutineInputs callInputs = inputs.withFrequencyCount(nFreq);

        double[] spectrumIn = new double[nFreq * RoutineBuffers.INPUT_COMPONENTS];
        for (int f = 0; f < nFreq; f++) {
            spectrumIn[f] = spectrum[f];
            spectrumIn[2 * nFreq + f] = uncertainty[f];
        }

        return new RoutineBuffers(
                callInputs.integerInputs(),
                callInputs.realInputs(),
                table,
                frequenciesGhz.clone(),
                spectrumIn,
                new double[RoutineBuffers.OUTPUT_PARAMETERS],
                new double[RoutineBuffers.OUTPUT_PARAMETERS],
                new double[nFreq * RoutineBuffers.OUTPUT_COMPONENTS]);
    }

    static FitOutput unmarshal(RoutineBuffers buffers) {
        int nFreq = buffers.frequencyCount();
        double[] flat = buffers.spectrumOut();
        double[][] spectrum = new double[nFreq][RoutineBuffers.OUTPUT_COMPONENTS];
        for (int k = 0; k < RoutineBuffers.OUTPUT_COMPONENTS; k++) {
            for (int f = 0; f < nFreq; f++) {
                spectrum[f][k] = flat[k * nFreq + f];
            }
        }
        return new FitOutput(spectrum, buffers.parametersOut().clone(), buffers.uncertaintiesOut().clone());
    }
}
