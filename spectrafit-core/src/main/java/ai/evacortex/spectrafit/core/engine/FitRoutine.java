/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.engine;

/**
 * {@code FitRoutine} is the opaque external spectrum fitter.
 *
 * <p>The routine takes a buffer count and a fixed block of {@value RoutineBuffers#BUFFER_COUNT}
 * buffers (integer inputs, real inputs, guess table, frequencies, spectrum in, parameters out,
 * uncertainties out, spectrum out) and returns a status, where {@code 0} means success.</p>
 *
 * <p>Implementations are <b>not</b> assumed to be reentrant: they may keep hidden state between
 * calls. Callers must go through {@link FitGateway}, which serializes every invocation.</p>
 *
 * @see FitGateway
 * @see RoutineBuffers
 */
public interface FitRoutine {

    /**
     * Runs one fit, writing results into the output buffers of {@code buffers}.
     *
     * @param bufferCount number of buffers in the argument block, always {@value RoutineBuffers#BUFFER_COUNT}
     * @param buffers     the argument block
     * @return status code; anything other than {@code 0} is a failure
     */
    int invoke(long bufferCount, RoutineBuffers buffers);
}
