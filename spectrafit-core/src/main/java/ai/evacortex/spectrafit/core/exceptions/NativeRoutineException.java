/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.exceptions;

public class NativeRoutineException extends RuntimeException {

    public static final int CODE_INVOCATION_FAILED = -1;

    private final int code;

    public NativeRoutineException(int code, String message) {
        super("Fitting routine failed with code " + code + ": " + message);
        this.code = code;
    }

    public NativeRoutineException(int code, String message, Throwable cause) {
        super("Fitting routine failed with code " + code + ": " + message, cause);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
