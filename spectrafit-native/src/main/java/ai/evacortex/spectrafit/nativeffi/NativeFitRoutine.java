/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.nativeffi;

import ai.evacortex.spectrafit.core.config.FitConfig;
import ai.evacortex.spectrafit.core.engine.FitRoutine;
import ai.evacortex.spectrafit.core.engine.RoutineBuffers;
import com.sun.jna.Function;
import com.sun.jna.NativeLibrary;
import com.sun.jna.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * NativeFitRoutine binds the compiled spectrum fitting library through JNA.
 * It calls the Fortran entry point
 * - get_mw_fit_(long long n, double** argv)  (get_mw_fit on Windows)
 * with the eight buffers of {@link RoutineBuffers} in argv order.
 *
 * <p>The routine keeps internal state and is not reentrant. Calls are expected to arrive
 * through {@link ai.evacortex.spectrafit.core.engine.FitGateway}, which serializes them.</p>
 */
public final class NativeFitRoutine implements FitRoutine {

    private static final Logger log = LoggerFactory.getLogger(NativeFitRoutine.class);

    public static final String ENTRY_POINT = Platform.isWindows() ? "get_mw_fit" : "get_mw_fit_";

    private final Function entry;

    public NativeFitRoutine(String libraryPath) {
        Objects.requireNonNull(libraryPath, "libraryPath must not be null");
        try {
            NativeLibrary library = NativeLibrary.getInstance(libraryPath);
            this.entry = library.getFunction(ENTRY_POINT);
        } catch (UnsatisfiedLinkError e) {
            throw new IllegalStateException("Cannot load fitting routine '" + ENTRY_POINT + "' from "
                    + libraryPath + ": " + e.getMessage(), e);
        }
        log.info("Loaded fitting routine {} from {}", ENTRY_POINT, libraryPath);
    }

    public static NativeFitRoutine fromConfig(FitConfig config) {
        if (config.nativeLibraryPath() == null) {
            throw new IllegalStateException("No native library configured (spectrafit.nativeLibrary)");
        }
        return new NativeFitRoutine(config.nativeLibraryPath());
    }

    @Override
    public int invoke(long bufferCount, RoutineBuffers buffers) {
        try (NativeBuffers nb = new NativeBuffers(buffers)) {
            int status = entry.invokeInt(new Object[]{bufferCount, nb.argv()});
            nb.copyOutputs(buffers);
            return status;
        }
    }
}
