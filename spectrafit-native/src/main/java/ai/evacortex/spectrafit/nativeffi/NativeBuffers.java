/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.nativeffi;

import ai.evacortex.spectrafit.core.engine.RoutineBuffers;
import com.sun.jna.Memory;
import com.sun.jna.Native;
import com.sun.jna.Pointer;

/**
 * Off-heap copies of the eight routine buffers plus the pointer array handed to the routine.
 * Inputs are copied in on allocation; {@link #copyOutputs(RoutineBuffers)} copies the three
 * output buffers back into the heap arrays after the call.
 */
final class NativeBuffers implements AutoCloseable {

    private final Memory[] segments = new Memory[RoutineBuffers.BUFFER_COUNT];
    private final Memory argv;

    NativeBuffers(RoutineBuffers buffers) {
        segments[0] = ints(buffers.integerInputs());
        segments[1] = doubles(buffers.realInputs());
        segments[2] = doubles(buffers.guessTable());
        segments[3] = doubles(buffers.frequencies());
        segments[4] = doubles(buffers.spectrumIn());
        segments[5] = doubles(buffers.parametersOut());
        segments[6] = doubles(buffers.uncertaintiesOut());
        segments[7] = doubles(buffers.spectrumOut());

        argv = new Memory((long) Native.POINTER_SIZE * segments.length);
        for (int i = 0; i < segments.length; i++) {
            argv.setPointer((long) i * Native.POINTER_SIZE, segments[i]);
        }
    }

    Pointer argv() {
        return argv;
    }

    Pointer segment(int index) {
        return segments[index];
    }

    void copyOutputs(RoutineBuffers buffers) {
        read(segments[5], buffers.parametersOut());
        read(segments[6], buffers.uncertaintiesOut());
        read(segments[7], buffers.spectrumOut());
    }

    @Override
    public void close() {
        argv.close();
        for (Memory m : segments) {
            m.close();
        }
    }

    private static Memory ints(int[] values) {
        Memory m = new Memory((long) Integer.BYTES * values.length);
        m.write(0, values, 0, values.length);
        return m;
    }

    private static Memory doubles(double[] values) {
        Memory m = new Memory((long) Double.BYTES * values.length);
        m.write(0, values, 0, values.length);
        return m;
    }

    private static void read(Memory m, double[] into) {
        m.read(0, into, 0, into.length);
    }
}
