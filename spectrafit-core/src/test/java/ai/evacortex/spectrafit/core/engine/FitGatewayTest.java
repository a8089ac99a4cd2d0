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
import ai.evacortex.spectrafit.core.FitTestUtils;
import ai.evacortex.spectrafit.core.ParameterGuessTable;
import ai.evacortex.spectrafit.core.exceptions.NativeRoutineException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class FitGatewayTest {

    @Test
    void marshal_buildsColumnMajorBuffers() {
        double[] freq = {1.0, 2.0, 3.0};
        double[] spec = {10.0, 20.0, 30.0};
        double[] sigma = {0.1, 0.2, 0.3};
        RoutineBuffers b = FitGateway.marshal(RoutineInputs.defaults(), ParameterGuessTable.defaults(), freq, spec, sigma);

        assertEquals(3, b.integerInputs()[RoutineInputs.FREQUENCY_COUNT_SLOT], "Frequency count is set per call");
        assertEquals(7, b.integerInputs()[0]);
        assertArrayEquals(new double[]{0.17, 1e-6, 1.0, 4.0, 8.0, 0.015}, b.realInputs());
        assertEquals(45, b.guessTable().length);
        assertEquals(12, b.spectrumIn().length);
        assertArrayEquals(spec, new double[]{b.spectrumIn()[0], b.spectrumIn()[1], b.spectrumIn()[2]});
        assertArrayEquals(sigma, new double[]{b.spectrumIn()[6], b.spectrumIn()[7], b.spectrumIn()[8]});
        assertEquals(0.0, b.spectrumIn()[3]);
        assertEquals(0.0, b.spectrumIn()[9]);
        assertEquals(8, b.parametersOut().length);
        assertEquals(8, b.uncertaintiesOut().length);
        assertEquals(6, b.spectrumOut().length);
    }

    @Test
    void marshal_leavesCallerInputsUntouched() {
        RoutineInputs inputs = RoutineInputs.defaults();
        FitGateway.marshal(inputs, ParameterGuessTable.defaults(), new double[]{1, 2}, new double[]{1, 2}, new double[]{1, 2});
        assertEquals(RoutineInputs.defaults(), inputs);
    }

    @Test
    void marshal_rejectsLengthMismatch() {
        assertThrows(IllegalArgumentException.class, () -> FitGateway.marshal(RoutineInputs.defaults(),
                ParameterGuessTable.defaults(), new double[]{1, 2}, new double[]{1}, new double[]{1, 2}));
    }

    @Test
    void fit_unmarshalsOutputs() {
        FitGateway gateway = new FitGateway(FitTestUtils.echoRoutine());
        FitTask task = FitTestUtils.task(3, 4);

        FitResult r = gateway.fit(task);

        assertEquals(3, r.taskId());
        assertEquals(task.coordinate(), r.coordinate());
        assertEquals(4, r.fittedSpectrum().length);
        assertEquals(2, r.spectrumComponents());
        assertArrayEquals(new double[]{3.0, 6.0}, r.fittedSpectrum()[0]);
        assertArrayEquals(new double[]{9.0, 9.0, 9.0, 9.0}, r.totalSpectrum());
        assertEquals(3.0, r.fittedParameters()[0]);
        assertEquals(10.0, r.fittedParameters()[7]);
        assertEquals(0.7, r.parameterUncertainties()[7], 1e-12);
        assertSame(task.runMetadata(), r.runMetadata());
    }

    @Test
    void everyCall_acquiresTheGlobalPermit() {
        FitGateway gateway = new FitGateway(FitTestUtils.echoRoutine());
        assertSame(NativeCallPermit.global(), gateway.permit());
        long before = gateway.permit().acquisitions();
        gateway.fit(FitTestUtils.task(0, 2));
        gateway.fit(FitTestUtils.task(1, 2));
        assertEquals(before + 2, gateway.permit().acquisitions());
        assertFalse(gateway.permit().isHeld());
    }

    @Test
    void nonZeroStatus_raisesWithCode() {
        FitGateway gateway = new FitGateway((n, b) -> 42);
        NativeRoutineException e = assertThrows(NativeRoutineException.class, () -> gateway.fit(FitTestUtils.task(0, 2)));
        assertEquals(42, e.code());
    }

    @Test
    void routineCrash_isWrapped() {
        FitGateway gateway = new FitGateway((n, b) -> { throw new UnsatisfiedLinkError("boom"); });
        NativeRoutineException e = assertThrows(NativeRoutineException.class, () -> gateway.fit(FitTestUtils.task(0, 2)));
        assertEquals(NativeRoutineException.CODE_INVOCATION_FAILED, e.code());
        assertInstanceOf(UnsatisfiedLinkError.class, e.getCause());
        assertFalse(NativeCallPermit.global().isHeld(), "Permit must be released after a crash");
    }

    @Test
    void routine_receivesBufferCountEight() {
        AtomicReference<Long> seen = new AtomicReference<>();
        FitGateway gateway = new FitGateway((n, b) -> { seen.set(n); return 0; });
        gateway.fit(FitTestUtils.task(0, 2));
        assertEquals(8L, seen.get());
    }

    @Test @Timeout(60)
    void routineIsNeverEnteredConcurrently() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        FitRoutine tracking = (n, b) -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            return 0;
        };
        // distinct gateway instances share the process-wide permit
        FitGateway g1 = new FitGateway(tracking);
        FitGateway g2 = new FitGateway(tracking);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            FitGateway g = i % 2 == 0 ? g1 : g2;
            FitTask t = FitTestUtils.task(i, 3);
            futures.add(pool.submit(() -> {
                start.await();
                return g.fit(t);
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get();
        pool.shutdown();

        assertEquals(1, maxActive.get(), "At most one call may be inside the routine");
    }
}
