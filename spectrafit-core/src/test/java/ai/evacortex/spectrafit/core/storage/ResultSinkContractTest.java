/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.storage;

import ai.evacortex.spectrafit.core.FitResult;
import ai.evacortex.spectrafit.core.FitTask;
import ai.evacortex.spectrafit.core.FitTestUtils;
import ai.evacortex.spectrafit.core.engine.FitGateway;
import ai.evacortex.spectrafit.core.exceptions.PersistException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

abstract class ResultSinkContractTest {

    protected abstract ResultSink sink();

    protected static final FitGateway GATEWAY = new FitGateway(FitTestUtils.echoRoutine());

    @Test
    void distinctTaskIds_arePersisted() {
        ResultSink sink = sink();
        for (int i = 0; i < 5; i++) {
            FitTask t = FitTestUtils.task(i, 3);
            sink.persist(t, GATEWAY.fit(t));
        }
    }

    @Test
    void secondWriteOfSameSlot_fails() {
        ResultSink sink = sink();
        FitTask t = FitTestUtils.task(1, 3);
        FitResult r = GATEWAY.fit(t);
        sink.persist(t, r);
        PersistException e = assertThrows(PersistException.class, () -> sink.persist(t, r));
        assertEquals(1, e.taskId());
    }

    @Test @Timeout(60)
    void concurrentWritersToDistinctSlots() throws Exception {
        ResultSink sink = sink();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            FitTask t = FitTestUtils.task(i, 4);
            FitResult r = GATEWAY.fit(t);
            futures.add(pool.submit(() -> sink.persist(t, r)));
        }
        for (Future<?> f : futures) f.get();
        pool.shutdown();
    }
}
