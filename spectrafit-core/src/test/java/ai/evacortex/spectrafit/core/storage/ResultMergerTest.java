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
import ai.evacortex.spectrafit.core.FitTestUtils;
import ai.evacortex.spectrafit.core.PixelCoordinate;
import ai.evacortex.spectrafit.core.RunMetadata;
import ai.evacortex.spectrafit.core.engine.FitGateway;
import ai.evacortex.spectrafit.core.exceptions.MergeSchemaException;
import ai.evacortex.spectrafit.core.orchestration.FailureKind;
import ai.evacortex.spectrafit.core.orchestration.TaskOutcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ResultMergerTest {

    private static final FitGateway GATEWAY = new FitGateway(FitTestUtils.echoRoutine());
    private static final RunMetadata META = FitTestUtils.runMetadata(3);

    private final ResultMerger merger = new ResultMerger();

    private static List<TaskOutcome> outcomes(int count) {
        List<TaskOutcome> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(new TaskOutcome.Success(GATEWAY.fit(FitTestUtils.task(i, 3))));
        }
        out.add(new TaskOutcome.Failed(count, FailureKind.NATIVE_ROUTINE, 7, "non-zero status"));
        out.add(new TaskOutcome.Cancelled(count + 1));
        return out;
    }

    @Test
    void merge_isSealedAndKeyedByTaskId() {
        AggregatedStore store = merger.merge(outcomes(4), META);
        assertTrue(store.isSealed());
        assertEquals(List.of(0, 1, 2, 3), store.taskIds());
        assertEquals(1, store.failures().size());
        assertEquals(7, store.failures().get(0).code());
        assertEquals(List.of(5), store.cancelledTaskIds());
        assertSame(META, store.runMetadata());
        assertTrue(store.get(2).isPresent());
        assertFalse(store.contains(4));
    }

    @Test
    void merge_isOrderIndependent() {
        List<TaskOutcome> ordered = outcomes(10);
        List<TaskOutcome> shuffled = new ArrayList<>(ordered);
        Collections.shuffle(shuffled, new Random(3));
        assertEquals(merger.merge(ordered, META), merger.merge(shuffled, META));
    }

    @Test
    void merge_isIdempotent() {
        List<TaskOutcome> o = outcomes(6);
        AggregatedStore a = merger.merge(o, META);
        AggregatedStore b = merger.merge(o, META);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void sealedStore_rejectsWrites() {
        AggregatedStore store = merger.merge(outcomes(1), META);
        assertThrows(IllegalStateException.class, () -> store.recordCancelled(42));
    }

    @Test
    void sealedStore_contentCannotChangeThroughReturnedArrays() {
        AggregatedStore store = merger.merge(outcomes(3), META);
        FitResult first = store.get(1).orElseThrow();
        first.fittedParameters()[0] = 999.0;
        first.parameterUncertainties()[1] = 999.0;
        first.fittedSpectrum()[0][0] = -1.0;
        store.results().get(1).fittedParameters()[0] = 999.0;

        FitResult again = store.get(1).orElseThrow();
        assertEquals(1.0, again.fittedParameters()[0]);
        assertEquals(0.1, again.parameterUncertainties()[1], 1e-12);
        assertEquals(1.0, again.fittedSpectrum()[0][0]);
        assertTrue(again.sameContent(first));
    }

    @Test
    void duplicateTaskId_isSchemaError() {
        List<TaskOutcome> o = outcomes(2);
        o.add(new TaskOutcome.Failed(0, FailureKind.PERSIST, 0, "again"));
        MergeSchemaException e = assertThrows(MergeSchemaException.class, () -> merger.merge(o, META));
        assertEquals(o.size(), e.outcomes().size());
    }

    @Test
    void parameterLengthMismatch_isSchemaError() {
        List<TaskOutcome> o = outcomes(2);
        FitResult odd = new FitResult(9, new PixelCoordinate(0, 0), new double[3][2], new double[5], new double[5], META);
        o.add(new TaskOutcome.Success(odd));
        assertThrows(MergeSchemaException.class, () -> merger.merge(o, META));
    }

    @Test
    void spectrumShapeMismatch_isSchemaError() {
        List<TaskOutcome> o = outcomes(2);
        FitResult odd = new FitResult(9, new PixelCoordinate(0, 0), new double[4][2], new double[8], new double[8], META);
        o.add(new TaskOutcome.Success(odd));
        assertThrows(MergeSchemaException.class, () -> merger.merge(o, META));
    }

    @Test
    void uncertaintyLengthMismatch_isSchemaError() {
        FitResult odd = new FitResult(0, new PixelCoordinate(0, 0), new double[3][2], new double[8], new double[7], META);
        assertThrows(MergeSchemaException.class,
                () -> merger.merge(List.of(new TaskOutcome.Success(odd)), META));
    }

    @Test
    void emptyOutcomes_yieldEmptyStore() {
        AggregatedStore store = merger.merge(List.of(), META);
        assertEquals(0, store.size());
        assertTrue(store.isSealed());
    }
}
