/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.storage;

import ai.evacortex.spectrafit.core.FitTestUtils;
import ai.evacortex.spectrafit.core.engine.FitGateway;
import ai.evacortex.spectrafit.core.orchestration.FailureKind;
import ai.evacortex.spectrafit.core.orchestration.TaskOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregatedStoreWriterTest {

    @TempDir Path tempDir;

    private final AggregatedStoreWriter writer = new AggregatedStoreWriter();

    @Test
    void fileName_replacesExtension() {
        assertEquals("eovsa_20220101.json", AggregatedStoreWriter.fileNameFor("/data/in/eovsa_20220101.fits"));
        assertEquals("cube.json", AggregatedStoreWriter.fileNameFor("cube"));
        assertEquals("spectrafit.json", AggregatedStoreWriter.fileNameFor(null));
    }

    @Test
    void writeThenRead_restoresStore() throws Exception {
        FitGateway gateway = new FitGateway(FitTestUtils.echoRoutine());
        AggregatedStore store = new ResultMerger().merge(List.of(
                new TaskOutcome.Success(gateway.fit(FitTestUtils.task(0, 4))),
                new TaskOutcome.Success(gateway.fit(FitTestUtils.task(2, 4))),
                new TaskOutcome.Failed(1, FailureKind.NATIVE_ROUTINE, 3, "non-zero status"),
                new TaskOutcome.Cancelled(3)), FitTestUtils.runMetadata(4));

        Path file = writer.write(store, tempDir.resolve("out/cube.json"));
        assertTrue(Files.exists(file));
        assertFalse(Files.exists(tempDir.resolve("out/cube.json.tmp")));

        AggregatedStore back = writer.read(file);
        assertEquals(store, back);
        assertTrue(back.isSealed());
    }

    @Test
    void unsealedStore_isNotWritten() {
        AggregatedStore open = new AggregatedStore(FitTestUtils.runMetadata(2));
        assertThrows(IllegalStateException.class, () -> writer.write(open, tempDir.resolve("x.json")));
    }
}
