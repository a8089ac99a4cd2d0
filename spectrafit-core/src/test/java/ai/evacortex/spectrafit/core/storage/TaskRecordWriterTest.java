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
import ai.evacortex.spectrafit.core.ParameterGuessTable;
import ai.evacortex.spectrafit.core.exceptions.PersistException;
import ai.evacortex.spectrafit.core.storage.io.codec.TaskRecordCodec;
import ai.evacortex.spectrafit.core.storage.io.format.RecordHeader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskRecordWriterTest extends ResultSinkContractTest {

    @TempDir Path tempDir;

    @Override
    protected ResultSink sink() {
        return new TaskRecordWriter(tempDir);
    }

    @Test
    void recordFileIsNamedAfterTaskId() {
        assertEquals("task_0007.sfr", TaskRecordWriter.fileName(7));
        assertEquals("task_12345.sfr", TaskRecordWriter.fileName(12345));
    }

    @Test
    void writtenRecord_readsBackIdentically() {
        TaskRecordWriter writer = new TaskRecordWriter(tempDir);
        FitTask task = FitTestUtils.task(4, 5);
        FitResult result = GATEWAY.fit(task);
        writer.persist(task, result);

        TaskRecord back = new TaskRecordReader(tempDir).get(4);
        assertTrue(result.sameContent(back.result()), "Decoded result must equal the written one");
        assertEquals(ParameterGuessTable.defaults(), back.guessTable());
        assertEquals(task.runMetadata(), back.result().runMetadata());
    }

    @Test
    void reEncodingDecodedRecord_isByteIdentical() throws IOException {
        TaskRecordWriter writer = new TaskRecordWriter(tempDir);
        FitTask task = FitTestUtils.task(2, 6);
        writer.persist(task, GATEWAY.fit(task));

        byte[] file = Files.readAllBytes(writer.pathFor(2));
        byte[] payload = Arrays.copyOfRange(file, RecordHeader.SIZE, file.length);

        TaskRecord decoded = TaskRecordCodec.decode(2, ByteBuffer.wrap(payload));
        assertArrayEquals(payload, TaskRecordCodec.encode(decoded.result(), decoded.guessTable()));
    }

    @Test
    void corruptedPayload_isDetected() throws IOException {
        TaskRecordWriter writer = new TaskRecordWriter(tempDir);
        FitTask task = FitTestUtils.task(1, 3);
        writer.persist(task, GATEWAY.fit(task));

        Path file = writer.pathFor(1);
        byte[] bytes = Files.readAllBytes(file);
        bytes[RecordHeader.SIZE + 20] ^= 0x5A;
        Files.write(file, bytes);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new TaskRecordReader(tempDir).get(1));
        assertTrue(e.getMessage().contains("Checksum"));
    }

    @Test
    void badMagic_isRejected() throws IOException {
        Files.write(tempDir.resolve(TaskRecordWriter.fileName(9)), new byte[64]);
        assertThrows(IllegalArgumentException.class, () -> new TaskRecordReader(tempDir).get(9));
    }

    @Test
    void missingRecord_surfacesIoError() {
        assertThrows(UncheckedIOException.class, () -> new TaskRecordReader(tempDir).get(99));
    }

    @Test
    void reader_listsTaskIdsInOrder() {
        TaskRecordWriter writer = new TaskRecordWriter(tempDir);
        for (int id : new int[]{5, 0, 3}) {
            FitTask t = FitTestUtils.task(id, 2);
            writer.persist(t, GATEWAY.fit(t));
        }
        assertEquals(List.of(0, 3, 5), new TaskRecordReader(tempDir).taskIds());
    }

    @Test
    void clearPrevious_removesOnlyTaskRecords() throws IOException {
        TaskRecordWriter writer = new TaskRecordWriter(tempDir);
        for (int id : new int[]{0, 1, 2}) {
            FitTask t = FitTestUtils.task(id, 2);
            writer.persist(t, GATEWAY.fit(t));
        }
        Files.writeString(tempDir.resolve("task_0007.sfr.tmp"), "partial");
        Files.writeString(tempDir.resolve("cube.json"), "{}");

        assertEquals(4, new TaskRecordWriter(tempDir).clearPrevious());
        assertEquals(List.of(), new TaskRecordReader(tempDir).taskIds());
        assertTrue(Files.exists(tempDir.resolve("cube.json")));
        assertEquals(0, new TaskRecordWriter(tempDir.resolve("missing")).clearPrevious());
    }

    @Test
    void unwritableDirectory_isPersistFailure() throws IOException {
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "x");
        TaskRecordWriter writer = new TaskRecordWriter(blocker);
        FitTask t = FitTestUtils.task(0, 2);

        PersistException e = assertThrows(PersistException.class, () -> writer.persist(t, GATEWAY.fit(t)));
        assertEquals(0, e.taskId());
    }
}
