/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.storage;

import ai.evacortex.spectrafit.core.storage.io.codec.TaskRecordCodec;
import ai.evacortex.spectrafit.core.storage.io.format.RecordHeader;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads per-task records back by task id, verifying header and checksum. Decoded records are
 * cached; the cache is bounded by entry count.
 */
public class TaskRecordReader {

    private final Path directory;
    private final LoadingCache<Integer, TaskRecord> cache;

    public TaskRecordReader(Path directory) {
        this(directory, 1024);
    }

    public TaskRecordReader(Path directory, int maxEntries) {
        this.directory = directory;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build(this::load);
    }

    public TaskRecord get(int taskId) {
        return cache.get(taskId);
    }

    /** Task ids of every record file present, ascending. */
    public List<Integer> taskIds() {
        List<Integer> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                    .filter(n -> n.startsWith("task_") && n.endsWith(TaskRecordWriter.EXTENSION))
                    .map(n -> n.substring(5, n.length() - TaskRecordWriter.EXTENSION.length()))
                    .map(Integer::parseInt)
                    .sorted()
                    .forEach(ids::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list records in " + directory, e);
        }
        return ids;
    }

    private TaskRecord load(Integer taskId) {
        Path file = directory.resolve(TaskRecordWriter.fileName(taskId));
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read record " + file, e);
        }

        ByteBuffer buf = ByteBuffer.wrap(bytes);
        RecordHeader header = RecordHeader.from(buf);
        if (header.taskId() != taskId) {
            throw new IllegalStateException("Record " + file + " belongs to task " + header.taskId());
        }
        if (buf.remaining() != header.payloadLength()) {
            throw new IllegalStateException("Record " + file + " is truncated: expected "
                    + header.payloadLength() + " payload bytes, found " + buf.remaining());
        }
        ByteBuffer payload = buf.slice();
        if (HashingUtil.checksum(payload) != header.checksum()) {
            throw new IllegalStateException("Checksum mismatch in record " + file);
        }
        return TaskRecordCodec.decode(taskId, payload);
    }
}
