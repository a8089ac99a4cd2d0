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
import ai.evacortex.spectrafit.core.exceptions.PersistException;
import ai.evacortex.spectrafit.core.storage.io.codec.TaskRecordCodec;
import ai.evacortex.spectrafit.core.storage.io.format.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Writes one checksummed binary file per task: {@code task_0000.sfr}, {@code task_0001.sfr}, ...
 *
 * <p>Each record is written to a temporary sibling and moved into place, so a reader never sees
 * a half-written slot. Writers for different task ids never touch the same file.</p>
 *
 * <p>A run starts with {@link #clearPrevious()} so records left by an earlier run in the same
 * directory never mix with the new ones.</p>
 */
public class TaskRecordWriter implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(TaskRecordWriter.class);

    public static final String EXTENSION = ".sfr";

    private final Path directory;
    private final Set<Integer> written = ConcurrentHashMap.newKeySet();

    public TaskRecordWriter(Path directory) {
        this.directory = directory;
    }

    public static String fileName(int taskId) {
        return String.format("task_%04d%s", taskId, EXTENSION);
    }

    public Path pathFor(int taskId) {
        return directory.resolve(fileName(taskId));
    }

    /**
     * Deletes task records and leftover temporaries from an earlier run in this directory.
     *
     * @return number of files removed
     */
    public int clearPrevious() {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int removed = 0;
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String name = file.getFileName().toString();
                if (name.startsWith("task_")
                        && (name.endsWith(EXTENSION) || name.endsWith(EXTENSION + ".tmp"))) {
                    Files.deleteIfExists(file);
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear previous records in " + directory, e);
        }
        if (removed > 0) {
            log.info("Removed {} task records of a previous run from {}", removed, directory);
        }
        return removed;
    }

    @Override
    public void persist(FitTask task, FitResult result) {
        int taskId = result.taskId();
        if (!written.add(taskId)) {
            throw new PersistException(taskId, "slot already written in this run", null);
        }

        Path target = pathFor(taskId);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            byte[] payload = TaskRecordCodec.encode(result, task.parameterGuessTable());
            RecordHeader header = new RecordHeader(RecordHeader.CURRENT_VERSION, System.currentTimeMillis(),
                    taskId, payload.length, HashingUtil.checksum(payload));

            Files.createDirectories(directory);
            try (OutputStream out = Files.newOutputStream(tmp)) {
                out.write(header.toBytes());
                out.write(payload);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Task {} written to {}", taskId, target);
        } catch (IOException | RuntimeException e) {
            written.remove(taskId);
            deleteQuietly(tmp);
            throw new PersistException(taskId, e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary record {}: {}", tmp, e.getMessage());
        }
    }
}
