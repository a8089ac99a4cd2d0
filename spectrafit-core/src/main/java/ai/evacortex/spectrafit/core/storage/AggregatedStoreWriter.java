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
import ai.evacortex.spectrafit.core.PixelCoordinate;
import ai.evacortex.spectrafit.core.RunMetadata;
import ai.evacortex.spectrafit.core.orchestration.TaskOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON form of an {@link AggregatedStore}: one document per run with results keyed by task id,
 * the failure manifest and the cancelled task ids.
 */
public class AggregatedStoreWriter {

    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper = JsonSupport.newMapper();

    record StoreDocument(int formatVersion,
                         RunMetadata run,
                         Map<Integer, ResultDocument> results,
                         List<TaskOutcome.Failed> failures,
                         List<Integer> cancelled) {}

    record ResultDocument(PixelCoordinate coordinate,
                          double[][] fittedSpectrum,
                          double[] fittedParameters,
                          double[] parameterUncertainties) {}

    /** Output file name for a source: its base name with the extension replaced by {@code .json}. */
    public static String fileNameFor(String sourceId) {
        String base = sourceId == null || sourceId.isBlank() ? "spectrafit" : Path.of(sourceId).getFileName().toString();
        int dot = base.lastIndexOf('.');
        return (dot > 0 ? base.substring(0, dot) : base) + ".json";
    }

    public Path write(AggregatedStore store, Path file) {
        if (!store.isSealed()) {
            throw new IllegalStateException("Only a sealed store can be written");
        }
        Map<Integer, ResultDocument> results = new TreeMap<>();
        for (FitResult r : store.results()) {
            results.put(r.taskId(), new ResultDocument(r.coordinate(), r.fittedSpectrum(), r.fittedParameters(),
                    r.parameterUncertainties()));
        }
        StoreDocument doc = new StoreDocument(FORMAT_VERSION, store.runMetadata(), results, store.failures(),
                store.cancelledTaskIds());

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), doc);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write aggregated store " + file, e);
        }
    }

    public AggregatedStore read(Path file) {
        StoreDocument doc;
        try {
            doc = mapper.readValue(file.toFile(), StoreDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read aggregated store " + file, e);
        }
        if (doc.formatVersion() > FORMAT_VERSION) {
            throw new IllegalStateException("Unsupported store format version " + doc.formatVersion());
        }

        AggregatedStore store = new AggregatedStore(doc.run());
        if (doc.results() != null) {
            doc.results().forEach((taskId, r) -> store.append(new FitResult(taskId, r.coordinate(),
                    r.fittedSpectrum(), r.fittedParameters(), r.parameterUncertainties(), doc.run())));
        }
        if (doc.failures() != null) doc.failures().forEach(store::recordFailure);
        if (doc.cancelled() != null) doc.cancelled().forEach(store::recordCancelled);
        store.seal();
        return store;
    }
}
