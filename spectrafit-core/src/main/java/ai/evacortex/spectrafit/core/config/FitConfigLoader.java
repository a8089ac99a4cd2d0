/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.config;

import ai.evacortex.spectrafit.core.BackgroundRegion;
import ai.evacortex.spectrafit.core.FieldOfView;
import ai.evacortex.spectrafit.core.ParameterGuessTable;
import ai.evacortex.spectrafit.core.engine.RoutineInputs;
import ai.evacortex.spectrafit.core.storage.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a {@link FitConfig} from JSON. Absent keys keep their defaults; unknown keys are logged
 * and ignored. Regions use the nested pair form, e.g.
 * {@code "backgroundRegion": [[0.15, 0.75], [0.25, 0.85]]}.
 */
public final class FitConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(FitConfigLoader.class);

    private static final Set<String> KEYS = Set.of(
            "backgroundRegion", "integratedThresholdSfu", "rmsFactor", "marginPixels",
            "startFrequencyHz", "endFrequencyHz", "concurrencyLimit", "mode", "fieldOfView",
            "target", "parameterGuessTable", "integerInputs", "realInputs",
            "outputDirectory", "nativeLibraryPath");

    private final ObjectMapper mapper = JsonSupport.newMapper();

    public FitConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + file, e);
        }
    }

    public FitConfig load(InputStream in) throws IOException {
        return apply(FitConfig.defaults(), mapper.readTree(in));
    }

    FitConfig apply(FitConfig base, JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Configuration must be a JSON object");
        }
        for (Iterator<String> it = root.fieldNames(); it.hasNext(); ) {
            String key = it.next();
            if (!KEYS.contains(key)) {
                log.warn("Ignoring unknown configuration key '{}'", key);
            }
        }

        FitConfig c = base;
        if (root.hasNonNull("backgroundRegion")) {
            c = c.withBackgroundRegion(BackgroundRegion.of(mapper.treeToValue(root.get("backgroundRegion"), double[][].class)));
        }
        if (root.hasNonNull("integratedThresholdSfu")) {
            c = c.withIntegratedThresholdSfu(root.get("integratedThresholdSfu").asDouble());
        }
        if (root.hasNonNull("rmsFactor")) {
            c = c.withRmsFactor(root.get("rmsFactor").asDouble());
        }
        if (root.hasNonNull("marginPixels")) {
            c = c.withMarginPixels(root.get("marginPixels").asInt());
        }
        if (root.hasNonNull("startFrequencyHz") || root.hasNonNull("endFrequencyHz")) {
            c = c.withFrequencyRange(
                    root.hasNonNull("startFrequencyHz") ? root.get("startFrequencyHz").asDouble() : c.startFrequencyHz(),
                    root.hasNonNull("endFrequencyHz") ? root.get("endFrequencyHz").asDouble() : c.endFrequencyHz());
        }
        if (root.hasNonNull("concurrencyLimit")) {
            c = c.withConcurrencyLimit(root.get("concurrencyLimit").asInt());
        }
        if (root.hasNonNull("mode")) {
            c = c.withMode(FitMode.valueOf(root.get("mode").asText().trim().toUpperCase(Locale.ROOT)));
        }
        if (root.hasNonNull("fieldOfView")) {
            c = c.withFieldOfView(FieldOfView.of(mapper.treeToValue(root.get("fieldOfView"), double[][].class)));
        }
        if (root.hasNonNull("target")) {
            c = c.withTarget(mapper.treeToValue(root.get("target"), TargetCoordinate.class));
        }
        if (root.hasNonNull("parameterGuessTable")) {
            double[][] rows = mapper.treeToValue(root.get("parameterGuessTable"), double[][].class);
            c = c.withParameterGuessTable(rows.length == ParameterGuessTable.ROW_COUNT
                    ? ParameterGuessTable.of(rows)
                    : ParameterGuessTable.padded(rows));
        }
        if (root.hasNonNull("integerInputs") || root.hasNonNull("realInputs")) {
            RoutineInputs current = c.routineInputs();
            int[] ints = root.hasNonNull("integerInputs")
                    ? mapper.treeToValue(root.get("integerInputs"), int[].class)
                    : current.integerInputs();
            double[] reals = root.hasNonNull("realInputs")
                    ? mapper.treeToValue(root.get("realInputs"), double[].class)
                    : current.realInputs();
            c = c.withRoutineInputs(new RoutineInputs(ints, reals));
        }
        if (root.hasNonNull("outputDirectory")) {
            c = c.withOutputDirectory(root.get("outputDirectory").asText());
        }
        if (root.hasNonNull("nativeLibraryPath")) {
            c = c.withNativeLibraryPath(root.get("nativeLibraryPath").asText());
        }
        return c;
    }
}
