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
import ai.evacortex.spectrafit.core.math.BackgroundEstimator;
import ai.evacortex.spectrafit.core.math.MaskBuilder;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable run configuration.
 *
 * <p>{@code startFrequencyHz} and {@code endFrequencyHz} may be {@code null}, meaning the first
 * and last frequency of the cube. {@code fieldOfView} switches mask construction from threshold
 * mode to explicit region mode when set. {@code nativeLibraryPath} is only read by the native
 * module.</p>
 *
 * <p>Any value can be overridden by a {@code spectrafit.*} system property, see
 * {@link #withSystemOverrides()}.</p>
 */
public record FitConfig(BackgroundRegion backgroundRegion,
                        double integratedThresholdSfu,
                        double rmsFactor,
                        int marginPixels,
                        Double startFrequencyHz,
                        Double endFrequencyHz,
                        int concurrencyLimit,
                        FitMode mode,
                        FieldOfView fieldOfView,
                        TargetCoordinate target,
                        ParameterGuessTable parameterGuessTable,
                        RoutineInputs routineInputs,
                        String outputDirectory,
                        String nativeLibraryPath) {

    public static final String PROPERTY_PREFIX = "spectrafit.";

    public FitConfig {
        Objects.requireNonNull(backgroundRegion, "backgroundRegion must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(parameterGuessTable, "parameterGuessTable must not be null");
        Objects.requireNonNull(routineInputs, "routineInputs must not be null");
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (!(rmsFactor > 0)) {
            throw new IllegalArgumentException("rmsFactor must be positive: " + rmsFactor);
        }
        if (marginPixels < 0) {
            throw new IllegalArgumentException("marginPixels must be non-negative: " + marginPixels);
        }
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1: " + concurrencyLimit);
        }
    }

    public static FitConfig defaults() {
        return new FitConfig(
                BackgroundRegion.DEFAULT,
                MaskBuilder.DEFAULT_THRESHOLD_SFU,
                BackgroundEstimator.DEFAULT_RMS_FACTOR,
                MaskBuilder.DEFAULT_MARGIN_PIXELS,
                null,
                null,
                Math.max(1, Runtime.getRuntime().availableProcessors()),
                FitMode.BATCH,
                null,
                null,
                ParameterGuessTable.defaults(),
                RoutineInputs.defaults(),
                ".",
                null);
    }

    public Path outputPath() {
        return Path.of(outputDirectory);
    }

    public FitConfig withBackgroundRegion(BackgroundRegion region) {
        return new FitConfig(region, integratedThresholdSfu, rmsFactor, marginPixels, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, mode, fieldOfView, target, parameterGuessTable, routineInputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withIntegratedThresholdSfu(double threshold) {
        return new FitConfig(backgroundRegion, threshold, rmsFactor, marginPixels, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, mode, fieldOfView, target, parameterGuessTable, routineInputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withRmsFactor(double factor) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, factor, marginPixels, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, mode, fieldOfView, target, parameterGuessTable, routineInputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withMarginPixels(int margin) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, rmsFactor, margin, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, mode, fieldOfView, target, parameterGuessTable, routineInputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withFrequencyRange(Double startHz, Double endHz) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, rmsFactor, marginPixels, startHz,
                endHz, concurrencyLimit, mode, fieldOfView, target, parameterGuessTable, routineInputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withConcurrencyLimit(int limit) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, rmsFactor, marginPixels, startFrequencyHz,
                endFrequencyHz, limit, mode, fieldOfView, target, parameterGuessTable, routineInputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withMode(FitMode newMode) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, rmsFactor, marginPixels, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, newMode, fieldOfView, target, parameterGuessTable, routineInputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withFieldOfView(FieldOfView fov) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, rmsFactor, marginPixels, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, mode, fov, target, parameterGuessTable, routineInputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withTarget(TargetCoordinate coordinate) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, rmsFactor, marginPixels, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, mode, fieldOfView, coordinate, parameterGuessTable, routineInputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withParameterGuessTable(ParameterGuessTable table) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, rmsFactor, marginPixels, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, mode, fieldOfView, target, table, routineInputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withRoutineInputs(RoutineInputs inputs) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, rmsFactor, marginPixels, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, mode, fieldOfView, target, parameterGuessTable, inputs,
                outputDirectory, nativeLibraryPath);
    }

    public FitConfig withOutputDirectory(String directory) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, rmsFactor, marginPixels, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, mode, fieldOfView, target, parameterGuessTable, routineInputs,
                directory, nativeLibraryPath);
    }

    public FitConfig withNativeLibraryPath(String path) {
        return new FitConfig(backgroundRegion, integratedThresholdSfu, rmsFactor, marginPixels, startFrequencyHz,
                endFrequencyHz, concurrencyLimit, mode, fieldOfView, target, parameterGuessTable, routineInputs,
                outputDirectory, path);
    }

    /**
     * Applies {@code spectrafit.threshold}, {@code spectrafit.rmsFactor}, {@code spectrafit.margin},
     * {@code spectrafit.startFrequencyHz}, {@code spectrafit.endFrequencyHz},
     * {@code spectrafit.concurrency}, {@code spectrafit.mode}, {@code spectrafit.outputDirectory}
     * and {@code spectrafit.nativeLibrary} when present.
     */
    public FitConfig withSystemOverrides() {
        FitConfig c = this;
        String threshold = property("threshold");
        if (threshold != null) c = c.withIntegratedThresholdSfu(Double.parseDouble(threshold));
        String factor = property("rmsFactor");
        if (factor != null) c = c.withRmsFactor(Double.parseDouble(factor));
        Integer margin = Integer.getInteger(PROPERTY_PREFIX + "margin");
        if (margin != null) c = c.withMarginPixels(margin);
        String start = property("startFrequencyHz");
        String end = property("endFrequencyHz");
        if (start != null || end != null) {
            c = c.withFrequencyRange(start != null ? Double.valueOf(start) : c.startFrequencyHz(),
                    end != null ? Double.valueOf(end) : c.endFrequencyHz());
        }
        Integer concurrency = Integer.getInteger(PROPERTY_PREFIX + "concurrency");
        if (concurrency != null) c = c.withConcurrencyLimit(concurrency);
        String mode = property("mode");
        if (mode != null) c = c.withMode(FitMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
        String out = property("outputDirectory");
        if (out != null) c = c.withOutputDirectory(out);
        String lib = property("nativeLibrary");
        if (lib != null) c = c.withNativeLibraryPath(lib);
        return c;
    }

    private static String property(String key) {
        String v = System.getProperty(PROPERTY_PREFIX + key);
        return v == null || v.isBlank() ? null : v;
    }
}
