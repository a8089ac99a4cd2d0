/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

import ai.evacortex.spectrafit.core.config.FitConfig;
import ai.evacortex.spectrafit.core.config.FitMode;
import ai.evacortex.spectrafit.core.config.TargetCoordinate;
import ai.evacortex.spectrafit.core.engine.FitGateway;
import ai.evacortex.spectrafit.core.engine.FitRoutine;
import ai.evacortex.spectrafit.core.exceptions.InvalidRegionException;
import ai.evacortex.spectrafit.core.math.BackgroundEstimator;
import ai.evacortex.spectrafit.core.math.BrightnessConverter;
import ai.evacortex.spectrafit.core.math.MaskBuilder;
import ai.evacortex.spectrafit.core.math.MaskSelection;
import ai.evacortex.spectrafit.core.orchestration.BatchFitOrchestrator;
import ai.evacortex.spectrafit.core.orchestration.RunCancellation;
import ai.evacortex.spectrafit.core.orchestration.TaskOutcome;
import ai.evacortex.spectrafit.core.storage.AggregatedStore;
import ai.evacortex.spectrafit.core.storage.AggregatedStoreWriter;
import ai.evacortex.spectrafit.core.storage.ResultMerger;
import ai.evacortex.spectrafit.core.storage.TaskRecordWriter;
import ai.evacortex.spectrafit.core.task.TaskBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * {@code SpectralFitPipeline} runs the masked batch fit of one cube.
 *
 * <p>The cube is read once on construction and converted to flux density when it is delivered
 * in brightness temperature. The noise estimate and the pixel selection are derived lazily from
 * the current {@link FitConfig} and dropped whenever a setting they depend on changes.</p>
 *
 * <p>Batch runs write one record per task into the output directory and then the aggregated
 * store next to them, named after the source. Single runs fit one pixel on the calling thread
 * and persist nothing.</p>
 */
public final class SpectralFitPipeline {

    private static final Logger log = LoggerFactory.getLogger(SpectralFitPipeline.class);

    private final CubeSource source;
    private final FitGateway gateway;
    private final SpectralCube cube;
    private final FluxCube flux;

    private FitConfig config;
    private RmsVector rms;
    private MaskSelection selection;

    public SpectralFitPipeline(CubeSource source, FitRoutine routine, FitConfig config) {
        this(source, new FitGateway(routine), config);
    }

    public SpectralFitPipeline(CubeSource source, FitGateway gateway, FitConfig config) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.cube = source.readCube();

        CubeMetadata meta = cube.metadata();
        if (meta != null && meta.isBrightnessTemperature()) {
            log.info("Converting {} from brightness temperature to flux density", meta.sourceId());
            this.flux = BrightnessConverter.toFluxCube(cube.flux(), cube.frequencies(), meta.pixelAreaArcsec2());
        } else {
            this.flux = cube.flux();
        }
    }

    public synchronized FitConfig config() {
        return config;
    }

    public FluxCube flux() {
        return flux;
    }

    public FrequencyGrid frequencies() {
        return cube.frequencies();
    }

    public synchronized void updateConfig(FitConfig newConfig) {
        Objects.requireNonNull(newConfig, "config must not be null");
        FitConfig old = this.config;
        this.config = newConfig;
        if (!old.backgroundRegion().equals(newConfig.backgroundRegion()) || old.rmsFactor() != newConfig.rmsFactor()) {
            rms = null;
            selection = null;
        }
        if (old.integratedThresholdSfu() != newConfig.integratedThresholdSfu()
                || old.marginPixels() != newConfig.marginPixels()
                || !Objects.equals(old.fieldOfView(), newConfig.fieldOfView())) {
            selection = null;
        }
    }

    public void updateThreshold(double thresholdSfu) {
        updateConfig(config().withIntegratedThresholdSfu(thresholdSfu));
    }

    public void updateBackgroundRegion(BackgroundRegion region) {
        updateConfig(config().withBackgroundRegion(region));
    }

    public synchronized RmsVector rms() {
        if (rms == null) {
            rms = BackgroundEstimator.estimateRms(flux, config.backgroundRegion(), config.rmsFactor());
        }
        return rms;
    }

    /**
     * @throws ai.evacortex.spectrafit.core.exceptions.DegenerateThresholdException in threshold mode
     *         when no pixel or every pixel passes
     * @throws InvalidRegionException in field-of-view mode when the region misses the plane
     */
    public synchronized MaskSelection selection() {
        if (selection == null) {
            selection = config.fieldOfView() != null
                    ? MaskBuilder.fromFieldOfView(flux, config.fieldOfView(), config.marginPixels(), source)
                    : MaskBuilder.fromThreshold(flux, rms(), config.integratedThresholdSfu(), config.marginPixels(), source);
        }
        return selection;
    }

    public synchronized FrequencySubset frequencySubset() {
        FrequencyGrid grid = cube.frequencies();
        double start = config.startFrequencyHz() != null ? config.startFrequencyHz() : grid.first();
        double end = config.endFrequencyHz() != null ? config.endFrequencyHz() : grid.last();
        return grid.subset(start, end);
    }

    public synchronized RunMetadata runMetadata() {
        MaskSelection sel = selection();
        return new RunMetadata(sourceId(), frequencySubset(), sel.savedRange(), sel.worldCenter(),
                config.backgroundRegion(), config.rmsFactor(), config.routineInputs());
    }

    /** Runs according to the configured {@link FitMode}. */
    public AggregatedStore run(RunCancellation cancellation) {
        if (config().mode() == FitMode.SINGLE) {
            FitResult result = fitSingle(config().target());
            return new ResultMerger().merge(List.of(new TaskOutcome.Success(result)), result.runMetadata());
        }
        return fitBatch(cancellation);
    }

    public AggregatedStore fitBatch(RunCancellation cancellation) {
        FitConfig cfg;
        List<FitTask> tasks;
        RunMetadata metadata;
        synchronized (this) {
            cfg = config;
            metadata = runMetadata();
            FrequencySubset subset = metadata.frequencies();
            log.info("Fitting range {} - {} GHz, {} pixels, inputs {}", subset.ghz(0), subset.ghz(subset.size() - 1),
                    selection.pixels().size(), cfg.routineInputs());
            tasks = TaskBuilder.buildTasks(flux, rms(), selection.pixels(), subset, cfg.parameterGuessTable(),
                    metadata, cfg.rmsFactor());
        }

        Path outDir = cfg.outputPath();
        TaskRecordWriter writer = new TaskRecordWriter(outDir);
        writer.clearPrevious();
        BatchFitOrchestrator orchestrator = new BatchFitOrchestrator(gateway, writer);
        AggregatedStore store = orchestrator.run(tasks, cfg.concurrencyLimit(), cancellation, metadata);

        Path file = outDir.resolve(AggregatedStoreWriter.fileNameFor(sourceId()));
        new AggregatedStoreWriter().write(store, file);
        log.info("Aggregated store written to {}", file);
        return store;
    }

    /** Fits the first pixel of the current selection. */
    public FitResult fitSingle() {
        return fitSingle(null);
    }

    /**
     * Fits one pixel on the calling thread. Without a target the first pixel of the current
     * selection is used.
     *
     * @throws InvalidRegionException if the target lies outside the cube or the selection is empty
     */
    public FitResult fitSingle(TargetCoordinate target) {
        FitTask task;
        synchronized (this) {
            RunMetadata metadata = runMetadata();
            PixelCoordinate pixel;
            if (target != null) {
                pixel = target.resolve(source);
                if (pixel.row() < 0 || pixel.row() >= flux.rows() || pixel.col() < 0 || pixel.col() >= flux.cols()) {
                    throw new InvalidRegionException("target " + target + " maps to " + pixel
                            + " outside the " + flux.rows() + "x" + flux.cols() + " plane");
                }
            } else {
                if (selection.pixels().size() == 0) {
                    throw new InvalidRegionException("no pixel selected for single-pixel fit");
                }
                pixel = selection.pixels().first();
                log.info("No target given, fitting the first selected pixel {}", pixel);
            }
            task = TaskBuilder.buildSingle(flux, rms(), pixel, metadata.frequencies(), config.parameterGuessTable(),
                    metadata, config.rmsFactor());
        }
        return gateway.fit(task);
    }

    private String sourceId() {
        return cube.metadata() != null ? cube.metadata().sourceId() : null;
    }
}
