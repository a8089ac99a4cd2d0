/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.math;

import ai.evacortex.spectrafit.core.*;
import ai.evacortex.spectrafit.core.exceptions.DegenerateThresholdException;
import ai.evacortex.spectrafit.core.exceptions.InvalidRegionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Selects the pixels to fit, either from an explicit field of view or from an integrated-flux
 * threshold, and derives the padded bounding box recorded as provenance.
 */
public final class MaskBuilder {

    private static final Logger log = LoggerFactory.getLogger(MaskBuilder.class);

    public static final double DEFAULT_THRESHOLD_SFU = 1.0;
    public static final int DEFAULT_MARGIN_PIXELS = 5;

    private MaskBuilder() {}

    /**
     * Threshold mode. A pixel is selected iff {@code Σ_f (flux[f] − rms[f]) > thresholdSfu}.
     *
     * @throws DegenerateThresholdException if no pixel or every pixel is selected
     */
    public static MaskSelection fromThreshold(FluxCube cube, RmsVector rms, double thresholdSfu,
                                              int marginPixels, CubeSource transform) {
        Objects.requireNonNull(cube, "cube must not be null");
        Objects.requireNonNull(rms, "rms must not be null");
        if (rms.size() != cube.frequencies()) {
            throw new IllegalArgumentException("RMS length " + rms.size() + " does not match "
                    + cube.frequencies() + " frequencies");
        }

        boolean[][] selected = new boolean[cube.rows()][cube.cols()];
        for (int r = 0; r < cube.rows(); r++) {
            for (int c = 0; c < cube.cols(); c++) {
                double integrated = 0.0;
                for (int f = 0; f < cube.frequencies(); f++) {
                    integrated += cube.value(f, r, c) - rms.at(f);
                }
                selected[r][c] = integrated > thresholdSfu;
            }
        }

        Mask mask = new Mask(selected);
        int count = mask.selectedCount();
        if (count == 0 || count == mask.size()) {
            throw new DegenerateThresholdException(thresholdSfu, count, mask.size());
        }
        log.info("Threshold {} sfu selects {} of {} pixels", thresholdSfu, count, mask.size());
        return finish(mask, marginPixels, transform);
    }

    /**
     * Explicit region mode: every pixel inside the field of view, with both corners mapped
     * through the cube's world-to-pixel transform.
     */
    public static MaskSelection fromFieldOfView(FluxCube cube, FieldOfView fov, int marginPixels,
                                                CubeSource transform) {
        Objects.requireNonNull(fov, "field of view must not be null");
        PixelCoordinate a = transform.worldToPixel(fov.x1(), fov.y1());
        PixelCoordinate b = transform.worldToPixel(fov.x2(), fov.y2());

        int rowLo = Math.max(Math.min(a.row(), b.row()), 0);
        int rowHi = Math.min(Math.max(a.row(), b.row()), cube.rows() - 1);
        int colLo = Math.max(Math.min(a.col(), b.col()), 0);
        int colHi = Math.min(Math.max(a.col(), b.col()), cube.cols() - 1);
        if (rowHi < rowLo || colHi < colLo) {
            throw new InvalidRegionException("field of view " + fov + " lies outside the "
                    + cube.rows() + "x" + cube.cols() + " plane");
        }

        boolean[][] selected = new boolean[cube.rows()][cube.cols()];
        for (int r = rowLo; r <= rowHi; r++) {
            for (int c = colLo; c <= colHi; c++) {
                selected[r][c] = true;
            }
        }
        Mask mask = new Mask(selected);
        log.info("Field of view selects {} of {} pixels", mask.selectedCount(), mask.size());
        return finish(mask, marginPixels, transform);
    }

    private static MaskSelection finish(Mask mask, int marginPixels, CubeSource transform) {
        if (marginPixels < 0) {
            throw new IllegalArgumentException("margin must be non-negative: " + marginPixels);
        }
        PixelSet pixels = mask.pixelSet();
        BoundingBox box = BoundingBox.padded(pixels.pixels(), marginPixels, mask.rows(), mask.cols());
        PixelCoordinate center = box.center();
        WorldPoint worldCenter = transform.pixelToWorld(center.row(), center.col());
        return new MaskSelection(mask, pixels, box, worldCenter);
    }
}
