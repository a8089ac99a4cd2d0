/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.source;

import ai.evacortex.spectrafit.core.*;

import java.util.Objects;

/**
 * {@link CubeSource} over an in-memory cube, for callers that decode the image file
 * themselves.
 */
public final class ArrayCubeSource implements CubeSource {

    private final SpectralCube cube;
    private final LinearWcs wcs;

    public ArrayCubeSource(SpectralCube cube, LinearWcs wcs) {
        this.cube = Objects.requireNonNull(cube, "cube must not be null");
        this.wcs = Objects.requireNonNull(wcs, "wcs must not be null");
    }

    /** A flux-density cube in sfu on an identity transform. */
    public static ArrayCubeSource ofFlux(String sourceId, double[][][] sfu, double[] frequenciesHz) {
        LinearWcs wcs = LinearWcs.identity();
        CubeMetadata meta = new CubeMetadata(sourceId, "Flux Density", "sfu", wcs.pixelAreaArcsec2());
        return new ArrayCubeSource(new SpectralCube(new FluxCube(sfu), new FrequencyGrid(frequenciesHz), meta), wcs);
    }

    @Override
    public SpectralCube readCube() {
        return cube;
    }

    @Override
    public WorldPoint pixelToWorld(int row, int col) {
        return wcs.toWorld(row, col);
    }

    @Override
    public PixelCoordinate worldToPixel(double x, double y) {
        return wcs.toPixel(x, y);
    }
}
