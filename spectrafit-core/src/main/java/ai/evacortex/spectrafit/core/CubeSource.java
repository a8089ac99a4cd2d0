/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

/**
 * {@code CubeSource} supplies the multi-frequency brightness cube and its pixel/world transform.
 *
 * <p>Implementations own file formats and header parsing; the fitting pipeline only reads
 * the cube once per run and maps coordinates through the two transform methods.</p>
 */
public interface CubeSource {

    /**
     * Reads the cube, its frequency grid and descriptive metadata.
     *
     * @return the ingested cube
     */
    SpectralCube readCube();

    /**
     * Maps a pixel position to world coordinates.
     *
     * @param row pixel row (Y)
     * @param col pixel column (X)
     * @return world position in x, y order
     */
    WorldPoint pixelToWorld(int row, int col);

    /**
     * Maps world coordinates to the pixel containing them, truncating fractional positions toward zero.
     *
     * @param x world X
     * @param y world Y
     * @return pixel position; may lie outside the cube
     * @throws ai.evacortex.spectrafit.core.exceptions.InvalidRegionException if the position is not representable
     */
    PixelCoordinate worldToPixel(double x, double y);
}
