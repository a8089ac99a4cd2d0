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
import ai.evacortex.spectrafit.core.source.ArrayCubeSource;
import ai.evacortex.spectrafit.core.source.LinearWcs;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MaskBuilderTest {

    private static final RmsVector ZERO_RMS = new RmsVector(new double[]{0.0, 0.0});

    private static ArrayCubeSource source(double[][][] data) {
        return ArrayCubeSource.ofFlux("m.fits", data, new double[]{1e9, 2e9});
    }

    @Test
    void threshold_selectsPixelsAboveIntegratedFlux() {
        ArrayCubeSource src = FitTestUtils.threeByThreeSource();
        FluxCube cube = src.readCube().flux();

        MaskSelection sel = MaskBuilder.fromThreshold(cube, ZERO_RMS, 0.0, 5, src);

        assertEquals(8, sel.pixels().size());
        assertFalse(sel.mask().isSelected(0, 0));
        assertEquals(new PixelCoordinate(0, 1), sel.pixels().get(0), "Row-major order");
        assertEquals(new PixelCoordinate(2, 2), sel.pixels().get(7));
    }

    @Test
    void threshold_noneSelected_isDegenerate() {
        ArrayCubeSource src = FitTestUtils.threeByThreeSource();
        DegenerateThresholdException e = assertThrows(DegenerateThresholdException.class,
                () -> MaskBuilder.fromThreshold(src.readCube().flux(), ZERO_RMS, 100.0, 5, src));
        assertEquals(0, e.selected());
        assertEquals(9, e.total());
    }

    @Test
    void threshold_allSelected_isDegenerate() {
        ArrayCubeSource src = source(FitTestUtils.constantCube(2, 3, 3, 1.0));
        assertThrows(DegenerateThresholdException.class,
                () -> MaskBuilder.fromThreshold(src.readCube().flux(), ZERO_RMS, 0.0, 5, src));
    }

    @Test
    void threshold_subtractsRmsPerFrequency() {
        ArrayCubeSource src = FitTestUtils.threeByThreeSource();
        // integrated flux of the bright pixels is 2 - 0.6 - 0.6 = 0.8
        RmsVector rms = new RmsVector(new double[]{0.6, 0.6});
        assertThrows(DegenerateThresholdException.class,
                () -> MaskBuilder.fromThreshold(src.readCube().flux(), rms, 1.0, 5, src));
        assertEquals(8, MaskBuilder.fromThreshold(src.readCube().flux(), rms, 0.5, 5, src).pixels().size());
    }

    @Test
    void boundingBox_containsEverySelectedPixelAndIsClamped() {
        double[][][] data = FitTestUtils.constantCube(2, 20, 20, 0.0);
        data[0][8][9] = 5; data[1][8][9] = 5;
        data[0][11][12] = 5; data[1][11][12] = 5;
        ArrayCubeSource src = source(data);

        MaskSelection sel = MaskBuilder.fromThreshold(src.readCube().flux(), ZERO_RMS, 1.0, 3, src);
        BoundingBox box = sel.savedRange();
        assertEquals(new BoundingBox(5, 14, 6, 15), box);
        for (PixelCoordinate p : sel.pixels().pixels()) {
            assertTrue(box.contains(p), "Box must contain " + p);
        }

        MaskSelection wide = MaskBuilder.fromThreshold(src.readCube().flux(), ZERO_RMS, 1.0, 50, src);
        assertEquals(new BoundingBox(0, 20, 0, 20), wide.savedRange());
    }

    @Test
    void worldCenter_isTransformOfIntegerBoxCenter() {
        ArrayCubeSource flat = FitTestUtils.threeByThreeSource();
        LinearWcs wcs = new LinearWcs(0, -100.0, 2.0, 0, 50.0, 2.0);
        ArrayCubeSource src = new ArrayCubeSource(flat.readCube(), wcs);

        MaskSelection sel = MaskBuilder.fromThreshold(src.readCube().flux(), ZERO_RMS, 0.0, 5, src);
        // box rows [0,3], cols [0,3] -> center (1,1)
        assertEquals(new WorldPoint(-98.0, 52.0), sel.worldCenter());
    }

    @Test
    void fieldOfView_selectsInclusiveRectangle() {
        ArrayCubeSource src = source(FitTestUtils.constantCube(2, 10, 10, 0.0));
        MaskSelection sel = MaskBuilder.fromFieldOfView(src.readCube().flux(),
                FieldOfView.of(new double[][]{{2, 3}, {4, 5}}), 0, src);

        assertEquals(9, sel.pixels().size());
        assertEquals(List.of(new PixelCoordinate(3, 2), new PixelCoordinate(3, 3)),
                sel.pixels().pixels().subList(0, 2));
        assertEquals(new BoundingBox(3, 5, 2, 4), sel.savedRange());
    }

    @Test
    void fieldOfView_outsidePlane_isInvalidRegion() {
        ArrayCubeSource src = source(FitTestUtils.constantCube(2, 10, 10, 0.0));
        assertThrows(InvalidRegionException.class, () -> MaskBuilder.fromFieldOfView(src.readCube().flux(),
                FieldOfView.of(new double[][]{{40, 40}, {50, 50}}), 0, src));
    }
}
