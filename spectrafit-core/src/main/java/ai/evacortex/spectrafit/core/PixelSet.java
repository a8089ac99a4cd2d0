/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

import java.util.List;

/**
 * Stable ordered pixel list. Task ids are positions in this list.
 */
public record PixelSet(List<PixelCoordinate> pixels) {

    public PixelSet {
        pixels = List.copyOf(pixels);
    }

    public static PixelSet single(PixelCoordinate pixel) {
        return new PixelSet(List.of(pixel));
    }

    public int size() {
        return pixels.size();
    }

    public PixelCoordinate get(int taskId) {
        return pixels.get(taskId);
    }

    public PixelCoordinate first() {
        return pixels.get(0);
    }
}
