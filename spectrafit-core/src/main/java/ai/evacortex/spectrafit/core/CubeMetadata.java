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
 * Descriptive header values of an ingested cube.
 *
 * @param sourceId        file name or other identifier of the source
 * @param brightnessType  physical quantity, e.g. {@code "Brightness Temperature"} or {@code "Flux Density"}
 * @param unit            data unit, e.g. {@code "K"} or {@code "sfu"}
 * @param pixelAreaArcsec2 solid angle of one pixel in arcsec²
 */
public record CubeMetadata(String sourceId, String brightnessType, String unit, double pixelAreaArcsec2) {

    public boolean isBrightnessTemperature() {
        return "Brightness Temperature".equalsIgnoreCase(brightnessType)
                || (unit != null && unit.contains("K"));
    }
}
