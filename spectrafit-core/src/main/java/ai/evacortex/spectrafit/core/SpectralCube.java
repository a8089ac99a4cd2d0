/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

public record SpectralCube(FluxCube flux, FrequencyGrid frequencies, CubeMetadata metadata) {

    public SpectralCube {
        if (flux.frequencies() != frequencies.size()) {
            throw new IllegalArgumentException("Cube has " + flux.frequencies()
                    + " frequency planes but the grid has " + frequencies.size());
        }
    }
}
