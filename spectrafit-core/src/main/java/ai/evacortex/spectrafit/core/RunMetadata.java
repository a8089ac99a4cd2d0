/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core;

import ai.evacortex.spectrafit.core.engine.RoutineInputs;

/**
 * Provenance shared by every task of a run. None of it affects fitting; it is carried into
 * each persisted record so results can be interpreted without the source cube.
 *
 * @param sourceId         identifier of the input cube (usually its file name)
 * @param frequencies      the fitted frequency range
 * @param savedRange       padded bounding box of the selection
 * @param worldCenter      world coordinates of the bounding box center
 * @param backgroundRegion region the noise was estimated from
 * @param rmsFactor        noise inflation factor
 * @param routineInputs    integer and real inputs passed to the routine
 */
public record RunMetadata(String sourceId,
                          FrequencySubset frequencies,
                          BoundingBox savedRange,
                          WorldPoint worldCenter,
                          BackgroundRegion backgroundRegion,
                          double rmsFactor,
                          RoutineInputs routineInputs) {
}
