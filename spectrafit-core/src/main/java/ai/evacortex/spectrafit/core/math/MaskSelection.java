/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.math;

import ai.evacortex.spectrafit.core.BoundingBox;
import ai.evacortex.spectrafit.core.Mask;
import ai.evacortex.spectrafit.core.PixelSet;
import ai.evacortex.spectrafit.core.WorldPoint;

/**
 * Result of a mask build: the mask, its pixels in task order and the saved-data provenance.
 */
public record MaskSelection(Mask mask, PixelSet pixels, BoundingBox savedRange, WorldPoint worldCenter) {}
