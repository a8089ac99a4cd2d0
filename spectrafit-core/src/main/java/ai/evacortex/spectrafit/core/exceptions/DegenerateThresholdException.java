/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.exceptions;

public class DegenerateThresholdException extends RuntimeException {

    private final double threshold;
    private final int selected;
    private final int total;

    public DegenerateThresholdException(double threshold, int selected, int total) {
        super(selected == 0
                ? "Threshold " + threshold + " sfu is too large, none of the " + total + " pixels is selected"
                : "Threshold " + threshold + " sfu is too small, all " + total + " pixels are selected");
        this.threshold = threshold;
        this.selected = selected;
        this.total = total;
    }

    public double threshold() { return threshold; }
    public int selected()     { return selected; }
    public int total()        { return total; }
}
