/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.color;

/**
 * Luma-weighted RGB distance: {@code 0.3·Δr² + 0.59·Δg² + 0.11·Δb²}.
 */
public final class WeightedRgbMetric implements ColorMetric {

    public static final double RED_WEIGHT = 0.3;
    public static final double GREEN_WEIGHT = 0.59;
    public static final double BLUE_WEIGHT = 0.11;

    private static final double[] WEIGHTS = {RED_WEIGHT, GREEN_WEIGHT, BLUE_WEIGHT};

    @Override
    public double compare(Rgba a, Rgba b) {
        if (a == null || b == null) {
            throw new NullPointerException("colors must not be null");
        }
        return axisDistance(0, a.r() - b.r())
                + axisDistance(1, a.g() - b.g())
                + axisDistance(2, a.b() - b.b());
    }

    @Override
    public double axisWeight(int axis) {
        if (axis < 0) throw new IllegalArgumentException("Negative axis: " + axis);
        return WEIGHTS[axis % 3];
    }
}
