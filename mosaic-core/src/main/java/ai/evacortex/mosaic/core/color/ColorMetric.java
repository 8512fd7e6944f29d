/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.color;

import ai.evacortex.mosaic.core.signature.Signature;

/**
 * {@code ColorMetric} defines the distance used to decide which tile best replaces a region
 * of the source image.
 *
 * <p>The distance is a weighted sum of squared channel differences:</p>
 * <pre>
 *     d(a, b) = Σ w_c · (a_c − b_c)²      c ∈ {R, G, B}
 * </pre>
 *
 * <p>Alpha never contributes. Implementations must be pure, symmetric and non-negative,
 * and must return zero exactly when both colors share the same RGB channels.</p>
 *
 * <p>For signatures carrying several colors the distance is the sum of the per-color
 * distances, taken position by position. The weight returned by {@link #axisWeight(int)}
 * is the factor applied to a single squared channel difference; a Euclidean spatial index
 * scales each coordinate by its square root.</p>
 *
 * @see WeightedRgbMetric
 * @see Signature
 */
public interface ColorMetric {

    /**
     * Distance between two colors.
     *
     * @param a first color
     * @param b second color
     * @return weighted squared distance, {@code >= 0}
     */
    double compare(Rgba a, Rgba b);

    /**
     * Distance between two signatures of the same shape.
     *
     * @param a first signature
     * @param b second signature
     * @return sum of the per-color distances
     * @throws IllegalArgumentException if the shapes differ
     */
    default double compare(Signature a, Signature b) {
        if (a.shape() != b.shape()) {
            throw new IllegalArgumentException("Signature shape mismatch: " + a.shape() + " vs " + b.shape());
        }
        double total = 0.0;
        for (int i = 0; i < a.colorCount(); i++) {
            total += compare(a.color(i), b.color(i));
        }
        return total;
    }

    /**
     * Weight of one coordinate axis of a signature vector. Axes cycle R, G, B per color.
     *
     * @param axis coordinate index, {@code 0 <= axis < signature.dimensions()}
     * @return weight applied to the squared difference on that axis
     */
    double axisWeight(int axis);

    /**
     * Contribution of a single axis difference to the total distance.
     */
    default double axisDistance(int axis, int delta) {
        return axisWeight(axis) * delta * delta;
    }
}
