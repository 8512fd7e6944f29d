/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.color;

import ai.evacortex.mosaic.core.signature.MonoSignature;
import ai.evacortex.mosaic.core.signature.QuadSignature;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static ai.evacortex.mosaic.core.MosaicTestUtils.randomColor;
import static org.junit.jupiter.api.Assertions.*;

class WeightedRgbMetricTest {

    private final ColorMetric metric = new WeightedRgbMetric();

    @Test
    void testCompare_isSymmetricNonNegativeAndZeroOnSelf() {
        Random random = new Random(42);
        for (int i = 0; i < 1_000; i++) {
            Rgba a = randomColor(random);
            Rgba b = randomColor(random);
            double ab = metric.compare(a, b);
            assertEquals(ab, metric.compare(b, a), "metric must be symmetric");
            assertTrue(ab >= 0.0, "metric must be non-negative");
            assertEquals(0.0, metric.compare(a, a), "distance to itself must be zero");
        }
    }

    @Test
    void testCompare_usesLumaWeightsAndIgnoresAlpha() {
        assertEquals(0.3 * 100, metric.compare(Rgba.opaque(10, 0, 0), Rgba.opaque(0, 0, 0)), 1e-9);
        assertEquals(0.59 * 100, metric.compare(Rgba.opaque(0, 10, 0), Rgba.opaque(0, 0, 0)), 1e-9);
        assertEquals(0.11 * 100, metric.compare(Rgba.opaque(0, 0, 10), Rgba.opaque(0, 0, 0)), 1e-9);
        assertEquals(0.0, metric.compare(new Rgba(1, 2, 3, 0), new Rgba(1, 2, 3, 255)),
                "alpha must not contribute to the distance");
    }

    @Test
    void testCompare_quadSignaturesSumPerQuadrant() {
        Rgba black = Rgba.opaque(0, 0, 0);
        QuadSignature a = new QuadSignature(black, black, black, black);
        QuadSignature b = new QuadSignature(Rgba.opaque(10, 0, 0), black, black, Rgba.opaque(0, 0, 10));
        assertEquals(30.0 + 11.0, metric.compare(a, b), 1e-9);
    }

    @Test
    void testCompare_rejectsMixedShapes() {
        Rgba c = Rgba.opaque(1, 1, 1);
        assertThrows(IllegalArgumentException.class,
                () -> metric.compare(new MonoSignature(c), new QuadSignature(c, c, c, c)));
    }

    @Test
    void testAxisWeight_cyclesRgbPerColor() {
        assertEquals(WeightedRgbMetric.RED_WEIGHT, metric.axisWeight(0));
        assertEquals(WeightedRgbMetric.GREEN_WEIGHT, metric.axisWeight(4));
        assertEquals(WeightedRgbMetric.BLUE_WEIGHT, metric.axisWeight(11));
    }
}
