/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.signature;

import ai.evacortex.mosaic.core.color.Rgba;

import java.util.List;

/**
 * Reduced color representation of an image or of a unit of the source image.
 *
 * <p>A signature is a fixed-dimension integer vector: the RGB channels of its colors, in
 * color order. Alpha is carried for rendering but is not a coordinate.</p>
 */
public sealed interface Signature permits MonoSignature, QuadSignature {

    SignatureShape shape();

    Rgba color(int index);

    List<Rgba> colors();

    default int colorCount() {
        return shape().colorCount();
    }

    default int dimensions() {
        return shape().dimensions();
    }

    /**
     * @param axis {@code 0 <= axis < dimensions()}; axis {@code 3k + c} is channel {@code c} of color {@code k}
     */
    default int coordinate(int axis) {
        return color(axis / 3).channel(axis % 3);
    }

    static Signature of(SignatureShape shape, List<Rgba> colors) {
        if (colors.size() != shape.colorCount()) {
            throw new IllegalArgumentException("Shape " + shape + " needs " + shape.colorCount()
                    + " colors, got " + colors.size());
        }
        return switch (shape) {
            case MONO -> new MonoSignature(colors.get(0));
            case QUAD -> new QuadSignature(colors.get(0), colors.get(1), colors.get(2), colors.get(3));
        };
    }
}
