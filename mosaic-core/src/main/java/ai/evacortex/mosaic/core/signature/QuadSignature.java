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
import java.util.Objects;

public record QuadSignature(Rgba topLeft, Rgba topRight, Rgba bottomRight, Rgba bottomLeft) implements Signature {

    public QuadSignature {
        Objects.requireNonNull(topLeft, "topLeft must not be null");
        Objects.requireNonNull(topRight, "topRight must not be null");
        Objects.requireNonNull(bottomRight, "bottomRight must not be null");
        Objects.requireNonNull(bottomLeft, "bottomLeft must not be null");
    }

    @Override
    public SignatureShape shape() {
        return SignatureShape.QUAD;
    }

    @Override
    public Rgba color(int index) {
        return switch (index) {
            case 0 -> topLeft;
            case 1 -> topRight;
            case 2 -> bottomRight;
            case 3 -> bottomLeft;
            default -> throw new IndexOutOfBoundsException("Quad signature color index: " + index);
        };
    }

    @Override
    public List<Rgba> colors() {
        return List.of(topLeft, topRight, bottomRight, bottomLeft);
    }
}
