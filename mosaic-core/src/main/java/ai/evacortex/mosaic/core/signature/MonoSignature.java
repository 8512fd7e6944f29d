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

public record MonoSignature(Rgba color) implements Signature {

    public MonoSignature {
        Objects.requireNonNull(color, "color must not be null");
    }

    @Override
    public SignatureShape shape() {
        return SignatureShape.MONO;
    }

    @Override
    public Rgba color(int index) {
        if (index != 0) throw new IndexOutOfBoundsException("Mono signature has a single color: " + index);
        return color;
    }

    @Override
    public List<Rgba> colors() {
        return List.of(color);
    }
}
