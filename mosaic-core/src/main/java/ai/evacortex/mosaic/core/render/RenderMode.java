/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.render;

import ai.evacortex.mosaic.core.signature.SignatureShape;

import java.util.Locale;

/**
 * Mapping granularity between source pixels and output tiles.
 */
public enum RenderMode {

    /** One tile per source pixel, matched on the pixel color. */
    ONE_TO_ONE(1, SignatureShape.MONO),

    /** One tile per 2x2 source block, matched on the four corner colors. */
    FOUR_TO_ONE(2, SignatureShape.QUAD),

    /** One tile per source pixel, picked uniformly at random. */
    RANDOM(1, SignatureShape.MONO);

    private final int blockSize;
    private final SignatureShape shape;

    RenderMode(int blockSize, SignatureShape shape) {
        this.blockSize = blockSize;
        this.shape = shape;
    }

    /** Side, in source pixels, of the block replaced by one tile. */
    public int blockSize() {
        return blockSize;
    }

    /** Signature shape the tile set must be analyzed with. */
    public SignatureShape shape() {
        return shape;
    }

    public boolean matchesColors() {
        return this != RANDOM;
    }

    public static RenderMode parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "1:1", "1TO1", "ONE_TO_ONE" -> ONE_TO_ONE;
            case "4:1", "4TO1", "FOUR_TO_ONE" -> FOUR_TO_ONE;
            case "RANDOM" -> RANDOM;
            default -> throw new IllegalArgumentException("Unknown render mode: " + value);
        };
    }
}
