/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.signature;

/**
 * Shape of a color signature. Every tile in a tile set shares one shape.
 */
public enum SignatureShape {

    /** Average color of the whole tile. */
    MONO(1),

    /** Average colors of the four quadrants, ordered top-left, top-right, bottom-right, bottom-left. */
    QUAD(4);

    private final int colorCount;

    SignatureShape(int colorCount) {
        this.colorCount = colorCount;
    }

    public int colorCount() {
        return colorCount;
    }

    /** Number of RGB coordinates in the signature vector. */
    public int dimensions() {
        return colorCount * 3;
    }

    public static SignatureShape fromCode(int code) {
        return switch (code) {
            case 1 -> MONO;
            case 4 -> QUAD;
            default -> throw new IllegalArgumentException("Unknown signature shape code: " + code);
        };
    }

    public int code() {
        return colorCount;
    }
}
