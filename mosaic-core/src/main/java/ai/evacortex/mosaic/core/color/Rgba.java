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
 * Immutable 8-bit RGBA color. Channels are kept in [0, 255].
 */
public record Rgba(int r, int g, int b, int a) {

    public Rgba {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
        checkChannel("a", a);
    }

    public static Rgba opaque(int r, int g, int b) {
        return new Rgba(r, g, b, 255);
    }

    public static Rgba fromArgb(int argb) {
        return new Rgba((argb >>> 16) & 0xFF, (argb >>> 8) & 0xFF, argb & 0xFF, (argb >>> 24) & 0xFF);
    }

    public int toArgb() {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    public Rgba withAlpha(int alpha) {
        return new Rgba(r, g, b, alpha);
    }

    /**
     * @param channel 0 = red, 1 = green, 2 = blue, 3 = alpha
     */
    public int channel(int channel) {
        return switch (channel) {
            case 0 -> r;
            case 1 -> g;
            case 2 -> b;
            case 3 -> a;
            default -> throw new IllegalArgumentException("Unknown channel: " + channel);
        };
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Channel " + name + " out of range [0, 255]: " + value);
        }
    }
}
