/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.render;

import java.awt.image.BufferedImage;

/**
 * Alpha-over compositing on ARGB canvases.
 *
 * <pre>
 *     αo = αs + αd·(1 − αs)
 *     Co = (Cs·αs + Cd·αd·(1 − αs)) / αo
 * </pre>
 *
 * On an opaque destination this is {@code dest = src·α + dest·(1 − α)}.
 */
final class PixelBlender {

    private PixelBlender() {}

    static int over(int dst, int src) {
        int sa = src >>> 24;
        if (sa == 255) return src;
        if (sa == 0) return dst;

        double as = sa / 255.0;
        double ad = (dst >>> 24) / 255.0;
        double keep = ad * (1.0 - as);
        double ao = as + keep;

        int r = channel((src >>> 16) & 0xFF, (dst >>> 16) & 0xFF, as, keep, ao);
        int g = channel((src >>> 8) & 0xFF, (dst >>> 8) & 0xFF, as, keep, ao);
        int b = channel(src & 0xFF, dst & 0xFF, as, keep, ao);
        int a = (int) Math.round(ao * 255.0);
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    /**
     * Composites {@code tile} over {@code canvas} with its top-left corner at ({@code x}, {@code y}),
     * clipped to the canvas.
     */
    static void overlay(BufferedImage canvas, BufferedImage tile, int x, int y) {
        int w = Math.min(tile.getWidth(), canvas.getWidth() - x);
        int h = Math.min(tile.getHeight(), canvas.getHeight() - y);
        for (int ty = 0; ty < h; ty++) {
            for (int tx = 0; tx < w; tx++) {
                canvas.setRGB(x + tx, y + ty, over(canvas.getRGB(x + tx, y + ty), tile.getRGB(tx, ty)));
            }
        }
    }

    /**
     * Blends a flat {@code argb} rectangle over the canvas, clipped to the canvas.
     */
    static void fill(BufferedImage canvas, int argb, int x, int y, int width, int height) {
        int right = Math.min(x + width, canvas.getWidth());
        int bottom = Math.min(y + height, canvas.getHeight());
        for (int py = y; py < bottom; py++) {
            for (int px = x; px < right; px++) {
                canvas.setRGB(px, py, over(canvas.getRGB(px, py), argb));
            }
        }
    }

    private static int channel(int cs, int cd, double as, double keep, double ao) {
        long v = Math.round((cs * as + cd * keep) / ao);
        return (int) Math.max(0, Math.min(255, v));
    }
}
