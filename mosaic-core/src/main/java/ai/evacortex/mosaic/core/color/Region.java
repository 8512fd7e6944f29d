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
 * Axis-aligned pixel rectangle: {@code x ∈ [left, left + width)}, {@code y ∈ [top, top + height)}.
 */
public record Region(int left, int top, int width, int height) {

    public Region {
        if (left < 0 || top < 0) {
            throw new IllegalArgumentException("Region origin must not be negative: " + left + "," + top);
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Region size must not be negative: " + width + "x" + height);
        }
    }

    public static Region of(int width, int height) {
        return new Region(0, 0, width, height);
    }

    public long area() {
        return (long) width * height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * Splits into four equal quadrants of {@code floor(w/2) x floor(h/2)} in the order
     * top-left, top-right, bottom-right, bottom-left. Odd residual rows and columns are dropped.
     */
    public Region[] quadrants() {
        int halfW = width / 2;
        int halfH = height / 2;
        return new Region[] {
                new Region(left, top, halfW, halfH),
                new Region(left + halfW, top, halfW, halfH),
                new Region(left + halfW, top + halfH, halfW, halfH),
                new Region(left, top + halfH, halfW, halfH)
        };
    }
}
