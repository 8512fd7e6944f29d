/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.render;

import ai.evacortex.mosaic.core.exceptions.InvalidRenderOptionsException;
import ai.evacortex.mosaic.core.index.IndexStrategy;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Parameters of one render.
 *
 * @param tileSize      side in pixels of every placed tile
 * @param mode          source-to-tile mapping
 * @param tintOpacity   opacity in [0, 1] of the source-color overlay; 0 disables tinting
 * @param indexStrategy nearest-tile search used by color-matching modes
 */
public record RenderOptions(int tileSize, RenderMode mode, double tintOpacity, IndexStrategy indexStrategy) {

    public static final int DEFAULT_TILE_SIZE = 16;

    public RenderOptions {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(indexStrategy, "indexStrategy must not be null");
        if (tileSize <= 0) {
            throw new InvalidRenderOptionsException("tile size must be a positive integer, got " + tileSize);
        }
        if (Double.isNaN(tintOpacity) || tintOpacity < 0.0 || tintOpacity > 1.0) {
            throw new InvalidRenderOptionsException("tint opacity must be within [0, 1], got " + tintOpacity);
        }
    }

    public RenderOptions(int tileSize, RenderMode mode, double tintOpacity) {
        this(tileSize, mode, tintOpacity, IndexStrategy.defaultStrategy());
    }

    public static RenderOptions of(int tileSize, RenderMode mode) {
        return new RenderOptions(tileSize, mode, 0.0);
    }

    public RenderOptions withIndexStrategy(IndexStrategy strategy) {
        return new RenderOptions(tileSize, mode, tintOpacity, strategy);
    }

    public int tintAlpha() {
        return (int) Math.round(255 * tintOpacity);
    }

    /**
     * Checks the options against the source before any canvas is allocated.
     *
     * @throws InvalidRenderOptionsException if 4:1 mode meets odd dimensions or the canvas would not fit in memory
     */
    public void validateFor(BufferedImage source) {
        int w = source.getWidth();
        int h = source.getHeight();
        if (w == 0 || h == 0) {
            throw new InvalidRenderOptionsException("source image has no pixels");
        }
        int block = mode.blockSize();
        if (w % block != 0 || h % block != 0) {
            throw new InvalidRenderOptionsException(mode + " needs source dimensions divisible by " + block
                    + ", got " + w + "x" + h);
        }
        long canvasW = (long) (w / block) * tileSize;
        long canvasH = (long) (h / block) * tileSize;
        if (canvasW > Integer.MAX_VALUE || canvasH > Integer.MAX_VALUE || canvasW * canvasH > Integer.MAX_VALUE) {
            throw new InvalidRenderOptionsException("output canvas " + canvasW + "x" + canvasH + " is too large");
        }
    }

    public int canvasWidth(BufferedImage source) {
        return source.getWidth() / mode.blockSize() * tileSize;
    }

    public int canvasHeight(BufferedImage source) {
        return source.getHeight() / mode.blockSize() * tileSize;
    }
}
