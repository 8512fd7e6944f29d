/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.render;

import ai.evacortex.mosaic.core.Tile;
import ai.evacortex.mosaic.core.TileSet;
import ai.evacortex.mosaic.core.color.ColorMetric;
import ai.evacortex.mosaic.core.color.Rgba;
import ai.evacortex.mosaic.core.color.WeightedRgbMetric;
import ai.evacortex.mosaic.core.exceptions.EmptyTileSetException;
import ai.evacortex.mosaic.core.exceptions.InvalidRenderOptionsException;
import ai.evacortex.mosaic.core.exceptions.TileDecodeException;
import ai.evacortex.mosaic.core.index.TileIndex;
import ai.evacortex.mosaic.core.io.ImageCodec;
import ai.evacortex.mosaic.core.signature.MonoSignature;
import ai.evacortex.mosaic.core.signature.QuadSignature;
import ai.evacortex.mosaic.core.signature.Signature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Builds the mosaic canvas from a source image and a tile set.
 *
 * <p>The source is scanned unit by unit in raster order (one unit is one pixel, or one 2x2
 * block in {@link RenderMode#FOUR_TO_ONE}). For every unit the compositor computes the unit
 * signature from direct pixel reads, picks a tile, places the tile's resized image through
 * the per-render {@link ResizeCache} and, when tinting is enabled, blends the unit's original
 * colors over it (each quadrant with its own corner color in 4:1 mode).</p>
 *
 * <p>Rendering is single-threaded. For color-matching modes, identical inputs produce
 * bit-identical canvases. The canvas is only returned once complete; any failure aborts the
 * render without output.</p>
 */
public class MosaicCompositor {

    private static final Logger LOG = LoggerFactory.getLogger(MosaicCompositor.class);

    private final ImageCodec codec;
    private final ColorMetric metric;
    private final Random random;

    public MosaicCompositor(ImageCodec codec) {
        this(codec, new WeightedRgbMetric(), new Random());
    }

    /**
     * @param random generator used by {@link RenderMode#RANDOM}; seed it for reproducible output
     */
    public MosaicCompositor(ImageCodec codec, ColorMetric metric, Random random) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public BufferedImage render(BufferedImage source, TileSet tileSet, RenderOptions options) {
        return render(source, tileSet, options, new ResizeCache(codec, options.tileSize()));
    }

    /**
     * Renders with a caller-supplied resize cache, e.g. to inspect its statistics afterwards.
     *
     * @throws InvalidRenderOptionsException if the options do not fit the source or the tile set
     * @throws EmptyTileSetException         if the tile set is empty
     * @throws TileDecodeException           if a chosen tile can no longer be decoded
     */
    public BufferedImage render(BufferedImage source, TileSet tileSet, RenderOptions options, ResizeCache cache) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(tileSet, "tileSet must not be null");
        RenderMode mode = options.mode();

        options.validateFor(source);
        if (cache.tileSize() != options.tileSize()) {
            throw new InvalidRenderOptionsException("resize cache holds " + cache.tileSize() + "px tiles, render needs "
                    + options.tileSize() + "px");
        }
        if (mode.matchesColors() && tileSet.shape() != mode.shape()) {
            throw new InvalidRenderOptionsException(mode + " needs " + mode.shape() + " tile signatures, tile set has "
                    + tileSet.shape());
        }
        tileSet.requireNonEmpty();

        TileIndex index = mode.matchesColors() ? tileSet.index(options.indexStrategy(), metric) : null;
        Map<Signature, Tile> matches = new HashMap<>();

        int size = options.tileSize();
        int block = mode.blockSize();
        int cols = source.getWidth() / block;
        int rows = source.getHeight() / block;
        int tintAlpha = options.tintAlpha();
        BufferedImage canvas = new BufferedImage(cols * size, rows * size, BufferedImage.TYPE_INT_ARGB);

        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                Signature unit = unitSignature(source, mode, col * block, row * block);
                Tile tile = mode.matchesColors()
                        ? matches.computeIfAbsent(unit, s -> index.nearest(s).tile())
                        : tileSet.randomTile(random);

                int x = col * size;
                int y = row * size;
                PixelBlender.overlay(canvas, cache.get(tile.path()), x, y);
                if (tintAlpha > 0) {
                    tint(canvas, unit, x, y, size, tintAlpha);
                }
            }
        }

        LOG.info("Rendered {}x{} mosaic ({} mode, {} units, {} distinct tiles)",
                canvas.getWidth(), canvas.getHeight(), mode, cols * rows, cache.size());
        return canvas;
    }

    private static Signature unitSignature(BufferedImage source, RenderMode mode, int x, int y) {
        if (mode == RenderMode.FOUR_TO_ONE) {
            return new QuadSignature(
                    Rgba.fromArgb(source.getRGB(x, y)),
                    Rgba.fromArgb(source.getRGB(x + 1, y)),
                    Rgba.fromArgb(source.getRGB(x + 1, y + 1)),
                    Rgba.fromArgb(source.getRGB(x, y + 1)));
        }
        return new MonoSignature(Rgba.fromArgb(source.getRGB(x, y)));
    }

    private static void tint(BufferedImage canvas, Signature unit, int x, int y, int size, int alpha) {
        if (unit instanceof QuadSignature quad) {
            int half = size / 2;
            PixelBlender.fill(canvas, quad.topLeft().withAlpha(alpha).toArgb(), x, y, half, half);
            PixelBlender.fill(canvas, quad.topRight().withAlpha(alpha).toArgb(), x + half, y, half, half);
            PixelBlender.fill(canvas, quad.bottomRight().withAlpha(alpha).toArgb(), x + half, y + half, half, half);
            PixelBlender.fill(canvas, quad.bottomLeft().withAlpha(alpha).toArgb(), x, y + half, half, half);
        } else {
            PixelBlender.fill(canvas, unit.color(0).withAlpha(alpha).toArgb(), x, y, size, size);
        }
    }
}
