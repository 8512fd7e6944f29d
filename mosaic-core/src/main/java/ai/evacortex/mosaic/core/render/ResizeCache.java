/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.render;

import ai.evacortex.mosaic.core.io.ImageCodec;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Tile path → decoded tile resized to {@code tileSize x tileSize}.
 *
 * <p>Each distinct path is decoded and resized once; entries are never evicted. One instance
 * belongs to one render call and is not shared between concurrent renders.</p>
 */
public final class ResizeCache {

    private final int tileSize;
    private final LoadingCache<Path, BufferedImage> cache;

    public ResizeCache(ImageCodec codec, int tileSize) {
        this.tileSize = tileSize;
        this.cache = Caffeine.newBuilder()
                .executor(Runnable::run)
                .recordStats()
                .build(path -> codec.resize(codec.read(path), tileSize, tileSize));
    }

    public BufferedImage get(Path path) {
        return cache.get(path);
    }

    public int tileSize() {
        return tileSize;
    }

    /** Number of decode + resize operations performed so far. */
    public long loadCount() {
        return cache.stats().loadCount();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long size() {
        return cache.estimatedSize();
    }
}
