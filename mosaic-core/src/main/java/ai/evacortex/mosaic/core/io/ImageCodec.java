/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.io;

import ai.evacortex.mosaic.core.exceptions.TileDecodeException;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Image codec used by the analyzer and the compositor.
 *
 * <p>Decoded images are always 8-bit ARGB ({@link BufferedImage#TYPE_INT_ARGB}); RGB sources
 * come back fully opaque.</p>
 *
 * @see ImageIoCodec
 */
public interface ImageCodec {

    /**
     * @param name  identifier used in error messages, usually the tile path
     * @param bytes encoded image
     * @throws TileDecodeException if the bytes are not a decodable image
     */
    BufferedImage decode(String name, byte[] bytes);

    /**
     * @throws TileDecodeException if the file is missing, unreadable or not a decodable image
     */
    BufferedImage read(Path path);

    /**
     * Resamples {@code image} to {@code width x height}.
     */
    BufferedImage resize(BufferedImage image, int width, int height);

    /**
     * Encodes {@code image} to {@code path}; the format follows the file extension, PNG by default.
     */
    void write(BufferedImage image, Path path) throws IOException;
}
