/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.exceptions;

public class TileSetCacheCorruptedException extends RuntimeException {
    public TileSetCacheCorruptedException(String message) {
        super("Corrupted tile set cache: " + message);
    }

    public TileSetCacheCorruptedException(String message, Throwable cause) {
        super("Corrupted tile set cache: " + message, cause);
    }
}
