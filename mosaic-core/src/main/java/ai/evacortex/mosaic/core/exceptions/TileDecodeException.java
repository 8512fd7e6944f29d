/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.exceptions;

public class TileDecodeException extends RuntimeException {
    public TileDecodeException(String tile, String reason) {
        super("Tile '" + tile + "' cannot be decoded: " + reason);
    }

    public TileDecodeException(String tile, Throwable cause) {
        super("Tile '" + tile + "' cannot be decoded: " + cause.getMessage(), cause);
    }
}
