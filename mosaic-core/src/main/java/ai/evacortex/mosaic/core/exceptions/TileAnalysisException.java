/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.exceptions;


public class TileAnalysisException extends RuntimeException {

    public TileAnalysisException(String message) {
        super(message);
    }

    public TileAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
