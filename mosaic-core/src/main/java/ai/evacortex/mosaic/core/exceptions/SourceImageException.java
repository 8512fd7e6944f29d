/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.exceptions;

public class SourceImageException extends RuntimeException {
    public SourceImageException(String source) {
        super("Source image '" + source + "' is missing or cannot be decoded.");
    }

    public SourceImageException(String source, Throwable cause) {
        super("Source image '" + source + "' is missing or cannot be decoded.", cause);
    }
}
