/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core;

import ai.evacortex.mosaic.core.signature.Signature;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Candidate image for the mosaic. The image itself is reopened from {@code path} only when
 * the tile is placed.
 */
public record Tile(Path path, Signature signature) {
    public Tile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(signature, "signature must not be null");
    }
}
