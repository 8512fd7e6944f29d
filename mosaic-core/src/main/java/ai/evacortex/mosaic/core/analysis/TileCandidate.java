/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.analysis;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A tile-corpus entry before decoding: its path and encoded bytes.
 */
public record TileCandidate(Path path, byte[] data) {
    public TileCandidate {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(data, "data must not be null");
    }
}
