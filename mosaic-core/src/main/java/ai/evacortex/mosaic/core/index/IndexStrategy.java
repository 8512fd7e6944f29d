/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.index;

import ai.evacortex.mosaic.core.TileSet;
import ai.evacortex.mosaic.core.color.ColorMetric;

import java.util.Locale;

public enum IndexStrategy {

    /** Exhaustive scan; exact, O(n) per query. */
    LINEAR {
        @Override
        public TileIndex build(TileSet tileSet, ColorMetric metric) {
            return new LinearScanIndex(tileSet, metric);
        }
    },

    /** k-d tree over signature coordinates; exact, sub-linear per query on typical corpora. */
    KD_TREE {
        @Override
        public TileIndex build(TileSet tileSet, ColorMetric metric) {
            return new KdTreeIndex(tileSet, metric);
        }
    };

    private static final IndexStrategy DEFAULT =
            parse(System.getProperty("mosaic.index.strategy", "KD_TREE"));

    public abstract TileIndex build(TileSet tileSet, ColorMetric metric);

    public static IndexStrategy defaultStrategy() {
        return DEFAULT;
    }

    public static IndexStrategy parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "LINEAR", "SCAN" -> LINEAR;
            case "KD_TREE", "KDTREE", "KD" -> KD_TREE;
            default -> throw new IllegalArgumentException("Unknown index strategy: " + value);
        };
    }
}
