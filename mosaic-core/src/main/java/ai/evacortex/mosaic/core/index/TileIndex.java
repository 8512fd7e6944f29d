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
import ai.evacortex.mosaic.core.exceptions.EmptyTileSetException;
import ai.evacortex.mosaic.core.signature.Signature;

/**
 * {@code TileIndex} answers nearest-tile queries over an immutable {@link TileSet}.
 *
 * <p>An index reflects exactly the tiles present when it was built. All implementations use
 * the same {@link ai.evacortex.mosaic.core.color.ColorMetric}, so two indexes over the same set
 * report the same nearest distance for the same query. Repeated queries against one index are
 * deterministic.</p>
 *
 * <p>Implementations are immutable and safe to share between threads.</p>
 *
 * @see LinearScanIndex
 * @see KdTreeIndex
 */
public interface TileIndex {

    /**
     * Finds the tile whose signature minimizes the metric distance to {@code query}.
     *
     * @param query signature of the region to replace
     * @return the closest tile and its distance
     * @throws EmptyTileSetException    if the indexed set is empty
     * @throws IllegalArgumentException if the query shape differs from the set's shape
     */
    TileMatch nearest(Signature query);

    /**
     * @return the tile set this index was built from
     */
    TileSet tileSet();
}
