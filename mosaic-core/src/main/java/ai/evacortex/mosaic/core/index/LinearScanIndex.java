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
import ai.evacortex.mosaic.core.signature.Signature;

import java.util.Objects;

public final class LinearScanIndex implements TileIndex {

    private final TileSet tileSet;
    private final ColorMetric metric;

    public LinearScanIndex(TileSet tileSet, ColorMetric metric) {
        this.tileSet = Objects.requireNonNull(tileSet, "tileSet must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
    }

    @Override
    public TileMatch nearest(Signature query) {
        tileSet.requireNonEmpty();
        if (query.shape() != tileSet.shape()) {
            throw new IllegalArgumentException("Query shape " + query.shape() + " does not match tile set shape "
                    + tileSet.shape());
        }

        double best = Double.MAX_VALUE;
        int bestPos = 0;
        for (int i = 0; i < tileSet.size(); i++) {
            double d = metric.compare(query, tileSet.get(i).signature());
            if (d < best) {
                best = d;
                bestPos = i;
            }
        }
        return new TileMatch(tileSet.get(bestPos), bestPos, best);
    }

    @Override
    public TileSet tileSet() {
        return tileSet;
    }
}
