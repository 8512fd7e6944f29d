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
import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.NearestNeighborSearchOnKDTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Nearest-tile search on an imglib2 {@link KDTree} built over signature coordinates
 * (3 axes for mono signatures, 12 for quad signatures).
 *
 * <p>The tree searches by Euclidean distance, so every coordinate is stored and queried
 * multiplied by {@code √axisWeight(axis)}. The squared Euclidean distance in that space is
 * then the weighted metric itself, and the tile found is a nearest tile under
 * {@link ColorMetric#compare(Signature, Signature)}. The reported distance is recomputed
 * with the metric, so it matches {@link LinearScanIndex} up to floating-point error. Among
 * tiles at exactly equal distance the tree's pick is deterministic but not necessarily the
 * first inserted one.</p>
 *
 * <p>The tree is immutable; each query runs its own search object, so one index can serve
 * concurrent renders.</p>
 */
public final class KdTreeIndex implements TileIndex {

    private final TileSet tileSet;
    private final ColorMetric metric;
    private final double[] axisScale;
    private final KDTree<Integer> tree;

    public KdTreeIndex(TileSet tileSet, ColorMetric metric) {
        this.tileSet = Objects.requireNonNull(tileSet, "tileSet must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");

        int dimensions = tileSet.shape().dimensions();
        this.axisScale = new double[dimensions];
        for (int axis = 0; axis < dimensions; axis++) {
            axisScale[axis] = Math.sqrt(metric.axisWeight(axis));
        }

        // KDTree reorders its input lists, so positions travel with the points
        List<Integer> positions = new ArrayList<>(tileSet.size());
        List<RealPoint> points = new ArrayList<>(tileSet.size());
        for (int i = 0; i < tileSet.size(); i++) {
            positions.add(i);
            points.add(scaled(tileSet.get(i).signature()));
        }
        this.tree = tileSet.isEmpty() ? null : new KDTree<>(positions, points);
    }

    @Override
    public TileMatch nearest(Signature query) {
        tileSet.requireNonEmpty();
        if (query.shape() != tileSet.shape()) {
            throw new IllegalArgumentException("Query shape " + query.shape() + " does not match tile set shape "
                    + tileSet.shape());
        }

        NearestNeighborSearchOnKDTree<Integer> search = new NearestNeighborSearchOnKDTree<>(tree);
        search.search(scaled(query));
        int position = search.getSampler().get();
        return new TileMatch(tileSet.get(position), position, metric.compare(query, tileSet.get(position).signature()));
    }

    @Override
    public TileSet tileSet() {
        return tileSet;
    }

    private RealPoint scaled(Signature signature) {
        double[] coordinates = new double[axisScale.length];
        for (int axis = 0; axis < axisScale.length; axis++) {
            coordinates[axis] = signature.coordinate(axis) * axisScale[axis];
        }
        return new RealPoint(coordinates);
    }
}
