/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core;

import ai.evacortex.mosaic.core.color.ColorMetric;
import ai.evacortex.mosaic.core.exceptions.EmptyTileSetException;
import ai.evacortex.mosaic.core.index.IndexStrategy;
import ai.evacortex.mosaic.core.index.TileIndex;
import ai.evacortex.mosaic.core.signature.SignatureShape;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Immutable collection of analyzed tiles sharing one {@link SignatureShape}.
 *
 * <p>The position of a tile in the set is its insertion index; index matches report it.</p>
 */
public final class TileSet implements Iterable<Tile> {

    private final SignatureShape shape;
    private final List<Tile> tiles;

    public TileSet(SignatureShape shape, Collection<Tile> tiles) {
        this.shape = Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(tiles, "tiles must not be null");
        for (Tile tile : tiles) {
            if (tile.signature().shape() != shape) {
                throw new IllegalArgumentException("Tile " + tile.path() + " has shape "
                        + tile.signature().shape() + ", expected " + shape);
            }
        }
        this.tiles = List.copyOf(new ArrayList<>(tiles));
    }

    public static TileSet empty(SignatureShape shape) {
        return new TileSet(shape, List.of());
    }

    public SignatureShape shape() {
        return shape;
    }

    public int size() {
        return tiles.size();
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }

    public Tile get(int index) {
        return tiles.get(index);
    }

    public List<Tile> tiles() {
        return tiles;
    }

    /**
     * Uniformly random tile.
     *
     * @param random caller-owned generator
     * @throws EmptyTileSetException if the set is empty
     */
    public Tile randomTile(Random random) {
        requireNonEmpty();
        return tiles.get(random.nextInt(tiles.size()));
    }

    public TileIndex index(IndexStrategy strategy, ColorMetric metric) {
        return strategy.build(this, metric);
    }

    public void requireNonEmpty() {
        if (tiles.isEmpty()) throw new EmptyTileSetException();
    }

    @Override
    public Iterator<Tile> iterator() {
        return tiles.iterator();
    }

    @Override
    public String toString() {
        return "TileSet[" + shape + ", " + tiles.size() + " tiles]";
    }
}
