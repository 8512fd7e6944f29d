/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.index;

import ai.evacortex.mosaic.core.Tile;
import ai.evacortex.mosaic.core.TileSet;
import ai.evacortex.mosaic.core.color.ColorMetric;
import ai.evacortex.mosaic.core.color.Rgba;
import ai.evacortex.mosaic.core.color.WeightedRgbMetric;
import ai.evacortex.mosaic.core.exceptions.EmptyTileSetException;
import ai.evacortex.mosaic.core.signature.MonoSignature;
import ai.evacortex.mosaic.core.signature.QuadSignature;
import ai.evacortex.mosaic.core.signature.Signature;
import ai.evacortex.mosaic.core.signature.SignatureShape;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static ai.evacortex.mosaic.core.MosaicTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class LinearScanIndexTest {

    private final ColorMetric metric = new WeightedRgbMetric();

    @Test
    void testNearest_minimizesMetric() {
        TileSet tileSet = randomTileSet(SignatureShape.MONO, 200, 7);
        TileIndex index = new LinearScanIndex(tileSet, metric);
        Random random = new Random(99);
        for (int i = 0; i < 100; i++) {
            Signature query = randomSignature(SignatureShape.MONO, random);
            TileMatch match = index.nearest(query);
            for (Tile tile : tileSet) {
                assertTrue(match.distance() <= metric.compare(query, tile.signature()),
                        "no tile may be closer than the returned one");
            }
            assertEquals(metric.compare(query, match.tile().signature()), match.distance());
        }
    }

    @Test
    void testNearest_exactMatchHasZeroDistance() {
        TileSet tileSet = randomTileSet(SignatureShape.QUAD, 50, 3);
        TileIndex index = new LinearScanIndex(tileSet, metric);
        Tile target = tileSet.get(17);
        TileMatch match = index.nearest(target.signature());
        assertEquals(0.0, match.distance());
        assertEquals(target.signature(), match.tile().signature());
    }

    @Test
    void testNearest_firstInsertedTileWinsTies() {
        Rgba c = Rgba.opaque(100, 100, 100);
        TileSet tileSet = new TileSet(SignatureShape.MONO, List.of(
                new Tile(Path.of("a.png"), new MonoSignature(Rgba.opaque(0, 0, 0))),
                new Tile(Path.of("b.png"), new MonoSignature(c)),
                new Tile(Path.of("c.png"), new MonoSignature(c))));
        TileMatch match = new LinearScanIndex(tileSet, metric).nearest(new MonoSignature(c));
        assertEquals(1, match.position());
        assertEquals(Path.of("b.png"), match.tile().path());
    }

    @Test
    void testNearest_emptySetFailsFast() {
        TileIndex index = new LinearScanIndex(TileSet.empty(SignatureShape.MONO), metric);
        assertThrows(EmptyTileSetException.class, () -> index.nearest(new MonoSignature(RED)));
    }

    @Test
    void testNearest_rejectsShapeMismatch() {
        TileIndex index = new LinearScanIndex(randomTileSet(SignatureShape.MONO, 3, 1), metric);
        assertThrows(IllegalArgumentException.class,
                () -> index.nearest(new QuadSignature(RED, RED, RED, RED)));
    }
}
