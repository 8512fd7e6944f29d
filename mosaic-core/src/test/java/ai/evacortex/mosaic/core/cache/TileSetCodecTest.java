/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.cache;

import ai.evacortex.mosaic.core.TileSet;
import ai.evacortex.mosaic.core.analysis.AnalyzerOptions;
import ai.evacortex.mosaic.core.analysis.TileAnalyzer;
import ai.evacortex.mosaic.core.analysis.TileCandidate;
import ai.evacortex.mosaic.core.exceptions.TileSetCacheCorruptedException;
import ai.evacortex.mosaic.core.io.ImageIoCodec;
import ai.evacortex.mosaic.core.signature.SignatureShape;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static ai.evacortex.mosaic.core.MosaicTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class TileSetCodecTest {

    @Test
    void testAnalyzedTileSetSurvivesPersistence() {
        Random random = new Random(5);
        List<TileCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            candidates.add(new TileCandidate(Path.of("tiles", "photo-" + i + ".png"),
                    png(image(2, 2, randomColor(random), randomColor(random), randomColor(random), randomColor(random)))));
        }

        TileSet analyzed;
        try (TileAnalyzer analyzer = new TileAnalyzer(new ImageIoCodec(), new AnalyzerOptions(4, 3, true))) {
            analyzed = analyzer.analyze(candidates, SignatureShape.QUAD);
        }
        TileSet restored = TileSetCodec.deserialize(TileSetCodec.serialize(analyzed));

        assertEquals(SignatureShape.QUAD, restored.shape());
        assertEquals(analyzed.tiles(), restored.tiles(), "order and content must be preserved");
        assertEquals(sortedByPath(analyzed), sortedByPath(restored));
    }

    @Test
    void testEmptyTileSetIsPersistable() {
        TileSet restored = TileSetCodec.deserialize(TileSetCodec.serialize(TileSet.empty(SignatureShape.MONO)));
        assertTrue(restored.isEmpty());
        assertEquals(SignatureShape.MONO, restored.shape());
    }

    @Test
    void testTruncatedDataIsRejected() {
        byte[] data = TileSetCodec.serialize(randomTileSet(SignatureShape.MONO, 10, 1));
        byte[] truncated = Arrays.copyOf(data, data.length - 3);
        assertThrows(TileSetCacheCorruptedException.class, () -> TileSetCodec.deserialize(truncated));
        assertThrows(TileSetCacheCorruptedException.class, () -> TileSetCodec.deserialize(new byte[5]));
    }

    @Test
    void testBadMagicIsRejected() {
        byte[] data = TileSetCodec.serialize(randomTileSet(SignatureShape.MONO, 3, 1));
        data[0] ^= 0x7F;
        TileSetCacheCorruptedException e =
                assertThrows(TileSetCacheCorruptedException.class, () -> TileSetCodec.deserialize(data));
        assertTrue(e.getMessage().contains("MAGIC"), e.getMessage());
    }

    @Test
    void testUnknownShapeAndTrailingBytesAreRejected() {
        byte[] data = TileSetCodec.serialize(randomTileSet(SignatureShape.QUAD, 3, 1));

        byte[] badShape = data.clone();
        badShape[6] = 7;
        assertThrows(TileSetCacheCorruptedException.class, () -> TileSetCodec.deserialize(badShape));

        byte[] trailing = Arrays.copyOf(data, data.length + 2);
        assertThrows(TileSetCacheCorruptedException.class, () -> TileSetCodec.deserialize(trailing));
    }

    @Test
    void testHugeTileCountIsRejected() {
        byte[] data = TileSetCodec.serialize(randomTileSet(SignatureShape.MONO, 2, 1));
        ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).putInt(7, Integer.MAX_VALUE);
        assertThrows(TileSetCacheCorruptedException.class, () -> TileSetCodec.deserialize(data));
    }
}
