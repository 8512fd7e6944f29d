/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.cache;

import ai.evacortex.mosaic.core.Tile;
import ai.evacortex.mosaic.core.TileSet;
import ai.evacortex.mosaic.core.color.Rgba;
import ai.evacortex.mosaic.core.exceptions.TileSetCacheCorruptedException;
import ai.evacortex.mosaic.core.signature.Signature;
import ai.evacortex.mosaic.core.signature.SignatureShape;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary codec for persisted {@link TileSet}s.
 *
 * <h3>Layout</h3>
 * Little-endian:
 * <pre>
 *   int    MAGIC ('MTSC')
 *   short  VERSION
 *   byte   shape code (1 = mono, 4 = quad)
 *   int    tile count
 *   repeated:
 *     int    path length in bytes
 *     byte[] UTF-8 path
 *     byte[] colorCount × (r, g, b, a)
 * </pre>
 *
 * Any structural inconsistency is reported as {@link TileSetCacheCorruptedException}.
 */
public final class TileSetCodec {

    private static final int MAGIC = 0x4D545343; // 'MTSC'
    private static final short VERSION = 1;
    public static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;
    public static final int MAX_PATH_BYTES = 32_768;

    private static final int HEADER_SIZE = 4 + 2 + 1 + 4;

    private TileSetCodec() {}

    public static byte[] serialize(TileSet tileSet) {
        SignatureShape shape = tileSet.shape();
        List<byte[]> paths = new ArrayList<>(tileSet.size());
        int size = HEADER_SIZE;
        for (Tile tile : tileSet) {
            byte[] path = tile.path().toString().getBytes(StandardCharsets.UTF_8);
            if (path.length > MAX_PATH_BYTES) {
                throw new IllegalArgumentException("Tile path too long to persist: " + tile.path());
            }
            paths.add(path);
            size += 4 + path.length + shape.colorCount() * 4;
        }

        ByteBuffer buf = ByteBuffer.allocate(size).order(ORDER);
        buf.putInt(MAGIC);
        buf.putShort(VERSION);
        buf.put((byte) shape.code());
        buf.putInt(tileSet.size());
        for (int i = 0; i < tileSet.size(); i++) {
            byte[] path = paths.get(i);
            buf.putInt(path.length);
            buf.put(path);
            for (Rgba color : tileSet.get(i).signature().colors()) {
                buf.put((byte) color.r());
                buf.put((byte) color.g());
                buf.put((byte) color.b());
                buf.put((byte) color.a());
            }
        }
        return buf.array();
    }

    public static TileSet deserialize(byte[] data) {
        ByteBuffer buf = ByteBuffer.wrap(data).order(ORDER);
        try {
            if (buf.remaining() < HEADER_SIZE) throw new TileSetCacheCorruptedException("truncated header");
            if (buf.getInt() != MAGIC) throw new TileSetCacheCorruptedException("invalid MAGIC header");
            short version = buf.getShort();
            if (version != VERSION) throw new TileSetCacheCorruptedException("unsupported version " + version);

            SignatureShape shape = SignatureShape.fromCode(buf.get());
            int count = buf.getInt();
            int minTileSize = 4 + shape.colorCount() * 4;
            if (count < 0 || (long) count * minTileSize > buf.remaining()) {
                throw new TileSetCacheCorruptedException("suspicious tile count " + count);
            }

            List<Tile> tiles = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                int len = buf.getInt();
                if (len <= 0 || len > MAX_PATH_BYTES) {
                    throw new TileSetCacheCorruptedException("suspicious path length " + len + " at tile " + i);
                }
                byte[] path = new byte[len];
                buf.get(path);
                List<Rgba> colors = new ArrayList<>(shape.colorCount());
                for (int c = 0; c < shape.colorCount(); c++) {
                    colors.add(new Rgba(buf.get() & 0xFF, buf.get() & 0xFF, buf.get() & 0xFF, buf.get() & 0xFF));
                }
                tiles.add(new Tile(Path.of(new String(path, StandardCharsets.UTF_8)), Signature.of(shape, colors)));
            }
            if (buf.hasRemaining()) {
                throw new TileSetCacheCorruptedException(buf.remaining() + " trailing bytes");
            }
            return new TileSet(shape, tiles);
        } catch (BufferUnderflowException e) {
            throw new TileSetCacheCorruptedException("unexpected end of data", e);
        } catch (IllegalArgumentException e) {
            throw new TileSetCacheCorruptedException(e.getMessage(), e);
        }
    }
}
