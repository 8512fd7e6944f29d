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
import ai.evacortex.mosaic.core.exceptions.TileSetCacheCorruptedException;
import ai.evacortex.mosaic.core.signature.SignatureShape;
import net.jpountz.xxhash.XXHashFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * On-disk cache of analyzed tile sets keyed by (tile directory, signature shape).
 *
 * <p>The cache is never refreshed implicitly: callers drop stale entries with
 * {@link #invalidate}. An entry whose file is missing or fails to decode is logged, removed
 * and reported as a miss, so the caller simply analyzes again.</p>
 */
public class TileSetCache {

    private static final Logger LOG = LoggerFactory.getLogger(TileSetCache.class);

    public static final Path DEFAULT_ROOT = Path.of(System.getProperty("mosaic.cache.dir",
            Path.of(System.getProperty("user.home"), ".emosaic", "cache").toString()));

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private final Path root;
    private final CacheManifest manifest;

    public TileSetCache(Path root) {
        this.root = root;
        this.manifest = CacheManifest.loadOrCreate(root.resolve("manifest.json"));
    }

    public static TileSetCache openDefault() {
        return new TileSetCache(DEFAULT_ROOT);
    }

    public Path root() {
        return root;
    }

    public Optional<TileSet> load(Path directory, SignatureShape shape) {
        String key = key(directory, shape);
        CacheManifest.Entry entry = manifest.get(key);
        if (entry == null) return Optional.empty();

        if (entry.file() == null) {
            LOG.warn("Discarding tile set cache entry for {}: manifest entry has no file", directory);
            invalidate(directory, shape);
            return Optional.empty();
        }
        Path file = root.resolve(entry.file());
        try {
            TileSet tileSet = TileSetCodec.deserialize(Files.readAllBytes(file));
            if (tileSet.shape() != shape) {
                throw new TileSetCacheCorruptedException("expected " + shape + " tiles, found " + tileSet.shape());
            }
            LOG.info("Loaded {} cached {} tiles for {}", tileSet.size(), shape, directory);
            return Optional.of(tileSet);
        } catch (IOException | TileSetCacheCorruptedException e) {
            LOG.warn("Discarding tile set cache {} for {}: {}", file, directory, e.getMessage());
            invalidate(directory, shape);
            return Optional.empty();
        }
    }

    public void store(Path directory, SignatureShape shape, TileSet tileSet) {
        if (tileSet.shape() != shape) {
            throw new IllegalArgumentException("Tile set shape " + tileSet.shape() + " does not match " + shape);
        }
        String key = key(directory, shape);
        String fileName = fileName(key);
        Path file = root.resolve(fileName);
        try {
            Files.createDirectories(root);
            Path tmp = root.resolve(fileName + ".tmp");
            Files.write(tmp, TileSetCodec.serialize(absolute(tileSet)));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist tile set cache " + file, e);
        }
        manifest.put(key, new CacheManifest.Entry(normalize(directory).toString(), shape, fileName,
                tileSet.size(), System.currentTimeMillis()));
        LOG.info("Cached {} {} tiles for {}", tileSet.size(), shape, directory);
    }

    /**
     * @return {@code true} if an entry existed
     */
    public boolean invalidate(Path directory, SignatureShape shape) {
        CacheManifest.Entry removed = manifest.remove(key(directory, shape));
        if (removed == null) return false;
        if (removed.file() == null) return true;
        try {
            Files.deleteIfExists(root.resolve(removed.file()));
        } catch (IOException e) {
            LOG.warn("Failed to delete cache file {}: {}", removed.file(), e.getMessage());
        }
        return true;
    }

    static String key(Path directory, SignatureShape shape) {
        return normalize(directory) + "|" + shape.name();
    }

    static String fileName(String key) {
        byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
        long hash = XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
        return String.format("%016x.tiles", hash);
    }

    // entries are shared by every working directory that names the same corpus
    private static TileSet absolute(TileSet tileSet) {
        List<Tile> tiles = new ArrayList<>(tileSet.size());
        for (Tile tile : tileSet) {
            tiles.add(new Tile(normalize(tile.path()), tile.signature()));
        }
        return new TileSet(tileSet.shape(), tiles);
    }

    private static Path normalize(Path directory) {
        return directory.toAbsolutePath().normalize();
    }
}
