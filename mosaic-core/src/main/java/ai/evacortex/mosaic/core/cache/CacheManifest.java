/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.cache;

import ai.evacortex.mosaic.core.signature.SignatureShape;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * JSON index of the persisted tile sets, one entry per (directory, shape) key.
 */
public class CacheManifest {

    private static final Logger LOG = LoggerFactory.getLogger(CacheManifest.class);

    private final Path manifestFile;
    private final Map<String, Entry> entries;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock rwLock;

    public record Entry(String directory, SignatureShape shape, String file, int tiles, long createdAt) {}

    public static CacheManifest loadOrCreate(Path path) {
        CacheManifest manifest = new CacheManifest(path);
        if (Files.exists(path)) {
            try (InputStream in = Files.newInputStream(path)) {
                TypeReference<Map<String, Entry>> typeRef = new TypeReference<>() {};
                Map<String, Entry> loaded = manifest.mapper.readValue(in, typeRef);
                if (loaded != null) manifest.entries.putAll(loaded);
            } catch (IOException e) {
                LOG.warn("Ignoring unreadable cache manifest {}: {}", path, e.getMessage());
            }
        }
        return manifest;
    }

    private CacheManifest(Path manifestFile) {
        this.manifestFile = manifestFile;
        this.mapper = new ObjectMapper();
        this.entries = new HashMap<>();
        this.rwLock = new ReentrantReadWriteLock();
    }

    public Entry get(String key) {
        rwLock.readLock().lock();
        try {
            return entries.get(key);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public void put(String key, Entry entry) {
        rwLock.writeLock().lock();
        try {
            entries.put(key, entry);
            flush();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public Entry remove(String key) {
        rwLock.writeLock().lock();
        try {
            Entry removed = entries.remove(key);
            if (removed != null) flush();
            return removed;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public int size() {
        rwLock.readLock().lock();
        try {
            return entries.size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public void flush() {
        rwLock.writeLock().lock();
        try {
            Files.createDirectories(manifestFile.getParent());
            Path tmp = manifestFile.resolveSibling(manifestFile.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, entries);
            }
            Files.move(tmp, manifestFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush cache manifest " + manifestFile, e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }
}
