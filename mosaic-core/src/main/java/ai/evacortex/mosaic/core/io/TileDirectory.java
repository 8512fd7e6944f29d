/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.io;

import ai.evacortex.mosaic.core.analysis.TileCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lists the tile corpus of a directory (non-recursive, by file name).
 */
public final class TileDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(TileDirectory.class);

    private TileDirectory() {}

    public static List<Path> files(Path dir) {
        try (Stream<Path> stream = Files.list(dir.toAbsolutePath().normalize())) {
            return stream.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list tile directory " + dir, e);
        }
    }

    /**
     * Reads every regular file of {@code dir}. Files that cannot be read are logged and skipped;
     * whether the bytes are an image is decided later by the analyzer.
     */
    public static List<TileCandidate> list(Path dir) {
        List<TileCandidate> candidates = new ArrayList<>();
        for (Path file : files(dir)) {
            try {
                candidates.add(new TileCandidate(file, Files.readAllBytes(file)));
            } catch (IOException e) {
                LOG.warn("Skipping unreadable tile {}: {}", file, e.getMessage());
            }
        }
        LOG.debug("Listed {} tile candidates in {}", candidates.size(), dir);
        return candidates;
    }
}
