/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.analysis;

import ai.evacortex.mosaic.core.Tile;
import ai.evacortex.mosaic.core.TileSet;
import ai.evacortex.mosaic.core.color.ColorExtractor;
import ai.evacortex.mosaic.core.exceptions.TileAnalysisException;
import ai.evacortex.mosaic.core.exceptions.TileDecodeException;
import ai.evacortex.mosaic.core.io.ImageCodec;
import ai.evacortex.mosaic.core.io.TileDirectory;
import ai.evacortex.mosaic.core.signature.Signature;
import ai.evacortex.mosaic.core.signature.SignatureShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a tile corpus into a {@link TileSet}.
 *
 * <p>Candidates are split into batches, one task per batch on a fixed worker pool. Workers
 * share nothing but the result queue: each decodes its tiles, computes their signatures and
 * offers one result per candidate. {@link #analyze} blocks until every batch has finished,
 * then drains exactly one result per candidate. Result order is irrelevant.</p>
 *
 * <p>A tile that fails to decode, has zero size, is too small for the requested shape or is
 * mostly transparent produces an empty result and is left out of the set.</p>
 */
public class TileAnalyzer implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(TileAnalyzer.class);

    private final ImageCodec codec;
    private final ColorExtractor extractor;
    private final AnalyzerOptions options;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private record AnalysisResult(Path path, Optional<Signature> signature) {}

    public TileAnalyzer(ImageCodec codec) {
        this(codec, AnalyzerOptions.defaults());
    }

    public TileAnalyzer(ImageCodec codec, AnalyzerOptions options) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.extractor = new ColorExtractor(options.alphaGate());
        AtomicInteger threadNo = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(options.poolSize(), r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("tile-analyzer-" + threadNo.incrementAndGet());
            return t;
        });
    }

    public TileSet analyzeDirectory(Path dir, SignatureShape shape) {
        return analyze(TileDirectory.list(dir), shape);
    }

    public TileSet analyze(List<TileCandidate> candidates, SignatureShape shape) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        if (closed.get()) throw new IllegalStateException("Analyzer is closed");

        int total = candidates.size();
        if (total == 0) return TileSet.empty(shape);

        BlockingQueue<AnalysisResult> results = new LinkedBlockingQueue<>();
        List<Future<?>> batches = new ArrayList<>();
        int batchSize = options.batchSize();
        for (int from = 0; from < total; from += batchSize) {
            List<TileCandidate> batch = List.copyOf(candidates.subList(from, Math.min(total, from + batchSize)));
            int batchNo = from / batchSize;
            batches.add(executor.submit(() -> analyzeBatch(batchNo, batch, shape, results)));
        }
        awaitAll(batches);

        List<Tile> tiles = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            AnalysisResult result = results.poll();
            if (result == null) {
                throw new TileAnalysisException("Expected " + total + " analysis results, received " + i);
            }
            result.signature().ifPresent(signature -> tiles.add(new Tile(result.path(), signature)));
        }

        LOG.info("Analyzed {} tile candidates: {} {} tiles kept, {} skipped",
                total, tiles.size(), shape, total - tiles.size());
        return new TileSet(shape, tiles);
    }

    private void analyzeBatch(int batchNo, List<TileCandidate> batch, SignatureShape shape,
                              BlockingQueue<AnalysisResult> results) {
        for (TileCandidate candidate : batch) {
            results.add(new AnalysisResult(candidate.path(), signatureOf(candidate, shape)));
        }
        LOG.debug("Batch {} done ({} tiles)", batchNo, batch.size());
    }

    private Optional<Signature> signatureOf(TileCandidate candidate, SignatureShape shape) {
        BufferedImage image;
        try {
            image = codec.decode(candidate.path().toString(), candidate.data());
        } catch (TileDecodeException e) {
            LOG.warn("Skipping tile {}: {}", candidate.path(), e.getMessage());
            return Optional.empty();
        }

        int minSide = shape == SignatureShape.QUAD ? 2 : 1;
        if (image.getWidth() < minSide || image.getHeight() < minSide) {
            LOG.warn("Skipping tile {}: {}x{} is too small for {} signatures",
                    candidate.path(), image.getWidth(), image.getHeight(), shape);
            return Optional.empty();
        }

        Optional<Signature> signature = extractor.signature(image, shape);
        if (signature.isEmpty()) {
            LOG.debug("Skipping mostly transparent tile {}", candidate.path());
        }
        return signature;
    }

    private void awaitAll(List<Future<?>> batches) {
        for (Future<?> batch : batches) {
            try {
                batch.get();
            } catch (ExecutionException e) {
                batches.forEach(f -> f.cancel(true));
                throw new TileAnalysisException("Tile analysis worker failed", e.getCause());
            } catch (InterruptedException e) {
                batches.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new TileAnalysisException("Interrupted while waiting for tile analysis", e);
            }
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
