/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core;

import ai.evacortex.mosaic.core.analysis.AnalyzerOptions;
import ai.evacortex.mosaic.core.analysis.TileAnalyzer;
import ai.evacortex.mosaic.core.cache.TileSetCache;
import ai.evacortex.mosaic.core.exceptions.*;
import ai.evacortex.mosaic.core.io.ImageCodec;
import ai.evacortex.mosaic.core.io.ImageIoCodec;
import ai.evacortex.mosaic.core.render.MosaicCompositor;
import ai.evacortex.mosaic.core.render.RenderOptions;
import ai.evacortex.mosaic.core.signature.SignatureShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code MosaicGenerator} runs the whole photomosaic pipeline: read and validate the source,
 * obtain the tile set for the requested mode (from the tile set cache or by analyzing the tile
 * directory), render, and only then encode the output.
 *
 * <p>Errors surface in pipeline order:</p>
 * <ul>
 *     <li>{@link SourceImageException}: source missing or undecodable, before any other work</li>
 *     <li>{@link InvalidRenderOptionsException}: options incompatible with the source, before analysis</li>
 *     <li>{@link EmptyTileSetException}: no usable tile in the corpus, right after analysis</li>
 *     <li>{@link TileDecodeException}: a matched tile became unreadable during rendering</li>
 * </ul>
 *
 * <p>No output file is written unless rendering completed.</p>
 */
public class MosaicGenerator implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(MosaicGenerator.class);

    private final ImageCodec codec;
    private final TileAnalyzer analyzer;
    private final TileSetCache cache;
    private final MosaicCompositor compositor;

    public MosaicGenerator() {
        this(new ImageIoCodec(), AnalyzerOptions.defaults(), TileSetCache.openDefault());
    }

    public MosaicGenerator(ImageCodec codec, AnalyzerOptions analyzerOptions, TileSetCache cache) {
        this(codec, new TileAnalyzer(codec, analyzerOptions), cache, new MosaicCompositor(codec));
    }

    public MosaicGenerator(ImageCodec codec, TileAnalyzer analyzer, TileSetCache cache, MosaicCompositor compositor) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.cache = cache;
        this.compositor = Objects.requireNonNull(compositor, "compositor must not be null");
    }

    /**
     * @param useCache read and populate the tile set cache; {@code false} always re-analyzes
     */
    public BufferedImage generate(Path tilesDir, Path sourcePath, RenderOptions options, boolean useCache) {
        BufferedImage source = readSource(sourcePath);
        options.validateFor(source);

        TileSet tileSet = tileSet(tilesDir, options.mode().shape(), useCache);
        if (tileSet.isEmpty()) {
            throw new EmptyTileSetException("No usable tile found in " + tilesDir);
        }

        return compositor.render(source, tileSet, options);
    }

    public void generateTo(Path tilesDir, Path sourcePath, RenderOptions options, boolean useCache, Path output)
            throws IOException {
        BufferedImage mosaic = generate(tilesDir, sourcePath, options, useCache);
        codec.write(mosaic, output);
        LOG.info("Wrote mosaic to {}", output);
    }

    /**
     * Returns the tile set for {@code shape}, analyzing the directory on a cache miss.
     */
    public TileSet tileSet(Path tilesDir, SignatureShape shape, boolean useCache) {
        if (useCache && cache != null) {
            Optional<TileSet> cached = cache.load(tilesDir, shape);
            if (cached.isPresent()) return cached.get();
        }

        TileSet analyzed = analyzer.analyzeDirectory(tilesDir, shape);
        if (useCache && cache != null && !analyzed.isEmpty()) {
            cache.store(tilesDir, shape, analyzed);
        }
        return analyzed;
    }

    private BufferedImage readSource(Path sourcePath) {
        if (!Files.isRegularFile(sourcePath)) {
            throw new SourceImageException(sourcePath.toString());
        }
        try {
            return codec.read(sourcePath);
        } catch (TileDecodeException e) {
            throw new SourceImageException(sourcePath.toString(), e);
        }
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
