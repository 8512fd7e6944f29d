/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.analysis;

/**
 * Tuning of the analysis pool.
 *
 * @param poolSize  number of worker threads
 * @param batchSize number of tiles handled by one task
 * @param alphaGate exclude tiles that are mostly fully transparent
 */
public record AnalyzerOptions(int poolSize, int batchSize, boolean alphaGate) {

    public static final int DEFAULT_BATCH_SIZE = Integer.getInteger("mosaic.analysis.batchSize", 500);
    public static final int DEFAULT_POOL_SIZE =
            Integer.getInteger("mosaic.analysis.threads", Runtime.getRuntime().availableProcessors());

    public AnalyzerOptions {
        if (poolSize <= 0) throw new IllegalArgumentException("Pool size must be > 0");
        if (batchSize <= 0) throw new IllegalArgumentException("Batch size must be > 0");
    }

    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions(DEFAULT_POOL_SIZE, DEFAULT_BATCH_SIZE, true);
    }

    public AnalyzerOptions withBatchSize(int batchSize) {
        return new AnalyzerOptions(poolSize, batchSize, alphaGate);
    }

    public AnalyzerOptions withPoolSize(int poolSize) {
        return new AnalyzerOptions(poolSize, batchSize, alphaGate);
    }
}
