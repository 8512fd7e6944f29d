/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.io;

import java.awt.image.BufferedImage;

/**
 * Separable Lanczos resampling of ARGB images.
 *
 * <p>Each output sample is a normalized weighted sum of the source samples under a
 * {@code sinc(x)·sinc(x/a)} window. When shrinking, the window is stretched by the scale
 * factor so every source pixel contributes. Edges are clamped; channels are filtered
 * independently and rounded back to [0, 255].</p>
 */
public final class LanczosResampler {

    public static final int DEFAULT_LOBES = 3;

    private final int lobes;

    public LanczosResampler() {
        this(DEFAULT_LOBES);
    }

    public LanczosResampler(int lobes) {
        if (lobes <= 0) throw new IllegalArgumentException("Lobes must be > 0");
        this.lobes = lobes;
    }

    public BufferedImage resize(BufferedImage src, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + width + "x" + height);
        }
        int srcW = src.getWidth();
        int srcH = src.getHeight();
        if (srcW == width && srcH == height) {
            return copy(src);
        }

        int[] pixels = src.getRGB(0, 0, srcW, srcH, null, 0, srcW);

        Kernel horizontal = kernel(srcW, width);
        double[] rows = new double[srcH * width * 4];
        for (int y = 0; y < srcH; y++) {
            for (int x = 0; x < width; x++) {
                double a = 0, r = 0, g = 0, b = 0;
                int start = horizontal.start[x];
                double[] weights = horizontal.weights[x];
                for (int k = 0; k < weights.length; k++) {
                    int sx = clamp(start + k, srcW);
                    int p = pixels[y * srcW + sx];
                    double w = weights[k];
                    a += w * ((p >>> 24) & 0xFF);
                    r += w * ((p >>> 16) & 0xFF);
                    g += w * ((p >>> 8) & 0xFF);
                    b += w * (p & 0xFF);
                }
                int o = (y * width + x) * 4;
                rows[o] = a;
                rows[o + 1] = r;
                rows[o + 2] = g;
                rows[o + 3] = b;
            }
        }

        Kernel vertical = kernel(srcH, height);
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            int start = vertical.start[y];
            double[] weights = vertical.weights[y];
            for (int x = 0; x < width; x++) {
                double a = 0, r = 0, g = 0, b = 0;
                for (int k = 0; k < weights.length; k++) {
                    int sy = clamp(start + k, srcH);
                    int o = (sy * width + x) * 4;
                    double w = weights[k];
                    a += w * rows[o];
                    r += w * rows[o + 1];
                    g += w * rows[o + 2];
                    b += w * rows[o + 3];
                }
                out.setRGB(x, y, (toByte(a) << 24) | (toByte(r) << 16) | (toByte(g) << 8) | toByte(b));
            }
        }
        return out;
    }

    private Kernel kernel(int srcSize, int dstSize) {
        double scale = (double) srcSize / dstSize;
        double filterScale = Math.max(scale, 1.0);
        double support = lobes * filterScale;

        int[] start = new int[dstSize];
        double[][] weights = new double[dstSize][];
        for (int i = 0; i < dstSize; i++) {
            double center = (i + 0.5) * scale - 0.5;
            int left = (int) Math.floor(center - support) + 1;
            int right = (int) Math.ceil(center + support) - 1;
            double[] w = new double[right - left + 1];
            double sum = 0.0;
            for (int j = left; j <= right; j++) {
                double v = lanczos((j - center) / filterScale);
                w[j - left] = v;
                sum += v;
            }
            if (sum != 0.0) {
                for (int k = 0; k < w.length; k++) w[k] /= sum;
            }
            start[i] = left;
            weights[i] = w;
        }
        return new Kernel(start, weights);
    }

    private double lanczos(double x) {
        if (x == 0.0) return 1.0;
        if (Math.abs(x) >= lobes) return 0.0;
        double px = Math.PI * x;
        return lobes * Math.sin(px) * Math.sin(px / lobes) / (px * px);
    }

    private static int clamp(int index, int size) {
        return index < 0 ? 0 : Math.min(index, size - 1);
    }

    private static int toByte(double v) {
        long rounded = Math.round(v);
        return (int) Math.max(0, Math.min(255, rounded));
    }

    private static BufferedImage copy(BufferedImage src) {
        BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_ARGB);
        int[] pixels = src.getRGB(0, 0, src.getWidth(), src.getHeight(), null, 0, src.getWidth());
        out.setRGB(0, 0, src.getWidth(), src.getHeight(), pixels, 0, src.getWidth());
        return out;
    }

    private record Kernel(int[] start, double[][] weights) {}
}
