/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.color;

import ai.evacortex.mosaic.core.signature.MonoSignature;
import ai.evacortex.mosaic.core.signature.QuadSignature;
import ai.evacortex.mosaic.core.signature.Signature;
import ai.evacortex.mosaic.core.signature.SignatureShape;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Computes average colors of image regions and turns them into tile signatures.
 *
 * <p>When the alpha gate is enabled, a region in which more than half of the pixels are
 * fully transparent has no average color. Such tiles would be almost invisible once placed
 * and are kept out of the tile set.</p>
 */
public final class ColorExtractor {

    private static final double TRANSPARENT_LIMIT = 0.5;

    private final boolean alphaGate;

    public ColorExtractor(boolean alphaGate) {
        this.alphaGate = alphaGate;
    }

    public ColorExtractor() {
        this(true);
    }

    public boolean alphaGate() {
        return alphaGate;
    }

    public Optional<Rgba> averageColor(BufferedImage image, Region region) {
        if (region.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty region: " + region);
        }
        if (region.left() + region.width() > image.getWidth() || region.top() + region.height() > image.getHeight()) {
            throw new IllegalArgumentException("Region " + region + " exceeds image bounds "
                    + image.getWidth() + "x" + image.getHeight());
        }

        long r = 0, g = 0, b = 0, a = 0;
        long transparent = 0;
        for (int y = region.top(); y < region.top() + region.height(); y++) {
            for (int x = region.left(); x < region.left() + region.width(); x++) {
                int argb = image.getRGB(x, y);
                int alpha = (argb >>> 24) & 0xFF;
                if (alpha == 0) transparent++;
                a += alpha;
                r += (argb >>> 16) & 0xFF;
                g += (argb >>> 8) & 0xFF;
                b += argb & 0xFF;
            }
        }

        double count = region.area();
        if (alphaGate && transparent / count > TRANSPARENT_LIMIT) {
            return Optional.empty();
        }
        return Optional.of(new Rgba(mean(r, count), mean(g, count), mean(b, count), mean(a, count)));
    }

    public Optional<Signature> signature(BufferedImage image, SignatureShape shape) {
        Region whole = Region.of(image.getWidth(), image.getHeight());
        return switch (shape) {
            case MONO -> averageColor(image, whole).map(MonoSignature::new);
            case QUAD -> quadSignature(image, whole);
        };
    }

    private Optional<Signature> quadSignature(BufferedImage image, Region whole) {
        Region[] quadrants = whole.quadrants();
        Rgba[] colors = new Rgba[quadrants.length];
        for (int i = 0; i < quadrants.length; i++) {
            Optional<Rgba> color = averageColor(image, quadrants[i]);
            if (color.isEmpty()) return Optional.empty();
            colors[i] = color.get();
        }
        return Optional.of(new QuadSignature(colors[0], colors[1], colors[2], colors[3]));
    }

    private static int mean(long sum, double count) {
        return (int) Math.round(sum / count);
    }
}
