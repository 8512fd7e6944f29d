/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.io;

import ai.evacortex.mosaic.core.color.Rgba;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.Random;

import static ai.evacortex.mosaic.core.MosaicTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class LanczosResamplerTest {

    private final LanczosResampler resampler = new LanczosResampler();

    @Test
    void testSameSizeIsExactCopy() {
        Random random = new Random(2);
        Rgba[] pixels = new Rgba[12];
        for (int i = 0; i < pixels.length; i++) pixels[i] = randomColor(random);
        BufferedImage src = image(4, 3, pixels);

        BufferedImage out = resampler.resize(src, 4, 3);

        assertNotSame(src, out);
        for (int i = 0; i < pixels.length; i++) {
            assertEquals(src.getRGB(i % 4, i / 4), out.getRGB(i % 4, i / 4));
        }
    }

    @Test
    void testUniformColorSurvivesScaling() {
        Rgba color = new Rgba(37, 142, 201, 255);
        BufferedImage src = solid(9, 7, color);

        assertUniform(resampler.resize(src, 3, 2), color);
        assertUniform(resampler.resize(src, 20, 31), color);
        assertUniform(resampler.resize(src, 1, 1), color);
    }

    @Test
    void testDownscaleAveragesHalves() {
        // left half black, right half white
        BufferedImage src = new BufferedImage(8, 2, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 8; x++) {
                src.setRGB(x, y, x < 4 ? 0xFF000000 : 0xFFFFFFFF);
            }
        }
        BufferedImage out = resampler.resize(src, 2, 1);
        int left = out.getRGB(0, 0) & 0xFF;
        int right = out.getRGB(1, 0) & 0xFF;
        assertTrue(left < 96, "left sample should stay dark: " + left);
        assertTrue(right > 159, "right sample should stay bright: " + right);
    }

    @Test
    void testRejectsNonPositiveTarget() {
        BufferedImage src = solid(2, 2, RED);
        assertThrows(IllegalArgumentException.class, () -> resampler.resize(src, 0, 2));
        assertThrows(IllegalArgumentException.class, () -> new LanczosResampler(0));
    }

    private static void assertUniform(BufferedImage img, Rgba expected) {
        for (int y = 0; y < img.getHeight(); y++) {
            for (int x = 0; x < img.getWidth(); x++) {
                assertEquals(expected, Rgba.fromArgb(img.getRGB(x, y)), "pixel (" + x + "," + y + ")");
            }
        }
    }
}
