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
import ai.evacortex.mosaic.core.exceptions.TileDecodeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static ai.evacortex.mosaic.core.MosaicTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ImageIoCodecTest {

    private final ImageIoCodec codec = new ImageIoCodec();

    @Test
    void testDecodeGarbageFails() {
        byte[] junk = "definitely not a picture".getBytes(StandardCharsets.UTF_8);
        TileDecodeException e = assertThrows(TileDecodeException.class, () -> codec.decode("junk.png", junk));
        assertTrue(e.getMessage().contains("junk.png"), e.getMessage());
    }

    @Test
    void testDecodeRgbYieldsOpaqueArgb() throws IOException {
        BufferedImage rgb = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(1, 1, 0x123456);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(rgb, "png", out);

        BufferedImage decoded = codec.decode("rgb.png", out.toByteArray());

        assertEquals(BufferedImage.TYPE_INT_ARGB, decoded.getType());
        assertEquals(new Rgba(0x12, 0x34, 0x56, 255), Rgba.fromArgb(decoded.getRGB(1, 1)));
        assertEquals(255, Rgba.fromArgb(decoded.getRGB(0, 0)).a());
    }

    @Test
    void testDecodeKeepsTransparency() {
        Rgba clear = new Rgba(10, 20, 30, 0);
        BufferedImage decoded = codec.decode("clear.png", png(solid(2, 2, clear)));
        assertEquals(0, Rgba.fromArgb(decoded.getRGB(0, 0)).a());
    }

    @Test
    void testReadMissingFileFails(@TempDir Path dir) {
        assertThrows(TileDecodeException.class, () -> codec.read(dir.resolve("absent.png")));
    }

    @Test
    void testWriteCreatesParentsAndRoundTrips(@TempDir Path dir) throws IOException {
        BufferedImage img = image(2, 1, RED, BLUE);
        Path target = dir.resolve("out").resolve("mosaic.png");

        codec.write(img, target);

        BufferedImage back = codec.read(target);
        assertEquals(RED.toArgb(), back.getRGB(0, 0));
        assertEquals(BLUE.toArgb(), back.getRGB(1, 0));
    }

    @Test
    void testWriteJpegDropsAlpha(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("mosaic.jpg");
        codec.write(solid(8, 8, GREEN), target);
        assertTrue(Files.size(target) > 0);
        assertEquals(8, codec.read(target).getWidth());
    }

    @Test
    void testResizeDelegatesToResampler() {
        BufferedImage resized = codec.resize(solid(6, 6, YELLOW), 2, 3);
        assertEquals(2, resized.getWidth());
        assertEquals(3, resized.getHeight());
        assertEquals(YELLOW.toArgb(), resized.getRGB(1, 2));
    }
}
