/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core.io;

import ai.evacortex.mosaic.core.exceptions.TileDecodeException;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.Set;

/**
 * {@link ImageCodec} backed by {@code javax.imageio}, resizing with {@link LanczosResampler}.
 */
public class ImageIoCodec implements ImageCodec {

    private static final String DEFAULT_FORMAT = "png";
    private static final Set<String> OPAQUE_FORMATS = Set.of("jpg", "bmp");

    private final LanczosResampler resampler;

    public ImageIoCodec() {
        this(new LanczosResampler());
    }

    public ImageIoCodec(LanczosResampler resampler) {
        this.resampler = resampler;
    }

    @Override
    public BufferedImage decode(String name, byte[] bytes) {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new TileDecodeException(name, e);
        }
        if (decoded == null) {
            throw new TileDecodeException(name, "no registered reader understands the format");
        }
        if (decoded.getWidth() == 0 || decoded.getHeight() == 0) {
            throw new TileDecodeException(name, "image has zero width or height");
        }
        return toArgb(decoded);
    }

    @Override
    public BufferedImage read(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new TileDecodeException(path.toString(), e);
        }
        return decode(path.toString(), bytes);
    }

    @Override
    public BufferedImage resize(BufferedImage image, int width, int height) {
        return resampler.resize(toArgb(image), width, height);
    }

    @Override
    public void write(BufferedImage image, Path path) throws IOException {
        String format = formatOf(path);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            BufferedImage encoded = OPAQUE_FORMATS.contains(format) ? toRgb(image) : image;
            if (!ImageIO.write(encoded, format, out)) {
                throw new IOException("No image writer for format '" + format + "'");
            }
        }
    }

    public static BufferedImage toArgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_ARGB) return image;
        BufferedImage argb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                argb.setRGB(x, y, image.getRGB(x, y));
            }
        }
        return argb;
    }

    // JPEG and BMP writers reject images with an alpha channel
    private static BufferedImage toRgb(BufferedImage image) {
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static String formatOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) return DEFAULT_FORMAT;
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ext.equals("jpeg") ? "jpg" : ext;
    }
}
