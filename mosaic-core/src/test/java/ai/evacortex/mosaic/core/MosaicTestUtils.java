/*
 * Emosaic — Photomosaic Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.mosaic.core;

import ai.evacortex.mosaic.core.color.Rgba;
import ai.evacortex.mosaic.core.signature.MonoSignature;
import ai.evacortex.mosaic.core.signature.QuadSignature;
import ai.evacortex.mosaic.core.signature.Signature;
import ai.evacortex.mosaic.core.signature.SignatureShape;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;


/**
 * Utility class for synthesizing images, tiles and tile sets in tests.
 */
public class MosaicTestUtils {

    public static final Rgba RED = Rgba.opaque(255, 0, 0);
    public static final Rgba GREEN = Rgba.opaque(0, 255, 0);
    public static final Rgba BLUE = Rgba.opaque(0, 0, 255);
    public static final Rgba YELLOW = Rgba.opaque(255, 255, 0);

    /**
     * Creates an ARGB image filled with one color.
     */
    public static BufferedImage solid(int width, int height, Rgba color) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                img.setRGB(x, y, color.toArgb());
            }
        }
        return img;
    }

    /**
     * Creates an ARGB image from pixels given in raster order.
     */
    public static BufferedImage image(int width, int height, Rgba... pixels) {
        if (pixels.length != width * height) throw new IllegalArgumentException("pixel count mismatch");
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int i = 0; i < pixels.length; i++) {
            img.setRGB(i % width, i / width, pixels[i].toArgb());
        }
        return img;
    }

    public static byte[] png(BufferedImage image) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path writePng(Path dir, String name, BufferedImage image) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve(name);
        Files.write(file, png(image));
        return file;
    }

    public static Rgba randomColor(Random random) {
        return Rgba.opaque(random.nextInt(256), random.nextInt(256), random.nextInt(256));
    }

    public static Signature randomSignature(SignatureShape shape, Random random) {
        return switch (shape) {
            case MONO -> new MonoSignature(randomColor(random));
            case QUAD -> new QuadSignature(randomColor(random), randomColor(random),
                    randomColor(random), randomColor(random));
        };
    }

    /**
     * Creates a tile set of {@code size} random signatures with synthetic paths.
     */
    public static TileSet randomTileSet(SignatureShape shape, int size, long seed) {
        Random random = new Random(seed);
        List<Tile> tiles = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            tiles.add(new Tile(Path.of("tiles", "tile-" + i + ".png"), randomSignature(shape, random)));
        }
        return new TileSet(shape, tiles);
    }

    public static List<Tile> sortedByPath(TileSet tileSet) {
        return tileSet.tiles().stream()
                .sorted(Comparator.comparing(t -> t.path().toString()))
                .toList();
    }
}
