package com.phillippitts.aerodefect.testutil;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Random;

/**
 * Synthetic images for preprocessing and pipeline tests.
 */
public final class TestImages {

    private TestImages() {
    }

    public static BufferedImage uniform(int width, int height, int gray) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int rgb = (gray << 16) | (gray << 8) | gray;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                img.setRGB(x, y, rgb);
            }
        }
        return img;
    }

    /**
     * Black/white squares of {@code cell} pixels: mean luma near 128 and very strong edges.
     */
    public static BufferedImage checkerboard(int width, int height, int cell) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                boolean white = ((x / cell) + (y / cell)) % 2 == 0;
                img.setRGB(x, y, white ? 0xFFFFFF : 0x000000);
            }
        }
        return img;
    }

    /**
     * Uniform random gray levels in {@code [low, high]}, seeded for repeatability.
     */
    public static BufferedImage noise(int width, int height, int low, int high, long seed) {
        Random random = new Random(seed);
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int g = low + random.nextInt(high - low + 1);
                img.setRGB(x, y, (g << 16) | (g << 8) | g);
            }
        }
        return img;
    }

    public static byte[] png(BufferedImage image) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /** A valid 640x640 mid-gray PNG. */
    public static byte[] validPng() {
        return png(noise(640, 640, 100, 160, 7L));
    }
}
