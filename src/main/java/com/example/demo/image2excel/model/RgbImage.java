package com.example.demo.image2excel.model;

import lombok.Getter;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Decoded raster image: row-major pixels packed as {@code 0xRRGGBB}.
 *
 * The pixel array is taken as reported by the decoder and may disagree with
 * {@code width * height}; callers must check {@link #hasPixelCountMismatch()} and never index
 * past {@link #pixelCount()}.
 */
@Getter
public class RgbImage {

    private int width;
    private int height;
    private int[] pixels;

    public RgbImage(int width, int height, int[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    public int pixelCount() {
        return pixels.length;
    }

    public long expectedPixelCount() {
        return (long) width * height;
    }

    public boolean hasPixelCountMismatch() {
        return pixels.length != expectedPixelCount();
    }

    public int red(int index) {
        return (pixels[index] >> 16) & 0xFF;
    }

    public int green(int index) {
        return (pixels[index] >> 8) & 0xFF;
    }

    public int blue(int index) {
        return pixels[index] & 0xFF;
    }

    /**
     * Resample in place to the given size using bilinear interpolation.
     */
    public void resize(int newHeight, int newWidth) {
        if (newHeight <= 0 || newWidth <= 0) {
            throw new IllegalArgumentException("Resize target must be positive: " + newWidth + "x" + newHeight);
        }
        if (newHeight == height && newWidth == width) {
            return;
        }

        BufferedImage source = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int available = (int) Math.min(pixels.length, expectedPixelCount());
        int fullRows = available / width;
        if (fullRows > 0) {
            source.setRGB(0, 0, width, fullRows, pixels, 0, width);
        }
        if (available % width != 0) {
            source.setRGB(0, fullRows, available % width, 1, pixels, fullRows * width, width);
        }

        BufferedImage target = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(source, 0, 0, newWidth, newHeight, null);
        } finally {
            g.dispose();
        }

        this.pixels = target.getRGB(0, 0, newWidth, newHeight, null, 0, newWidth);
        this.width = newWidth;
        this.height = newHeight;
    }
}
