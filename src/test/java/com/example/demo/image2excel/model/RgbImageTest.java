package com.example.demo.image2excel.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class RgbImageTest {

    @Test
    public void testResizeResamplesInPlace() {
        int[] pixels = new int[8 * 4];
        Arrays.fill(pixels, 0x336699);
        RgbImage image = new RgbImage(8, 4, pixels);

        image.resize(2, 4);

        assertEquals(4, image.getWidth());
        assertEquals(2, image.getHeight());
        assertEquals(8, image.pixelCount());
        assertFalse(image.hasPixelCountMismatch());
        for (int i = 0; i < image.pixelCount(); i++) {
            assertEquals(0x33, image.red(i));
            assertEquals(0x66, image.green(i));
            assertEquals(0x99, image.blue(i));
        }
    }

    @Test
    public void testResizeToSameSizeKeepsPixels() {
        int[] pixels = {1, 2, 3, 4};
        RgbImage image = new RgbImage(2, 2, pixels);

        image.resize(2, 2);

        assertSame(pixels, image.getPixels());
    }

    @Test
    public void testResizeToleratesShortPixelArray() {
        RgbImage image = new RgbImage(4, 4, new int[10]);
        assertTrue(image.hasPixelCountMismatch());

        image.resize(2, 2);

        assertEquals(4, image.pixelCount());
        assertFalse(image.hasPixelCountMismatch());
    }

    @Test
    public void testRejectsEmptyDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new RgbImage(0, 3, new int[0]));
        assertThrows(IllegalArgumentException.class, () -> new RgbImage(3, 1, new int[3]).resize(0, 1));
    }
}
