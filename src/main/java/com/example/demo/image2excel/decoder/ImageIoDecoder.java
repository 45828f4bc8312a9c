package com.example.demo.image2excel.decoder;

import com.example.demo.image2excel.exception.ImageDecodeException;
import com.example.demo.image2excel.model.RgbImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decoder backed by {@link ImageIO}; handles whatever formats the installed readers support
 * (PNG, JPEG, BMP, GIF, WBMP out of the box). Alpha is dropped.
 */
@Slf4j
@Component
public class ImageIoDecoder implements ImageDecoder {

    @Override
    public RgbImage decode(Path imagePath) {
        if (!Files.isRegularFile(imagePath)) {
            throw new ImageDecodeException(ImageDecodeException.IMAGE_NOT_FOUND,
                    "Image file not found: " + imagePath);
        }

        BufferedImage image;
        try (InputStream in = Files.newInputStream(imagePath)) {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new ImageDecodeException(ImageDecodeException.DECODE_FAILED,
                    "Failed to read image " + imagePath + ": " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException(ImageDecodeException.UNSUPPORTED_FORMAT,
                    "No image reader recognizes " + imagePath);
        }

        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] &= 0xFFFFFF;
        }
        log.info("Decoded {} ({}x{}, {} pixels)", imagePath.getFileName(), width, height, pixels.length);
        return new RgbImage(width, height, pixels);
    }
}
