package com.example.demo.image2excel.decoder;

import com.example.demo.image2excel.model.RgbImage;

import java.nio.file.Path;

/**
 * Decodes an image file into 8-bit RGB pixels.
 */
public interface ImageDecoder {

    /**
     * @throws com.example.demo.image2excel.exception.ImageDecodeException if the file cannot be opened or decoded
     */
    RgbImage decode(Path imagePath);
}
