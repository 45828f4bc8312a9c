package com.example.demo.image2excel.exception;

/**
 * The source image could not be opened or decoded.
 */
public class ImageDecodeException extends ConversionException {

    public static final String IMAGE_NOT_FOUND = "IMAGE_NOT_FOUND";
    public static final String UNSUPPORTED_FORMAT = "UNSUPPORTED_FORMAT";
    public static final String DECODE_FAILED = "DECODE_FAILED";

    public ImageDecodeException(String code, String description) {
        super(code, description, 2, null);
    }

    public ImageDecodeException(String code, String description, Throwable cause) {
        super(code, description, 2, cause);
    }
}
