package com.example.demo.image2excel.exception;

/**
 * The spreadsheet host could not be initialized, or the finished workbook could not be saved.
 */
public class SinkUnavailableException extends ConversionException {

    public static final String SINK_UNAVAILABLE = "SINK_UNAVAILABLE";
    public static final String OUTPUT_FAILED = "OUTPUT_FAILED";

    public SinkUnavailableException(String code, String description, Throwable cause) {
        super(code, description, 3, cause);
    }
}
