package com.example.demo.image2excel.exception;

import lombok.Getter;

/**
 * Fatal failure of a conversion run. Carries a short machine-readable code, a human-readable
 * description and the process exit code the command line reports for it.
 */
@Getter
public class ConversionException extends RuntimeException {

    public static final String CONVERSION_ABORTED = "CONVERSION_ABORTED";

    private final String code;
    private final String description;
    private final int exitCode;

    public ConversionException(String code, String description) {
        this(code, description, 4, null);
    }

    public ConversionException(String code, String description, Throwable cause) {
        this(code, description, 4, cause);
    }

    protected ConversionException(String code, String description, int exitCode, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
        this.exitCode = exitCode;
    }
}
