package com.example.demo.image2excel.exception;

/**
 * A single cell write was rejected by the sink. Not fatal: the run records it and moves on.
 */
public class CellWriteException extends RuntimeException {

    public CellWriteException(String message) {
        super(message);
    }

    public CellWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
