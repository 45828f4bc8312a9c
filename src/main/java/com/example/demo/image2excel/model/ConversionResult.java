package com.example.demo.image2excel.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Outcome of a completed conversion run, including the non-fatal anomalies it recorded.
 */
@Value
@Builder
public class ConversionResult {
    int sourceWidth;
    int sourceHeight;
    TargetSize targetSize;
    String rightmostColumn;
    boolean resized;
    boolean pixelCountMismatch;
    long cellsWritten;
    long failedWrites;
    long skippedPixels;
    int reclamations;
    long elapsedMillis;
    Path outputPath;

    public boolean hasAnomalies() {
        return pixelCountMismatch || failedWrites > 0 || skippedPixels > 0;
    }
}
