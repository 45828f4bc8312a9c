package com.example.demo.image2excel.engine;

import lombok.Value;

@Value
public class RowProcessingResult {
    long cellsWritten;
    long failedWrites;
    long skippedPixels;
}
