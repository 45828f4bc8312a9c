package com.example.demo.image2excel.model;

import lombok.Value;

/**
 * Grid size an image is rendered at, always within the {@link GridBounds} it was computed for.
 */
@Value
public class TargetSize {
    int rows;
    int columns;

    public long cellCount() {
        return (long) rows * columns;
    }
}
