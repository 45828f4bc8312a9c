package com.example.demo.image2excel.model;

import lombok.Value;

/**
 * Maximum rows and columns of the target worksheet.
 */
@Value
public class GridBounds {
    int maxRows;
    int maxColumns;

    public GridBounds(int maxRows, int maxColumns) {
        if (maxRows <= 0 || maxColumns <= 0) {
            throw new IllegalArgumentException("Grid bounds must be positive: " + maxRows + "x" + maxColumns);
        }
        this.maxRows = maxRows;
        this.maxColumns = maxColumns;
    }
}
