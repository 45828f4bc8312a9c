package com.example.demo.image2excel.model;

import lombok.Value;

/**
 * A1-style cell address: column letters plus a 1-based row number.
 */
@Value
public class CellAddress {
    String column;
    int row;

    @Override
    public String toString() {
        return column + row;
    }
}
