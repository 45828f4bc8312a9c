package com.example.demo.image2excel.engine;

import com.example.demo.image2excel.model.CellWrite;
import lombok.Value;

import java.util.List;

/**
 * The writes computed for one image row, handed from a producer to the writing side.
 */
@Value
class RowBatch {
    int row;
    List<CellWrite> writes;
    int skippedPixels;
}
