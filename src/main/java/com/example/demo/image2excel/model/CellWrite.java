package com.example.demo.image2excel.model;

import lombok.Value;

/**
 * One pending fill-color write, channels already truncated to the sink's encoding.
 */
@Value
public class CellWrite {
    CellAddress address;
    int red;
    int green;
    int blue;
}
