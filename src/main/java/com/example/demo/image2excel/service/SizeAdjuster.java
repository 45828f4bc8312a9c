package com.example.demo.image2excel.service;

import com.example.demo.image2excel.model.GridBounds;
import com.example.demo.image2excel.model.TargetSize;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Clamps image dimensions to the worksheet's maximum rows and columns, keeping the aspect ratio.
 *
 * Rows are clamped first. The column clamp then works from the already-reduced size, so the two
 * steps are not independent and must run in this order. Quotients are truncated.
 */
@Slf4j
@Component
public class SizeAdjuster {

    public TargetSize adjust(int width, int height, GridBounds bounds) {
        long newHeight = height;
        long newWidth = width;

        if (newHeight > bounds.getMaxRows()) {
            newHeight = bounds.getMaxRows();
            newWidth = Math.max(1L, newHeight * width / height);
        }

        if (newWidth > bounds.getMaxColumns()) {
            newHeight = Math.max(1L, bounds.getMaxColumns() * newHeight / newWidth);
            newWidth = bounds.getMaxColumns();
        }

        if (newHeight != height || newWidth != width) {
            log.info("Image {}x{} exceeds the {}x{} grid, adjusting to {}x{}",
                    width, height, bounds.getMaxColumns(), bounds.getMaxRows(), newWidth, newHeight);
        }
        return new TargetSize((int) newHeight, (int) newWidth);
    }
}
