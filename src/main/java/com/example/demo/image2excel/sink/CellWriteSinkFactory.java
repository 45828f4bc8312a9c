package com.example.demo.image2excel.sink;

import com.example.demo.image2excel.config.ConversionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Creates the sink for one conversion run. The sink must be used from the thread that created it.
 */
@Component
@RequiredArgsConstructor
public class CellWriteSinkFactory {
    private final ConversionProperties properties;

    public CellWriteSink create(Path outputPath) {
        return new ExcelCellWriteSink(properties.getOutput(), outputPath);
    }
}
