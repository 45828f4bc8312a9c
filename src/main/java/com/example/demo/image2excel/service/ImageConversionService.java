package com.example.demo.image2excel.service;

import com.example.demo.image2excel.aspect.LogExecutionTime;
import com.example.demo.image2excel.config.ConversionProperties;
import com.example.demo.image2excel.decoder.ImageDecoder;
import com.example.demo.image2excel.engine.ProgressTracker;
import com.example.demo.image2excel.engine.ResourceReclaimer;
import com.example.demo.image2excel.engine.RowProcessingResult;
import com.example.demo.image2excel.engine.RowProcessor;
import com.example.demo.image2excel.model.ConversionResult;
import com.example.demo.image2excel.model.RgbImage;
import com.example.demo.image2excel.model.TargetSize;
import com.example.demo.image2excel.sink.CellWriteSink;
import com.example.demo.image2excel.sink.CellWriteSinkFactory;
import com.example.demo.image2excel.util.ColumnLetters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main orchestrator for a conversion run.
 * Decodes the image, fits it to the grid, streams its pixels into the sink and presents the result.
 *
 * Fatal errors (decode, sink initialization, aborted writes) propagate before the grid is
 * presented. Non-fatal anomalies are collected into the returned {@link ConversionResult}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageConversionService {
    private final ImageDecoder imageDecoder;
    private final SizeAdjuster sizeAdjuster;
    private final RowProcessor rowProcessor;
    private final CellWriteSinkFactory sinkFactory;
    private final ConversionProperties properties;

    @LogExecutionTime("Image Conversion")
    public ConversionResult convert(Path imagePath) {
        long start = System.currentTimeMillis();

        RgbImage image = imageDecoder.decode(imagePath);
        int sourceWidth = image.getWidth();
        int sourceHeight = image.getHeight();
        boolean mismatch = validatePixelCount(image);

        TargetSize target = sizeAdjuster.adjust(sourceWidth, sourceHeight, properties.gridBounds());
        boolean resized = target.getRows() != sourceHeight || target.getColumns() != sourceWidth;
        if (resized) {
            image.resize(target.getRows(), target.getColumns());
        }

        String rightmostColumn = ColumnLetters.of(image.getWidth());
        log.info("Rendering {}x{} pixels into cells A1:{}{}", image.getWidth(), image.getHeight(),
                rightmostColumn, image.getHeight());

        Path outputPath = resolveOutputPath(imagePath);
        RowProcessingResult rows;
        int reclamations;
        Path saved;
        try (CellWriteSink sink = sinkFactory.create(outputPath)) {
            sink.open(target);

            System.out.println("Converting image...");
            ProgressTracker progress = ProgressTracker.startingNow(image.expectedPixelCount());
            ResourceReclaimer reclaimer = new ResourceReclaimer(sink,
                    properties.getReclaim().getThreshold(), properties.getReclaim().isForceGc());

            rows = rowProcessor.process(image, sink, progress, reclaimer);
            progress.complete();
            reclamations = reclaimer.getReclamations();

            sink.finishLayout();
            saved = sink.present();
        }

        ConversionResult result = ConversionResult.builder()
                .sourceWidth(sourceWidth)
                .sourceHeight(sourceHeight)
                .targetSize(target)
                .rightmostColumn(rightmostColumn)
                .resized(resized)
                .pixelCountMismatch(mismatch)
                .cellsWritten(rows.getCellsWritten())
                .failedWrites(rows.getFailedWrites())
                .skippedPixels(rows.getSkippedPixels())
                .reclamations(reclamations)
                .elapsedMillis(System.currentTimeMillis() - start)
                .outputPath(saved)
                .build();

        if (result.hasAnomalies()) {
            log.warn("Conversion finished with anomalies: pixel count mismatch={}, skipped pixels={}, failed writes={}",
                    mismatch, result.getSkippedPixels(), result.getFailedWrites());
        }
        log.info("Wrote {} cells, {} reclamation pass(es)", result.getCellsWritten(), reclamations);
        return result;
    }

    /**
     * Warn when the decoder's pixel count disagrees with width x height. The reported pixels stay
     * the ground truth; cells without a pixel are skipped.
     */
    private boolean validatePixelCount(RgbImage image) {
        if (!image.hasPixelCountMismatch()) {
            return false;
        }
        log.warn("Image pixel count does not match the calculated pixel count (H*W) - expected:{} actual:{}",
                image.expectedPixelCount(), image.pixelCount());
        return true;
    }

    Path resolveOutputPath(Path imagePath) {
        String fileName = imagePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;

        String directory = properties.getOutput().getDirectory();
        Path parent = directory != null && !directory.isBlank()
                ? Paths.get(directory)
                : imagePath.toAbsolutePath().getParent();
        return parent.resolve(baseName + ".xlsx");
    }
}
