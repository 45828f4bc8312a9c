package com.example.demo.image2excel.cli;

import com.example.demo.image2excel.exception.ConversionException;
import com.example.demo.image2excel.model.ConversionResult;
import com.example.demo.image2excel.service.ImageConversionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry: {@code image2excel <image-path>}.
 *
 * Exit codes: 0 success, 1 usage, 2 image not decodable, 3 spreadsheet host unavailable,
 * 4 conversion aborted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConvertCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = "Usage: image2excel <image-path>\n"
            + "Renders the image as colored cells in an Excel workbook saved next to it.";

    private final ImageConversionService conversionService;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getNonOptionArgs());
    }

    int execute(List<String> positional) {
        if (positional == null || positional.isEmpty()) {
            System.out.println(USAGE);
            return 1;
        }

        String imagePath = positional.get(0);
        try {
            ConversionResult result = conversionService.convert(Paths.get(imagePath));
            System.out.printf("Done: %d cells (%dx%d, A1:%s%d) in %.1fs -> %s%n",
                    result.getCellsWritten(),
                    result.getTargetSize().getColumns(), result.getTargetSize().getRows(),
                    result.getRightmostColumn(), result.getTargetSize().getRows(),
                    result.getElapsedMillis() / 1000.0, result.getOutputPath());
            if (result.hasAnomalies()) {
                System.out.printf("Anomalies: pixel count mismatch=%s, skipped pixels=%d, failed writes=%d%n",
                        result.isPixelCountMismatch(), result.getSkippedPixels(), result.getFailedWrites());
            }
            return 0;
        } catch (ConversionException e) {
            log.error("Conversion of {} failed [{}]: {}", imagePath, e.getCode(), e.getDescription(), e);
            System.out.println("ERROR: " + e.getDescription());
            return e.getExitCode();
        } catch (InvalidPathException e) {
            log.error("Not a valid image path: {}", imagePath, e);
            System.out.println("ERROR: not a valid path: " + imagePath);
            return 2;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
