package com.example.demo.image2excel.cli;

import com.example.demo.image2excel.exception.ConversionException;
import com.example.demo.image2excel.exception.ImageDecodeException;
import com.example.demo.image2excel.model.ConversionResult;
import com.example.demo.image2excel.model.TargetSize;
import com.example.demo.image2excel.service.ImageConversionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class ConvertCommandRunnerTest {

    private ImageConversionService service;
    private ConvertCommandRunner runner;
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    public void setup() {
        service = Mockito.mock(ImageConversionService.class);
        runner = new ConvertCommandRunner(service);
        originalOut = System.out;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    public void restore() {
        System.setOut(originalOut);
    }

    @Test
    public void testMissingArgumentPrintsUsageAndExitsWithOne() {
        runner.run(new DefaultApplicationArguments());

        assertEquals(1, runner.getExitCode());
        assertTrue(output().startsWith("Usage: image2excel <image-path>"));
        verifyNoInteractions(service);
    }

    @Test
    public void testOptionsAreNotTakenAsTheImagePath() {
        runner.run(new DefaultApplicationArguments("--image2excel.reclaim.threshold=10"));

        assertEquals(1, runner.getExitCode());
        verifyNoInteractions(service);
    }

    @Test
    public void testSuccessfulConversion() {
        when(service.convert(Paths.get("cat.png"))).thenReturn(ConversionResult.builder()
                .targetSize(new TargetSize(2, 3))
                .rightmostColumn("C")
                .cellsWritten(6)
                .elapsedMillis(1_500)
                .outputPath(Paths.get("cat.xlsx"))
                .build());

        runner.run(new DefaultApplicationArguments("cat.png"));

        assertEquals(0, runner.getExitCode());
        assertTrue(output().contains("Done: 6 cells (3x2, A1:C2)"), output());
        assertFalse(output().contains("Anomalies"));
    }

    @Test
    public void testAnomaliesAreSummarized() {
        when(service.convert(Paths.get("cat.png"))).thenReturn(ConversionResult.builder()
                .targetSize(new TargetSize(2, 3))
                .rightmostColumn("C")
                .cellsWritten(5)
                .failedWrites(1)
                .build());

        assertEquals(0, runner.execute(List.of("cat.png")));
        assertTrue(output().contains("failed writes=1"), output());
    }

    @Test
    public void testFatalErrorsMapToExitCodes() {
        when(service.convert(Paths.get("missing.png"))).thenThrow(
                new ImageDecodeException(ImageDecodeException.IMAGE_NOT_FOUND, "Image file not found: missing.png"));
        when(service.convert(Paths.get("broken.png"))).thenThrow(
                new ConversionException(ConversionException.CONVERSION_ABORTED, "host went away"));

        assertEquals(2, runner.execute(List.of("missing.png")));
        assertTrue(output().contains("ERROR: Image file not found: missing.png"));
        assertEquals(4, runner.execute(List.of("broken.png")));
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }
}
