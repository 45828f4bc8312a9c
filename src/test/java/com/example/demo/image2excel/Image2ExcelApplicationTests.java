package com.example.demo.image2excel;

import com.example.demo.image2excel.cli.ConvertCommandRunner;
import com.example.demo.image2excel.model.ConversionResult;
import com.example.demo.image2excel.service.ImageConversionService;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("local")
public class Image2ExcelApplicationTests {

    @Autowired
    private ImageConversionService conversionService;

    @Autowired
    private ConvertCommandRunner runner;

    @TempDir
    Path tempDir;

    @Test
    public void startupWithoutImagePathReportsUsage() {
        assertEquals(1, runner.getExitCode());
    }

    @Test
    public void convertsPngIntoColoredWorkbook() throws Exception {
        int width = 20;
        int height = 12;
        BufferedImage png = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                png.setRGB(x, y, (x * 12) << 16 | (y * 20) << 8 | 0x40);
            }
        }
        Path image = tempDir.resolve("gradient.png");
        ImageIO.write(png, "png", image.toFile());

        ConversionResult result = conversionService.convert(image);

        assertEquals(width * height, result.getCellsWritten());
        assertEquals("T", result.getRightmostColumn());
        // threshold 8 in the local profile: every row triggers a pass
        assertTrue(result.getReclamations() > 0);
        assertEquals(tempDir.resolve("gradient.xlsx"), result.getOutputPath());

        try (InputStream in = Files.newInputStream(result.getOutputPath()); XSSFWorkbook wb = new XSSFWorkbook(in)) {
            Sheet sheet = wb.getSheet("Image");
            assertEquals(height - 1, sheet.getLastRowNum());
            for (int y = 0; y < height; y++) {
                assertEquals(width, sheet.getRow(y).getLastCellNum());
                for (int x = 0; x < width; x++) {
                    XSSFCell cell = (XSSFCell) sheet.getRow(y).getCell(x);
                    byte[] rgb = cell.getCellStyle().getFillForegroundXSSFColor().getRGB();
                    assertEquals(x * 12, rgb[0] & 0xFF);
                    assertEquals(y * 20, rgb[1] & 0xFF);
                    assertEquals(0x40, rgb[2] & 0xFF);
                }
            }
        }
    }
}
