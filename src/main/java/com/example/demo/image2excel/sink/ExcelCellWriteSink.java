package com.example.demo.image2excel.sink;

import com.example.demo.image2excel.config.ConversionProperties;
import com.example.demo.image2excel.exception.CellWriteException;
import com.example.demo.image2excel.exception.SinkUnavailableException;
import com.example.demo.image2excel.model.CellAddress;
import com.example.demo.image2excel.model.TargetSize;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.ClientAnchor;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFDrawing;
import org.apache.poi.xssf.streaming.SXSSFRow;
import org.apache.poi.xssf.streaming.SXSSFSheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.apache.poi.xssf.usermodel.XSSFAnchor;
import org.apache.poi.xssf.usermodel.XSSFShape;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.TreeSet;

/**
 * Apache POI backed sink writing a streaming (SXSSF) .xlsx workbook.
 *
 * Rows stay in memory until {@link #clearFormatting(int)} flushes them to the temporary sheet
 * file; a flushed row can no longer be written. Not thread-safe.
 */
@Slf4j
public class ExcelCellWriteSink implements CellWriteSink {

    private static final float POINTS_PER_PIXEL = 0.75f;

    private final ConversionProperties.Output output;
    private final Path outputPath;

    private SXSSFWorkbook workbook;
    private SXSSFSheet sheet;
    private CellStyleCache styles;
    private int columns;

    // 0-based indices of rows created and not yet flushed
    private final TreeSet<Integer> rowsInMemory = new TreeSet<>();
    private int flushedThrough;

    public ExcelCellWriteSink(ConversionProperties.Output output, Path outputPath) {
        this.output = output;
        this.outputPath = outputPath;
    }

    @Override
    public boolean isConcurrentWriteSafe() {
        return false;
    }

    @Override
    public void open(TargetSize size) {
        SpreadsheetVersion version = SpreadsheetVersion.EXCEL2007;
        if (size.getRows() > version.getMaxRows() || size.getColumns() > version.getMaxColumns()) {
            throw new SinkUnavailableException(SinkUnavailableException.SINK_UNAVAILABLE,
                    String.format("Grid %dx%d does not fit an .xlsx worksheet (%dx%d)",
                            size.getColumns(), size.getRows(), version.getMaxColumns(), version.getMaxRows()),
                    null);
        }

        try {
            workbook = new SXSSFWorkbook(-1);
            workbook.setCompressTempFiles(true);
            sheet = workbook.createSheet(output.getSheetName());
            styles = new CellStyleCache(workbook);
            columns = size.getColumns();
        } catch (RuntimeException | LinkageError e) {
            throw new SinkUnavailableException(SinkUnavailableException.SINK_UNAVAILABLE,
                    "Excel workbook could not be created. Check that Apache POI (poi-ooxml) and its "
                            + "dependencies are installed and compatible", e);
        }
        log.debug("Opened workbook sheet '{}' for {}x{} cells", output.getSheetName(), size.getColumns(), size.getRows());
    }

    @Override
    public void setCellColor(CellAddress address, int red, int green, int blue) {
        int rowNumber = address.getRow();
        if (rowNumber <= flushedThrough) {
            throw new CellWriteException("Row " + rowNumber + " was already flushed, cannot write " + address);
        }
        int columnIndex = CellReference.convertColStringToIndex(address.getColumn());
        if (columnIndex < 0 || columnIndex >= columns) {
            throw new CellWriteException("Cell " + address + " is outside the " + columns + "-column grid");
        }

        SXSSFRow row = sheet.getRow(rowNumber - 1);
        if (row == null) {
            row = sheet.createRow(rowNumber - 1);
            rowsInMemory.add(rowNumber - 1);
        }
        Cell cell = row.createCell(columnIndex);
        cell.setCellStyle(styles.fill(red, green, blue));
    }

    @Override
    public void clearFormatting(int throughRow) {
        if (throughRow <= flushedThrough) {
            return;
        }
        // rows above throughRow stay in memory, everything at or below it goes to disk
        int remaining = rowsInMemory.tailSet(throughRow, true).size();
        try {
            sheet.flushRows(remaining);
        } catch (IOException e) {
            throw new RuntimeException("Failed to flush rows 1.." + throughRow + " to the temporary sheet file", e);
        }
        rowsInMemory.headSet(throughRow).clear();
        flushedThrough = throughRow;
        log.debug("Flushed rows through {}, {} rows still in memory, {} cell styles", throughRow,
                rowsInMemory.size(), styles.size());
    }

    @Override
    public void finishLayout() {
        int width = output.getColumnWidth() * 256;
        for (int c = 0; c < columns; c++) {
            sheet.setColumnWidth(c, width);
        }
        // square cells: row height equals the column width
        sheet.setDefaultRowHeightInPoints(sheet.getColumnWidthInPixels(0) * POINTS_PER_PIXEL);

        XSSFDrawing drawing = sheet.getDrawingPatriarch();
        if (drawing != null) {
            for (XSSFShape shape : drawing) {
                XSSFAnchor anchor = shape.getAnchor();
                if (anchor instanceof ClientAnchor) {
                    ((ClientAnchor) anchor).setAnchorType(ClientAnchor.AnchorType.MOVE_DONT_RESIZE);
                }
            }
        }

        sheet.setZoom(output.getZoom());
        workbook.setActiveSheet(0);
        sheet.setSelected(true);
    }

    @Override
    public Path present() {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(outputPath)) {
                workbook.write(out);
            }
        } catch (IOException e) {
            throw new SinkUnavailableException(SinkUnavailableException.OUTPUT_FAILED,
                    "Failed to save workbook to " + outputPath, e);
        }
        log.info("Workbook saved to {}", outputPath.toAbsolutePath());

        if (output.isOpenOnFinish()) {
            openInDesktop();
        }
        return outputPath;
    }

    private void openInDesktop() {
        if (GraphicsEnvironment.isHeadless() || !Desktop.isDesktopSupported()
                || !Desktop.getDesktop().isSupported(Desktop.Action.OPEN)) {
            log.info("No desktop available to open the workbook, open {} manually", outputPath.toAbsolutePath());
            return;
        }
        try {
            Desktop.getDesktop().open(outputPath.toFile());
        } catch (IOException e) {
            log.warn("Could not open {} in the spreadsheet application: {}", outputPath, e.getMessage());
        }
    }

    @Override
    public void close() {
        if (workbook == null) {
            return;
        }
        try {
            workbook.close();
        } catch (IOException e) {
            throw new RuntimeException("Failed to close Excel workbook", e);
        } finally {
            workbook.dispose();
            workbook = null;
        }
    }
}
