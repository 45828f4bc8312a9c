package com.example.demo.image2excel.sink;

import com.example.demo.image2excel.exception.CellWriteException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;

import java.util.HashMap;
import java.util.Map;

/**
 * One solid-fill cell style per distinct color.
 *
 * An .xlsx workbook holds at most 64000 cell styles, so styles are shared by every cell of the
 * same color. Once the workbook refuses new styles, cells with unseen colors are rejected.
 */
@Slf4j
class CellStyleCache {

    private final Workbook workbook;
    private final Map<Integer, CellStyle> styles = new HashMap<>();
    private boolean exhausted;

    CellStyleCache(Workbook workbook) {
        this.workbook = workbook;
    }

    CellStyle fill(int red, int green, int blue) {
        int rgb = (red << 16) | (green << 8) | blue;
        CellStyle style = styles.get(rgb);
        if (style != null) {
            return style;
        }
        if (exhausted) {
            throw new CellWriteException(String.format("No cell style left for color #%06X", rgb));
        }

        try {
            XSSFCellStyle created = (XSSFCellStyle) workbook.createCellStyle();
            created.setFillForegroundColor(new XSSFColor(new byte[]{(byte) red, (byte) green, (byte) blue}, null));
            created.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            styles.put(rgb, created);
            return created;
        } catch (IllegalStateException e) {
            exhausted = true;
            log.warn("Workbook cell style limit reached after {} colors; lower image2excel.processing.channel-bits "
                    + "to reduce the palette", styles.size());
            throw new CellWriteException(String.format("No cell style left for color #%06X", rgb), e);
        }
    }

    int size() {
        return styles.size();
    }
}
