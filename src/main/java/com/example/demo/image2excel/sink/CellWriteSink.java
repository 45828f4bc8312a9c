package com.example.demo.image2excel.sink;

import com.example.demo.image2excel.model.CellAddress;
import com.example.demo.image2excel.model.TargetSize;

import java.nio.file.Path;

/**
 * Spreadsheet host that materializes colored cells.
 *
 * Unless {@link #isConcurrentWriteSafe()} returns true, every method must be called from one
 * thread only; the row processor then funnels all writes through a single consumer.
 */
public interface CellWriteSink extends AutoCloseable {

    /**
     * Whether {@link #setCellColor} and {@link #clearFormatting} may be called from several threads at once.
     */
    boolean isConcurrentWriteSafe();

    /**
     * Create a blank grid of at least {@code size.rows x size.columns}.
     *
     * @throws com.example.demo.image2excel.exception.SinkUnavailableException if the host cannot be initialized
     */
    void open(TargetSize size);

    /**
     * Fill one cell with a solid color.
     *
     * @throws com.example.demo.image2excel.exception.CellWriteException if this cell was rejected;
     *         any other exception means the sink is no longer usable
     */
    void setCellColor(CellAddress address, int red, int green, int blue);

    /**
     * Release per-write formatting state held for rows {@code 1..throughRow}. Every row in that
     * range is fully written; no write to it will follow.
     */
    void clearFormatting(int throughRow);

    /**
     * Uniform row and column sizing, shapes locked to their aspect ratio.
     */
    void finishLayout();

    /**
     * Make the finished grid visible to the user.
     *
     * @return where the document was saved, or null if this sink keeps nothing on disk
     */
    Path present();

    @Override
    void close();
}
