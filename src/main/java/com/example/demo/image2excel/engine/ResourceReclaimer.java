package com.example.demo.image2excel.engine;

import com.example.demo.image2excel.sink.CellWriteSink;
import lombok.extern.slf4j.Slf4j;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Backpressure valve against formatting state piling up in the sink.
 *
 * Counts cell writes; once the count exceeds the threshold it asks the sink to clear the rows
 * finished so far, optionally requests a garbage collection, and resets the count. Only the
 * contiguous prefix of completed rows is ever cleared, so a row still being written is never
 * touched even when rows finish out of order.
 */
@Slf4j
public class ResourceReclaimer {

    private final CellWriteSink sink;
    private final long threshold;
    private final boolean forceGc;

    private final AtomicLong writesSinceReclaim = new AtomicLong();
    private final BitSet completedRows = new BitSet();
    private int contiguousRows;
    private int clearedThrough;
    private int reclamations;

    public ResourceReclaimer(CellWriteSink sink, long threshold, boolean forceGc) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("Reclamation threshold must be positive: " + threshold);
        }
        this.sink = sink;
        this.threshold = threshold;
        this.forceGc = forceGc;
    }

    /**
     * Record a fully written row and the number of writes it took.
     */
    public void rowWritten(int row, long writes) {
        synchronized (this) {
            completedRows.set(row);
            while (completedRows.get(contiguousRows + 1)) {
                contiguousRows++;
            }
        }
        if (writesSinceReclaim.addAndGet(writes) > threshold) {
            reclaim();
        }
    }

    private synchronized void reclaim() {
        long writes = writesSinceReclaim.get();
        if (writes <= threshold) {
            return;
        }

        if (contiguousRows > clearedThrough) {
            sink.clearFormatting(contiguousRows);
            completedRows.clear(clearedThrough + 1, contiguousRows + 1);
            clearedThrough = contiguousRows;
        }
        if (forceGc) {
            System.gc();
        }
        writesSinceReclaim.set(0L);
        reclamations++;
        log.debug("Reclamation #{} after {} writes, rows 1..{} cleared", reclamations, writes, clearedThrough);
    }

    public long getWritesSinceReclaim() {
        return writesSinceReclaim.get();
    }

    public synchronized int getReclamations() {
        return reclamations;
    }

    public synchronized int getClearedThrough() {
        return clearedThrough;
    }
}
