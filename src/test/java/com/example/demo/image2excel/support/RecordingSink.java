package com.example.demo.image2excel.support;

import com.example.demo.image2excel.exception.CellWriteException;
import com.example.demo.image2excel.model.CellAddress;
import com.example.demo.image2excel.model.TargetSize;
import com.example.demo.image2excel.sink.CellWriteSink;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory sink recording every call, for engine and service tests.
 */
public class RecordingSink implements CellWriteSink {

    @Value
    public static class Write {
        String address;
        int row;
        int red;
        int green;
        int blue;
    }

    private final boolean concurrentSafe;

    public final List<Write> writes = Collections.synchronizedList(new ArrayList<>());
    public final List<Integer> clears = Collections.synchronizedList(new ArrayList<>());
    public final Set<String> writerThreads = ConcurrentHashMap.newKeySet();

    public Predicate<CellAddress> reject = address -> false;
    public Predicate<CellAddress> breakOn = address -> false;

    public volatile TargetSize openedWith;
    public volatile boolean clearedAheadOfWrites;
    public volatile boolean layoutFinished;
    public volatile boolean presented;
    public volatile boolean closed;

    public RecordingSink(boolean concurrentSafe) {
        this.concurrentSafe = concurrentSafe;
    }

    @Override
    public boolean isConcurrentWriteSafe() {
        return concurrentSafe;
    }

    @Override
    public void open(TargetSize size) {
        openedWith = size;
    }

    @Override
    public void setCellColor(CellAddress address, int red, int green, int blue) {
        writerThreads.add(Thread.currentThread().getName());
        if (breakOn.test(address)) {
            throw new IllegalStateException("host went away at " + address);
        }
        if (reject.test(address)) {
            throw new CellWriteException("rejected " + address);
        }
        writes.add(new Write(address.toString(), address.getRow(), red, green, blue));
    }

    @Override
    public void clearFormatting(int throughRow) {
        clears.add(throughRow);
        if (openedWith == null) {
            return;
        }
        long expected = (long) throughRow * openedWith.getColumns();
        long written;
        synchronized (writes) {
            written = writes.stream().filter(w -> w.getRow() <= throughRow).count();
        }
        if (written < expected) {
            clearedAheadOfWrites = true;
        }
    }

    @Override
    public void finishLayout() {
        layoutFinished = true;
    }

    @Override
    public Path present() {
        presented = true;
        return null;
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<String> addresses() {
        synchronized (writes) {
            List<String> out = new ArrayList<>();
            for (Write w : writes) {
                out.add(w.getAddress());
            }
            return out;
        }
    }

    public Write writeAt(String address) {
        synchronized (writes) {
            return writes.stream().filter(w -> w.getAddress().equals(address)).findFirst().orElse(null);
        }
    }
}
