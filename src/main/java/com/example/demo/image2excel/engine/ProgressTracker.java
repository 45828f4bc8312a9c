package com.example.demo.image2excel.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Counts processed pixels and prints a progress line at most once per percentage point and at
 * most once per elapsed second.
 *
 * Safe for concurrent callers. Increments are atomic; emission is serialized. A line is printed
 * only when the percentage has advanced AND the whole-second value of the elapsed time differs
 * from the last printed line.
 */
@Slf4j
public class ProgressTracker {

    private static final String FORMAT = "\tConverting: %%%d (elapsed: %dm %ds)";

    private final long totalPixels;
    private final LongSupplier elapsedMillis;
    private final Consumer<String> printer;

    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicInteger previousPercentage = new AtomicInteger();
    private final AtomicLong lastReportSecond = new AtomicLong(-1L);

    public ProgressTracker(long totalPixels, LongSupplier elapsedMillis, Consumer<String> printer) {
        if (totalPixels <= 0) {
            throw new IllegalArgumentException("Total pixel count must be positive: " + totalPixels);
        }
        this.totalPixels = totalPixels;
        this.elapsedMillis = elapsedMillis;
        this.printer = printer;
    }

    /**
     * Tracker printing to standard output, timed from the moment it is created.
     */
    public static ProgressTracker startingNow(long totalPixels) {
        long start = System.nanoTime();
        return new ProgressTracker(totalPixels, () -> (System.nanoTime() - start) / 1_000_000L, System.out::println);
    }

    public void report(long increment) {
        long processed = processedCount.addAndGet(increment);
        int percentage = percentageOf(processed);
        long millis = elapsedMillis.getAsLong();
        long second = millis / 1000L;

        if (percentage > previousPercentage.get() && second != lastReportSecond.get()) {
            synchronized (this) {
                if (percentage > previousPercentage.get() && second != lastReportSecond.get()) {
                    emit(percentage, millis);
                    lastReportSecond.set(second);
                    previousPercentage.set(percentage);
                }
            }
        }
    }

    /**
     * Print the 100% line if the per-second gate held it back.
     */
    public synchronized void complete() {
        if (processedCount.get() >= totalPixels && previousPercentage.get() < 100) {
            long millis = elapsedMillis.getAsLong();
            emit(100, millis);
            lastReportSecond.set(millis / 1000L);
            previousPercentage.set(100);
        }
    }

    private void emit(int percentage, long millis) {
        long seconds = millis / 1000L;
        printer.accept(String.format(FORMAT, percentage, seconds / 60L, seconds % 60L));
        log.debug("Progress {}% ({} of {} pixels)", percentage, processedCount.get(), totalPixels);
    }

    private int percentageOf(long processed) {
        return (int) Math.min(100L, processed * 100L / totalPixels);
    }

    public long getProcessedCount() {
        return processedCount.get();
    }

    public int getPercentage() {
        return previousPercentage.get();
    }
}
