package com.example.demo.image2excel.engine;

import com.example.demo.image2excel.config.ConversionProperties;
import com.example.demo.image2excel.exception.CellWriteException;
import com.example.demo.image2excel.exception.ConversionException;
import com.example.demo.image2excel.model.CellAddress;
import com.example.demo.image2excel.model.CellWrite;
import com.example.demo.image2excel.model.RgbImage;
import com.example.demo.image2excel.sink.CellWriteSink;
import com.example.demo.image2excel.util.ColumnLetters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maps every image pixel to one colored cell.
 *
 * Rows are computed in parallel by a pool of workers, one row per unit of work, in no particular
 * order. Writes within a row are sequential. When the sink is not safe for concurrent calls, workers
 * hand finished rows to a bounded channel and the calling thread drains it, performing every sink
 * call itself; producers block while the channel is full. A thread-safe sink is written to by the
 * workers directly.
 *
 * A rejected cell ({@link CellWriteException}) is counted and skipped. Any other failure, from a
 * worker or from the sink, stops all workers and surfaces as a {@link ConversionException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RowProcessor {

    private static final long POLL_MILLIS = 100L;

    private final ConversionProperties properties;

    public RowProcessingResult process(RgbImage image, CellWriteSink sink, ProgressTracker progress,
                                       ResourceReclaimer reclaimer) {
        ConversionProperties.Processing settings = properties.getProcessing();
        int workers = Math.min(settings.effectiveWorkers(), image.getHeight());
        RowComputer computer = new RowComputer(image, settings.getChannelBits());
        RowWriter writer = new RowWriter(sink, progress, reclaimer, image.getWidth());

        if (sink.isConcurrentWriteSafe()) {
            log.debug("Writing {} rows directly from {} workers", image.getHeight(), workers);
            writeFromWorkers(workers, image.getHeight(), computer, writer);
        } else {
            log.debug("Writing {} rows through a {}-row channel fed by {} workers",
                    image.getHeight(), settings.getChannelCapacity(), workers);
            writeThroughChannel(workers, settings.getChannelCapacity(), image.getHeight(), computer, writer);
        }
        return writer.result();
    }

    private void writeFromWorkers(int workers, int height, RowComputer computer, RowWriter writer) {
        AtomicInteger nextRow = new AtomicInteger(1);
        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        ExecutorService pool = newWorkerPool(workers);
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                tasks.add(pool.submit(() -> {
                    int row;
                    while (failure.get() == null && (row = nextRow.getAndIncrement()) <= height) {
                        try {
                            writer.write(computer.compute(row));
                        } catch (RuntimeException e) {
                            failure.compareAndSet(null, e);
                        }
                    }
                }));
            }
            for (Future<?> task : tasks) {
                task.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure.compareAndSet(null, new ConversionException(ConversionException.CONVERSION_ABORTED,
                    "Interrupted while rows were being written", e));
        } catch (ExecutionException e) {
            failure.compareAndSet(null, new ConversionException(ConversionException.CONVERSION_ABORTED,
                    "Row worker failed: " + e.getCause(), e.getCause()));
        } finally {
            pool.shutdownNow();
        }
        rethrow(failure.get());
    }

    private void writeThroughChannel(int workers, int capacity, int height, RowComputer computer, RowWriter writer) {
        BlockingQueue<RowBatch> channel = new ArrayBlockingQueue<>(Math.max(1, capacity));
        AtomicInteger nextRow = new AtomicInteger(1);
        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        ExecutorService pool = newWorkerPool(workers);
        try {
            List<Future<?>> producers = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                producers.add(pool.submit(() -> produce(computer, channel, nextRow, height, failure)));
            }

            int received = 0;
            while (received < height && failure.get() == null) {
                RowBatch batch = channel.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (batch == null) {
                    if (allDone(producers) && channel.isEmpty()) {
                        failure.compareAndSet(null, new IllegalStateException(
                                "Row workers stopped after " + received + " of " + height + " rows"));
                    }
                    continue;
                }
                try {
                    writer.write(batch);
                } catch (RuntimeException e) {
                    failure.compareAndSet(null, e);
                    break;
                }
                received++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure.compareAndSet(null, new ConversionException(ConversionException.CONVERSION_ABORTED,
                    "Interrupted while waiting for rows", e));
        } finally {
            pool.shutdownNow();
        }
        rethrow(failure.get());
    }

    private void produce(RowComputer computer, BlockingQueue<RowBatch> channel, AtomicInteger nextRow, int height,
                         AtomicReference<RuntimeException> failure) {
        try {
            int row;
            while (failure.get() == null && (row = nextRow.getAndIncrement()) <= height) {
                RowBatch batch = computer.compute(row);
                while (!channel.offer(batch, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    if (failure.get() != null) {
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            // shutdownNow() after the consumer finished or gave up
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            failure.compareAndSet(null, e);
        }
    }

    private static boolean allDone(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            if (!future.isDone()) {
                return false;
            }
        }
        return true;
    }

    private static void rethrow(RuntimeException failure) {
        if (failure == null) {
            return;
        }
        if (failure instanceof ConversionException) {
            throw failure;
        }
        throw new ConversionException(ConversionException.CONVERSION_ABORTED,
                "Conversion aborted: " + failure.getMessage(), failure);
    }

    private static ExecutorService newWorkerPool(int workers) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "image2excel-row-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(workers, factory);
    }

    /**
     * Turns one image row into cell writes. Pure apart from reading the image; shared by all workers.
     */
    static final class RowComputer {
        private final RgbImage image;
        private final String[] columnLetters;
        private final int channelMask;

        RowComputer(RgbImage image, int channelBits) {
            if (channelBits < 1 || channelBits > 8) {
                throw new IllegalArgumentException("Channel bits must be within 1..8: " + channelBits);
            }
            this.image = image;
            this.columnLetters = ColumnLetters.range(image.getWidth());
            this.channelMask = (0xFF << (8 - channelBits)) & 0xFF;
        }

        RowBatch compute(int row) {
            int width = image.getWidth();
            long rowStart = (long) (row - 1) * width;
            List<CellWrite> writes = new ArrayList<>(width);
            int skipped = 0;

            for (int j = 1; j <= width; j++) {
                long pixelIndex = rowStart + j - 1;
                if (pixelIndex >= image.pixelCount()) {
                    skipped++;
                    continue;
                }
                int index = (int) pixelIndex;
                writes.add(new CellWrite(new CellAddress(columnLetters[j - 1], row),
                        image.red(index) & channelMask,
                        image.green(index) & channelMask,
                        image.blue(index) & channelMask));
            }
            return new RowBatch(row, writes, skipped);
        }
    }

    /**
     * Issues a row's writes to the sink, then reports the row to progress and reclamation.
     */
    static final class RowWriter {
        private final CellWriteSink sink;
        private final ProgressTracker progress;
        private final ResourceReclaimer reclaimer;
        private final int width;

        private final AtomicLong cellsWritten = new AtomicLong();
        private final AtomicLong failedWrites = new AtomicLong();
        private final AtomicLong skippedPixels = new AtomicLong();

        RowWriter(CellWriteSink sink, ProgressTracker progress, ResourceReclaimer reclaimer, int width) {
            this.sink = sink;
            this.progress = progress;
            this.reclaimer = reclaimer;
            this.width = width;
        }

        void write(RowBatch batch) {
            long written = 0;
            for (CellWrite write : batch.getWrites()) {
                try {
                    sink.setCellColor(write.getAddress(), write.getRed(), write.getGreen(), write.getBlue());
                    written++;
                } catch (CellWriteException e) {
                    long failures = failedWrites.incrementAndGet();
                    if (failures == 1) {
                        log.warn("Cell {} could not be written, continuing: {}", write.getAddress(), e.getMessage());
                    } else {
                        log.debug("Cell {} could not be written: {}", write.getAddress(), e.getMessage());
                    }
                }
            }
            cellsWritten.addAndGet(written);
            if (batch.getSkippedPixels() > 0) {
                skippedPixels.addAndGet(batch.getSkippedPixels());
            }

            progress.report(width);
            reclaimer.rowWritten(batch.getRow(), batch.getWrites().size());
        }

        RowProcessingResult result() {
            return new RowProcessingResult(cellsWritten.get(), failedWrites.get(), skippedPixels.get());
        }
    }
}
