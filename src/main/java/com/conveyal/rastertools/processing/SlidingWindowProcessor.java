package com.conveyal.rastertools.processing;

import com.conveyal.rastertools.RasterConfigurationException;
import com.conveyal.rastertools.RasterProcessingException;
import com.conveyal.rastertools.RasterToolsConfig;
import com.conveyal.rastertools.progress.LoggingProgressListener;
import com.conveyal.rastertools.progress.NoopProgressListener;
import com.conveyal.rastertools.progress.ProgressListener;
import com.conveyal.rastertools.raster.DataType;
import com.conveyal.rastertools.raster.OutputProfile;
import com.conveyal.rastertools.raster.RasterBlock;
import com.conveyal.rastertools.raster.RasterDestination;
import com.conveyal.rastertools.raster.RasterMetadata;
import com.conveyal.rastertools.raster.RasterReader;
import com.conveyal.rastertools.raster.RasterSource;
import com.conveyal.rastertools.raster.RasterWriter;
import com.conveyal.rastertools.util.ExceptionUtils;
import com.conveyal.rastertools.windows.SlidingWindow;
import com.conveyal.rastertools.windows.SlidingWindows;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Runs a ProcessingUnit over every sliding window of a source raster, in parallel, writing the results into a new
 * output raster.
 *
 * Everything that can be checked up front is checked before the output is created: band numbers, window size and
 * overlap, and whether the destination can be written. These problems raise RasterConfigurationException.
 * The output is then created with its final profile, and one work item is built per window (and per band when the
 * unit processes bands separately).
 *
 * Items are handed to a fixed pool of worker threads. Each worker reads the window plus its overlap through a reader
 * of its own, pads the parts that fall outside the raster, runs the unit and crops the overlap off the result.
 * The thread that called run() is the only one writing to the output: finished windows come back to it through a
 * completion queue and are written as soon as they arrive, in whatever order. Because write windows never overlap,
 * the output does not depend on that order. At most two windows per worker are in flight at once, so memory use does
 * not grow with the size of the raster.
 *
 * The first failure aborts the run. Remaining work is cancelled, all readers and the writer are closed, and a
 * RasterProcessingException naming the failed work item is thrown. The partial output should be discarded.
 */
public class SlidingWindowProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(SlidingWindowProcessor.class);

    /** How long to wait for cancelled workers to stop before closing the readers they may still be using. */
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final RasterToolsConfig config;

    public SlidingWindowProcessor (RasterToolsConfig config) {
        this.config = checkNotNull(config);
    }

    /**
     * Process the whole source raster with the given unit, using configuration from environment variables and system
     * properties.
     * @return the profile of the output raster that was created.
     */
    public static OutputProfile run (RasterSource source, RasterDestination destination, ProcessingUnit unit,
                                     SlidingOptions options) {
        return new SlidingWindowProcessor(RasterToolsConfig.fromEnvironment()).process(source, destination, unit, options);
    }

    /** @return the profile of the output raster that was created. */
    public OutputProfile process (RasterSource source, RasterDestination destination, ProcessingUnit unit,
                                  SlidingOptions options) {
        checkNotNull(source);
        checkNotNull(destination);
        checkNotNull(unit);
        checkNotNull(options);

        RasterMetadata metadata = readMetadata(source);
        int[] bands = validateBands(metadata, options.bands());
        validateWindowing(options);
        destination.checkWritable();

        OutputProfile profile = outputProfile(metadata, bands.length, unit, options);
        SlidingWindows windows = new SlidingWindows(metadata.width, metadata.height,
                options.windowWidth(), options.windowHeight(), options.overlap(), options.overlap());
        List<WorkItem> items = WorkItem.forWindows(windows, bands, unit.mode());
        int workers = workerCount(options, items.size());
        ProgressListener progress = progressListener(options);

        LOG.info("Processing {} with {} into {}: {} work items, {} worker(s), {}.", source.describe(), unit.name,
                destination.describe(), items.size(), workers, options);
        Stopwatch stopwatch = Stopwatch.createStarted();

        RasterWriter writer;
        try {
            writer = destination.create(profile);
        } catch (IOException e) {
            throw new RasterProcessingException("Could not create output " + destination.describe(), e);
        }
        progress.beginTask("Processing " + unit.name, items.size());

        ExecutorService executor = Executors.newFixedThreadPool(workers, new ThreadFactoryBuilder()
                .setNameFormat("rastertools-worker-%d").setDaemon(true).build());
        WorkerReaders readers = new WorkerReaders(source);
        RuntimeException failure = null;
        try {
            writeAll(items, new ExecutorCompletionService<>(executor), 2 * workers, metadata.dataType, unit, options,
                    readers, writer, progress);
        } catch (RuntimeException e) {
            LOG.error("Processing {} with {} failed: {}", source.describe(), unit.name,
                    ExceptionUtils.shortCauseString(e));
            failure = e;
        } finally {
            failure = shutdown(executor, readers, writer, failure);
        }
        if (failure != null) {
            throw failure;
        }
        LOG.info("Finished processing {} with {} in {}.", source.describe(), unit.name, stopwatch);
        return profile;
    }

    /**
     * Submit work items while fewer than maxInFlight are pending, and write each finished window as it comes back.
     * This runs on the calling thread, which is the only thread ever writing to the output.
     */
    private void writeAll (List<WorkItem> items, CompletionService<WindowTask> completionService, int maxInFlight,
                           DataType sourceType, ProcessingUnit unit, SlidingOptions options, WorkerReaders readers,
                           RasterWriter writer, ProgressListener progress) {
        Iterator<WorkItem> pending = items.iterator();
        int submitted = 0;
        int completed = 0;
        while (completed < items.size()) {
            while (pending.hasNext() && submitted - completed < maxInFlight) {
                completionService.submit(new WindowTask(pending.next(), sourceType, unit, options, readers));
                submitted += 1;
            }
            WindowTask task;
            try {
                task = completionService.take().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RasterProcessingException("Interrupted while waiting for processed windows.", e);
            } catch (ExecutionException e) {
                Throwable cause = ExceptionUtils.unwrap(e);
                if (cause instanceof RasterProcessingException) {
                    throw (RasterProcessingException) cause;
                }
                throw new RasterProcessingException("A worker failed unexpectedly.", cause);
            }
            task.write(writer);
            completed += 1;
            progress.increment();
        }
    }

    /**
     * Stop the workers, then close readers and writer. Problems while closing are attached to an earlier failure if
     * there is one, otherwise they become the failure of the run.
     */
    private static RuntimeException shutdown (ExecutorService executor, WorkerReaders readers, RasterWriter writer,
                                              RuntimeException failure) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Worker threads did not stop within {} seconds.", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = withFailure(failure, new RasterProcessingException("Interrupted while stopping workers.", e));
        }
        try {
            readers.close();
        } catch (IOException e) {
            failure = withFailure(failure, new RasterProcessingException("Could not close source readers.", e));
        }
        try {
            writer.close();
        } catch (IOException e) {
            failure = withFailure(failure, new RasterProcessingException("Could not close output writer.", e));
        }
        return failure;
    }

    private static RuntimeException withFailure (RuntimeException failure, RuntimeException next) {
        if (failure == null) {
            return next;
        }
        failure.addSuppressed(next);
        return failure;
    }

    private static RasterMetadata readMetadata (RasterSource source) {
        try (RasterReader reader = source.openReader()) {
            return reader.metadata();
        } catch (IOException e) {
            throw new RasterProcessingException("Could not open source " + source.describe(), e);
        }
    }

    private static int[] validateBands (RasterMetadata metadata, int[] requested) {
        if (requested.length == 0) {
            return metadata.allBands();
        }
        for (int band : requested) {
            if (!metadata.hasBand(band)) {
                throw new RasterConfigurationException(String.format(
                        "Band %d does not exist, the raster has %d band(s): requested %s.",
                        band, metadata.bandCount, Arrays.toString(requested)));
            }
        }
        return requested;
    }

    private static void validateWindowing (SlidingOptions options) {
        if (options.windowWidth() <= 0 || options.windowHeight() <= 0) {
            throw new RasterConfigurationException(String.format(
                    "Window size must be positive, got %dx%d.", options.windowWidth(), options.windowHeight()));
        }
        int smallestSide = Math.min(options.windowWidth(), options.windowHeight());
        if (options.overlap() < 0 || 2 * options.overlap() >= smallestSide) {
            throw new RasterConfigurationException(String.format(
                    "Overlap must be at least 0 and less than half the window size (%d), got %d.",
                    smallestSide, options.overlap()));
        }
        if (options.workers() != null && options.workers() < 1) {
            throw new RasterConfigurationException("Worker count must be at least 1, got " + options.workers());
        }
    }

    /**
     * The output has one band per requested band and the size of the source. Its blocks have the size of the
     * windows, except on rasters smaller than a window, where blocks are the largest power of two that fits.
     */
    static OutputProfile outputProfile (RasterMetadata metadata, int bandCount, ProcessingUnit unit,
                                        SlidingOptions options) {
        int blockWidth = blockSize(options.windowWidth(), metadata.width);
        int blockHeight = blockSize(options.windowHeight(), metadata.height);
        Double nodata = unit.nodata() != null ? unit.nodata() : metadata.nodata;
        return new OutputProfile(metadata.width, metadata.height, bandCount, unit.outputType(), nodata,
                blockWidth, blockHeight, true, unit.compression());
    }

    private static int blockSize (int windowSize, int imageSize) {
        return imageSize < windowSize ? Integer.highestOneBit(imageSize) : windowSize;
    }

    private int workerCount (SlidingOptions options, int itemCount) {
        int workers = options.workers() != null ? options.workers() : config.maxWorkers();
        return Math.max(1, Math.min(workers, itemCount));
    }

    private ProgressListener progressListener (SlidingOptions options) {
        if (options.progressListener() != null) {
            return options.progressListener();
        }
        return config.progressEnabled() ? new LoggingProgressListener() : new NoopProgressListener();
    }

    /**
     * Reads, pads, processes and crops one work item on a worker thread, then holds the result until the writing
     * thread picks it up.
     */
    private static class WindowTask implements Callable<WindowTask> {

        private final WorkItem item;
        private final DataType sourceType;
        private final ProcessingUnit unit;
        private final SlidingOptions options;
        private final WorkerReaders readers;

        // Written by the worker, then by the writing thread. Future.get() orders the handover.
        private WorkItemState state = WorkItemState.PENDING;
        private RasterBlock result;

        WindowTask (WorkItem item, DataType sourceType, ProcessingUnit unit, SlidingOptions options,
                    WorkerReaders readers) {
            this.item = item;
            this.sourceType = sourceType;
            this.unit = unit;
            this.options = options;
            this.readers = readers;
        }

        private void moveTo (WorkItemState next) {
            state = state.checkTransition(next);
        }

        @Override
        public WindowTask call () {
            SlidingWindow window = item.slidingWindow;
            try {
                moveTo(WorkItemState.READING);
                RasterBlock block = readers.get().read(item.sourceBands(), window.readWindow);
                block = options.padMode().pad(block, window.pad, sourceType);
                block = block.castTo(unit.processingType());
                moveTo(WorkItemState.COMPUTING);
                LOG.debug("Computing {}", item);
                RasterBlock computed = unit.compute(block);
                int rowOverlap = options.overlap();
                int colOverlap = options.overlap();
                result = computed.crop(rowOverlap, rowOverlap, colOverlap, colOverlap);
                checkState(result.height == window.writeWindow.height && result.width == window.writeWindow.width,
                        "Cropped result %s does not fit %s", result, window.writeWindow);
                return this;
            } catch (Exception e) {
                WorkItemState failedIn = state;
                state = WorkItemState.FAILED;
                throw new RasterProcessingException(String.format("Failed while %s %s: %s",
                        failedIn.name().toLowerCase(Locale.ROOT), item, ExceptionUtils.shortCauseString(e)), e);
            }
        }

        void write (RasterWriter writer) {
            moveTo(WorkItemState.WRITING);
            try {
                writer.write(item.outputBands(), item.slidingWindow.writeWindow, result);
            } catch (IOException | RuntimeException e) {
                state = WorkItemState.FAILED;
                throw new RasterProcessingException("Failed to write " + item, e);
            }
            result = null;
            moveTo(WorkItemState.DONE);
        }

    }

}
