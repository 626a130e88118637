package com.conveyal.rastertools.processing;

import com.conveyal.rastertools.progress.ProgressListener;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * How a raster is cut into windows and processed: window size, overlap between windows, padding at the raster edges,
 * the bands to process and the number of workers. Values are only checked when a run starts, so that all problems are
 * reported as configuration errors of that run.
 */
public class SlidingOptions {

    public static final int DEFAULT_WINDOW_SIZE = 1024;

    private int windowWidth = DEFAULT_WINDOW_SIZE;
    private int windowHeight = DEFAULT_WINDOW_SIZE;
    private int overlap = 0;
    private PadMode padMode = PadMode.EDGE;
    private int[] bands = new int[0];
    private Integer workers;
    private ProgressListener progressListener;

    public static SlidingOptions defaults () {
        return new SlidingOptions();
    }

    /** Square windows of the given size. */
    public SlidingOptions windowSize (int size) {
        return windowSize(size, size);
    }

    public SlidingOptions windowSize (int width, int height) {
        this.windowWidth = width;
        this.windowHeight = height;
        return this;
    }

    /** Number of pixels each window shares with its neighbors on every side. */
    public SlidingOptions overlap (int overlap) {
        this.overlap = overlap;
        return this;
    }

    public SlidingOptions padMode (PadMode padMode) {
        this.padMode = checkNotNull(padMode);
        return this;
    }

    /** One-based numbers of the bands to process, in output order. No bands means all bands of the source. */
    public SlidingOptions bands (int... bands) {
        this.bands = checkNotNull(bands).clone();
        return this;
    }

    /** Number of worker threads, or null to use the configured maximum. */
    public SlidingOptions workers (Integer workers) {
        this.workers = workers;
        return this;
    }

    /** Listener receiving progress, or null to choose one according to the configuration. */
    public SlidingOptions progressListener (ProgressListener progressListener) {
        this.progressListener = progressListener;
        return this;
    }

    public int windowWidth () {
        return windowWidth;
    }

    public int windowHeight () {
        return windowHeight;
    }

    public int overlap () {
        return overlap;
    }

    public PadMode padMode () {
        return padMode;
    }

    public int[] bands () {
        return bands.clone();
    }

    public Integer workers () {
        return workers;
    }

    public ProgressListener progressListener () {
        return progressListener;
    }

    @Override
    public String toString () {
        return String.format("window %dx%d, overlap %d, %s padding, bands %s, workers %s", windowWidth, windowHeight,
                overlap, padMode, bands.length == 0 ? "all" : Arrays.toString(bands),
                workers == null ? "default" : workers);
    }

}
