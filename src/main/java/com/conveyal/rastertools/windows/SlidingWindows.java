package com.conveyal.rastertools.windows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import java.util.Iterator;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Generates the sliding windows needed to process an image of a given size in tiles of a given size, where each tile
 * is read with some overlap around it to give spatially-aware algorithms enough context.
 *
 * <pre>
 * (-o,-o)
 *    |-----------|      ...      ---------|
 *    | (0,0)     |                        |
 *    |   ********|**********************  |
 *    |   *       |                     *  |
 *    |-----------|               ---------|
 *        *                             *
 *    |   *       |                     *  |
 *    |   ********|**********************  |
 *    |           |                   (w,h)|
 *    |-----------|     ...       ---------|
 *                                      (w+o,h+o)
 * </pre>
 *
 * The first raw window starts at (-overlap, -overlap) and the last one ends at (width + overlap, height + overlap).
 * Consecutive raw windows are shifted by (tile size - 2 * overlap), so once each raw window is shrunk by the overlap
 * on every side the resulting write windows tile the image exactly, with no gaps and no overlaps. The read window is
 * the raw window clamped to the image, and the pad is whatever was clamped away.
 *
 * Instances are immutable and the generated sequence is restartable. The order of the windows carries no meaning:
 * any permutation of them produces the same output raster.
 */
public class SlidingWindows implements Iterable<SlidingWindow> {

    public final int imageWidth;
    public final int imageHeight;
    public final int windowWidth;
    public final int windowHeight;
    public final int colOverlap;
    public final int rowOverlap;

    public SlidingWindows (int imageWidth, int imageHeight, int windowWidth, int windowHeight,
                           int colOverlap, int rowOverlap) {
        checkArgument(imageWidth > 0 && imageHeight > 0, "Image size must be positive: %sx%s", imageWidth, imageHeight);
        checkArgument(windowWidth > 0 && windowHeight > 0, "Window size must be positive: %sx%s", windowWidth, windowHeight);
        checkArgument(colOverlap >= 0 && rowOverlap >= 0, "Overlap must not be negative.");
        checkArgument(2 * colOverlap < windowWidth && 2 * rowOverlap < windowHeight,
                "Overlap (%s, %s) must be less than half of the window size (%s, %s).",
                colOverlap, rowOverlap, windowWidth, windowHeight);
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.windowWidth = windowWidth;
        this.windowHeight = windowHeight;
        this.colOverlap = colOverlap;
        this.rowOverlap = rowOverlap;
    }

    /** Square windows with the same overlap along both axes. */
    public SlidingWindows (int imageWidth, int imageHeight, int windowSize, int overlap) {
        this(imageWidth, imageHeight, windowSize, windowSize, overlap, overlap);
    }

    private int[] windowSize () {
        return new int[] {windowWidth, windowHeight};
    }

    private int[] shift () {
        return new int[] {windowWidth - 2 * colOverlap, windowHeight - 2 * rowOverlap};
    }

    private int[] stop () {
        return new int[] {imageWidth + colOverlap, imageHeight + rowOverlap};
    }

    private int[] start () {
        return new int[] {-colOverlap, -rowOverlap};
    }

    @Override
    public Iterator<SlidingWindow> iterator () {
        Iterable<Window> raw = WindowPlanner.slices2d(windowSize(), shift(), stop(), start());
        return Iterables.transform(raw, this::toSlidingWindow).iterator();
    }

    /** @return the number of windows this generator yields, without generating them. */
    public int size () {
        return WindowPlanner.windowCount(windowSize(), shift(), stop(), start());
    }

    /** Materialize all the windows in an immutable list. This is cheap: windows are only metadata. */
    public List<SlidingWindow> toList () {
        return ImmutableList.copyOf(this);
    }

    /**
     * Derive the read window, padding and write window from one raw (unclamped) window.
     * A write window falling outside the image would mean the arithmetic above is broken, not that the caller
     * supplied bad arguments, so it is reported as an illegal state.
     */
    private SlidingWindow toSlidingWindow (Window raw) {
        PadSpec pad = PadSpec.forWindow(raw, imageWidth, imageHeight);
        Window readWindow = raw.clampTo(imageWidth, imageHeight);
        Window writeWindow = raw.shrink(rowOverlap, colOverlap);
        checkState(writeWindow.isWithin(imageWidth, imageHeight),
                "Generated write window %s lies outside the %sx%s image.", writeWindow, imageWidth, imageHeight);
        return new SlidingWindow(readWindow, pad, writeWindow);
    }

}
