package com.conveyal.rastertools.windows;

import com.google.common.collect.AbstractIterator;

import java.util.Iterator;
import java.util.NoSuchElementException;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Pure arithmetic for partitioning raster extents into (possibly overlapping) ranges along one or two axes.
 * All sequences returned here are lazy and restartable: each call to iterator() starts again from the first range.
 *
 * Two-dimensional arguments are given in (columns, rows) order, i.e. (x, y), matching the way window and image sizes
 * are usually stated as width by height. Results are iterated in row-major order.
 */
public abstract class WindowPlanner {

    /**
     * Produce the sequence of 1D windows covering [start, stop). Window i is
     * (start + i * shift, min(start + windowWidth + i * shift, stop)). The last window always ends exactly at stop,
     * so it may be narrower than windowWidth.
     *
     * @param windowWidth the width of each window
     * @param shift distance between the starts of two consecutive windows, must be positive
     * @param stop the exclusive end of the covered range
     * @param start the inclusive start of the covered range, which may be negative
     */
    public static Iterable<Slice> slices1d (int windowWidth, int shift, int stop, int start) {
        checkArgument(shift > 0, "Shift between windows must be positive, was %s.", shift);
        final int count = sliceCount(windowWidth, shift, stop, start);
        return () -> new Iterator<Slice>() {
            private int i = 0;

            @Override
            public boolean hasNext () {
                return i < count;
            }

            @Override
            public Slice next () {
                if (!hasNext()) throw new NoSuchElementException();
                int min = start + i * shift;
                int max = Math.min(start + windowWidth + i * shift, stop);
                i += 1;
                return new Slice(min, max);
            }
        };
    }

    public static Iterable<Slice> slices1d (int windowWidth, int shift, int stop) {
        return slices1d(windowWidth, shift, stop, 0);
    }

    /**
     * The number of windows produced by slices1d: ceil(1 + max(0, stop - start - windowWidth) / shift),
     * evaluated in integer arithmetic.
     */
    public static int sliceCount (int windowWidth, int shift, int stop, int start) {
        checkArgument(shift > 0, "Shift between windows must be positive, was %s.", shift);
        long remainder = Math.max(0L, (long) stop - start - windowWidth);
        return Math.toIntExact(1 + (remainder + shift - 1) / shift);
    }

    /**
     * The row-major cross product of one slices1d sequence per axis: for each row range, every column range.
     * Each element is returned as a Window spanning (rowMin, rowMax, colMin, colMax).
     * The shift must not exceed the window size by more than the remaining extent, otherwise the last range of an
     * axis would be inverted and no window could represent it.
     *
     * @param windowSize window (width, height)
     * @param shift shift between windows along (columns, rows)
     * @param stop exclusive end along (columns, rows)
     * @param start inclusive start along (columns, rows)
     */
    public static Iterable<Window> slices2d (int[] windowSize, int[] shift, int[] stop, int[] start) {
        checkPair(windowSize, "windowSize");
        checkPair(shift, "shift");
        checkPair(stop, "stop");
        checkPair(start, "start");
        final Iterable<Slice> cols = slices1d(windowSize[0], shift[0], stop[0], start[0]);
        final Iterable<Slice> rows = slices1d(windowSize[1], shift[1], stop[1], start[1]);
        return () -> new AbstractIterator<Window>() {
            private final Iterator<Slice> rowIterator = rows.iterator();
            private Iterator<Slice> colIterator = null;
            private Slice currentRow = null;

            @Override
            protected Window computeNext () {
                while (colIterator == null || !colIterator.hasNext()) {
                    if (!rowIterator.hasNext()) {
                        return endOfData();
                    }
                    currentRow = rowIterator.next();
                    colIterator = cols.iterator();
                }
                return Window.fromSlices(currentRow, colIterator.next());
            }
        };
    }

    /** Convenience version of slices2d applying the same values to both axes, starting at zero. */
    public static Iterable<Window> slices2d (int windowSize, int shift, int stop) {
        return slices2d(pair(windowSize), pair(shift), pair(stop), pair(0));
    }

    /** Total number of windows produced by slices2d with the same arguments. */
    public static int windowCount (int[] windowSize, int[] shift, int[] stop, int[] start) {
        return Math.multiplyExact(
            sliceCount(windowSize[0], shift[0], stop[0], start[0]),
            sliceCount(windowSize[1], shift[1], stop[1], start[1])
        );
    }

    /** @return a two-element array with the same value for both axes. */
    public static int[] pair (int value) {
        return new int[] {value, value};
    }

    private static void checkPair (int[] values, String name) {
        checkArgument(values != null && values.length == 2, "%s must have exactly two values (columns, rows).", name);
    }

}
