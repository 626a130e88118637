package com.conveyal.rastertools.windows;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A rectangle in raster pixel space, addressed by the offset of its upper left pixel and its size.
 * Rows increase downward and columns increase to the right. Equals and hashcode are semantic.
 *
 * Windows produced by the SlidingWindows generator may temporarily lie partly outside the raster (before clamping),
 * so negative offsets are allowed here. Only sizes must be non-negative.
 */
public class Window {

    public final int rowOffset;

    public final int colOffset;

    public final int height;

    public final int width;

    public Window (int rowOffset, int colOffset, int height, int width) {
        checkArgument(height >= 0 && width >= 0, "Window size must not be negative: %sx%s", width, height);
        this.rowOffset = rowOffset;
        this.colOffset = colOffset;
        this.height = height;
        this.width = width;
    }

    /** Build a window from half-open row and column ranges, [rowStart, rowStop) x [colStart, colStop). */
    public static Window fromBounds (int rowStart, int rowStop, int colStart, int colStop) {
        return new Window(rowStart, colStart, rowStop - rowStart, colStop - colStart);
    }

    public static Window fromSlices (Slice rows, Slice cols) {
        return fromBounds(rows.min, rows.max, cols.min, cols.max);
    }

    public int rowStart () {
        return rowOffset;
    }

    public int rowStop () {
        return rowOffset + height;
    }

    public int colStart () {
        return colOffset;
    }

    public int colStop () {
        return colOffset + width;
    }

    public long pixelCount () {
        return (long) width * height;
    }

    /** @return a new window clamped to [0, width) x [0, height) of a raster. */
    public Window clampTo (int rasterWidth, int rasterHeight) {
        return fromBounds(
            Math.max(0, rowStart()), Math.min(rasterHeight, rowStop()),
            Math.max(0, colStart()), Math.min(rasterWidth, colStop())
        );
    }

    /** @return a new window with the given number of pixels removed from each side. */
    public Window shrink (int rowMargin, int colMargin) {
        return fromBounds(rowStart() + rowMargin, rowStop() - rowMargin, colStart() + colMargin, colStop() - colMargin);
    }

    /** @return true if this window lies entirely within [0, width) x [0, height) of a raster. */
    public boolean isWithin (int rasterWidth, int rasterHeight) {
        return rowStart() >= 0 && colStart() >= 0 && rowStop() <= rasterHeight && colStop() <= rasterWidth;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Window window = (Window) o;
        return rowOffset == window.rowOffset && colOffset == window.colOffset
                && height == window.height && width == window.width;
    }

    @Override
    public int hashCode () {
        return Arrays.hashCode(new int[] {rowOffset, colOffset, height, width});
    }

    @Override
    public String toString () {
        return String.format("Window[rows %d-%d, cols %d-%d]", rowStart(), rowStop(), colStart(), colStop());
    }

}
