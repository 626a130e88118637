package com.conveyal.rastertools.windows;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Number of pixels that must be synthesized before and after a clamped window along each axis, because the
 * unclamped window extended outside the raster. All four values are non-negative.
 */
public class PadSpec {

    public static final PadSpec NONE = new PadSpec(0, 0, 0, 0);

    public final int rowBefore;
    public final int rowAfter;
    public final int colBefore;
    public final int colAfter;

    public PadSpec (int rowBefore, int rowAfter, int colBefore, int colAfter) {
        checkArgument(rowBefore >= 0 && rowAfter >= 0 && colBefore >= 0 && colAfter >= 0,
                "Padding must not be negative.");
        this.rowBefore = rowBefore;
        this.rowAfter = rowAfter;
        this.colBefore = colBefore;
        this.colAfter = colAfter;
    }

    /**
     * Compute the padding needed for an unclamped window over a raster of the given size: the amount by which the
     * window extends past each edge.
     */
    public static PadSpec forWindow (Window unclamped, int rasterWidth, int rasterHeight) {
        return new PadSpec(
            Math.max(0, -unclamped.rowStart()),
            Math.max(0, unclamped.rowStop() - rasterHeight),
            Math.max(0, -unclamped.colStart()),
            Math.max(0, unclamped.colStop() - rasterWidth)
        );
    }

    public boolean isEmpty () {
        return rowBefore == 0 && rowAfter == 0 && colBefore == 0 && colAfter == 0;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PadSpec padSpec = (PadSpec) o;
        return rowBefore == padSpec.rowBefore && rowAfter == padSpec.rowAfter
                && colBefore == padSpec.colBefore && colAfter == padSpec.colAfter;
    }

    @Override
    public int hashCode () {
        return Arrays.hashCode(new int[] {rowBefore, rowAfter, colBefore, colAfter});
    }

    @Override
    public String toString () {
        return String.format("PadSpec[rows (%d, %d), cols (%d, %d)]", rowBefore, rowAfter, colBefore, colAfter);
    }

}
