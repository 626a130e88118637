package com.conveyal.rastertools.windows;

/**
 * A half-open range [min, max) along one axis of a raster, as produced by the WindowPlanner.
 * The range may start before zero or end beyond the raster dimension when a window is expanded by its overlap.
 */
public class Slice {

    public final int min;

    public final int max;

    public Slice (int min, int max) {
        this.min = min;
        this.max = max;
    }

    public int length () {
        return max - min;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Slice slice = (Slice) o;
        return min == slice.min && max == slice.max;
    }

    @Override
    public int hashCode () {
        return 31 * min + max;
    }

    @Override
    public String toString () {
        return "(" + min + ", " + max + ")";
    }

}
