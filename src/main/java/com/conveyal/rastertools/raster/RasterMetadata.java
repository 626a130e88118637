package com.conveyal.rastertools.raster;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The properties of a readable raster that the processing engine relies on: its size, number of bands, pixel type
 * and optional nodata value. Band numbers are one-based throughout, as in most GIS tools.
 */
public class RasterMetadata {

    public final int width;

    public final int height;

    public final int bandCount;

    public final DataType dataType;

    /** The value marking missing pixels, or null if the raster has no nodata value. */
    public final Double nodata;

    public RasterMetadata (int width, int height, int bandCount, DataType dataType, Double nodata) {
        checkArgument(width > 0 && height > 0, "Raster size must be positive: %sx%s", width, height);
        checkArgument(bandCount > 0, "Raster must have at least one band.");
        this.width = width;
        this.height = height;
        this.bandCount = bandCount;
        this.dataType = checkNotNull(dataType);
        this.nodata = nodata;
    }

    public boolean hasNodata () {
        return nodata != null;
    }

    /** @return true if the one-based band number exists in this raster. */
    public boolean hasBand (int band) {
        return band >= 1 && band <= bandCount;
    }

    /** @return the one-based numbers of all bands of this raster. */
    public int[] allBands () {
        int[] bands = new int[bandCount];
        for (int b = 0; b < bandCount; b++) {
            bands[b] = b + 1;
        }
        return bands;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RasterMetadata that = (RasterMetadata) o;
        return width == that.width && height == that.height && bandCount == that.bandCount
                && dataType == that.dataType && Objects.equals(nodata, that.nodata);
    }

    @Override
    public int hashCode () {
        return Objects.hash(width, height, bandCount, dataType, nodata);
    }

    @Override
    public String toString () {
        return String.format("%dx%d, %d band(s) of %s, nodata %s", width, height, bandCount, dataType, nodata);
    }

}
