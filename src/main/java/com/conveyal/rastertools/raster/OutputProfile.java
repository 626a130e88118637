package com.conveyal.rastertools.raster;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Everything needed to create an output raster before any pixel is written to it. A profile is fixed once the output
 * is created: instances are immutable, and the with* methods return modified copies.
 */
public class OutputProfile {

    public final int width;
    public final int height;
    public final int bandCount;
    public final DataType dataType;

    /** Nodata value of the output, or null if it has none. Masked pixels are written with this value. */
    public final Double nodata;

    /** Size of the internal storage blocks (or strips, when not tiled) of the output. */
    public final int blockWidth;
    public final int blockHeight;

    public final boolean tiled;

    public final Compression compression;

    public OutputProfile (int width, int height, int bandCount, DataType dataType, Double nodata,
                          int blockWidth, int blockHeight, boolean tiled, Compression compression) {
        checkArgument(width > 0 && height > 0, "Output size must be positive: %sx%s", width, height);
        checkArgument(bandCount > 0, "Output must have at least one band.");
        checkArgument(blockWidth > 0 && blockHeight > 0, "Block size must be positive: %sx%s", blockWidth, blockHeight);
        this.width = width;
        this.height = height;
        this.bandCount = bandCount;
        this.dataType = checkNotNull(dataType);
        this.nodata = nodata;
        this.blockWidth = blockWidth;
        this.blockHeight = blockHeight;
        this.tiled = tiled;
        this.compression = checkNotNull(compression);
    }

    /**
     * A profile describing an untiled, uncompressed raster with the same size, bands, type and nodata as the given
     * metadata. Untiled rasters are stored in strips one row high.
     */
    public static OutputProfile like (RasterMetadata metadata) {
        return new OutputProfile(metadata.width, metadata.height, metadata.bandCount, metadata.dataType,
                metadata.nodata, metadata.width, 1, false, Compression.NONE);
    }

    public OutputProfile withBlockSize (int blockWidth, int blockHeight, boolean tiled) {
        return new OutputProfile(width, height, bandCount, dataType, nodata, blockWidth, blockHeight, tiled, compression);
    }

    public OutputProfile withDataType (DataType dataType) {
        return new OutputProfile(width, height, bandCount, dataType, nodata, blockWidth, blockHeight, tiled, compression);
    }

    /** The metadata a reader of the raster created from this profile will report. */
    public RasterMetadata toMetadata () {
        return new RasterMetadata(width, height, bandCount, dataType, nodata);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutputProfile that = (OutputProfile) o;
        return width == that.width && height == that.height && bandCount == that.bandCount
                && blockWidth == that.blockWidth && blockHeight == that.blockHeight && tiled == that.tiled
                && dataType == that.dataType && Objects.equals(nodata, that.nodata) && compression == that.compression;
    }

    @Override
    public int hashCode () {
        return Objects.hash(width, height, bandCount, dataType, nodata, blockWidth, blockHeight, tiled, compression);
    }

    @Override
    public String toString () {
        return String.format("%dx%d, %d band(s) of %s, nodata %s, %s %dx%d, compression %s", width, height,
                bandCount, dataType, nodata, tiled ? "tiles" : "strips", blockWidth, blockHeight, compression);
    }

}
