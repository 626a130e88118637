package com.conveyal.rastertools.raster;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A block of pixel values with dimensions (bands, rows, columns), plus an optional mask flagging missing pixels.
 * This is what raster readers return for a window, what processing algorithms receive and return, and what writers
 * store. Values are kept as doubles whatever the storage type of the raster; see DataType for conversions.
 *
 * Storage is a single flat array, band-major then row-major (columns vary fastest). The mask has the same layout and
 * is null when no pixel is masked, so algorithms that don't care about missing data can ignore it entirely.
 *
 * Blocks are not threadsafe. Each block is created, filled and consumed by one worker at a time.
 */
public class RasterBlock {

    public final int bands;

    public final int height;

    public final int width;

    private final double[] values;

    /** True where the pixel is missing (nodata). Null if no pixel is masked. */
    private boolean[] mask;

    public RasterBlock (int bands, int height, int width) {
        this(bands, height, width, new double[checkedSize(bands, height, width)], null);
    }

    /** Wrap existing arrays without copying them. The mask may be null. */
    public RasterBlock (int bands, int height, int width, double[] values, boolean[] mask) {
        int size = checkedSize(bands, height, width);
        checkNotNull(values);
        checkArgument(values.length == size, "Expected %s values for %sx%sx%s block, got %s",
                size, bands, height, width, values.length);
        checkArgument(mask == null || mask.length == size, "Mask size does not match values.");
        this.bands = bands;
        this.height = height;
        this.width = width;
        this.values = values;
        this.mask = mask;
    }

    private static int checkedSize (int bands, int height, int width) {
        checkArgument(bands > 0 && height >= 0 && width >= 0, "Invalid block shape %sx%sx%s", bands, height, width);
        return Math.toIntExact((long) bands * height * width);
    }

    public int index (int band, int row, int col) {
        return (band * height + row) * width + col;
    }

    public double get (int band, int row, int col) {
        return values[index(band, row, col)];
    }

    public void set (int band, int row, int col, double value) {
        values[index(band, row, col)] = value;
    }

    public boolean hasMask () {
        return mask != null;
    }

    public boolean isMasked (int band, int row, int col) {
        return mask != null && mask[index(band, row, col)];
    }

    public void setMasked (int band, int row, int col, boolean masked) {
        if (mask == null) {
            if (!masked) return;
            mask = new boolean[values.length];
        }
        mask[index(band, row, col)] = masked;
    }

    /** The backing array of values. Changes to the returned array are visible in this block. */
    public double[] values () {
        return values;
    }

    /** The backing mask array, or null if no pixel is masked. */
    public boolean[] mask () {
        return mask;
    }

    /**
     * Mask every pixel equal to the given nodata value. Does nothing if nodata is null.
     * NaN nodata values mask NaN pixels.
     */
    public void maskNodata (Double nodata) {
        if (nodata == null) return;
        double nd = nodata;
        for (int i = 0; i < values.length; i++) {
            if (values[i] == nd || (Double.isNaN(nd) && Double.isNaN(values[i]))) {
                if (mask == null) mask = new boolean[values.length];
                mask[i] = true;
            }
        }
    }

    /**
     * @return a new block without the given number of pixels on each side.
     */
    public RasterBlock crop (int top, int bottom, int left, int right) {
        checkArgument(top >= 0 && bottom >= 0 && left >= 0 && right >= 0, "Crop margins must not be negative.");
        checkArgument(top + bottom <= height && left + right <= width,
                "Cannot crop (%s, %s, %s, %s) from a %sx%s block.", top, bottom, left, right, width, height);
        if (top == 0 && bottom == 0 && left == 0 && right == 0) {
            return this;
        }
        int newHeight = height - top - bottom;
        int newWidth = width - left - right;
        RasterBlock cropped = new RasterBlock(bands, newHeight, newWidth);
        if (mask != null) cropped.mask = new boolean[cropped.values.length];
        for (int b = 0; b < bands; b++) {
            for (int r = 0; r < newHeight; r++) {
                int from = index(b, r + top, left);
                int to = cropped.index(b, r, 0);
                System.arraycopy(values, from, cropped.values, to, newWidth);
                if (mask != null) System.arraycopy(mask, from, cropped.mask, to, newWidth);
            }
        }
        return cropped;
    }

    /** @return a new single-band block containing a copy of the given zero-based band. */
    public RasterBlock band (int band) {
        checkElementIndex(band, bands, "band");
        int bandSize = height * width;
        RasterBlock single = new RasterBlock(1, height, width);
        System.arraycopy(values, band * bandSize, single.values, 0, bandSize);
        if (mask != null) {
            single.mask = Arrays.copyOfRange(mask, band * bandSize, (band + 1) * bandSize);
        }
        return single;
    }

    /** @return a new block with every value cast to the given data type. The mask is carried over. */
    public RasterBlock castTo (DataType dataType) {
        double[] cast = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            cast[i] = dataType.cast(values[i]);
        }
        return new RasterBlock(bands, height, width, cast, mask == null ? null : mask.clone());
    }

    public RasterBlock copy () {
        return new RasterBlock(bands, height, width, values.clone(), mask == null ? null : mask.clone());
    }

    public boolean sameShape (RasterBlock other) {
        return bands == other.bands && height == other.height && width == other.width;
    }

    @Override
    public String toString () {
        return String.format("RasterBlock[%d band(s), %dx%d%s]", bands, width, height, mask == null ? "" : ", masked");
    }

}
