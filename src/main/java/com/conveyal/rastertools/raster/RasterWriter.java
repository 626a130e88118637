package com.conveyal.rastertools.raster;

import com.conveyal.rastertools.windows.Window;

import java.io.Closeable;
import java.io.IOException;

/**
 * The write handle on an output raster. It is only ever used by one thread at a time.
 */
public interface RasterWriter extends Closeable {

    OutputProfile profile ();

    /**
     * Write a block into the given one-based output bands at the given window. The block must have one band per
     * output band and the same size as the window. Masked pixels are written as the profile's nodata value when it
     * has one, otherwise their underlying value is written.
     */
    void write (int[] bands, Window window, RasterBlock block) throws IOException;

}
