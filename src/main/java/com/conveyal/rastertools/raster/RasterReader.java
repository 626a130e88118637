package com.conveyal.rastertools.raster;

import com.conveyal.rastertools.windows.Window;

import java.io.Closeable;
import java.io.IOException;

/**
 * One open handle on a readable raster. Implementations are not required to be threadsafe.
 */
public interface RasterReader extends Closeable {

    RasterMetadata metadata ();

    /**
     * Read the given one-based bands within a window that must lie entirely inside the raster.
     * Pixels equal to the raster's nodata value are masked in the returned block.
     */
    RasterBlock read (int[] bands, Window window) throws IOException;

}
