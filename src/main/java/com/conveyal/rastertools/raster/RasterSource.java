package com.conveyal.rastertools.raster;

import java.io.IOException;

/**
 * A raster that can be read concurrently. Rather than sharing one handle between threads, each reading thread opens
 * its own RasterReader, so reads need no coordination.
 */
public interface RasterSource {

    RasterReader openReader () throws IOException;

    /** Short human readable name of this source for log messages. */
    String describe ();

}
