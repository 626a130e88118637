package com.conveyal.rastertools.raster;

import java.io.IOException;

/**
 * Somewhere an output raster can be created. Creation happens once, before any pixel is processed, and yields the
 * single writer through which every window of the output is then written.
 */
public interface RasterDestination {

    /**
     * Create an empty raster with the given profile, replacing any existing raster at this destination.
     * @throws com.conveyal.rastertools.RasterConfigurationException if the profile cannot be honored here.
     */
    RasterWriter create (OutputProfile profile) throws IOException;

    /**
     * Check that an output could be created here, without creating it.
     * @throws com.conveyal.rastertools.RasterConfigurationException if it cannot.
     */
    default void checkWritable () { }

    /** Short human readable name of this destination for log messages. */
    String describe ();

}
