package com.conveyal.rastertools;

/**
 * Signals that a processing run was set up with options that cannot work: band numbers outside the source raster,
 * an overlap too large for the window size, an output that cannot be created, unparseable configuration properties.
 * These are always detected before any window is processed, and are never corrected automatically.
 */
public class RasterConfigurationException extends RuntimeException {

    public RasterConfigurationException (String message) {
        super(message);
    }

    public RasterConfigurationException (String message, Throwable cause) {
        super(message, cause);
    }

}
