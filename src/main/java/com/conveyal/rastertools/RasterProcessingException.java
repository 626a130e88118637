package com.conveyal.rastertools;

/**
 * Signals that reading, computing or writing one window failed while a raster was being processed. The whole run is
 * aborted when this happens, and the partially written output should be discarded by the caller.
 */
public class RasterProcessingException extends RuntimeException {

    public RasterProcessingException (String message) {
        super(message);
    }

    public RasterProcessingException (String message, Throwable cause) {
        super(message, cause);
    }

}
