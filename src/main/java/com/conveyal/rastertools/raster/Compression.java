package com.conveyal.rastertools.raster;

/**
 * Compression requested for an output raster. Whether a given compression is honored is up to the destination;
 * destinations that cannot apply it must refuse to create the raster rather than silently ignoring it.
 */
public enum Compression {
    NONE,
    LZW,
    DEFLATE
}
