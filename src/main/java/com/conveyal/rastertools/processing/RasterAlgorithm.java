package com.conveyal.rastertools.processing;

import com.conveyal.rastertools.raster.RasterBlock;

/**
 * A transformation applied to every window of a raster, such as a filter, a radiometric index or a terrain metric.
 * Implementations must return a block with the same height and width as their input, and the same number of bands.
 * The input includes the overlap and padding around the window; the engine crops the result afterward, so
 * implementations never need to know where the window lies in the raster.
 *
 * Implementations are called concurrently from several worker threads and must not keep mutable state between
 * calls. They may modify and return their input block, which is not used again by the caller.
 */
@FunctionalInterface
public interface RasterAlgorithm {

    RasterBlock compute (RasterBlock input, AlgorithmArguments arguments);

}
