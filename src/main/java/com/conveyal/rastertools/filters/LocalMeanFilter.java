package com.conveyal.rastertools.filters;

import com.conveyal.rastertools.processing.AlgorithmArguments;
import com.conveyal.rastertools.raster.RasterBlock;

/**
 * Replaces each pixel by the mean of the valid pixels of the kernel around it, using the same integral image sums and
 * kernel placement as LocalSumFilter. Pixels with no valid pixel in their kernel, including the border rows and
 * columns of the block, are set to zero.
 */
public class LocalMeanFilter extends KernelFilter {

    @Override
    public String name () {
        return "mean";
    }

    @Override
    protected RasterBlock filter (RasterBlock input, int kernelSize, AlgorithmArguments arguments) {
        if (kernelSize == 1) {
            return input.copy();
        }
        RasterBlock output = new RasterBlock(input.bands, input.height, input.width);
        double fullKernel = (double) kernelSize * kernelSize;
        for (int b = 0; b < input.bands; b++) {
            double[] sums = LocalSumFilter.localSums(input, b, kernelSize, false);
            double[] counts = input.hasMask() ? LocalSumFilter.localSums(input, b, kernelSize, true) : null;
            int offset = output.index(b, 0, 0);
            for (int i = 0; i < sums.length; i++) {
                double valid = counts == null ? fullKernel : counts[i];
                output.values()[offset + i] = valid == 0 ? 0 : sums[i] / valid;
            }
        }
        return output;
    }

}
