package com.conveyal.rastertools.filters;

import com.conveyal.rastertools.processing.AlgorithmArguments;
import com.conveyal.rastertools.raster.RasterBlock;

import java.util.Arrays;

/**
 * Replaces each pixel by the median of the valid pixels of the kernel around it. Even counts take the upper of the two
 * middle values rather than their mean, so the result is always one of the input values. Beyond the block edges the
 * kernel is mirrored back into the block. A pixel whose kernel has no valid pixel is masked.
 *
 * Even kernels are centered with the extra pixel before the center, so a kernel of 8 spans 4 pixels before and 3 after.
 */
public class MedianFilter extends KernelFilter {

    @Override
    public String name () {
        return "median";
    }

    @Override
    protected RasterBlock filter (RasterBlock input, int kernelSize, AlgorithmArguments arguments) {
        RasterBlock output = new RasterBlock(input.bands, input.height, input.width);
        int before = kernelSize / 2;
        double[] kernel = new double[kernelSize * kernelSize];
        for (int b = 0; b < input.bands; b++) {
            for (int r = 0; r < input.height; r++) {
                for (int c = 0; c < input.width; c++) {
                    int count = 0;
                    for (int kr = r - before; kr < r - before + kernelSize; kr++) {
                        int sr = mirror(kr, input.height);
                        for (int kc = c - before; kc < c - before + kernelSize; kc++) {
                            int sc = mirror(kc, input.width);
                            if (!input.isMasked(b, sr, sc)) {
                                kernel[count++] = input.get(b, sr, sc);
                            }
                        }
                    }
                    if (count == 0) {
                        output.setMasked(b, r, c, true);
                    } else {
                        Arrays.sort(kernel, 0, count);
                        output.set(b, r, c, kernel[count / 2]);
                    }
                }
            }
        }
        return output;
    }

    /** Mirror an index into [0, length), repeating the edge pixel: -1 maps to 0, length maps to length - 1. */
    static int mirror (int i, int length) {
        int period = 2 * length;
        int m = Math.floorMod(i, period);
        return m < length ? m : period - 1 - m;
    }

}
