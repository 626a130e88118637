package com.conveyal.rastertools.filters;

import com.conveyal.rastertools.processing.AlgorithmArguments;
import com.conveyal.rastertools.raster.RasterBlock;

/**
 * Replaces each pixel by the sum of the kernel around it, computed from an integral image so the cost does not depend
 * on the kernel size. Masked and NaN pixels count as zero.
 *
 * A kernel of k pixels spans (k - 1) / 2 pixels before the center and k / 2 after it. The first (k + 1) / 2 rows and
 * columns of the block and the last k / 2 are set to zero. A kernel of 1 returns a copy of the input.
 */
public class LocalSumFilter extends KernelFilter {

    @Override
    public String name () {
        return "sum";
    }

    @Override
    protected RasterBlock filter (RasterBlock input, int kernelSize, AlgorithmArguments arguments) {
        if (kernelSize == 1) {
            return input.copy();
        }
        RasterBlock output = new RasterBlock(input.bands, input.height, input.width);
        for (int b = 0; b < input.bands; b++) {
            double[] sums = localSums(input, b, kernelSize, false);
            System.arraycopy(sums, 0, output.values(), output.index(b, 0, 0), sums.length);
        }
        return output;
    }

    /**
     * Kernel sums over one band of the block, row-major, zero in the border rows and columns.
     * @param countValid if true, sum ones for unmasked pixels instead of the pixel values, giving valid pixel counts.
     */
    static double[] localSums (RasterBlock block, int band, int kernelSize, boolean countValid) {
        int height = block.height;
        int width = block.width;
        // Integral image with an extra leading row and column of zeros: integral[r][c] is the sum of all pixels
        // above and left of (r, c), exclusive.
        double[][] integral = new double[height + 1][width + 1];
        for (int r = 0; r < height; r++) {
            double rowSum = 0;
            for (int c = 0; c < width; c++) {
                double value;
                if (countValid) {
                    value = block.isMasked(band, r, c) ? 0 : 1;
                } else {
                    value = block.get(band, r, c);
                    if (block.isMasked(band, r, c) || Double.isNaN(value)) value = 0;
                }
                rowSum += value;
                integral[r + 1][c + 1] = integral[r][c + 1] + rowSum;
            }
        }
        double[] sums = new double[height * width];
        int before = (kernelSize - 1) / 2;
        int after = kernelSize - 1 - before;
        for (int r = before + 1; r < height - after; r++) {
            for (int c = before + 1; c < width - after; c++) {
                int top = r - before;
                int left = c - before;
                int bottom = r + after + 1;
                int right = c + after + 1;
                sums[r * width + c] = integral[bottom][right] - integral[top][right]
                        - integral[bottom][left] + integral[top][left];
            }
        }
        return sums;
    }

}
