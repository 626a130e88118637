package com.conveyal.rastertools.filters;

import com.conveyal.rastertools.processing.AlgorithmArguments;
import com.conveyal.rastertools.processing.ProcessingMode;
import com.conveyal.rastertools.processing.ProcessingUnit;
import com.conveyal.rastertools.raster.RasterBlock;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Edge-preserving smoothing: each interior pixel is repeatedly replaced by a weighted mean of its 3x3 neighborhood,
 * where the weight of a pixel falls off with the local gradient (a Gaussian of standard deviation sigma). The kernel
 * size is the number of iterations. The outermost rows and columns of the block are left unchanged.
 *
 * Works on one band at a time.
 */
public class AdaptiveGaussianFilter extends KernelFilter {

    public static final String SIGMA = "sigma";

    public static final double DEFAULT_SIGMA = 1;

    /** Machine epsilon of float32, added to the weight sums to avoid dividing by zero. */
    private static final double EPSILON = Math.ulp(1.0f);

    @Override
    public String name () {
        return "adaptive_gaussian";
    }

    @Override
    protected ProcessingMode mode () {
        return ProcessingMode.PER_BAND;
    }

    @Override
    protected void declareArguments (ProcessingUnit unit) {
        unit.withArgument(SIGMA, DEFAULT_SIGMA);
    }

    @Override
    protected RasterBlock filter (RasterBlock input, int iterations, AlgorithmArguments arguments) {
        checkArgument(input.bands == 1, "The adaptive gaussian filter works on one band at a time, got %s",
                input.bands);
        double sigma = arguments.getDouble(SIGMA, DEFAULT_SIGMA);
        checkArgument(sigma > 0, "Sigma must be positive, got %s", sigma);
        RasterBlock output = input.copy();
        int height = input.height - 2;
        int width = input.width - 2;
        if (height <= 0 || width <= 0) {
            return output;
        }
        // Weights of the interior pixels, from the squared differences of their horizontal and vertical neighbors.
        double[] weights = new double[height * width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                double dx = input.get(0, r + 1, c) - input.get(0, r + 1, c + 2);
                double dy = input.get(0, r, c + 1) - input.get(0, r + 2, c + 1);
                weights[r * width + c] = Math.exp(-(dx * dx + dy * dy) / (2 * sigma * sigma));
            }
        }
        double[] weightSums = boxSum(weights, height, width);
        for (int i = 0; i < weightSums.length; i++) {
            weightSums[i] += EPSILON;
        }
        double[] product = new double[height * width];
        for (int iteration = 0; iteration < iterations; iteration++) {
            for (int r = 0; r < height; r++) {
                for (int c = 0; c < width; c++) {
                    product[r * width + c] = weights[r * width + c] * output.get(0, r + 1, c + 1);
                }
            }
            double[] sums = boxSum(product, height, width);
            for (int r = 0; r < height; r++) {
                for (int c = 0; c < width; c++) {
                    output.set(0, r + 1, c + 1, sums[r * width + c] / weightSums[r * width + c]);
                }
            }
        }
        return output;
    }

    /** Sums over the 3x3 neighborhood of each value, mirroring the edge values past the borders. */
    private static double[] boxSum (double[] values, int height, int width) {
        double[] sums = new double[values.length];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                double sum = 0;
                for (int dr = -1; dr <= 1; dr++) {
                    int sr = MedianFilter.mirror(r + dr, height);
                    for (int dc = -1; dc <= 1; dc++) {
                        sum += values[sr * width + MedianFilter.mirror(c + dc, width)];
                    }
                }
                sums[r * width + c] = sum;
            }
        }
        return sums;
    }

}
