package com.conveyal.rastertools.filters;

import com.conveyal.rastertools.processing.AlgorithmArguments;
import com.conveyal.rastertools.processing.ProcessingMode;
import com.conveyal.rastertools.processing.ProcessingUnit;
import com.conveyal.rastertools.processing.RasterAlgorithm;
import com.conveyal.rastertools.raster.DataType;
import com.conveyal.rastertools.raster.RasterBlock;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A filter computing each output pixel from a square kernel of input pixels around it. The kernel size is an argument
 * of the processing unit, so the same filter can be run with different kernels.
 *
 * Pixels closer to the block edge than the kernel reaches are not meaningful. Filtering sets the window overlap so
 * that those pixels always fall in the cropped overlap.
 */
public abstract class KernelFilter implements RasterAlgorithm {

    public static final String KERNEL_SIZE = "kernel_size";

    public static final int DEFAULT_KERNEL_SIZE = 8;

    /** Nodata value of filtered rasters. */
    public static final double DEFAULT_NODATA = -2;

    /** Short name of the filter, used in output file names. */
    public abstract String name ();

    /** Whether the filter must see bands one at a time. */
    protected ProcessingMode mode () {
        return ProcessingMode.WHOLE_STACK;
    }

    /** Declare any argument other than the kernel size on the unit. */
    protected void declareArguments (ProcessingUnit unit) { }

    @Override
    public RasterBlock compute (RasterBlock input, AlgorithmArguments arguments) {
        int kernelSize = arguments.getInt(KERNEL_SIZE, DEFAULT_KERNEL_SIZE);
        checkArgument(kernelSize >= 1, "Kernel size must be at least 1, got %s", kernelSize);
        return filter(input, kernelSize, arguments);
    }

    protected abstract RasterBlock filter (RasterBlock input, int kernelSize, AlgorithmArguments arguments);

    /** A new processing unit running this filter, writing float32 output with the default nodata value. */
    public ProcessingUnit toProcessingUnit () {
        ProcessingUnit unit = ProcessingUnit.create(name())
                .withAlgorithm(this)
                .withOutputType(DataType.FLOAT32)
                .withNodata(DEFAULT_NODATA)
                .withMode(mode())
                .withArgument(KERNEL_SIZE, DEFAULT_KERNEL_SIZE);
        declareArguments(unit);
        return unit;
    }

    @Override
    public String toString () {
        return name() + " filter";
    }

}
