package com.conveyal.rastertools.filters;

import com.conveyal.rastertools.RasterConfigurationException;
import com.conveyal.rastertools.RasterToolsConfig;
import com.conveyal.rastertools.processing.PadMode;
import com.conveyal.rastertools.processing.ProcessingUnit;
import com.conveyal.rastertools.processing.SlidingOptions;
import com.conveyal.rastertools.processing.SlidingWindowProcessor;
import com.conveyal.rastertools.raster.GridRasterFile;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Applies a kernel filter to grid raster files, one output file per input named after the input and the filter.
 * Windows overlap by (kernel size + 1) / 2 pixels, so that every written pixel was computed from a full kernel of
 * real or padded data.
 */
public class Filtering {

    private static final Logger LOG = LoggerFactory.getLogger(Filtering.class);

    private final ProcessingUnit unit;

    private final int kernelSize;

    private final int[] bands;

    private final RasterToolsConfig config;

    private int windowWidth = SlidingOptions.DEFAULT_WINDOW_SIZE;

    private int windowHeight = SlidingOptions.DEFAULT_WINDOW_SIZE;

    private PadMode padMode = PadMode.EDGE;

    /** Filter only the first band. */
    public Filtering (KernelFilter filter, int kernelSize) {
        this(filter, kernelSize, new int[] {1}, RasterToolsConfig.fromEnvironment());
    }

    /**
     * @param bands one-based numbers of the bands to filter; none means all bands.
     */
    public Filtering (KernelFilter filter, int kernelSize, int[] bands, RasterToolsConfig config) {
        if (kernelSize < 1) {
            throw new RasterConfigurationException("Kernel size must be at least 1, got " + kernelSize);
        }
        this.unit = filter.toProcessingUnit();
        this.unit.configure(ImmutableMap.of(KernelFilter.KERNEL_SIZE, kernelSize));
        this.kernelSize = kernelSize;
        this.bands = bands.clone();
        this.config = checkNotNull(config);
    }

    /** The filters available out of the box. */
    public static List<KernelFilter> defaultFilters () {
        return ImmutableList.of(new MedianFilter(), new LocalSumFilter(), new LocalMeanFilter(),
                new AdaptiveGaussianFilter());
    }

    /** Find one of the default filters by name. */
    public static KernelFilter filterNamed (String name) {
        for (KernelFilter filter : defaultFilters()) {
            if (filter.name().equals(name)) return filter;
        }
        throw new RasterConfigurationException("Unknown filter: " + name);
    }

    public Filtering withWindowSize (int windowWidth, int windowHeight) {
        this.windowWidth = windowWidth;
        this.windowHeight = windowHeight;
        return this;
    }

    public Filtering withPadMode (PadMode padMode) {
        this.padMode = checkNotNull(padMode);
        return this;
    }

    /** Set filter arguments other than the kernel size, such as the sigma of the adaptive gaussian filter. */
    public Filtering withFilterConfiguration (Map<String, ?> arguments) {
        unit.configure(arguments);
        return this;
    }

    public ProcessingUnit processingUnit () {
        return unit;
    }

    /** Overlap between windows needed for this kernel size. */
    public int overlap () {
        return (kernelSize + 1) / 2;
    }

    /**
     * Filter one grid file, writing the result into the given directory.
     * @return the path of the output file.
     */
    public Path processFile (Path input, Path outputDirectory) {
        int overlap = overlap();
        int smallestSide = Math.min(windowWidth, windowHeight);
        if (2 * overlap >= smallestSide) {
            throw new RasterConfigurationException(String.format(
                    "The kernel size (%d) must be strictly less than the window size minus 1 (%d).",
                    kernelSize, smallestSide));
        }
        String baseName = Files.getNameWithoutExtension(input.getFileName().toString());
        Path output = outputDirectory.resolve(baseName + "-" + unit.name + GridRasterFile.FILE_EXTENSION);
        LOG.info("Filtering {} with {} (kernel size {}) into {}", input, unit.name, kernelSize, output);
        SlidingOptions options = SlidingOptions.defaults()
                .windowSize(windowWidth, windowHeight)
                .overlap(overlap)
                .padMode(padMode)
                .bands(bands);
        new SlidingWindowProcessor(config).process(new GridRasterFile(input), new GridRasterFile(output), unit, options);
        return output;
    }

}
