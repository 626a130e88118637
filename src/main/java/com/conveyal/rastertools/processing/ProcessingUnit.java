package com.conveyal.rastertools.processing;

import com.conveyal.rastertools.RasterProcessingException;
import com.conveyal.rastertools.raster.Compression;
import com.conveyal.rastertools.raster.DataType;
import com.conveyal.rastertools.raster.RasterBlock;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A processing step that can be run over every window of a raster: an optional algorithm plus everything the engine
 * needs to know to run it (output data type and nodata value, whether it works per band or on the whole stack of
 * bands, and the arguments it declares).
 *
 * Units are set up with the fluent with* methods and configure(), then handed to the SlidingWindowProcessor.
 * They must not be reconfigured while a run is in progress. Since the configured arguments are held in an immutable
 * snapshot that is replaced as a whole, reading a unit from several workers at once is safe.
 *
 * A unit without an algorithm is the identity: it returns each window unchanged, which is useful for converting the
 * data type or block layout of a raster.
 */
public class ProcessingUnit {

    public final String name;

    private RasterAlgorithm algorithm;

    private DataType outputType = DataType.FLOAT32;

    /** Type windows are cast to before processing, or null to use the output type. */
    private DataType processingType;

    /** Nodata value of the output, or null to use the nodata value of the source. */
    private Double nodata;

    private ProcessingMode mode = ProcessingMode.WHOLE_STACK;

    private Compression compression = Compression.NONE;

    /** Declared arguments with their current values, in declaration order. */
    private final Map<String, Object> declaredArguments = new LinkedHashMap<>();

    private volatile AlgorithmArguments arguments = AlgorithmArguments.EMPTY;

    private ProcessingUnit (String name) {
        this.name = name;
    }

    public static ProcessingUnit create (String name) {
        checkArgument(name != null && !name.isEmpty(), "A processing unit must have a name.");
        return new ProcessingUnit(name);
    }

    public ProcessingUnit withAlgorithm (RasterAlgorithm algorithm) {
        this.algorithm = algorithm;
        return this;
    }

    public ProcessingUnit withOutputType (DataType outputType) {
        this.outputType = checkNotNull(outputType);
        return this;
    }

    public ProcessingUnit withProcessingType (DataType processingType) {
        this.processingType = processingType;
        return this;
    }

    public ProcessingUnit withNodata (Double nodata) {
        this.nodata = nodata;
        return this;
    }

    public ProcessingUnit withMode (ProcessingMode mode) {
        this.mode = checkNotNull(mode);
        return this;
    }

    public ProcessingUnit withCompression (Compression compression) {
        this.compression = checkNotNull(compression);
        return this;
    }

    /** Declare an argument consumed by the algorithm, with its default value. */
    public synchronized ProcessingUnit withArgument (String name, Object defaultValue) {
        checkNotNull(name);
        checkNotNull(defaultValue, "Argument %s must have a default value.", name);
        declaredArguments.put(name, defaultValue);
        arguments = new AlgorithmArguments(declaredArguments);
        return this;
    }

    /**
     * Set the values of declared arguments. Keys that were not declared with withArgument are ignored, so one map of
     * options can be used to configure several units.
     */
    public synchronized ProcessingUnit configure (Map<String, ?> values) {
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (declaredArguments.containsKey(entry.getKey()) && entry.getValue() != null) {
                declaredArguments.put(entry.getKey(), entry.getValue());
            }
        }
        arguments = new AlgorithmArguments(declaredArguments);
        return this;
    }

    /**
     * Apply the algorithm to one window. The result must have the shape of the input: the same number of bands,
     * rows and columns.
     * @throws RasterProcessingException if the algorithm returns a block of another shape.
     */
    public RasterBlock compute (RasterBlock input) {
        if (algorithm == null) {
            return input;
        }
        RasterBlock output = algorithm.compute(input, arguments);
        if (output == null) {
            throw new RasterProcessingException("Processing " + name + " returned no data.");
        }
        if (!output.sameShape(input)) {
            throw new RasterProcessingException(String.format(
                "Processing %s returned %s for an input of %s; the shapes must be equal.", name, output, input));
        }
        return output;
    }

    public DataType outputType () {
        return outputType;
    }

    public DataType processingType () {
        return processingType != null ? processingType : outputType;
    }

    public Double nodata () {
        return nodata;
    }

    public ProcessingMode mode () {
        return mode;
    }

    public Compression compression () {
        return compression;
    }

    public AlgorithmArguments arguments () {
        return arguments;
    }

    @Override
    public String toString () {
        return name;
    }

}
