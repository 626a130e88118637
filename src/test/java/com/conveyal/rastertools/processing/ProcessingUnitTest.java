package com.conveyal.rastertools.processing;

import com.conveyal.rastertools.RasterProcessingException;
import com.conveyal.rastertools.raster.Compression;
import com.conveyal.rastertools.raster.DataType;
import com.conveyal.rastertools.raster.RasterBlock;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessingUnitTest {

    @Test
    public void testDefaults () {
        ProcessingUnit unit = ProcessingUnit.create("identity");
        assertEquals(DataType.FLOAT32, unit.outputType());
        assertEquals(DataType.FLOAT32, unit.processingType());
        assertNull(unit.nodata());
        assertEquals(ProcessingMode.WHOLE_STACK, unit.mode());
        assertEquals(Compression.NONE, unit.compression());
        assertSame(AlgorithmArguments.EMPTY, unit.arguments());

        // Without an algorithm the input comes back unchanged.
        RasterBlock block = new RasterBlock(1, 2, 2);
        assertSame(block, unit.compute(block));

        unit.withOutputType(DataType.INT16);
        assertEquals(DataType.INT16, unit.processingType());
        unit.withProcessingType(DataType.FLOAT64);
        assertEquals(DataType.FLOAT64, unit.processingType());

        assertThrows(IllegalArgumentException.class, () -> ProcessingUnit.create(""));
    }

    @Test
    public void testConfigureOnlyDeclaredArguments () {
        ProcessingUnit unit = ProcessingUnit.create("scale")
                .withArgument("factor", 2)
                .withAlgorithm((input, arguments) -> {
                    double factor = arguments.getDouble("factor", 1);
                    for (int i = 0; i < input.values().length; i++) {
                        input.values()[i] *= factor;
                    }
                    return input;
                });
        assertEquals(2, unit.arguments().getInt("factor", 0));

        unit.configure(ImmutableMap.of("factor", "3.5", "unknown", 12));
        assertEquals(3.5, unit.arguments().getDouble("factor", 0));
        assertFalse(unit.arguments().contains("unknown"));

        RasterBlock block = new RasterBlock(1, 1, 2, new double[] {1, 2}, null);
        assertArrayEquals(new double[] {3.5, 7}, unit.compute(block).values());
    }

    @Test
    public void testArgumentParsing () {
        AlgorithmArguments arguments = new AlgorithmArguments(ImmutableMap.of("size", " 5 ", "name", "x"));
        assertEquals(5, arguments.getInt("size", 0));
        assertEquals(9, arguments.getInt("missing", 9));
        assertThrows(IllegalArgumentException.class, () -> arguments.getInt("name", 0));
        assertThrows(IllegalArgumentException.class, () -> arguments.getDouble("name", 0));
    }

    @Test
    public void testShapeContract () {
        ProcessingUnit shrinking = ProcessingUnit.create("shrinking")
                .withAlgorithm((input, arguments) -> input.crop(1, 0, 0, 0));
        assertThrows(RasterProcessingException.class, () -> shrinking.compute(new RasterBlock(1, 3, 3)));

        ProcessingUnit nothing = ProcessingUnit.create("nothing").withAlgorithm((input, arguments) -> null);
        assertThrows(RasterProcessingException.class, () -> nothing.compute(new RasterBlock(1, 3, 3)));
    }

}
