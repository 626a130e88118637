package com.conveyal.rastertools.processing;

import com.conveyal.rastertools.RasterConfigurationException;
import com.conveyal.rastertools.RasterProcessingException;
import com.conveyal.rastertools.RasterToolsConfig;
import com.conveyal.rastertools.progress.ProgressListener;
import com.conveyal.rastertools.raster.Compression;
import com.conveyal.rastertools.raster.DataType;
import com.conveyal.rastertools.raster.GridRasterFile;
import com.conveyal.rastertools.raster.InMemoryRaster;
import com.conveyal.rastertools.raster.OutputProfile;
import com.conveyal.rastertools.raster.RasterBlock;
import com.conveyal.rastertools.raster.RasterMetadata;
import com.conveyal.rastertools.raster.RasterReader;
import com.conveyal.rastertools.raster.RasterSource;
import com.conveyal.rastertools.raster.RasterWriter;
import com.conveyal.rastertools.windows.Window;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class SlidingWindowProcessorTest {

    @TempDir
    Path tempDir;

    private static SlidingWindowProcessor processor () {
        Properties properties = new Properties();
        properties.setProperty("no-progress", "true");
        properties.setProperty("max-workers", "4");
        return new SlidingWindowProcessor(RasterToolsConfig.fromProperties(properties));
    }

    private static RasterBlock randomBlock (int bands, int height, int width, long seed) {
        Random random = new Random(seed);
        RasterBlock block = new RasterBlock(bands, height, width);
        for (int i = 0; i < block.values().length; i++) {
            block.values()[i] = random.nextInt(256);
        }
        return block;
    }

    private static InMemoryRaster floatSource (int bands, int height, int width) {
        OutputProfile profile = new OutputProfile(width, height, bands, DataType.FLOAT32, null, width, 1, false,
                Compression.NONE);
        return InMemoryRaster.of("source", profile, randomBlock(bands, height, width, 42));
    }

    private static final RasterAlgorithm DOUBLING = (input, arguments) -> {
        double[] values = input.values();
        for (int i = 0; i < values.length; i++) {
            values[i] *= 2;
        }
        return input;
    };

    @Test
    public void testIdentityIsByteIdentical () throws IOException {
        // Unsigned bytes with 255 as nodata, so some of the random pixels are masked on the way through.
        OutputProfile profile = new OutputProfile(50, 37, 3, DataType.UINT8, 255.0, 16, 16, true, Compression.NONE);
        GridRasterFile source = new GridRasterFile(tempDir.resolve("source.grid"));
        try (RasterWriter writer = source.create(profile)) {
            writer.write(new int[] {1, 2, 3}, new Window(0, 0, 37, 50), randomBlock(3, 37, 50, 1));
        }
        GridRasterFile output = new GridRasterFile(tempDir.resolve("output.grid"));
        ProcessingUnit identity = ProcessingUnit.create("identity").withOutputType(DataType.UINT8);
        OutputProfile created = processor().process(source, output, identity,
                SlidingOptions.defaults().windowSize(16).overlap(3).padMode(PadMode.REFLECT).workers(3));
        assertEquals(profile, created);
        assertArrayEquals(Files.readAllBytes(source.path), Files.readAllBytes(output.path));
    }

    @Test
    public void testStatisticPaddingUsesSourceType () {
        OutputProfile profile = new OutputProfile(2, 1, 1, DataType.UINT8, null, 2, 1, false, Compression.NONE);
        InMemoryRaster source = InMemoryRaster.of("bytes", profile,
                new RasterBlock(1, 1, 2, new double[] {1, 2}, null));
        // Each pixel takes the value of its left neighbour, so the padded column shows up in the first output pixel.
        ProcessingUnit shiftRight = ProcessingUnit.create("shift right").withAlgorithm((input, arguments) -> {
            RasterBlock output = input.copy();
            for (int b = 0; b < input.bands; b++) {
                for (int r = 0; r < input.height; r++) {
                    for (int c = 1; c < input.width; c++) {
                        output.set(b, r, c, input.get(b, r, c - 1));
                    }
                }
            }
            return output;
        });
        InMemoryRaster output = new InMemoryRaster("output");
        processor().process(source, output, shiftRight,
                SlidingOptions.defaults().windowSize(4).overlap(1).padMode(PadMode.MEAN));
        // The mean of 1 and 2 is padded as 2 in an unsigned byte raster, not 1.5.
        assertEquals(2.0, output.toBlock().get(0, 0, 0));
        assertEquals(1.0, output.toBlock().get(0, 0, 1));
    }

    @Test
    public void testDoublingMatchesWholeImage () {
        InMemoryRaster source = floatSource(3, 45, 61);
        ProcessingUnit perBand = ProcessingUnit.create("per band").withAlgorithm(DOUBLING)
                .withMode(ProcessingMode.PER_BAND);
        InMemoryRaster output = new InMemoryRaster("output");
        processor().process(source, output, perBand, SlidingOptions.defaults().windowSize(20).overlap(4));

        ProcessingUnit wholeStack = ProcessingUnit.create("whole stack").withAlgorithm(DOUBLING);
        InMemoryRaster output3d = new InMemoryRaster("output 3d");
        processor().process(source, output3d, wholeStack, SlidingOptions.defaults().windowSize(12, 9).overlap(2));

        double[] expected = source.toBlock().values();
        double[] actual = output.toBlock().values();
        double[] actual3d = output3d.toBlock().values();
        for (int i = 0; i < expected.length; i++) {
            assertEquals(2 * expected[i], actual[i]);
            assertEquals(2 * expected[i], actual3d[i]);
        }
    }

    @Test
    public void testWorkerCountDoesNotChangeResult () {
        InMemoryRaster source = floatSource(2, 33, 47);
        // A 3x3 box sum: results depend on the overlap and padding, not only on the pixel itself.
        ProcessingUnit boxSum = ProcessingUnit.create("box sum").withAlgorithm((input, arguments) -> {
            RasterBlock output = new RasterBlock(input.bands, input.height, input.width);
            for (int b = 0; b < input.bands; b++) {
                for (int r = 1; r < input.height - 1; r++) {
                    for (int c = 1; c < input.width - 1; c++) {
                        double sum = 0;
                        for (int dr = -1; dr <= 1; dr++) {
                            for (int dc = -1; dc <= 1; dc++) {
                                sum += input.get(b, r + dr, c + dc);
                            }
                        }
                        output.set(b, r, c, sum);
                    }
                }
            }
            return output;
        }).withOutputType(DataType.FLOAT64);

        InMemoryRaster single = new InMemoryRaster("single");
        processor().process(source, single, boxSum, SlidingOptions.defaults().windowSize(8).overlap(1).workers(1));
        InMemoryRaster parallel = new InMemoryRaster("parallel");
        processor().process(source, parallel, boxSum, SlidingOptions.defaults().windowSize(8).overlap(1).workers(6));
        assertArrayEquals(single.toBlock().values(), parallel.toBlock().values());

        // A pixel in the middle of the image sees its true neighbors.
        RasterBlock input = source.toBlock();
        double expected = 0;
        for (int r = 19; r <= 21; r++) {
            for (int c = 29; c <= 31; c++) {
                expected += input.get(1, r, c);
            }
        }
        assertEquals(expected, parallel.toBlock().get(1, 20, 30));

        // Running again over the same destination gives the same output.
        processor().process(source, parallel, boxSum, SlidingOptions.defaults().windowSize(8).overlap(1).workers(3));
        assertArrayEquals(single.toBlock().values(), parallel.toBlock().values());
    }

    @Test
    public void testRequestedBandsAreWrittenInOrder () {
        InMemoryRaster source = floatSource(3, 10, 10);
        InMemoryRaster output = new InMemoryRaster("output");
        ProcessingUnit identity = ProcessingUnit.create("identity").withMode(ProcessingMode.PER_BAND);
        processor().process(source, output, identity, SlidingOptions.defaults().windowSize(4).bands(3, 1));
        assertEquals(2, output.metadata().bandCount);
        RasterBlock in = source.toBlock();
        RasterBlock out = output.toBlock();
        assertArrayEquals(in.band(2).values(), out.band(0).values());
        assertArrayEquals(in.band(0).values(), out.band(1).values());
    }

    @Test
    public void testOutputProfile () {
        RasterMetadata metadata = new RasterMetadata(20, 9, 4, DataType.UINT16, 0.0);
        ProcessingUnit unit = ProcessingUnit.create("unit");
        OutputProfile profile = SlidingWindowProcessor.outputProfile(metadata, 2, unit,
                SlidingOptions.defaults().windowSize(32));
        assertEquals(new OutputProfile(20, 9, 2, DataType.FLOAT32, 0.0, 16, 8, true, Compression.NONE), profile);

        unit.withNodata(-1.0).withOutputType(DataType.INT16);
        profile = SlidingWindowProcessor.outputProfile(metadata, 4, unit, SlidingOptions.defaults().windowSize(8, 4));
        assertEquals(new OutputProfile(20, 9, 4, DataType.INT16, -1.0, 8, 4, true, Compression.NONE), profile);
    }

    @Test
    public void testConfigurationErrorsComeBeforeOutput () {
        InMemoryRaster source = floatSource(2, 10, 10);
        ProcessingUnit identity = ProcessingUnit.create("identity");
        Path missing = tempDir.resolve("missing").resolve("out.grid");
        Path outputPath = tempDir.resolve("out.grid");

        assertThrows(RasterConfigurationException.class, () -> processor().process(source,
                new GridRasterFile(outputPath), identity, SlidingOptions.defaults().bands(1, 3)));
        assertThrows(RasterConfigurationException.class, () -> processor().process(source,
                new GridRasterFile(outputPath), identity, SlidingOptions.defaults().bands(0)));
        assertThrows(RasterConfigurationException.class, () -> processor().process(source,
                new GridRasterFile(outputPath), identity, SlidingOptions.defaults().windowSize(8).overlap(4)));
        assertThrows(RasterConfigurationException.class, () -> processor().process(source,
                new GridRasterFile(outputPath), identity, SlidingOptions.defaults().windowSize(0, 8)));
        assertThrows(RasterConfigurationException.class, () -> processor().process(source,
                new GridRasterFile(outputPath), identity, SlidingOptions.defaults().overlap(-1)));
        assertThrows(RasterConfigurationException.class, () -> processor().process(source,
                new GridRasterFile(outputPath), identity, SlidingOptions.defaults().workers(0)));
        assertFalse(Files.exists(outputPath));

        assertThrows(RasterConfigurationException.class, () -> processor().process(source,
                new GridRasterFile(missing), identity, SlidingOptions.defaults()));

        InMemoryRaster untouched = new InMemoryRaster("untouched");
        assertThrows(RasterConfigurationException.class, () -> processor().process(source, untouched, identity,
                SlidingOptions.defaults().bands(5)));
        assertThrows(IllegalStateException.class, untouched::profile);
    }

    @Test
    public void testFailureAbortsRunAndClosesReaders () {
        InMemoryRaster raster = floatSource(1, 40, 40);
        CountingSource source = new CountingSource(raster);
        AtomicInteger calls = new AtomicInteger();
        ProcessingUnit failing = ProcessingUnit.create("failing").withAlgorithm((input, arguments) -> {
            if (calls.incrementAndGet() == 5) {
                throw new ArithmeticException("boom");
            }
            return input;
        });
        RasterProcessingException e = assertThrows(RasterProcessingException.class, () -> processor().process(source,
                new InMemoryRaster("output"), failing, SlidingOptions.defaults().windowSize(5).workers(3)));
        assertTrue(e.getMessage().contains("work item"), e.getMessage());
        assertTrue(e.getMessage().contains("boom"), e.getMessage());
        assertTrue(e.getCause() instanceof ArithmeticException);
        assertEquals(source.opened.get(), source.closed.get());
        // Far fewer windows than the 64 in the image were started, since in-flight work is bounded.
        assertTrue(calls.get() < 64);
    }

    @Test
    public void testReadFailureIsReported () {
        InMemoryRaster raster = floatSource(1, 20, 20);
        RasterSource brokenReads = new RasterSource() {
            @Override
            public RasterReader openReader () {
                RasterReader reader = raster.openReader();
                return new RasterReader() {
                    @Override
                    public RasterMetadata metadata () {
                        return reader.metadata();
                    }

                    @Override
                    public RasterBlock read (int[] bands, Window window) throws IOException {
                        throw new IOException("disk on fire");
                    }

                    @Override
                    public void close () { }
                };
            }

            @Override
            public String describe () {
                return "broken";
            }
        };
        RasterProcessingException e = assertThrows(RasterProcessingException.class, () -> processor().process(
                brokenReads, new InMemoryRaster("output"), ProcessingUnit.create("identity"),
                SlidingOptions.defaults().windowSize(10)));
        assertTrue(e.getMessage().contains("reading"), e.getMessage());
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    public void testProgressIsReportedPerWorkItem () {
        InMemoryRaster source = floatSource(2, 30, 30);
        AtomicInteger total = new AtomicInteger();
        AtomicInteger done = new AtomicInteger();
        ProgressListener listener = new ProgressListener() {
            @Override
            public void beginTask (String description, int totalElements) {
                total.set(totalElements);
            }

            @Override
            public void increment (int n) {
                done.addAndGet(n);
            }
        };
        processor().process(source, new InMemoryRaster("output"),
                ProcessingUnit.create("identity").withMode(ProcessingMode.PER_BAND),
                SlidingOptions.defaults().windowSize(10).progressListener(listener));
        assertEquals(18, total.get());
        assertEquals(18, done.get());
    }

    /** Wraps a source to count the readers opened on it and closed. */
    private static class CountingSource implements RasterSource {

        final RasterSource wrapped;
        final AtomicInteger opened = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();

        CountingSource (RasterSource wrapped) {
            this.wrapped = wrapped;
        }

        @Override
        public RasterReader openReader () throws IOException {
            RasterReader reader = wrapped.openReader();
            opened.incrementAndGet();
            return new RasterReader() {
                @Override
                public RasterMetadata metadata () {
                    return reader.metadata();
                }

                @Override
                public RasterBlock read (int[] bands, Window window) throws IOException {
                    return reader.read(bands, window);
                }

                @Override
                public void close () throws IOException {
                    closed.incrementAndGet();
                    reader.close();
                }
            };
        }

        @Override
        public String describe () {
            return "counting " + wrapped.describe();
        }

    }

}
