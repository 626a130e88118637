package com.conveyal.rastertools.raster;

import com.conveyal.rastertools.RasterConfigurationException;
import com.conveyal.rastertools.windows.Window;
import com.google.common.io.LittleEndianDataInputStream;
import com.google.common.io.LittleEndianDataOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A raster stored in a simple binary file format supporting random-access windowed reads and writes, so that many
 * workers can read it at once and a single writer can fill it in one window at a time in any order.
 *
 * The file starts with a fixed-size little-endian header:
 * <pre>
 *   8 bytes  magic "RTGRID01"
 *   int      width, height, band count
 *   int      data type (DataType ordinal, so that enum must only ever be appended to)
 *   int      block width, block height
 *   byte     1 if tiled, 0 if stored in strips
 *   byte     1 if a nodata value follows, 0 otherwise
 *   double   nodata value
 *   (zero padding up to HEADER_BYTES)
 * </pre>
 * Pixel data follow, band-sequential, uncompressed, in the machine-independent little-endian byte order.
 * Within a band the raster is cut into blocks of the block size (strips are blocks spanning the full width), stored
 * in row-major block order, each block itself row-major and always full size even at the right and bottom edges.
 * Storing whole blocks keeps the pixels of one window close together in the file.
 */
public class GridRasterFile implements RasterSource, RasterDestination {

    private static final Logger LOG = LoggerFactory.getLogger(GridRasterFile.class);

    public static final String FILE_EXTENSION = ".grid";

    private static final byte[] MAGIC = "RTGRID01".getBytes(StandardCharsets.US_ASCII);

    private static final int HEADER_BYTES = 64;

    public final Path path;

    public GridRasterFile (Path path) {
        this.path = checkNotNull(path);
    }

    @Override
    public RasterReader openReader () throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            return new GridReader(channel, readHeader(channel));
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    @Override
    public void checkWritable () {
        Path absolute = path.toAbsolutePath();
        Path directory = absolute.getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            throw new RasterConfigurationException("Output directory does not exist: " + directory);
        }
        if (!Files.isWritable(directory)) {
            throw new RasterConfigurationException("Output directory is not writable: " + directory);
        }
        if (Files.exists(absolute) && !Files.isWritable(absolute)) {
            throw new RasterConfigurationException("Output file is not writable: " + absolute);
        }
    }

    /**
     * Create (or truncate) the file and size it for the whole raster. All pixels start out as the nodata value, or
     * zero when the profile has no nodata value.
     */
    @Override
    public RasterWriter create (OutputProfile profile) throws IOException {
        if (profile.compression != Compression.NONE) {
            throw new RasterConfigurationException(
                    "Grid raster files are uncompressed, cannot apply compression " + profile.compression);
        }
        checkWritable();
        Layout layout = new Layout(profile);
        FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.READ,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        try {
            writeFully(channel, ByteBuffer.wrap(encodeHeader(profile)), 0);
            fillWithNodata(channel, layout);
            LOG.debug("Created {} ({}), {} bytes.", path, profile, layout.fileBytes());
            return new GridWriter(channel, layout);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    @Override
    public String describe () {
        return path.toString();
    }

    @Override
    public String toString () {
        return "grid raster file " + path;
    }

    private static byte[] encodeHeader (OutputProfile profile) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(HEADER_BYTES);
        LittleEndianDataOutputStream out = new LittleEndianDataOutputStream(bytes);
        out.write(MAGIC);
        out.writeInt(profile.width);
        out.writeInt(profile.height);
        out.writeInt(profile.bandCount);
        out.writeInt(profile.dataType.ordinal());
        out.writeInt(profile.blockWidth);
        out.writeInt(profile.blockHeight);
        out.writeByte(profile.tiled ? 1 : 0);
        out.writeByte(profile.nodata != null ? 1 : 0);
        out.writeDouble(profile.nodata != null ? profile.nodata : 0);
        out.close();
        return Arrays.copyOf(bytes.toByteArray(), HEADER_BYTES);
    }

    private Layout readHeader (FileChannel channel) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES);
        readFully(channel, buffer, 0);
        LittleEndianDataInputStream in = new LittleEndianDataInputStream(new ByteArrayInputStream(buffer.array()));
        byte[] magic = new byte[MAGIC.length];
        in.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("Not a grid raster file: " + path);
        }
        int width = in.readInt();
        int height = in.readInt();
        int bandCount = in.readInt();
        int typeCode = in.readInt();
        int blockWidth = in.readInt();
        int blockHeight = in.readInt();
        boolean tiled = in.readByte() != 0;
        boolean hasNodata = in.readByte() != 0;
        double nodata = in.readDouble();
        if (typeCode < 0 || typeCode >= DataType.values().length) {
            throw new IOException("Unknown data type code " + typeCode + " in " + path);
        }
        try {
            OutputProfile profile = new OutputProfile(width, height, bandCount, DataType.values()[typeCode],
                    hasNodata ? nodata : null, blockWidth, blockHeight, tiled, Compression.NONE);
            Layout layout = new Layout(profile);
            if (channel.size() < layout.fileBytes()) {
                throw new IOException("Grid raster file is truncated: " + path);
            }
            return layout;
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt grid raster header in " + path, e);
        }
    }

    private static void fillWithNodata (FileChannel channel, Layout layout) throws IOException {
        OutputProfile profile = layout.profile;
        channel.truncate(HEADER_BYTES);
        if (profile.nodata == null) {
            // Extending the file fills it with zeros.
            writeFully(channel, ByteBuffer.allocate(1), layout.fileBytes() - 1);
            return;
        }
        int blockValues = layout.tileWidth * layout.tileHeight;
        ByteBuffer block = ByteBuffer.allocate(blockValues * profile.dataType.bytes).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < blockValues; i++) {
            profile.dataType.put(block, profile.nodata);
        }
        long blockBytes = block.capacity();
        long nBlocks = (layout.fileBytes() - HEADER_BYTES) / blockBytes;
        for (long b = 0; b < nBlocks; b++) {
            block.rewind();
            writeFully(channel, block, HEADER_BYTES + b * blockBytes);
        }
    }

    private static void readFully (FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, position);
            if (n < 0) {
                throw new EOFException("Unexpected end of grid raster file at byte " + position);
            }
            position += n;
        }
    }

    private static void writeFully (FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
    }

    /**
     * Where each pixel lives within the file. Strips are treated as blocks spanning the whole width of the raster.
     */
    private static class Layout {

        final OutputProfile profile;
        final int tileWidth;
        final int tileHeight;
        final int blocksAcross;
        final int blocksDown;

        Layout (OutputProfile profile) {
            this.profile = profile;
            this.tileWidth = profile.tiled ? profile.blockWidth : profile.width;
            this.tileHeight = profile.blockHeight;
            this.blocksAcross = (profile.width + tileWidth - 1) / tileWidth;
            this.blocksDown = (profile.height + tileHeight - 1) / tileHeight;
        }

        long fileBytes () {
            return HEADER_BYTES + (long) profile.bandCount * blocksDown * blocksAcross * tileWidth * tileHeight
                    * profile.dataType.bytes;
        }

        /** Byte position of a pixel, given a zero-based band. */
        long position (int band, int row, int col) {
            long blockIndex = ((long) band * blocksDown + row / tileHeight) * blocksAcross + col / tileWidth;
            long withinBlock = (long) (row % tileHeight) * tileWidth + col % tileWidth;
            return HEADER_BYTES + (blockIndex * tileWidth * tileHeight + withinBlock) * profile.dataType.bytes;
        }

        /** Exclusive end of the run of contiguous pixels starting at the given column, limited to stop. */
        int runEnd (int col, int stop) {
            return Math.min(stop, (col / tileWidth + 1) * tileWidth);
        }

        void checkRequest (int[] bands, Window window) {
            checkArgument(window.isWithin(profile.width, profile.height), "%s is outside the %sx%s raster",
                    window, profile.width, profile.height);
            for (int band : bands) {
                checkArgument(band >= 1 && band <= profile.bandCount, "No band %s in a %s band raster",
                        band, profile.bandCount);
            }
        }
    }

    private class GridReader implements RasterReader {

        private final FileChannel channel;
        private final Layout layout;
        private final RasterMetadata metadata;

        GridReader (FileChannel channel, Layout layout) {
            this.channel = channel;
            this.layout = layout;
            this.metadata = layout.profile.toMetadata();
        }

        @Override
        public RasterMetadata metadata () {
            return metadata;
        }

        @Override
        public RasterBlock read (int[] bands, Window window) throws IOException {
            layout.checkRequest(bands, window);
            DataType dataType = layout.profile.dataType;
            RasterBlock block = new RasterBlock(bands.length, window.height, window.width);
            ByteBuffer buffer = ByteBuffer.allocate(layout.tileWidth * dataType.bytes).order(ByteOrder.LITTLE_ENDIAN);
            double[] values = block.values();
            for (int b = 0; b < bands.length; b++) {
                for (int r = 0; r < window.height; r++) {
                    int row = window.rowOffset + r;
                    int col = window.colOffset;
                    while (col < window.colStop()) {
                        int end = layout.runEnd(col, window.colStop());
                        buffer.clear().limit((end - col) * dataType.bytes);
                        readFully(channel, buffer, layout.position(bands[b] - 1, row, col));
                        buffer.flip();
                        int i = block.index(b, r, col - window.colOffset);
                        for (int c = col; c < end; c++) {
                            values[i++] = dataType.get(buffer);
                        }
                        col = end;
                    }
                }
            }
            block.maskNodata(metadata.nodata);
            return block;
        }

        @Override
        public void close () throws IOException {
            channel.close();
        }
    }

    private class GridWriter implements RasterWriter {

        private final FileChannel channel;
        private final Layout layout;

        GridWriter (FileChannel channel, Layout layout) {
            this.channel = channel;
            this.layout = layout;
        }

        @Override
        public OutputProfile profile () {
            return layout.profile;
        }

        @Override
        public void write (int[] bands, Window window, RasterBlock block) throws IOException {
            layout.checkRequest(bands, window);
            checkArgument(block.bands == bands.length && block.height == window.height && block.width == window.width,
                    "Block %s does not match %s bands in %s", block, bands.length, window);
            OutputProfile profile = layout.profile;
            ByteBuffer buffer = ByteBuffer.allocate(layout.tileWidth * profile.dataType.bytes)
                    .order(ByteOrder.LITTLE_ENDIAN);
            for (int b = 0; b < bands.length; b++) {
                for (int r = 0; r < window.height; r++) {
                    int row = window.rowOffset + r;
                    int col = window.colOffset;
                    while (col < window.colStop()) {
                        int end = layout.runEnd(col, window.colStop());
                        buffer.clear();
                        for (int c = col; c < end; c++) {
                            int blockCol = c - window.colOffset;
                            double value = block.get(b, r, blockCol);
                            if (profile.nodata != null && block.isMasked(b, r, blockCol)) {
                                value = profile.nodata;
                            }
                            profile.dataType.put(buffer, value);
                        }
                        buffer.flip();
                        writeFully(channel, buffer, layout.position(bands[b] - 1, row, col));
                        col = end;
                    }
                }
            }
        }

        @Override
        public void close () throws IOException {
            channel.force(false);
            channel.close();
        }
    }

}
