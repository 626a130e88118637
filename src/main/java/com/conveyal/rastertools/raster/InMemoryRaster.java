package com.conveyal.rastertools.raster;

import com.conveyal.rastertools.windows.Window;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * A raster held entirely in memory, usable both as a source and as a destination. This is handy for tests, and for
 * chaining processing steps on rasters small enough to fit in memory. Stored values are always already cast to the
 * data type of the raster, so reading back returns exactly what a file of the same type would.
 *
 * Any number of readers may read concurrently as long as nothing is writing; the raster is written by at most one
 * writer.
 */
public class InMemoryRaster implements RasterSource, RasterDestination {

    private final String name;

    private OutputProfile profile;

    /** Pixel values, band-major then row-major, same layout as RasterBlock. */
    private double[] data;

    /** Create an empty destination. It can only be read after create() has been called on it. */
    public InMemoryRaster (String name) {
        this.name = checkNotNull(name);
    }

    /**
     * Create an in-memory raster holding a copy of the given block, which must have as many bands as the profile and
     * the same size. Masked pixels of the block are stored as the profile's nodata value.
     */
    public static InMemoryRaster of (String name, OutputProfile profile, RasterBlock block) {
        checkArgument(block.bands == profile.bandCount && block.height == profile.height && block.width == profile.width,
                "Block %s does not match profile %s", block, profile);
        InMemoryRaster raster = new InMemoryRaster(name);
        raster.create(profile);
        raster.write(profile.toMetadata().allBands(), new Window(0, 0, profile.height, profile.width), block);
        return raster;
    }

    /** The profile this raster was created with. */
    public synchronized OutputProfile profile () {
        checkState(profile != null, "In-memory raster %s has not been created yet.", name);
        return profile;
    }

    public RasterMetadata metadata () {
        return profile().toMetadata();
    }

    /** @return a copy of the whole raster as one block, with nodata pixels masked. */
    public RasterBlock toBlock () {
        OutputProfile p = profile();
        return read(p.toMetadata().allBands(), new Window(0, 0, p.height, p.width));
    }

    @Override
    public RasterReader openReader () {
        final RasterMetadata metadata = metadata();
        return new RasterReader() {
            @Override
            public RasterMetadata metadata () {
                return metadata;
            }

            @Override
            public RasterBlock read (int[] bands, Window window) {
                return InMemoryRaster.this.read(bands, window);
            }

            @Override
            public void close () { }
        };
    }

    @Override
    public synchronized RasterWriter create (OutputProfile newProfile) {
        checkNotNull(newProfile);
        double[] newData = new double[Math.toIntExact((long) newProfile.bandCount * newProfile.height * newProfile.width)];
        if (newProfile.nodata != null) {
            Arrays.fill(newData, newProfile.dataType.cast(newProfile.nodata));
        }
        this.profile = newProfile;
        this.data = newData;
        return new RasterWriter() {
            @Override
            public OutputProfile profile () {
                return newProfile;
            }

            @Override
            public void write (int[] bands, Window window, RasterBlock block) {
                InMemoryRaster.this.write(bands, window, block);
            }

            @Override
            public void close () { }
        };
    }

    private RasterBlock read (int[] bands, Window window) {
        OutputProfile p = profile();
        checkWindow(p, window);
        RasterBlock block = new RasterBlock(bands.length, window.height, window.width);
        for (int i = 0; i < bands.length; i++) {
            checkArgument(bands[i] >= 1 && bands[i] <= p.bandCount, "No band %s in raster %s", bands[i], name);
            for (int r = 0; r < window.height; r++) {
                int from = offset(p, bands[i] - 1, window.rowOffset + r, window.colOffset);
                System.arraycopy(data, from, block.values(), block.index(i, r, 0), window.width);
            }
        }
        block.maskNodata(p.nodata);
        return block;
    }

    private void write (int[] bands, Window window, RasterBlock block) {
        OutputProfile p = profile();
        checkWindow(p, window);
        checkArgument(block.bands == bands.length && block.height == window.height && block.width == window.width,
                "Block %s does not match %s bands in %s", block, bands.length, window);
        for (int i = 0; i < bands.length; i++) {
            checkArgument(bands[i] >= 1 && bands[i] <= p.bandCount, "No band %s in raster %s", bands[i], name);
            for (int r = 0; r < window.height; r++) {
                for (int c = 0; c < window.width; c++) {
                    double value = block.get(i, r, c);
                    if (p.nodata != null && block.isMasked(i, r, c)) {
                        value = p.nodata;
                    }
                    data[offset(p, bands[i] - 1, window.rowOffset + r, window.colOffset + c)] = p.dataType.cast(value);
                }
            }
        }
    }

    private static int offset (OutputProfile p, int band, int row, int col) {
        return (band * p.height + row) * p.width + col;
    }

    private static void checkWindow (OutputProfile p, Window window) {
        checkArgument(window.isWithin(p.width, p.height), "%s is outside the %sx%s raster", window, p.width, p.height);
    }

    @Override
    public String describe () {
        return "in-memory raster " + name;
    }

    @Override
    public String toString () {
        return describe();
    }

}
