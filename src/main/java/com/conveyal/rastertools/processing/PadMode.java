package com.conveyal.rastertools.processing;

import com.conveyal.rastertools.raster.DataType;
import com.conveyal.rastertools.raster.RasterBlock;
import com.conveyal.rastertools.windows.PadSpec;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Max;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Min;

import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * How to synthesize the pixels of a window that fall outside the raster. The vocabulary is the usual one for array
 * padding. Padding is applied one line at a time: first along columns (extending each column up and down), then along
 * rows of the row-padded block (extending each row left and right), so corner pixels derive from already padded data.
 *
 * Each mode fills the padded part of a line given the line's original values. Index-based modes copy values (and the
 * mask) from positions inside the original line. Statistic-based modes fill with a statistic of the valid, unmasked
 * values of the original line, converted to the data type of the source raster (integer types round to the nearest
 * value, ties to even); if the line has no valid value the padded pixels are zero and masked.
 */
public enum PadMode {

    /** Pad with zeros. */
    CONSTANT {
        @Override
        void fillLine (double[] values, boolean[] mask, int before, int length, int after, DataType type) {
            for (int i = 0; i < values.length; i++) {
                if (i >= before && i < before + length) continue;
                values[i] = 0;
                if (mask != null) mask[i] = false;
            }
        }
    },

    /** Repeat the edge value. */
    EDGE {
        @Override
        int sourceIndex (int i, int length) {
            return Math.max(0, Math.min(length - 1, i));
        }
    },

    MAXIMUM(true) {
        @Override
        double statistic (double[] validValues, int count) {
            return new Max().evaluate(validValues, 0, count);
        }
    },

    MEAN(true) {
        @Override
        double statistic (double[] validValues, int count) {
            return new Mean().evaluate(validValues, 0, count);
        }
    },

    MEDIAN(true) {
        @Override
        double statistic (double[] validValues, int count) {
            return new Median().evaluate(validValues, 0, count);
        }
    },

    MINIMUM(true) {
        @Override
        double statistic (double[] validValues, int count) {
            return new Min().evaluate(validValues, 0, count);
        }
    },

    /** Mirror the line around its first and last values, without repeating them: 3 2 | 1 2 3 | 2 1. */
    REFLECT {
        @Override
        int sourceIndex (int i, int length) {
            if (length == 1) return 0;
            int period = 2 * (length - 1);
            int m = Math.floorMod(i, period);
            return m < length ? m : period - m;
        }
    },

    /** Mirror the line around its edges, repeating the edge values: 2 1 | 1 2 3 | 3 2. */
    SYMMETRIC {
        @Override
        int sourceIndex (int i, int length) {
            int period = 2 * length;
            int m = Math.floorMod(i, period);
            return m < length ? m : period - 1 - m;
        }
    },

    /** Wrap around to the other end of the line: 2 3 | 1 2 3 | 1 2. */
    WRAP {
        @Override
        int sourceIndex (int i, int length) {
            return Math.floorMod(i, length);
        }
    };

    /** True for modes filling with a statistic of the line rather than copying values from it. */
    private final boolean statisticBased;

    PadMode () {
        this(false);
    }

    PadMode (boolean statisticBased) {
        this.statisticBased = statisticBased;
    }

    /**
     * Parse a pad mode name, ignoring case. "none" is accepted as a synonym for constant padding.
     * @throws IllegalArgumentException for unknown names.
     */
    public static PadMode forName (String name) {
        checkArgument(name != null, "Pad mode name must not be null.");
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("NONE".equals(normalized)) {
            return CONSTANT;
        }
        for (PadMode mode : values()) {
            if (mode.name().equals(normalized)) return mode;
        }
        throw new IllegalArgumentException("Unknown pad mode: " + name);
    }

    /**
     * For index-based modes, the position within the original line [0, length) whose value fills position i, where
     * i may be negative (before the line) or at least length (after it).
     */
    int sourceIndex (int i, int length) {
        throw new UnsupportedOperationException(name() + " padding is not index-based.");
    }

    /** For statistic-based modes, the fill value computed from the first count entries of validValues. */
    double statistic (double[] validValues, int count) {
        throw new UnsupportedOperationException(name() + " padding is not statistic-based.");
    }

    /**
     * Fill the padded parts of one line in place. The original values are in [before, before + length), the
     * padding to fill is [0, before) and [before + length, before + length + after). The mask may be null, meaning
     * no value of the line is masked; it is only written to when it is not null.
     * Modes override either this method, sourceIndex or statistic.
     */
    void fillLine (double[] values, boolean[] mask, int before, int length, int after, DataType type) {
        if (statisticBased) {
            fillWithStatistic(values, mask, before, length, type);
            return;
        }
        for (int i = 0; i < values.length; i++) {
            if (i >= before && i < before + length) continue;
            int source = before + sourceIndex(i - before, length);
            values[i] = values[source];
            if (mask != null) mask[i] = mask[source];
        }
    }

    private void fillWithStatistic (double[] values, boolean[] mask, int before, int length, DataType type) {
        double[] valid = new double[length];
        int count = 0;
        for (int i = before; i < before + length; i++) {
            if (mask == null || !mask[i]) valid[count++] = values[i];
        }
        double fill = 0;
        if (count > 0) {
            double value = statistic(valid, count);
            fill = type.cast(type.isFloatingPoint() ? value : Math.rint(value));
        }
        for (int i = 0; i < values.length; i++) {
            if (i >= before && i < before + length) continue;
            values[i] = fill;
            if (mask != null) mask[i] = count == 0;
        }
    }

    /** Pad a block holding values of any type, keeping statistic fills at full precision. */
    public RasterBlock pad (RasterBlock block, PadSpec pad) {
        return pad(block, pad, DataType.FLOAT64);
    }

    /**
     * Return a new block extended by the given padding, with the padded pixels synthesized according to this mode.
     * The block holds values read from a raster of the given type, and synthesized values are of that type too.
     * The input block is returned unchanged when there is nothing to pad.
     */
    public RasterBlock pad (RasterBlock block, PadSpec pad, DataType type) {
        if (pad.isEmpty()) {
            return block;
        }
        checkArgument(block.height > 0 && block.width > 0, "Cannot pad an empty block.");
        int height = block.height + pad.rowBefore + pad.rowAfter;
        int width = block.width + pad.colBefore + pad.colAfter;
        RasterBlock padded = new RasterBlock(block.bands, height, width);
        boolean masked = block.hasMask();

        // Place the original block, then pad every original column up and down.
        double[] column = new double[height];
        boolean[] columnMask = masked ? new boolean[height] : null;
        for (int b = 0; b < block.bands; b++) {
            for (int c = 0; c < block.width; c++) {
                for (int r = 0; r < block.height; r++) {
                    column[pad.rowBefore + r] = block.get(b, r, c);
                    if (masked) columnMask[pad.rowBefore + r] = block.isMasked(b, r, c);
                }
                fillLine(column, columnMask, pad.rowBefore, block.height, pad.rowAfter, type);
                for (int r = 0; r < height; r++) {
                    padded.set(b, r, pad.colBefore + c, column[r]);
                    if (masked) padded.setMasked(b, r, pad.colBefore + c, columnMask[r]);
                }
            }
        }

        // Then pad every row of the result, including the rows that were just synthesized, left and right.
        if (pad.colBefore > 0 || pad.colAfter > 0) {
            double[] row = new double[width];
            boolean[] rowMask = masked ? new boolean[width] : null;
            for (int b = 0; b < block.bands; b++) {
                for (int r = 0; r < height; r++) {
                    for (int c = pad.colBefore; c < pad.colBefore + block.width; c++) {
                        row[c] = padded.get(b, r, c);
                        if (masked) rowMask[c] = padded.isMasked(b, r, c);
                    }
                    fillLine(row, rowMask, pad.colBefore, block.width, pad.colAfter, type);
                    for (int c = 0; c < width; c++) {
                        padded.set(b, r, c, row[c]);
                        if (masked) padded.setMasked(b, r, c, rowMask[c]);
                    }
                }
            }
        }
        return padded;
    }

}
