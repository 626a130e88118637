package com.conveyal.rastertools.windows;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SlidingWindowsTest {

    /** Shorthand taking column offset, row offset, width and height, in that order. */
    private static Window xywh (int colOffset, int rowOffset, int width, int height) {
        return new Window(rowOffset, colOffset, height, width);
    }

    private static SlidingWindow sliding (Window read, PadSpec pad, Window write) {
        return new SlidingWindow(read, pad, write);
    }

    private static final PadSpec NO_PAD = PadSpec.NONE;

    @Test
    public void testWindowLargerThanImage () {
        assertEquals(ImmutableList.of(sliding(xywh(0, 0, 2, 2), NO_PAD, xywh(0, 0, 2, 2))),
                new SlidingWindows(2, 2, 5, 0).toList());
        // With overlap, the single window is padded on all sides.
        assertEquals(ImmutableList.of(sliding(xywh(0, 0, 2, 2), new PadSpec(1, 1, 1, 1), xywh(0, 0, 2, 2))),
                new SlidingWindows(2, 2, 5, 1).toList());
    }

    @Test
    public void testAdjacentWindows () {
        List<SlidingWindow> windows = new SlidingWindows(18, 18, 6, 0).toList();
        assertEquals(9, windows.size());
        int i = 0;
        for (int row = 0; row < 18; row += 6) {
            for (int col = 0; col < 18; col += 6) {
                Window expected = xywh(col, row, 6, 6);
                assertEquals(sliding(expected, NO_PAD, expected), windows.get(i++));
            }
        }
    }

    @Test
    public void testOverlappingWindows () {
        PadSpec rowsBefore = new PadSpec(2, 0, 0, 0);
        PadSpec rowsAfter = new PadSpec(0, 2, 0, 0);
        assertEquals(ImmutableList.of(
                sliding(xywh(0, 0, 8, 8), new PadSpec(2, 0, 2, 0), xywh(0, 0, 6, 6)),
                sliding(xywh(4, 0, 10, 8), rowsBefore, xywh(6, 0, 6, 6)),
                sliding(xywh(10, 0, 8, 8), new PadSpec(2, 0, 0, 2), xywh(12, 0, 6, 6)),
                sliding(xywh(0, 4, 8, 10), new PadSpec(0, 0, 2, 0), xywh(0, 6, 6, 6)),
                sliding(xywh(4, 4, 10, 10), NO_PAD, xywh(6, 6, 6, 6)),
                sliding(xywh(10, 4, 8, 10), new PadSpec(0, 0, 0, 2), xywh(12, 6, 6, 6)),
                sliding(xywh(0, 10, 8, 8), new PadSpec(0, 2, 2, 0), xywh(0, 12, 6, 6)),
                sliding(xywh(4, 10, 10, 8), rowsAfter, xywh(6, 12, 6, 6)),
                sliding(xywh(10, 10, 8, 8), new PadSpec(0, 2, 0, 2), xywh(12, 12, 6, 6))),
                new SlidingWindows(18, 18, 10, 2).toList());
    }

    @Test
    public void testDistinctOverlapPerAxis () {
        // 12 columns and 18 rows, windows 8 wide and 12 high, overlapping by 1 column and 2 rows.
        assertEquals(ImmutableList.of(
                sliding(xywh(0, 0, 7, 10), new PadSpec(2, 0, 1, 0), xywh(0, 0, 6, 8)),
                sliding(xywh(5, 0, 7, 10), new PadSpec(2, 0, 0, 1), xywh(6, 0, 6, 8)),
                sliding(xywh(0, 6, 7, 12), new PadSpec(0, 0, 1, 0), xywh(0, 8, 6, 8)),
                sliding(xywh(5, 6, 7, 12), new PadSpec(0, 0, 0, 1), xywh(6, 8, 6, 8)),
                sliding(xywh(0, 14, 7, 4), new PadSpec(0, 2, 1, 0), xywh(0, 16, 6, 2)),
                sliding(xywh(5, 14, 7, 4), new PadSpec(0, 2, 0, 1), xywh(6, 16, 6, 2))),
                new SlidingWindows(12, 18, 8, 12, 1, 2).toList());
    }

    @Test
    public void testFirstWindowPadding () {
        SlidingWindow first = new SlidingWindows(25, 25, 10, 2).iterator().next();
        assertEquals(new PadSpec(2, 0, 2, 0), first.pad);
        assertEquals(xywh(0, 0, 8, 8), first.readWindow);
        assertEquals(xywh(0, 0, 6, 6), first.writeWindow);
    }

    @Test
    public void testSizeMatchesIteration () {
        SlidingWindows windows = new SlidingWindows(100, 37, 16, 9, 3, 1);
        assertEquals(windows.toList().size(), windows.size());
    }

    /**
     * For every small combination of image size, window size and overlap, the write windows must cover every pixel
     * exactly once, the read window must be the write window grown by the overlap and clamped, and the padding must
     * be exactly what was clamped away.
     */
    @Test
    public void testWriteWindowsPartitionImage () {
        for (int width = 1; width <= 13; width++) {
            for (int height = 1; height <= 11; height += 2) {
                for (int size = 1; size <= 9; size++) {
                    for (int overlap = 0; 2 * overlap < size; overlap++) {
                        checkPartition(width, height, size, overlap);
                    }
                }
            }
        }
    }

    private static void checkPartition (int width, int height, int size, int overlap) {
        int[] covered = new int[width * height];
        String description = String.format("%dx%d image, window %d, overlap %d", width, height, size, overlap);
        for (SlidingWindow window : new SlidingWindows(width, height, size, overlap)) {
            Window write = window.writeWindow;
            assertTrue(write.isWithin(width, height), description);
            for (int r = write.rowStart(); r < write.rowStop(); r++) {
                for (int c = write.colStart(); c < write.colStop(); c++) {
                    covered[r * width + c] += 1;
                }
            }
            Window raw = Window.fromBounds(write.rowStart() - overlap, write.rowStop() + overlap,
                    write.colStart() - overlap, write.colStop() + overlap);
            assertEquals(raw.clampTo(width, height), window.readWindow, description);
            assertEquals(new PadSpec(
                    Math.max(0, -raw.rowStart()), Math.max(0, raw.rowStop() - height),
                    Math.max(0, -raw.colStart()), Math.max(0, raw.colStop() - width)), window.pad, description);
        }
        for (int i = 0; i < covered.length; i++) {
            assertEquals(1, covered[i], description + ", pixel " + i);
        }
    }

    @Test
    public void testInvalidArguments () {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindows(10, 10, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindows(10, 10, 8, -1));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindows(10, 10, 8, 4));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindows(10, 10, 8, 8, 1, 5));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindows(0, 10, 8, 1));
    }

}
