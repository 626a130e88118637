package com.conveyal.rastertools.processing;

import com.conveyal.rastertools.windows.SlidingWindow;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One unit of parallel work: a sliding window plus the bands to read from the source for it, and the bands of the
 * output raster its result is written to. Work items are created once before processing starts and never modified.
 * The band arrays are copied on the way in and out, so no one holding a work item can alter it.
 */
public class WorkItem {

    /** Position of this item in the order items were generated, for log and error messages. */
    public final int index;

    public final SlidingWindow slidingWindow;

    private final int[] sourceBands;

    private final int[] outputBands;

    public WorkItem (int index, SlidingWindow slidingWindow, int[] sourceBands, int[] outputBands) {
        checkArgument(index >= 0, "Work item index must not be negative.");
        checkNotNull(slidingWindow);
        checkArgument(sourceBands.length > 0, "A work item must read at least one band.");
        checkArgument(sourceBands.length == outputBands.length,
                "Work item reads %s bands but writes %s.", sourceBands.length, outputBands.length);
        this.index = index;
        this.slidingWindow = slidingWindow;
        this.sourceBands = sourceBands.clone();
        this.outputBands = outputBands.clone();
    }

    /** One-based numbers of the source bands read for this item. */
    public int[] sourceBands () {
        return sourceBands.clone();
    }

    /** One-based numbers of the output bands written with the result of this item. */
    public int[] outputBands () {
        return outputBands.clone();
    }

    /**
     * Build every work item for a run: for each sliding window in order, one item per band selection of the
     * processing mode. A requested band is always written to the output band at its position in the request, so
     * requesting bands 3 and 1 writes source band 3 to output band 1 and source band 1 to output band 2.
     */
    public static List<WorkItem> forWindows (Iterable<SlidingWindow> windows, int[] requestedBands,
                                             ProcessingMode mode) {
        int[] positions = new int[requestedBands.length];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = i + 1;
        }
        List<int[]> sourceSelections = mode.bandSelections(requestedBands);
        List<int[]> outputSelections = mode.bandSelections(positions);
        ImmutableList.Builder<WorkItem> items = ImmutableList.builder();
        int index = 0;
        for (SlidingWindow window : windows) {
            for (int s = 0; s < sourceSelections.size(); s++) {
                items.add(new WorkItem(index++, window, sourceSelections.get(s), outputSelections.get(s)));
            }
        }
        return items.build();
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkItem workItem = (WorkItem) o;
        return index == workItem.index && slidingWindow.equals(workItem.slidingWindow)
                && Arrays.equals(sourceBands, workItem.sourceBands) && Arrays.equals(outputBands, workItem.outputBands);
    }

    @Override
    public int hashCode () {
        int result = Objects.hash(index, slidingWindow);
        result = 31 * result + Arrays.hashCode(sourceBands);
        result = 31 * result + Arrays.hashCode(outputBands);
        return result;
    }

    @Override
    public String toString () {
        return String.format("work item %d (bands %s to %s, %s)", index, Arrays.toString(sourceBands),
                Arrays.toString(outputBands), slidingWindow.writeWindow);
    }

}
