package com.conveyal.rastertools.processing;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Whether a processing algorithm sees one band at a time or the whole stack of requested bands at once.
 * The choice is applied once, when work items are built: the requested bands are split into the band selections
 * that each work item reads.
 */
public enum ProcessingMode {

    /** Each window is processed once per band, and the algorithm receives single-band blocks. */
    PER_BAND {
        @Override
        public List<int[]> bandSelections (int[] bands) {
            ImmutableList.Builder<int[]> selections = ImmutableList.builder();
            for (int band : bands) {
                selections.add(new int[] {band});
            }
            return selections.build();
        }
    },

    /** Each window is processed once, and the algorithm receives all requested bands together. */
    WHOLE_STACK {
        @Override
        public List<int[]> bandSelections (int[] bands) {
            return ImmutableList.of(bands.clone());
        }
    };

    /**
     * Split the requested one-based band numbers into the selections read by each work item of one window.
     * Every requested band appears in exactly one selection, in the requested order.
     */
    public abstract List<int[]> bandSelections (int[] bands);

}
