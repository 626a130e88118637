package com.conveyal.rastertools.progress;

/**
 * This interface provides simple callbacks to allow long running operations to report on their progress.
 * Take care that all method implementations are very fast as the increment methods might be called in tight loops.
 * Processing calls these methods from a single thread, the one that writes the output.
 */
public interface ProgressListener {

    /**
     * Call this method once at the beginning of a new task, specifying how many sub-units of work will be performed.
     */
    void beginTask (String description, int totalElements);

    /** Call this method to report that N units of work have been performed. */
    void increment (int n);

    /** Call this method to report that one unit of work has been performed. */
    default void increment () {
        increment(1);
    }

}
