package com.conveyal.rastertools.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs progress at INFO level each time another step of the given percentage has been completed, and once at the end.
 * Not threadsafe, it should be called from one thread only.
 */
public class LoggingProgressListener implements ProgressListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressListener.class);

    private final int stepPercent;

    private String description;
    private int total;
    private int done;
    private int lastReportedPercent;

    public LoggingProgressListener () {
        this(10);
    }

    public LoggingProgressListener (int stepPercent) {
        if (stepPercent < 1 || stepPercent > 100) {
            throw new IllegalArgumentException("Progress step must be between 1 and 100 percent.");
        }
        this.stepPercent = stepPercent;
    }

    @Override
    public void beginTask (String description, int totalElements) {
        this.description = description;
        this.total = totalElements;
        this.done = 0;
        this.lastReportedPercent = 0;
        LOG.info("{}: {} windows to process.", description, totalElements);
    }

    @Override
    public void increment (int n) {
        done += n;
        if (total <= 0) return;
        int percent = (int) (100L * done / total);
        if (done >= total) {
            LOG.info("{}: done, {} of {} windows.", description, done, total);
            lastReportedPercent = 100;
        } else if (percent >= lastReportedPercent + stepPercent) {
            lastReportedPercent = percent - percent % stepPercent;
            LOG.info("{}: {}% ({} of {} windows).", description, lastReportedPercent, done, total);
        }
    }

    /** Number of units reported so far in the current task. */
    public int done () {
        return done;
    }

}
