package com.conveyal.rastertools.windows;

import java.util.Objects;

/**
 * One step of a sliding window traversal: the clamped window to read from the source, the padding to synthesize
 * around it, and the smaller window of useful data (without overlap) to write into the output.
 */
public class SlidingWindow {

    public final Window readWindow;

    public final PadSpec pad;

    public final Window writeWindow;

    public SlidingWindow (Window readWindow, PadSpec pad, Window writeWindow) {
        this.readWindow = readWindow;
        this.pad = pad;
        this.writeWindow = writeWindow;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SlidingWindow that = (SlidingWindow) o;
        return readWindow.equals(that.readWindow) && pad.equals(that.pad) && writeWindow.equals(that.writeWindow);
    }

    @Override
    public int hashCode () {
        return Objects.hash(readWindow, pad, writeWindow);
    }

    @Override
    public String toString () {
        return "read " + readWindow + " pad " + pad + " write " + writeWindow;
    }

}
