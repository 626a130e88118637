package com.conveyal.rastertools.processing;

import com.conveyal.rastertools.raster.RasterReader;
import com.conveyal.rastertools.raster.RasterSource;

import java.io.Closeable;
import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Hands each worker thread its own reader on the source raster, opened the first time that thread reads. Readers are
 * not threadsafe, so they are never shared. All readers opened during a run are closed together at its end, once no
 * worker is using them any more.
 */
class WorkerReaders implements Closeable {

    private final RasterSource source;

    private final ThreadLocal<RasterReader> threadReader = new ThreadLocal<>();

    private final Queue<RasterReader> openReaders = new ConcurrentLinkedQueue<>();

    WorkerReaders (RasterSource source) {
        this.source = source;
    }

    RasterReader get () throws IOException {
        RasterReader reader = threadReader.get();
        if (reader == null) {
            reader = source.openReader();
            openReaders.add(reader);
            threadReader.set(reader);
        }
        return reader;
    }

    /** Close every reader, reporting the first failure with any later ones attached as suppressed exceptions. */
    @Override
    public void close () throws IOException {
        IOException failure = null;
        RasterReader reader;
        while ((reader = openReaders.poll()) != null) {
            try {
                reader.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

}
