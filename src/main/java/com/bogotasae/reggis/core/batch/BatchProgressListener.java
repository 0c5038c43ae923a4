package com.bogotasae.reggis.core.batch;

import com.bogotasae.reggis.core.fs.InputUnit;

/**
 * Progress channel of a batch run. Unit and line events arrive on worker threads.
 * Exceptions thrown by a listener are logged and otherwise ignored.
 */
public interface BatchProgressListener {

    BatchProgressListener NONE = new BatchProgressListener() {
    };

    default void onStateChanged(BatchState state) {
    }

    default void onUnitStarted(InputUnit unit, int totalUnits) {
    }

    default void onUnitCompleted(InputUnit unit, int linesExtracted) {
    }

    default void onUnitFailed(InputUnit unit, FileError error) {
    }

    /**
     * Fired each time the running total of extracted lines crosses a multiple of the configured interval.
     */
    default void onLinesExtracted(long totalLines) {
    }

    default void onFinished(BatchReport report) {
    }
}
