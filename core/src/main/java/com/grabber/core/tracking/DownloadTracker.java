package com.grabber.core.tracking;

import java.io.IOException;

/**
 * Cross-run duplicate detection keyed by dedup key.
 */
public interface DownloadTracker {

    boolean isAlreadyDownloaded(String key);

    /**
     * Records a successful download. Persistent implementations write through before
     * returning.
     */
    void markDownloaded(String key) throws IOException;

    /**
     * Tracker for single mode: remembers nothing and touches no file.
     */
    static DownloadTracker noOp() {
        return NoOpTracker.INSTANCE;
    }
}
