package com.grabber.api;

/**
 * Callback for backends to report transfer progress.
 * Implementations must never throw into the backend.
 */
public interface TransferListener {

    TransferListener NONE = new TransferListener() {
    };

    /**
     * @param downloadedBytes bytes received so far
     * @param totalBytes      expected size, or a value &lt;= 0 when unknown
     */
    default void onBytes(long downloadedBytes, long totalBytes) {
    }

    // Raw tool output line
    default void onLine(String line) {
    }
}
