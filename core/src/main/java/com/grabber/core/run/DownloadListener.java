package com.grabber.core.run;

import com.grabber.common.model.DownloadRequest;

/**
 * Events a run emits to its controlling context. All methods are called on the worker
 * thread; implementations must not block.
 */
public interface DownloadListener {

    DownloadListener NONE = new DownloadListener() {
    };

    default void onLog(String line) {
    }

    default void onPercent(double percent) {
    }

    default void onSpeed(String speed) {
    }

    default void onEta(String eta) {
    }

    default void onUrlComplete(DownloadRequest request, boolean success, String detail) {
    }

    default void onFinished(boolean success, String summaryMessage) {
    }
}
