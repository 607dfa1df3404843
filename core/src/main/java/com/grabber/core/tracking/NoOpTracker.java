package com.grabber.core.tracking;

final class NoOpTracker implements DownloadTracker {

    static final NoOpTracker INSTANCE = new NoOpTracker();

    private NoOpTracker() {
    }

    @Override
    public boolean isAlreadyDownloaded(String key) {
        return false;
    }

    @Override
    public void markDownloaded(String key) {
        // single mode keeps no state
    }
}
