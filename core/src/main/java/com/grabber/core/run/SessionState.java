package com.grabber.core.run;

import com.grabber.common.model.DownloadRequest;
import com.grabber.common.model.LinkSource;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outcome bookkeeping of one run. Only the worker mutates the counters; the cancel flag
 * is the one field the controlling context writes.
 */
public class SessionState {

    public enum Mode {
        SINGLE,
        BULK
    }

    public record FailedUrl(String url, String source, String diagnostic) {
    }

    /**
     * Per-source tally for the history update at run end.
     */
    public static class SourceTally {
        private int downloaded;
        private int failed;

        public int getDownloaded() {
            return downloaded;
        }

        public int getFailed() {
            return failed;
        }
    }

    private final Mode mode;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private int successCount;
    private int skippedCount;
    private final List<FailedUrl> failedUrls = new ArrayList<>();
    private final Map<String, SourceTally> tallies = new LinkedHashMap<>();
    private final Map<File, Set<String>> downloadedKeysByList = new LinkedHashMap<>();

    public SessionState(Mode mode) {
        this.mode = mode;
    }

    public Mode getMode() {
        return mode;
    }

    public boolean isBulk() {
        return mode == Mode.BULK;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void recordSuccess(DownloadRequest request) {
        successCount++;
        for (LinkSource source : request.sources()) {
            tally(source.name()).downloaded++;
            if (source.linksFile() != null) {
                downloadedKeysByList.computeIfAbsent(source.linksFile(), f -> new LinkedHashSet<>())
                        .add(request.dedupKey());
            }
        }
    }

    void recordSkip(DownloadRequest request) {
        skippedCount++;
    }

    void recordFailure(DownloadRequest request, String diagnostic) {
        failedUrls.add(new FailedUrl(request.canonicalUrl(), request.sourceName(), diagnostic));
        for (LinkSource source : request.sources()) {
            tally(source.name()).failed++;
        }
    }

    private SourceTally tally(String sourceName) {
        return tallies.computeIfAbsent(sourceName, k -> new SourceTally());
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    public List<FailedUrl> getFailedUrls() {
        return Collections.unmodifiableList(failedUrls);
    }

    public Map<String, SourceTally> getTallies() {
        return Collections.unmodifiableMap(tallies);
    }

    public Map<File, Set<String>> getDownloadedKeysByList() {
        return Collections.unmodifiableMap(downloadedKeysByList);
    }
}
