package com.grabber.core.progress;

import com.grabber.api.TransferListener;
import com.grabber.core.run.DownloadListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Turns raw byte counters from a backend into percentage, speed and ETA events. Nothing
 * in here may abort a download: every failure is logged at debug and dropped.
 */
public class ProgressReporter implements TransferListener {
    private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

    private static final long MIN_EMIT_INTERVAL_NANOS = 250_000_000L;

    private final DownloadListener listener;
    private final BooleanSupplier cancelled;
    private final LongSupplier clock;

    private long startNanos;
    private long lastBytes;
    private long lastEmitNanos;
    private boolean cancelNoticeSent;

    public ProgressReporter(DownloadListener listener, BooleanSupplier cancelled) {
        this(listener, cancelled, System::nanoTime);
    }

    public ProgressReporter(DownloadListener listener, BooleanSupplier cancelled, LongSupplier clock) {
        this.listener = listener;
        this.cancelled = cancelled;
        this.clock = clock;
        reset();
    }

    /**
     * Starts timing a new transfer.
     */
    public void reset() {
        startNanos = clock.getAsLong();
        lastBytes = 0;
        lastEmitNanos = Long.MIN_VALUE;
    }

    @Override
    public void onBytes(long downloadedBytes, long totalBytes) {
        try {
            // counters went backwards: the backend started a new attempt or a new stream
            if (downloadedBytes < lastBytes) reset();
            lastBytes = downloadedBytes;

            long now = clock.getAsLong();
            boolean complete = totalBytes > 0 && downloadedBytes >= totalBytes;
            if (!complete && lastEmitNanos != Long.MIN_VALUE && now - lastEmitNanos < MIN_EMIT_INTERVAL_NANOS) {
                return;
            }
            lastEmitNanos = now;

            double seconds = (now - startNanos) / 1_000_000_000.0;
            double speed = seconds > 0 ? downloadedBytes / seconds : 0;

            if (totalBytes > 0) {
                listener.onPercent(Math.min(100.0, downloadedBytes * 100.0 / totalBytes));
            }
            if (speed > 0) {
                listener.onSpeed(formatSpeed(speed));
                if (totalBytes > 0) {
                    long remaining = Math.max(0, totalBytes - downloadedBytes);
                    listener.onEta(formatEta(Math.round(remaining / speed)));
                }
            }
        } catch (RuntimeException e) {
            logger.debug("Progress update dropped: {}", e.getMessage());
        }
        pollCancellation();
    }

    @Override
    public void onLine(String line) {
        try {
            listener.onLog(line);
        } catch (RuntimeException e) {
            logger.debug("Progress line dropped: {}", e.getMessage());
        }
        pollCancellation();
    }

    private void pollCancellation() {
        try {
            if (!cancelNoticeSent && cancelled.getAsBoolean()) {
                cancelNoticeSent = true;
                listener.onLog("⏹️ Cancel requested, finishing current download...");
            }
        } catch (RuntimeException e) {
            logger.debug("Cancellation poll failed: {}", e.getMessage());
        }
    }

    public static String formatSpeed(double bytesPerSecond) {
        return String.format(Locale.ROOT, "%.2f MB/s", bytesPerSecond / (1024.0 * 1024.0));
    }

    public static String formatEta(long seconds) {
        return seconds + " seconds";
    }
}
