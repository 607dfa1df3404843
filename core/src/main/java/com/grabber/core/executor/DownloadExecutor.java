package com.grabber.core.executor;

import com.grabber.api.DownloadBackend;
import com.grabber.api.DownloadOutcome;
import com.grabber.api.FetchRequest;
import com.grabber.api.TransferListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs one backend attempt and guarantees a normalized outcome: elapsed time is measured
 * here and anything a backend throws becomes a failed outcome instead of escaping.
 */
public class DownloadExecutor {
    private static final Logger logger = LoggerFactory.getLogger(DownloadExecutor.class);

    public DownloadOutcome invoke(DownloadBackend backend, FetchRequest request, TransferListener listener) {
        long start = System.nanoTime();
        DownloadOutcome outcome;
        try {
            outcome = backend.fetch(request, listener != null ? listener : TransferListener.NONE);
            if (outcome == null) {
                outcome = DownloadOutcome.failure(backend.getName() + " returned no outcome", null);
            }
        } catch (RuntimeException e) {
            logger.error("Backend {} crashed for {}", backend.getName(), request.url(), e);
            outcome = DownloadOutcome.failure(backend.getName() + " error: " + e.getMessage(), null);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        return outcome.withElapsed(elapsed);
    }
}
