package com.grabber.core.run;

import com.grabber.common.model.DownloadRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one download job on its own worker thread so the controlling context stays
 * responsive. {@link #cancel()} only raises the flag; the worker finishes the transfer in
 * flight and stops at the next check.
 */
public class DownloadJobRunner {
    private static final Logger logger = LoggerFactory.getLogger(DownloadJobRunner.class);

    private final RunContext ctx;
    private final List<DownloadRequest> requests;
    private final DownloadOrchestrator orchestrator;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<RunSummary> result = new CompletableFuture<>();
    private Thread workerThread;

    public DownloadJobRunner(RunContext ctx, List<DownloadRequest> requests) {
        this(ctx, requests, new DownloadOrchestrator(ctx));
    }

    public DownloadJobRunner(RunContext ctx, List<DownloadRequest> requests, DownloadOrchestrator orchestrator) {
        this.ctx = ctx;
        this.requests = List.copyOf(requests);
        this.orchestrator = orchestrator;
    }

    public void start() {
        if (started.getAndSet(true)) return;
        workerThread = new Thread(this::workerLoop, "DownloadWorker");
        workerThread.start();
    }

    public void cancel() {
        if (!ctx.getSession().isCancelled()) {
            logger.warn("⏹️ Cancel requested");
            ctx.getSession().cancel();
        }
    }

    public boolean isRunning() {
        return workerThread != null && workerThread.isAlive();
    }

    /**
     * Blocks until the worker is done.
     */
    public RunSummary await() throws InterruptedException, RunPreconditionException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RunPreconditionException rpe) throw rpe;
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Download worker failed", cause);
        }
    }

    /**
     * Waits up to {@code millis} for the worker to stop.
     *
     * @return true when the worker is no longer running
     */
    public boolean awaitTermination(long millis) throws InterruptedException {
        if (workerThread == null) return true;
        workerThread.join(millis);
        return !workerThread.isAlive();
    }

    private void workerLoop() {
        try {
            result.complete(orchestrator.run(requests));
        } catch (RunPreconditionException e) {
            logger.error("❌ Run not started: {}", e.getMessage());
            result.completeExceptionally(e);
        } catch (Exception e) {
            logger.error("Download worker crashed", e);
            result.completeExceptionally(e);
        }
    }
}
