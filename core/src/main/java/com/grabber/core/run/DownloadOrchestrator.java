package com.grabber.core.run;

import com.grabber.api.FetchRequest;
import com.grabber.common.model.DownloadRequest;
import com.grabber.common.model.LinkSource;
import com.grabber.core.auth.NetscapeCookies;
import com.grabber.core.config.Configuration;
import com.grabber.core.executor.DownloadExecutor;
import com.grabber.core.progress.ProgressReporter;
import com.grabber.core.retry.RetryController;
import com.grabber.core.tracking.HistoryStore;
import com.grabber.core.url.CreatorExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The per-run download loop. URLs are processed strictly one after another; cancellation
 * is polled between URLs and between attempts, never by interrupting a running backend.
 */
public class DownloadOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(DownloadOrchestrator.class);

    private final RunContext ctx;
    private final DownloadExecutor executor;

    public DownloadOrchestrator(RunContext ctx) {
        this(ctx, new DownloadExecutor());
    }

    public DownloadOrchestrator(RunContext ctx, DownloadExecutor executor) {
        this.ctx = ctx;
        this.executor = executor;
    }

    public RunSummary run(List<DownloadRequest> requests) throws RunPreconditionException {
        if (requests == null || requests.isEmpty()) {
            throw new RunPreconditionException("No URLs to download");
        }
        checkOutputLocations(requests);

        SessionState session = ctx.getSession();
        Configuration config = ctx.getConfig();
        DownloadListener listener = ctx.getListener();

        RetryController retry = new RetryController(executor, ctx.getClassifier(), ctx.getProxyPool(),
                ctx.getRateLimiter(), ctx.getRetryPolicy(), ctx.getSleeper(), session::isCancelled);
        FallbackChain chain = new FallbackChain(ctx.getRegistry(), ctx.getStrategyTable(), retry,
                ctx.isThorough() || config.forceAllBackends);
        ProgressReporter reporter = new ProgressReporter(listener, session::isCancelled);

        logger.info("🚀 Starting {} run: {} URLs", session.getMode(), requests.size());
        int index = 0;
        for (DownloadRequest request : requests) {
            index++;
            if (session.isCancelled()) {
                logger.info("⏹️ Run cancelled, {} URLs left unprocessed", requests.size() - index + 1);
                break;
            }
            if (ctx.getTracker().isAlreadyDownloaded(request.dedupKey())) {
                session.recordSkip(request);
                listener.onUrlComplete(request, true, "already downloaded");
                continue;
            }

            listener.onLog("[" + index + "/" + requests.size() + "] " + request.canonicalUrl());
            reporter.reset();
            try {
                FallbackChain.ChainResult result = chain.execute(request, baseRequest(request, config),
                        cookiesFor(request), reporter, deadlineFor(config));
                if (result.succeeded()) {
                    markDownloaded(request);
                    session.recordSuccess(request);
                    listener.onUrlComplete(request, true, result.backend() + ": " + result.diagnostic());
                } else if (result.cancelled()) {
                    logger.info("⏹️ {} abandoned after cancellation", request.canonicalUrl());
                    break;
                } else {
                    session.recordFailure(request, result.diagnostic());
                    listener.onUrlComplete(request, false, result.diagnostic());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Worker interrupted, stopping run");
                session.cancel();
                break;
            }
        }

        finish();
        RunSummary summary = RunSummary.of(session);
        listener.onFinished(summary.success(), summary.message());
        return summary;
    }

    private void checkOutputLocations(List<DownloadRequest> requests) throws RunPreconditionException {
        Set<File> dirs = new LinkedHashSet<>();
        for (DownloadRequest r : requests) dirs.add(outputDirFor(r));
        for (File dir : dirs) {
            if (!dir.exists() && !dir.mkdirs()) {
                throw new RunPreconditionException("Cannot create output directory " + dir.getAbsolutePath());
            }
            if (!dir.isDirectory() || !Files.isWritable(dir.toPath())) {
                throw new RunPreconditionException("Output location is not writable: " + dir.getAbsolutePath());
            }
        }
    }

    /**
     * Bulk requests land in their source folder. Single-mode requests go to
     * {@code <outputRoot>/@<creator>} when the URL names a creator, else to the root itself.
     */
    private File outputDirFor(DownloadRequest request) {
        LinkSource source = request.source();
        if (source != null && source.folder() != null) return source.folder();
        return CreatorExtractor.creatorOf(request.canonicalUrl())
                .map(creator -> new File(ctx.getOutputRoot(), "@" + creator))
                .orElse(ctx.getOutputRoot());
    }

    private FetchRequest baseRequest(DownloadRequest request, Configuration config) {
        return new FetchRequest(request.canonicalUrl(), outputDirFor(request), null, null,
                config.formatSpec(), Map.of(), Duration.ofSeconds(config.backendTimeoutSeconds));
    }

    private List<File> cookiesFor(DownloadRequest request) {
        File sourceFolder = request.source() != null ? request.source().folder() : null;
        Set<File> usable = new LinkedHashSet<>();
        for (File f : ctx.getCookieResolver().resolve(request.canonicalUrl(), sourceFolder)) {
            NetscapeCookies.ensureNetscape(f, request.platform()).ifPresent(usable::add);
        }
        return new ArrayList<>(usable);
    }

    private static long deadlineFor(Configuration config) {
        if (config.maxSecondsPerUrl <= 0) return Long.MAX_VALUE;
        return System.nanoTime() + Duration.ofSeconds(config.maxSecondsPerUrl).toNanos();
    }

    private void markDownloaded(DownloadRequest request) {
        try {
            ctx.getTracker().markDownloaded(request.dedupKey());
        } catch (IOException e) {
            // the file is on disk; only the duplicate guard for the next run is lost
            logger.error("Failed to record {} in tracking log", request.dedupKey(), e);
        }
    }

    private void finish() {
        SessionState session = ctx.getSession();
        if (!session.isBulk()) return;

        HistoryStore history = ctx.getHistory();
        if (history != null && !session.getTallies().isEmpty()) {
            session.getTallies().forEach((source, tally) ->
                    history.update(source, tally.getDownloaded(), tally.getFailed()));
            try {
                history.save();
            } catch (IOException e) {
                logger.error("Failed to save download history", e);
            }
        }

        SourceListUpdater updater = new SourceListUpdater(ctx.getExtractor(), ctx.getExtractor().getCanonicalizer());
        session.getDownloadedKeysByList().forEach((file, keys) -> {
            try {
                updater.removeDownloaded(file, keys);
            } catch (IOException e) {
                logger.error("Failed to update source list {}", file, e);
            }
        });
    }
}
