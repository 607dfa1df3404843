package com.grabber.core.retry;

import com.grabber.api.DownloadBackend;
import com.grabber.api.DownloadOutcome;
import com.grabber.api.FetchRequest;
import com.grabber.api.TransferListener;
import com.grabber.common.util.Sleeper;
import com.grabber.core.executor.DownloadExecutor;
import com.grabber.core.net.ProxyEntry;
import com.grabber.core.net.ProxyPool;
import com.grabber.core.net.RateLimiter;
import com.grabber.core.url.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Drives the retry budget of a single backend for a single URL:
 * <ol>
 *     <li>attempt without proxy</li>
 *     <li>blocked and a proxy is configured: retry once through the proxy</li>
 *     <li>still blocked: rotate the proxy and retry with exponential backoff</li>
 *     <li>anything else: one plain retry, then the backend counts as exhausted</li>
 * </ol>
 * An authentication rejection moves on to the next cookie candidate first. Unavailable
 * backends are never retried.
 */
public class RetryController {
    private static final Logger logger = LoggerFactory.getLogger(RetryController.class);

    private final DownloadExecutor executor;
    private final FailureClassifier classifier;
    private final ProxyPool proxyPool;
    private final RateLimiter rateLimiter;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final BooleanSupplier cancelled;

    public RetryController(DownloadExecutor executor,
                           FailureClassifier classifier,
                           ProxyPool proxyPool,
                           RateLimiter rateLimiter,
                           RetryPolicy policy,
                           Sleeper sleeper,
                           BooleanSupplier cancelled) {
        this.executor = executor;
        this.classifier = classifier;
        this.proxyPool = proxyPool;
        this.rateLimiter = rateLimiter;
        this.policy = policy;
        this.sleeper = sleeper;
        this.cancelled = cancelled;
    }

    /**
     * Result of spending one backend's budget on a URL.
     */
    public record BackendResult(DownloadOutcome outcome, FailureType failure, int attempts) {
        public boolean succeeded() {
            return outcome != null && outcome.succeeded();
        }
    }

    /**
     * @param backend        backend to drive
     * @param base           request without proxy and cookie file
     * @param cookies        cookie candidates in priority order (may be empty)
     * @param listener       progress sink
     * @param deadlineNanos  {@link System#nanoTime()} value after which no new attempt starts,
     *                       or {@link Long#MAX_VALUE}
     */
    public BackendResult run(DownloadBackend backend,
                             FetchRequest base,
                             List<File> cookies,
                             TransferListener listener,
                             long deadlineNanos) throws InterruptedException {
        List<File> cookieQueue = new ArrayList<>(cookies);
        if (cookieQueue.isEmpty()) cookieQueue.add(null);

        String domain = Platform.hostOf(base.url());
        int cookieIndex = 0;
        ProxyEntry proxy = null;
        int transientLeft = policy.transientRetries();
        int proxyLeft = policy.proxyRetries();
        int backoffIndex = 0;
        int attempts = 0;
        DownloadOutcome last = null;

        while (true) {
            if (cancelled.getAsBoolean()) {
                return new BackendResult(last, FailureType.CANCELLED, attempts);
            }
            if (attempts > 0 && System.nanoTime() > deadlineNanos) {
                logger.warn("⏱️ Time budget for {} spent, leaving {}", base.url(), backend.getName());
                return new BackendResult(last, FailureType.DEADLINE, attempts);
            }

            FetchRequest request = base.withCookieFile(cookieQueue.get(cookieIndex)).withProxy(proxy);
            rateLimiter.blockUntilAllowed(domain);
            attempts++;
            logger.debug("{} attempt {} for {} (proxy: {}, cookies: {})", backend.getName(), attempts,
                    base.url(), proxy, request.cookieFile() != null ? request.cookieFile().getName() : "none");
            last = executor.invoke(backend, request, listener);

            if (last.succeeded()) {
                return new BackendResult(last, FailureType.NONE, attempts);
            }
            if (last.kind() == DownloadOutcome.Kind.UNAVAILABLE) {
                logger.warn("🔧 {} is not available: {}", backend.getName(), last.shortDiagnostic());
                return new BackendResult(last, FailureType.CONFIGURATION, attempts);
            }

            FailureClassification cls = classifier.classify(last.diagnosticText());

            if (cls.authRejected() && !cls.ipBlocked()) {
                if (cookieIndex + 1 < cookieQueue.size()) {
                    cookieIndex++;
                    logger.info("🍪 {} rejected the cookies, trying {}", backend.getName(),
                            cookieQueue.get(cookieIndex).getName());
                    continue;
                }
                return new BackendResult(last, FailureType.AUTHENTICATION, attempts);
            }

            if (cls.ipBlocked()) {
                if (proxy == null && proxyLeft > 0 && proxyPool.getCurrent().isPresent()) {
                    proxyLeft--;
                    proxy = proxyPool.getCurrent().get();
                    logger.warn("🚫 {} looks IP-blocked, retrying via proxy {}", base.url(), proxy);
                    continue;
                }
                if (backoffIndex < policy.blockedRetries()) {
                    if (proxy != null && proxyPool.size() > 1) {
                        proxyPool.rotate();
                        proxy = proxyPool.getCurrent().orElse(null);
                    }
                    long delay = policy.backoffMillis(backoffIndex++);
                    logger.warn("🚫 Still blocked, backing off {} ms before retry {}/{}", delay,
                            backoffIndex, policy.blockedRetries());
                    sleeper.sleep(delay);
                    continue;
                }
                return new BackendResult(last, FailureType.ACCESS_BLOCKED, attempts);
            }

            if (transientLeft > 0) {
                transientLeft--;
                logger.info("🔁 {} failed ({}), retrying once", backend.getName(), last.shortDiagnostic());
                continue;
            }
            FailureType type = last.kind() == DownloadOutcome.Kind.TIMEOUT ? FailureType.TIMEOUT : FailureType.TRANSIENT;
            return new BackendResult(last, type, attempts);
        }
    }
}
