package com.grabber.core.run;

import com.grabber.common.util.Sleeper;
import com.grabber.core.auth.CookieResolver;
import com.grabber.core.config.Configuration;
import com.grabber.core.net.ProxyPool;
import com.grabber.core.net.RateLimiter;
import com.grabber.core.retry.FailureClassifier;
import com.grabber.core.retry.RetryPolicy;
import com.grabber.core.strategy.BackendRegistry;
import com.grabber.core.strategy.StrategyTable;
import com.grabber.core.tracking.DownloadTracker;
import com.grabber.core.tracking.HistoryStore;
import com.grabber.core.url.UrlExtractor;

import java.io.File;
import java.util.Objects;

/**
 * Everything one run needs, passed explicitly to the worker. Nothing here is shared
 * between runs except the registry and configuration it was built from.
 */
public final class RunContext {

    private final Configuration config;
    private final SessionState session;
    private final File outputRoot;
    private final boolean thorough;
    private final DownloadTracker tracker;
    private final HistoryStore history;
    private final ProxyPool proxyPool;
    private final RateLimiter rateLimiter;
    private final CookieResolver cookieResolver;
    private final FailureClassifier classifier;
    private final StrategyTable strategyTable;
    private final BackendRegistry registry;
    private final UrlExtractor extractor;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final DownloadListener listener;

    private RunContext(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.session = new SessionState(Objects.requireNonNull(b.mode, "mode"));
        this.outputRoot = Objects.requireNonNull(b.outputRoot, "outputRoot");
        this.thorough = b.thorough;
        this.tracker = b.tracker != null ? b.tracker : DownloadTracker.noOp();
        this.history = b.history;
        this.proxyPool = b.proxyPool != null ? b.proxyPool : ProxyPool.empty();
        this.rateLimiter = Objects.requireNonNull(b.rateLimiter, "rateLimiter");
        this.cookieResolver = Objects.requireNonNull(b.cookieResolver, "cookieResolver");
        this.classifier = Objects.requireNonNull(b.classifier, "classifier");
        this.strategyTable = Objects.requireNonNull(b.strategyTable, "strategyTable");
        this.registry = Objects.requireNonNull(b.registry, "registry");
        this.extractor = Objects.requireNonNull(b.extractor, "extractor");
        this.retryPolicy = b.retryPolicy != null ? b.retryPolicy : RetryPolicy.defaults();
        this.sleeper = b.sleeper != null ? b.sleeper : Sleeper.SYSTEM;
        this.listener = b.listener != null ? b.listener : DownloadListener.NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Configuration getConfig() {
        return config;
    }

    public SessionState getSession() {
        return session;
    }

    public File getOutputRoot() {
        return outputRoot;
    }

    public boolean isThorough() {
        return thorough;
    }

    public DownloadTracker getTracker() {
        return tracker;
    }

    /**
     * @return the history store, null in single mode
     */
    public HistoryStore getHistory() {
        return history;
    }

    public ProxyPool getProxyPool() {
        return proxyPool;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public CookieResolver getCookieResolver() {
        return cookieResolver;
    }

    public FailureClassifier getClassifier() {
        return classifier;
    }

    public StrategyTable getStrategyTable() {
        return strategyTable;
    }

    public BackendRegistry getRegistry() {
        return registry;
    }

    public UrlExtractor getExtractor() {
        return extractor;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public DownloadListener getListener() {
        return listener;
    }

    public static final class Builder {
        private Configuration config;
        private SessionState.Mode mode = SessionState.Mode.SINGLE;
        private File outputRoot;
        private boolean thorough;
        private DownloadTracker tracker;
        private HistoryStore history;
        private ProxyPool proxyPool;
        private RateLimiter rateLimiter;
        private CookieResolver cookieResolver;
        private FailureClassifier classifier;
        private StrategyTable strategyTable;
        private BackendRegistry registry;
        private UrlExtractor extractor;
        private RetryPolicy retryPolicy;
        private Sleeper sleeper;
        private DownloadListener listener;

        private Builder() {
        }

        public Builder config(Configuration config) {
            this.config = config;
            return this;
        }

        public Builder mode(SessionState.Mode mode) {
            this.mode = mode;
            return this;
        }

        public Builder outputRoot(File outputRoot) {
            this.outputRoot = outputRoot;
            return this;
        }

        public Builder thorough(boolean thorough) {
            this.thorough = thorough;
            return this;
        }

        public Builder tracker(DownloadTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public Builder history(HistoryStore history) {
            this.history = history;
            return this;
        }

        public Builder proxyPool(ProxyPool proxyPool) {
            this.proxyPool = proxyPool;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder cookieResolver(CookieResolver cookieResolver) {
            this.cookieResolver = cookieResolver;
            return this;
        }

        public Builder classifier(FailureClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder strategyTable(StrategyTable strategyTable) {
            this.strategyTable = strategyTable;
            return this;
        }

        public Builder registry(BackendRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder extractor(UrlExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder listener(DownloadListener listener) {
            this.listener = listener;
            return this;
        }

        public RunContext build() {
            return new RunContext(this);
        }
    }
}
