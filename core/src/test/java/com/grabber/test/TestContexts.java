package com.grabber.test;

import com.grabber.core.auth.CookieResolver;
import com.grabber.core.config.Configuration;
import com.grabber.core.net.ProxyPool;
import com.grabber.core.net.RateLimiter;
import com.grabber.core.retry.FailureClassifier;
import com.grabber.core.retry.RetryPolicy;
import com.grabber.core.run.RunContext;
import com.grabber.core.strategy.BackendRegistry;
import com.grabber.core.strategy.StrategyTable;
import com.grabber.core.url.UrlCanonicalizer;
import com.grabber.core.url.UrlExtractor;

import java.io.File;
import java.util.List;
import java.util.Map;

/**
 * Run contexts wired for tests: no pacing, no real sleeps, cookies only from the test root.
 */
public final class TestContexts {

    private TestContexts() {
    }

    public static UrlExtractor extractor(Configuration config) {
        return new UrlExtractor(new UrlCanonicalizer(config.trackingParameters));
    }

    /**
     * @param strategy every platform maps to this backend list
     */
    public static RunContext.Builder builder(File root, Configuration config, BackendRegistry registry, List<String> strategy) {
        config.strategy.put("other", strategy);
        config.strategy.put("twitter", strategy);
        config.strategy.put("tiktok", strategy);
        config.strategy.put("youtube", strategy);
        config.strategy.put("instagram", strategy);
        return RunContext.builder()
                .config(config)
                .outputRoot(new File(root, "out"))
                .proxyPool(ProxyPool.empty())
                .rateLimiter(new RateLimiter(0, Map.of()))
                .cookieResolver(new CookieResolver(root, new File(root, "cookies"), new File(root, "no-user-cookies.txt")))
                .classifier(new FailureClassifier(config.blockSignatures, config.authSignatures))
                .strategyTable(new StrategyTable(config.strategy, strategy.size()))
                .registry(registry)
                .extractor(extractor(config))
                .retryPolicy(RetryPolicy.defaults())
                .sleeper(new RecordingSleeper());
    }
}
