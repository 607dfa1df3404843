package com.grabber.core.net;

import com.grabber.common.util.Sleeper;
import com.grabber.core.url.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-domain pacing: consecutive calls to one domain are at least the configured interval
 * apart, whichever backend issues them. Different domains never wait on each other.
 */
public class RateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<String, Long> lastCallNanos = new HashMap<>();
    private final Map<String, Long> intervalOverrides = new HashMap<>();
    private final long defaultIntervalNanos;
    private final Sleeper sleeper;

    /**
     * @param defaultIntervalSeconds interval for domains without an override
     * @param overrides              platform tag or domain to interval in seconds
     */
    public RateLimiter(double defaultIntervalSeconds, Map<String, Double> overrides, Sleeper sleeper) {
        this.defaultIntervalNanos = toNanos(defaultIntervalSeconds);
        if (overrides != null) {
            overrides.forEach((k, v) -> {
                if (k != null && v != null) intervalOverrides.put(k.toLowerCase(Locale.ROOT), toNanos(v));
            });
        }
        this.sleeper = sleeper;
    }

    public RateLimiter(double defaultIntervalSeconds, Map<String, Double> overrides) {
        this(defaultIntervalSeconds, overrides, Sleeper.SYSTEM);
    }

    /**
     * Sleeps until a call to {@code domain} is allowed, then records the call.
     */
    public synchronized void blockUntilAllowed(String domain) throws InterruptedException {
        String key = domain == null ? "" : domain.toLowerCase(Locale.ROOT);
        long interval = intervalFor(key);
        Long last = lastCallNanos.get(key);
        if (last != null && interval > 0) {
            long waitNanos = interval - (System.nanoTime() - last);
            if (waitNanos > 0) {
                long millis = (waitNanos + 999_999) / 1_000_000;
                logger.debug("⏳ Rate limit {}: waiting {} ms", key, millis);
                sleeper.sleep(millis);
            }
        }
        lastCallNanos.put(key, System.nanoTime());
    }

    long intervalFor(String domain) {
        Long direct = intervalOverrides.get(domain);
        if (direct != null) return direct;
        String tag = Platform.classify("https://" + domain).tag();
        return intervalOverrides.getOrDefault(tag, defaultIntervalNanos);
    }

    private static long toNanos(double seconds) {
        return (long) (Math.max(0, seconds) * 1_000_000_000L);
    }
}
