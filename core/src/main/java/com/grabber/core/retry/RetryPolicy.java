package com.grabber.core.retry;

import java.time.Duration;

/**
 * Per-backend retry budget.
 *
 * @param transientRetries same-backend retries for failures without a block signature
 * @param proxyRetries     retries through the proxy once a block is detected
 * @param blockedRetries   backoff retries after the proxy retry was blocked as well
 * @param baseBackoff      first backoff delay, doubled for each further retry
 */
public record RetryPolicy(int transientRetries, int proxyRetries, int blockedRetries, Duration baseBackoff) {

    public static RetryPolicy defaults() {
        return new RetryPolicy(1, 1, 2, Duration.ofSeconds(2));
    }

    public static RetryPolicy withBlockedRetries(int blockedRetries) {
        return new RetryPolicy(1, 1, Math.max(0, blockedRetries), Duration.ofSeconds(2));
    }

    /**
     * Delay before the given backoff retry (0-based): base, 2*base, 4*base...
     */
    public long backoffMillis(int backoffIndex) {
        return baseBackoff.toMillis() * (1L << Math.min(backoffIndex, 20));
    }
}
