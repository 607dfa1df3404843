package com.grabber.core.net;

import com.grabber.test.RecordingSleeper;
import com.grabber.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RateLimiter
 */
class RateLimiterTest extends TestBase {

    @Test
    void testFirstCallIsFreeSecondWaitsForInterval() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        RateLimiter limiter = new RateLimiter(2.0, Map.of(), sleeper);

        limiter.blockUntilAllowed("www.example.com");
        assertTrue(sleeper.getSleeps().isEmpty());

        limiter.blockUntilAllowed("www.example.com");
        assertEquals(1, sleeper.getSleeps().size());
        long waited = sleeper.getSleeps().get(0);
        assertTrue(waited > 1500 && waited <= 2000, "expected close to 2000 ms, got " + waited);
    }

    @Test
    void testDomainsDoNotBlockEachOther() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        RateLimiter limiter = new RateLimiter(5.0, Map.of(), sleeper);

        limiter.blockUntilAllowed("www.youtube.com");
        limiter.blockUntilAllowed("www.tiktok.com");
        limiter.blockUntilAllowed("www.instagram.com");
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    void testPlatformOverridesApply() throws Exception {
        RateLimiter limiter = new RateLimiter(2.0, Map.of("instagram", 3.0, "cdn.example.com", 0.5));
        assertEquals(3_000_000_000L, limiter.intervalFor("www.instagram.com"));
        assertEquals(500_000_000L, limiter.intervalFor("cdn.example.com"));
        assertEquals(2_000_000_000L, limiter.intervalFor("example.org"));
    }

    @Test
    void testZeroIntervalNeverSleeps() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        RateLimiter limiter = new RateLimiter(0, Map.of(), sleeper);
        for (int i = 0; i < 5; i++) limiter.blockUntilAllowed("example.com");
        assertTrue(sleeper.getSleeps().isEmpty());
    }
}
