package com.grabber.core.run;

import com.grabber.common.model.DownloadRequest;
import com.grabber.common.model.LinkSource;
import com.grabber.core.url.Platform;
import com.grabber.test.TestBase;
import org.junit.jupiter.api.Test;

import java.io.File;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RunSummary and the session tallies behind it.
 */
class RunSummaryTest extends TestBase {

    private static DownloadRequest request(String url, LinkSource source) {
        return new DownloadRequest(url, url, url, Platform.OTHER, source);
    }

    @Test
    void testEmptySessionIsSuccessful() {
        RunSummary summary = RunSummary.of(new SessionState(SessionState.Mode.SINGLE));
        assertTrue(summary.success());
        assertEquals("Downloaded 0, skipped 0", summary.message());
    }

    @Test
    void testPartialSuccessListsFailures() {
        SessionState session = new SessionState(SessionState.Mode.SINGLE);
        session.recordSuccess(request("https://example.com/1", null));
        session.recordSkip(request("https://example.com/2", null));
        session.recordFailure(request("https://example.com/3", null), "yt-dlp: transient - boom");

        RunSummary summary = RunSummary.of(session);
        assertTrue(summary.success());
        assertEquals(1, summary.downloaded());
        assertEquals(1, summary.skipped());
        assertEquals(1, summary.failed());
        assertTrue(summary.message().startsWith("Completed with caveats: downloaded 1, skipped 1, failed 1"));
        assertTrue(summary.message().contains("✗ https://example.com/3 : yt-dlp: transient - boom"));
    }

    @Test
    void testOnlyFailuresIsNotSuccessful() {
        SessionState session = new SessionState(SessionState.Mode.SINGLE);
        session.recordFailure(request("https://example.com/3", null), "nope");
        session.cancel();

        RunSummary summary = RunSummary.of(session);
        assertFalse(summary.success());
        assertTrue(summary.cancelled());
        assertTrue(summary.message().startsWith("Cancelled. All downloads failed: failed 1, skipped 0"));
    }

    @Test
    void testBulkTalliesPerSource() {
        File folder = new File(tempDir, "creator_a");
        LinkSource source = new LinkSource("creator_a", folder, new File(folder, "links.txt"));
        SessionState session = new SessionState(SessionState.Mode.BULK);
        session.recordSuccess(request("https://example.com/1", source));
        session.recordSuccess(request("https://example.com/2", source));
        session.recordFailure(request("https://example.com/3", source), "nope");

        SessionState.SourceTally tally = session.getTallies().get("creator_a");
        assertEquals(2, tally.getDownloaded());
        assertEquals(1, tally.getFailed());
        assertEquals(2, session.getDownloadedKeysByList().get(source.linksFile()).size());
        assertEquals("creator_a", session.getFailedUrls().get(0).source());
    }
}
