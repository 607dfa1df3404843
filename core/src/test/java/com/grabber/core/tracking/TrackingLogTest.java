package com.grabber.core.tracking;

import com.grabber.test.TestBase;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TrackingLog
 */
class TrackingLogTest extends TestBase {

    @Test
    void testMarkedKeysSurviveReload() throws Exception {
        TrackingLog log = TrackingLog.inFolder(tempDir);
        assertFalse(log.isAlreadyDownloaded("1790000000000000001"));

        log.markDownloaded("1790000000000000001");
        log.markDownloaded("https://www.instagram.com/p/Cxyz123/");
        assertTrue(log.isAlreadyDownloaded("1790000000000000001"));

        TrackingLog reloaded = TrackingLog.inFolder(tempDir);
        assertEquals(2, reloaded.size());
        assertTrue(reloaded.isAlreadyDownloaded("https://www.instagram.com/p/Cxyz123/"));
        assertEquals(new File(tempDir, ".downloaded_keys.txt"), reloaded.getLogFile());
    }

    @Test
    void testDuplicateMarksAppendOnce() throws Exception {
        TrackingLog log = TrackingLog.inFolder(tempDir);
        log.markDownloaded("abc");
        log.markDownloaded(" abc ");
        log.markDownloaded("");
        log.markDownloaded(null);

        List<String> lines = readFile(log.getLogFile()).lines().toList();
        assertEquals(List.of("abc"), lines);
    }

    @Test
    void testLoadIgnoresBlankLines() throws Exception {
        writeFile(tempDir, TrackingLog.FILE_NAME, "one\n\n  two  \n\n");
        TrackingLog log = TrackingLog.inFolder(tempDir);
        assertEquals(2, log.size());
        assertTrue(log.isAlreadyDownloaded("two"));
    }

    @Test
    void testConcurrentMarksAreAllPersisted() throws Exception {
        TrackingLog log = TrackingLog.inFolder(tempDir);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            String key = "key-" + i;
            futures.add(pool.submit(() -> {
                log.markDownloaded(key);
                return null;
            }));
        }
        for (Future<?> f : futures) f.get();
        pool.shutdown();

        assertEquals(40, TrackingLog.inFolder(tempDir).size());
    }

    @Test
    void testNoOpTrackerRemembersNothing() throws Exception {
        DownloadTracker tracker = DownloadTracker.noOp();
        tracker.markDownloaded("x");
        assertFalse(tracker.isAlreadyDownloaded("x"));
    }
}
