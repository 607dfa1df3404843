package com.grabber.core.run;

import com.grabber.core.config.Configuration;
import com.grabber.core.url.UrlExtractor;
import com.grabber.test.TestBase;
import com.grabber.test.TestContexts;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SourceListUpdater
 */
class SourceListUpdaterTest extends TestBase {

    private final UrlExtractor extractor = TestContexts.extractor(new Configuration());
    private final SourceListUpdater updater = new SourceListUpdater(extractor, extractor.getCanonicalizer());

    @Test
    void testRemovesOnlyFullyDownloadedLines() throws Exception {
        File links = writeFile(tempDir, "links.txt", String.join("\n",
                "# favourites",
                "https://www.instagram.com/p/AAA111/?igsh=xyz",
                "https://www.instagram.com/p/BBB222/",
                "two on one line: https://www.instagram.com/p/AAA111/ https://www.instagram.com/p/CCC333/",
                ""));

        int removed = updater.removeDownloaded(links, Set.of("instagram_AAA111"));

        assertEquals(1, removed);
        String content = readFile(links);
        assertTrue(content.contains("# favourites"));
        assertTrue(content.contains("BBB222"));
        assertTrue(content.contains("CCC333"), "line with a pending URL stays");
        assertFalse(content.contains("igsh=xyz"));
        assertFalse(new File(tempDir, "links.txt.tmp").exists());
    }

    @Test
    void testNothingToRemoveLeavesFileUntouched() throws Exception {
        File links = writeFile(tempDir, "links.txt", "https://example.com/a\n");
        long modified = links.lastModified();

        assertEquals(0, updater.removeDownloaded(links, Set.of("https://example.com/b")));
        assertEquals(0, updater.removeDownloaded(links, Set.of()));
        assertEquals("https://example.com/a\n", readFile(links));
        assertEquals(modified, links.lastModified());
    }

    @Test
    void testMissingFileIsIgnored() throws Exception {
        assertEquals(0, updater.removeDownloaded(new File(tempDir, "gone.txt"), Set.of("x")));
    }
}
