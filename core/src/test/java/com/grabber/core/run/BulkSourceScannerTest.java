package com.grabber.core.run;

import com.grabber.common.model.LinkSource;
import com.grabber.test.TestBase;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BulkSourceScanner
 */
class BulkSourceScannerTest extends TestBase {

    private final BulkSourceScanner scanner = new BulkSourceScanner();

    @Test
    void testLinksFileWinsOverOtherTextFiles() throws Exception {
        File folder = new File(tempDir, "creator_b");
        writeFile(folder, "links.txt", "https://example.com/1");
        writeFile(folder, "notes.txt", "https://example.com/2");

        List<LinkSource> sources = scanner.scan(tempDir);
        assertEquals(1, sources.size());
        assertEquals("creator_b", sources.get(0).name());
        assertEquals(new File(folder, "links.txt"), sources.get(0).linksFile());
        assertEquals(folder, sources.get(0).folder());
    }

    @Test
    void testFallsBackToTextFilesExceptCookies() throws Exception {
        File folder = new File(tempDir, "creator_a");
        writeFile(folder, "b-list.txt", "x");
        writeFile(folder, "a-list.txt", "x");
        writeFile(folder, "instagram_cookies.txt", "x");
        writeFile(folder, ".hidden.txt", "x");
        writeFile(folder, "video.mp4", "x");

        List<LinkSource> sources = scanner.scan(tempDir);
        assertEquals(2, sources.size());
        assertEquals("a-list.txt", sources.get(0).linksFile().getName());
        assertEquals("b-list.txt", sources.get(1).linksFile().getName());
    }

    @Test
    void testFoldersAreSortedAndHiddenOnesIgnored() throws Exception {
        writeFile(new File(tempDir, "zeta"), "links.txt", "x");
        writeFile(new File(tempDir, "alpha"), "links.txt", "x");
        writeFile(new File(tempDir, ".cache"), "links.txt", "x");
        writeFile(tempDir, "links.txt", "root level files are not sources");
        new File(tempDir, "empty").mkdirs();

        List<String> names = scanner.scan(tempDir).stream().map(LinkSource::name).toList();
        assertEquals(List.of("alpha", "zeta"), names);
    }

    @Test
    void testMissingRootYieldsNothing() {
        assertTrue(scanner.scan(new File(tempDir, "nope")).isEmpty());
    }
}
