package com.grabber.core.auth;

import com.grabber.test.TestBase;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CookieResolver
 */
class CookieResolverTest extends TestBase {

    private static final String COOKIE = ".instagram.com\tTRUE\t/\tTRUE\t1999999999\tsessionid\tabc123\n";

    @Test
    void testResolvesInPriorityOrder() throws Exception {
        File cookiesDir = new File(tempDir, "cookies");
        File master = writeFile(cookiesDir, "cookies.txt", COOKIE);
        File platform = writeFile(cookiesDir, "instagram.txt", COOKIE);
        File platformAlt = writeFile(cookiesDir, "instagram_cookies.txt", COOKIE);
        File rootGeneric = writeFile(tempDir, "cookies.txt", COOKIE);
        File user = writeFile(new File(tempDir, "desktop"), "cookies.txt", COOKIE);
        File sourceFolder = new File(tempDir, "creator");
        File local = writeFile(sourceFolder, "insta_cookies.txt", COOKIE);
        writeFile(sourceFolder, "links.txt", "https://www.instagram.com/p/abc\n");

        CookieResolver resolver = new CookieResolver(tempDir, cookiesDir, user);
        List<File> resolved = resolver.resolve("https://www.instagram.com/p/abc", sourceFolder);

        assertEquals(List.of(master, platform, platformAlt, rootGeneric, user, local), resolved);
    }

    @Test
    void testOtherPlatformsFilesAreNotOffered() throws Exception {
        File cookiesDir = new File(tempDir, "cookies");
        writeFile(cookiesDir, "tiktok.txt", COOKIE);
        File youtube = writeFile(cookiesDir, "youtube.txt", COOKIE);

        CookieResolver resolver = new CookieResolver(tempDir, cookiesDir, new File(tempDir, "missing.txt"));
        assertEquals(List.of(youtube), resolver.resolve("https://youtu.be/dQw4w9WgXcQ"));
    }

    @Test
    void testSkipsTinyAndMissingFiles() throws Exception {
        File cookiesDir = new File(tempDir, "cookies");
        writeFile(cookiesDir, "cookies.txt", "# empty");
        CookieResolver resolver = new CookieResolver(tempDir, cookiesDir, new File(tempDir, "missing.txt"));
        assertTrue(resolver.resolve("https://www.tiktok.com/@a/video/1").isEmpty());
    }

    @Test
    void testRemovesDuplicatePaths() throws Exception {
        File rootGeneric = writeFile(tempDir, "cookies.txt", COOKIE);
        // user file points at the same file as the generic fallback
        CookieResolver resolver = new CookieResolver(tempDir, new File(tempDir, "cookies"),
                new File(tempDir, "./cookies.txt"));
        assertEquals(List.of(rootGeneric), resolver.resolve("https://example.com/video"));
    }
}
