package com.plugins.ytdlp.internal;

import com.grabber.api.FetchRequest;
import com.grabber.common.util.ProcessRunner;
import com.grabber.common.util.ToolLocator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GalleryDlBackend and the shared error ordering.
 */
class GalleryDlBackendTest {

    @TempDir
    File tempDir;

    @Test
    void testCommand() {
        GalleryDlBackend backend = new GalleryDlBackend(new ToolLocator(tempDir, ""), new ProcessRunner(), "gallery-dl");
        FetchRequest req = new FetchRequest("https://www.instagram.com/p/AbC123/", tempDir, new File(tempDir, "c.txt"), null, null,
                Map.of("User-Agent", "UA/2", "Referer", "https://www.instagram.com/"), Duration.ofSeconds(60));

        List<String> cmd = backend.buildCommand("gallery-dl", req);

        assertEquals(tempDir.getAbsolutePath(), cmd.get(cmd.indexOf("--directory") + 1));
        assertEquals("UA/2", cmd.get(cmd.indexOf("--user-agent") + 1));
        assertTrue(cmd.contains("--cookies"));
        assertFalse(cmd.contains("--proxy"));
        assertEquals("https://www.instagram.com/p/AbC123/", cmd.get(cmd.size() - 1));
    }

    @Test
    void testErrorFirst() {
        String output = "[instagram][info] fetching\n[instagram][error] HttpError: 401 Unauthorized\nbye";
        assertTrue(ExternalToolBackend.errorFirst(output).startsWith("[instagram][error] HttpError: 401 Unauthorized\n"));
        assertEquals("plain", ExternalToolBackend.errorFirst("plain"));
    }
}
