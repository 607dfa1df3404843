package com.grabber;

import com.grabber.common.model.DownloadRequest;
import com.grabber.core.config.Configuration;
import com.grabber.core.run.RunPlanner;
import com.grabber.test.TestBase;
import com.grabber.test.TestContexts;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the input file handling and log tee of Main.
 */
class MainTest extends TestBase {

    private final RunPlanner planner = new RunPlanner(TestContexts.extractor(new Configuration()));

    @Test
    void testJsonFileIsReadAsRecords() throws Exception {
        File input = writeFile(tempDir, "links.json",
                "[{\"url\": \"https://example.com/a.mp4\"}, {\"url\": \"https://example.com/b.mp4\"}]");
        List<DownloadRequest> requests = Main.planFile(planner, input);
        assertEquals(2, requests.size());
    }

    @Test
    void testInvalidJsonFallsBackToText() throws Exception {
        File input = writeFile(tempDir, "links.json", "oops https://example.com/a.mp4 [");
        List<DownloadRequest> requests = Main.planFile(planner, input);
        assertEquals(1, requests.size());
        assertEquals("https://example.com/a.mp4", requests.get(0).canonicalUrl());
    }

    @Test
    void testHtmlFileIsHarvested() throws Exception {
        File input = writeFile(tempDir, "saved.html",
                "<html><body><a href=\"https://www.instagram.com/p/AbC123/\">post</a></body></html>");
        List<DownloadRequest> requests = Main.planFile(planner, input);
        assertEquals(1, requests.size());
        assertEquals("instagram_AbC123", requests.get(0).dedupKey());
    }

    @Test
    void testMultiOutputStreamWritesEverywhere() throws Exception {
        ByteArrayOutputStream a = new ByteArrayOutputStream();
        ByteArrayOutputStream b = new ByteArrayOutputStream();
        try (Main.MultiOutputStream tee = new Main.MultiOutputStream(a, b)) {
            tee.write("hello".getBytes(StandardCharsets.UTF_8));
            tee.write('!');
        }
        assertEquals("hello!", a.toString(StandardCharsets.UTF_8));
        assertEquals("hello!", b.toString(StandardCharsets.UTF_8));
    }
}
