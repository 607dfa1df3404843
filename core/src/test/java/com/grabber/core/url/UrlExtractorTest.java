package com.grabber.core.url;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.grabber.common.model.DownloadRequest;
import com.grabber.core.config.Configuration;
import com.grabber.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UrlExtractor
 */
class UrlExtractorTest extends TestBase {

    private UrlExtractor extractor;

    @BeforeEach
    void init() {
        extractor = new UrlExtractor(new UrlCanonicalizer(new Configuration().trackingParameters));
    }

    @Test
    void testExtractsUrlsFromFreeTextWithPunctuation() {
        String text = "Check this https://www.tiktok.com/@u/video/123?is_from_webapp=1, and (https://youtu.be/dQw4w9WgXcQ).\n"
                + "Also \"https://example.com/clip.mp4\"; done";
        List<String> urls = extractor.extract(text);
        assertEquals(List.of(
                "https://www.tiktok.com/@u/video/123?is_from_webapp=1",
                "https://youtu.be/dQw4w9WgXcQ",
                "https://example.com/clip.mp4"), urls);
    }

    @Test
    void testTrackingVariantCollapsesToOneRequest() {
        List<DownloadRequest> requests = extractor.plan("https://x.com/p/abc?utm_source=ig\nhttps://x.com/p/abc");
        assertEquals(1, requests.size(), "tracking-decorated duplicate must collapse");
        assertEquals("https://x.com/p/abc", requests.get(0).canonicalUrl());
        assertEquals(Platform.TWITTER, requests.get(0).platform());
        assertNull(requests.get(0).source());
    }

    @Test
    void testDeduplicatesByPlatformIdPreservingFirstSeenOrder() {
        String text = "https://www.youtube.com/watch?v=dQw4w9WgXcQ https://example.com/a "
                + "https://youtu.be/dQw4w9WgXcQ https://example.com/a/";
        List<String> urls = extractor.extract(text);
        assertEquals(List.of("https://www.youtube.com/watch?v=dQw4w9WgXcQ", "https://example.com/a"), urls);
    }

    @Test
    void testRemovesZeroWidthCharacters() {
        List<String> urls = extractor.extract("https://\u200Bwww.instagram.com/p/ABC\uFEFF");
        assertEquals(List.of("https://www.instagram.com/p/ABC"), urls);
    }

    @Test
    void testPromotesWwwAndBareDomains() {
        assertEquals(List.of("https://www.youtube.com/watch?v=dQw4w9WgXcQ"),
                extractor.extract("www.youtube.com/watch?v=dQw4w9WgXcQ"));
        assertEquals(List.of("https://example.com/video.mp4"), extractor.extract("example.com/video.mp4"));
    }

    @Test
    void testLowerCasesScheme() {
        List<DownloadRequest> requests = extractor.plan("HTTPS://Example.com/A");
        assertEquals("https://example.com/A", requests.get(0).canonicalUrl());
    }

    @Test
    void testIgnoresTextWithoutUrls() {
        assertTrue(extractor.extract("nothing to see here").isEmpty());
        assertTrue(extractor.extract("   ").isEmpty());
        assertTrue(extractor.extract((String) null).isEmpty());
    }

    @Test
    void testExtractsFromRecordCollections() {
        List<Object> records = List.of(
                Map.of("url", "https://x.com/u/status/1", "title", "first"),
                Map.of("url", "https://twitter.com/u/status/1"),
                "see https://www.tiktok.com/@a/video/99");
        List<String> urls = extractor.extract(records);
        assertEquals(List.of("https://x.com/u/status/1", "https://www.tiktok.com/@a/video/99"), urls);
    }

    @Test
    void testExtractsFromJsonArray() {
        JsonArray array = new JsonArray();
        JsonObject a = new JsonObject();
        a.addProperty("url", "https://www.instagram.com/reel/Cabc/");
        array.add(a);
        JsonObject noUrl = new JsonObject();
        noUrl.addProperty("title", "no link");
        array.add(noUrl);
        array.add(new JsonPrimitive("https://youtu.be/dQw4w9WgXcQ"));

        List<String> urls = extractor.extract(array);
        assertEquals(List.of("https://www.instagram.com/reel/Cabc/", "https://youtu.be/dQw4w9WgXcQ"), urls);
    }

    @Test
    void testHarvestsAnchorsFromHtml() {
        String html = "<html><body><div><a href=\"https://www.instagram.com/reel/Cxyz/\">reel</a>"
                + "<a href=\"https://www.instagram.com/reel/Cxyz/?igsh=1\">same</a></div></body></html>";
        List<String> urls = extractor.extract(html);
        assertEquals(List.of("https://www.instagram.com/reel/Cxyz/"), urls);
    }
}
