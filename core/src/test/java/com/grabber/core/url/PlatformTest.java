package com.grabber.core.url;

import com.grabber.test.TestBase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Platform
 */
class PlatformTest extends TestBase {

    @Test
    void testClassifiesKnownHostsAndSubdomains() {
        assertEquals(Platform.YOUTUBE, Platform.classify("https://m.youtube.com/watch?v=abc"));
        assertEquals(Platform.YOUTUBE, Platform.classify("https://youtu.be/abc"));
        assertEquals(Platform.TWITTER, Platform.classify("https://x.com/u/status/1"));
        assertEquals(Platform.FACEBOOK, Platform.classify("https://fb.watch/xyz"));
        assertEquals(Platform.TIKTOK, Platform.classify("https://vm.tiktok.com/ZM123/"));
        assertEquals(Platform.INSTAGRAM, Platform.classify("https://user:pw@www.instagram.com/p/a"));
    }

    @Test
    void testLookalikeHostsAreOther() {
        assertEquals(Platform.OTHER, Platform.classify("https://notyoutube.com/watch"));
        assertEquals(Platform.OTHER, Platform.classify("https://box.com/file"));
        assertEquals(Platform.OTHER, Platform.classify("not a url"));
        assertEquals(Platform.OTHER, Platform.classify(null));
    }

    @Test
    void testTagsRoundTrip() {
        for (Platform p : Platform.values()) {
            assertEquals(p, Platform.fromTag(p.tag()));
        }
        assertEquals(Platform.OTHER, Platform.fromTag("myspace"));
        assertEquals("other", Platform.OTHER.tag());
    }

    @Test
    void testHostOf() {
        assertEquals("www.example.com", Platform.hostOf("HTTPS://WWW.Example.com:8080/path"));
        assertNull(Platform.hostOf("www.example.com/path"));
    }
}
