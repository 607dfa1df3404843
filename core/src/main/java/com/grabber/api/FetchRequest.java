package com.grabber.api;

import com.grabber.core.net.ProxyEntry;

import java.io.File;
import java.time.Duration;
import java.util.Map;

/**
 * Parameters of a single backend invocation.
 *
 * @param url        canonical URL to fetch
 * @param outputDir  directory the media must end up in
 * @param cookieFile Netscape cookie file, or null
 * @param proxy      egress proxy, or null for a direct connection
 * @param formatSpec yt-dlp style format selector, or null for the backend default
 * @param headers    extra HTTP headers (User-Agent, Referer...)
 * @param timeout    upper bound for the whole invocation
 */
public record FetchRequest(String url,
                           File outputDir,
                           File cookieFile,
                           ProxyEntry proxy,
                           String formatSpec,
                           Map<String, String> headers,
                           Duration timeout) {

    public FetchRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public FetchRequest withCookieFile(File file) {
        return new FetchRequest(url, outputDir, file, proxy, formatSpec, headers, timeout);
    }

    public FetchRequest withProxy(ProxyEntry entry) {
        return new FetchRequest(url, outputDir, cookieFile, entry, formatSpec, headers, timeout);
    }
}
