package com.plugins.ytdlp.internal;

/**
 * Flavours of the yt-dlp backend.
 */
public enum YtDlpProfile {
    // plain extraction
    STANDARD,
    // geo bypass, relaxed TLS, platform-specific extractor arguments
    TUNED,
    // generic extractor, for pages the site extractor chokes on
    GENERIC
}
