package com.grabber.common.model;

import com.grabber.core.url.Platform;

import java.util.ArrayList;
import java.util.List;

/**
 * One distinct URL scheduled for download in a run.
 *
 * @param rawInput     the token as it appeared in the input
 * @param canonicalUrl URL handed to the backends
 * @param dedupKey     identity used for duplicate detection
 * @param platform     classified source platform
 * @param source       originating source list in bulk mode, null in single mode
 * @param otherSources further bulk sources listing the same URL; their lists and history are
 *                     updated alongside {@code source}
 */
public record DownloadRequest(String rawInput,
                              String canonicalUrl,
                              String dedupKey,
                              Platform platform,
                              LinkSource source,
                              List<LinkSource> otherSources) {

    public DownloadRequest {
        otherSources = otherSources == null ? List.of() : List.copyOf(otherSources);
    }

    public DownloadRequest(String rawInput, String canonicalUrl, String dedupKey, Platform platform, LinkSource source) {
        this(rawInput, canonicalUrl, dedupKey, platform, source, List.of());
    }

    public String sourceName() {
        return source != null ? source.name() : null;
    }

    /**
     * Copy that also names {@code other} as an origin. Already known sources are ignored.
     */
    public DownloadRequest withOtherSource(LinkSource other) {
        if (other == null || sources().contains(other)) return this;
        List<LinkSource> more = new ArrayList<>(otherSources);
        more.add(other);
        return new DownloadRequest(rawInput, canonicalUrl, dedupKey, platform, source, more);
    }

    /**
     * Every source list the URL came from, the primary one first.
     */
    public List<LinkSource> sources() {
        List<LinkSource> all = new ArrayList<>();
        if (source != null) all.add(source);
        all.addAll(otherSources);
        return all;
    }
}
