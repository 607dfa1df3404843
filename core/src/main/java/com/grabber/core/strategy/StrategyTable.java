package com.grabber.core.strategy;

import com.grabber.core.url.Platform;

import java.util.*;

/**
 * Maps each platform to an ordered list of backend names, fastest and most reliable first.
 * Reordering or adding backends is a change to this table only.
 */
public class StrategyTable {

    public static final String YT_DLP = "yt-dlp";
    public static final String YT_DLP_TUNED = "yt-dlp-tuned";
    public static final String YT_DLP_GENERIC = "yt-dlp-generic";
    public static final String FFMPEG_STREAM = "ffmpeg-stream";
    public static final String GALLERY_DL = "gallery-dl";
    public static final String DIRECT_HTTP = "direct-http";

    private static final Map<Platform, List<String>> DEFAULTS = new EnumMap<>(Platform.class);

    static {
        DEFAULTS.put(Platform.YOUTUBE, List.of(YT_DLP, YT_DLP_TUNED, YT_DLP_GENERIC, FFMPEG_STREAM));
        DEFAULTS.put(Platform.INSTAGRAM, List.of(YT_DLP, GALLERY_DL, YT_DLP_TUNED, YT_DLP_GENERIC));
        DEFAULTS.put(Platform.TIKTOK, List.of(YT_DLP, YT_DLP_TUNED, YT_DLP_GENERIC, FFMPEG_STREAM));
        DEFAULTS.put(Platform.FACEBOOK, List.of(YT_DLP, YT_DLP_TUNED, YT_DLP_GENERIC, FFMPEG_STREAM));
        DEFAULTS.put(Platform.TWITTER, List.of(YT_DLP, GALLERY_DL, YT_DLP_TUNED, YT_DLP_GENERIC));
        DEFAULTS.put(Platform.REDDIT, List.of(YT_DLP, GALLERY_DL, YT_DLP_GENERIC));
        DEFAULTS.put(Platform.PINTEREST, List.of(GALLERY_DL, YT_DLP, YT_DLP_GENERIC));
        DEFAULTS.put(Platform.THREADS, List.of(YT_DLP, GALLERY_DL, YT_DLP_GENERIC));
        DEFAULTS.put(Platform.OTHER, List.of(YT_DLP, DIRECT_HTTP, YT_DLP_GENERIC, FFMPEG_STREAM));
    }

    private final Map<Platform, List<String>> table = new EnumMap<>(Platform.class);
    private final int defaultBackendCount;

    /**
     * @param overrides           platform tag to backend names; empty lists are ignored
     * @param defaultBackendCount how many entries a non-thorough lookup returns
     */
    public StrategyTable(Map<String, List<String>> overrides, int defaultBackendCount) {
        this.table.putAll(DEFAULTS);
        if (overrides != null) {
            overrides.forEach((tag, names) -> {
                if (names != null && !names.isEmpty()) {
                    table.put(Platform.fromTag(tag), List.copyOf(names));
                }
            });
        }
        this.defaultBackendCount = Math.max(1, defaultBackendCount);
    }

    /**
     * Ordered backend names for a platform.
     *
     * @param thorough include the slower alternates at the end of the list
     */
    public List<String> backendsFor(Platform platform, boolean thorough) {
        List<String> all = table.getOrDefault(platform, table.get(Platform.OTHER));
        if (thorough || all.size() <= defaultBackendCount) return all;
        return all.subList(0, defaultBackendCount);
    }
}
