package com.grabber.core.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Human readable quality labels and their yt-dlp format strings.
 */
public enum Quality {
    MOBILE("mobile", "bestvideo[height<=480][ext=mp4]+bestaudio/best[height<=480]"),
    LOW("low", "bestvideo[height<=480][ext=mp4]+bestaudio/best[height<=480]"),
    MEDIUM("medium", "bestvideo[height<=720][ext=mp4]+bestaudio/best[height<=720]"),
    HD("hd", "bestvideo[height<=1080][ext=mp4]+bestaudio/best[height<=1080]"),
    UHD("4k", "bestvideo[height<=2160][ext=mp4]+bestaudio/best[height<=2160]"),
    BEST("best", "bestvideo+bestaudio/best");

    private final String label;
    private final String formatSpec;

    Quality(String label, String formatSpec) {
        this.label = label;
        this.formatSpec = formatSpec;
    }

    public String label() {
        return label;
    }

    public String formatSpec() {
        return formatSpec;
    }

    public static Optional<Quality> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String l = label.trim().toLowerCase(Locale.ROOT);
        for (Quality q : values()) {
            if (q.label.equals(l)) return Optional.of(q);
        }
        return Optional.empty();
    }
}
