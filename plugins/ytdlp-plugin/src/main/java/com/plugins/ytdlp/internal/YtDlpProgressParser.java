package com.plugins.ytdlp.internal;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses yt-dlp output into byte counters. Understands the machine-readable line emitted
 * by {@link #PROGRESS_TEMPLATE} and, as a fallback, the default human-readable progress
 * line ({@code [download]  42.0% of ~10.00MiB at ...}).
 */
public final class YtDlpProgressParser {

    public static final String PREFIX = "GRABBER_PROGRESS";
    public static final String PROGRESS_TEMPLATE = "download:" + PREFIX
            + " %(progress.downloaded_bytes)s %(progress.total_bytes)s %(progress.total_bytes_estimate)s";

    private static final Pattern TEMPLATE_LINE = Pattern.compile("^" + PREFIX + "\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)");
    private static final Pattern HUMAN_LINE = Pattern.compile(
            "^\\[download]\\s+([\\d.]+)%\\s+of\\s+~?\\s*([\\d.]+)\\s*([KMGT]?i?B)", Pattern.CASE_INSENSITIVE);

    public record Progress(long downloadedBytes, long totalBytes) {
    }

    private YtDlpProgressParser() {
    }

    public static boolean isProgressLine(String line) {
        return line != null && (line.startsWith(PREFIX) || HUMAN_LINE.matcher(line.trim()).find());
    }

    public static Optional<Progress> parse(String line) {
        if (line == null) return Optional.empty();
        String s = line.trim();

        Matcher m = TEMPLATE_LINE.matcher(s);
        if (m.find()) {
            long downloaded = number(m.group(1));
            if (downloaded < 0) return Optional.empty();
            long total = number(m.group(2));
            if (total <= 0) total = number(m.group(3));
            return Optional.of(new Progress(downloaded, Math.max(total, -1)));
        }

        m = HUMAN_LINE.matcher(s);
        if (m.find()) {
            double percent = Double.parseDouble(m.group(1));
            long total = (long) (Double.parseDouble(m.group(2)) * unit(m.group(3)));
            return Optional.of(new Progress((long) (total * percent / 100.0), total));
        }
        return Optional.empty();
    }

    // yt-dlp prints NA for unknown fields and floats for estimates
    private static long number(String token) {
        try {
            return (long) Double.parseDouble(token);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static long unit(String u) {
        switch (u.toUpperCase(Locale.ROOT)) {
            case "KIB": return 1024L;
            case "MIB": return 1024L * 1024;
            case "GIB": return 1024L * 1024 * 1024;
            case "TIB": return 1024L * 1024 * 1024 * 1024;
            case "KB": return 1000L;
            case "MB": return 1000L * 1000;
            case "GB": return 1000L * 1000 * 1000;
            case "TB": return 1000L * 1000 * 1000 * 1000;
            default: return 1L;
        }
    }
}
