package com.grabber.core.url;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Closed set of recognized source platforms. Everything else is {@link #OTHER}.
 */
public enum Platform {
    YOUTUBE("youtube", List.of("youtube.com", "youtu.be")),
    INSTAGRAM("instagram", List.of("instagram.com")),
    TIKTOK("tiktok", List.of("tiktok.com")),
    FACEBOOK("facebook", List.of("facebook.com", "fb.watch", "fb.com")),
    TWITTER("twitter", List.of("twitter.com", "x.com")),
    REDDIT("reddit", List.of("reddit.com", "redd.it")),
    PINTEREST("pinterest", List.of("pinterest.com", "pin.it")),
    THREADS("threads", List.of("threads.net")),
    OTHER("other", List.of());

    private static final Pattern HOST = Pattern.compile("^[a-z][a-z0-9+.-]*://(?:[^@/?#]*@)?([^/?#:]+)", Pattern.CASE_INSENSITIVE);

    private final String tag;
    private final List<String> domains;

    Platform(String tag, List<String> domains) {
        this.tag = tag;
        this.domains = domains;
    }

    public String tag() {
        return tag;
    }

    public static Platform classify(String url) {
        String host = hostOf(url);
        if (host == null) return OTHER;
        for (Platform p : values()) {
            for (String d : p.domains) {
                if (host.equals(d) || host.endsWith("." + d)) return p;
            }
        }
        return OTHER;
    }

    public static Platform fromTag(String tag) {
        if (tag == null) return OTHER;
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (Platform p : values()) {
            if (p.tag.equals(t)) return p;
        }
        return OTHER;
    }

    /**
     * Lower-cased host of an absolute URL, or null for anything that is not one.
     */
    public static String hostOf(String url) {
        if (url == null) return null;
        Matcher m = HOST.matcher(url.trim());
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : null;
    }
}
