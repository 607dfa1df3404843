package com.grabber.core.url;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes URLs so that differently decorated links to the same post compare equal.
 * <p>
 * Both {@link #canonicalize(String)} and {@link #dedupKey(String)} are idempotent.
 */
public class UrlCanonicalizer {

    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B-\\u200D\\u2060\\uFEFF]");

    private static final Map<Platform, Pattern> ID_PATTERNS = Map.of(
            Platform.YOUTUBE, Pattern.compile("(?:[?&]v=|youtu\\.be/|/shorts/|/embed/|/live/)([A-Za-z0-9_-]{11})"),
            Platform.INSTAGRAM, Pattern.compile("/(?:p|reel|reels|tv)/([A-Za-z0-9_-]+)"),
            Platform.TIKTOK, Pattern.compile("/(?:video|photo)/(\\d+)"),
            Platform.TWITTER, Pattern.compile("/status(?:es)?/(\\d+)"),
            Platform.FACEBOOK, Pattern.compile("(?:/videos/(?:[^/?#]+/)?|/reel/|[?&]v=|[?&]story_fbid=)(\\d+)"),
            Platform.REDDIT, Pattern.compile("/comments/([a-z0-9]+)", Pattern.CASE_INSENSITIVE),
            Platform.PINTEREST, Pattern.compile("/pin/(\\d+)"),
            Platform.THREADS, Pattern.compile("/post/([A-Za-z0-9_-]+)"));

    private final List<String> trackingParameters;

    public UrlCanonicalizer(List<String> trackingParameters) {
        List<String> lower = new ArrayList<>();
        for (String p : trackingParameters) {
            if (p != null && !p.isBlank()) lower.add(p.trim().toLowerCase(Locale.ROOT));
        }
        this.trackingParameters = List.copyOf(lower);
    }

    /**
     * Strips tracking parameters and the fragment, lower-cases scheme and host and
     * removes trailing slashes from the path. Order of the remaining parameters is kept.
     */
    public String canonicalize(String url) {
        if (url == null) return "";
        String s = ZERO_WIDTH.matcher(url).replaceAll("").trim();
        if (s.isEmpty()) return s;

        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);

        String base = s;
        String query = null;
        int q = s.indexOf('?');
        if (q >= 0) {
            base = s.substring(0, q);
            query = s.substring(q + 1);
        }

        base = lowerSchemeAndHost(base);
        base = trimTrailingSlashes(base);

        List<String> kept = new ArrayList<>();
        if (query != null) {
            for (String param : query.split("&")) {
                if (param.isEmpty()) continue;
                int eq = param.indexOf('=');
                String name = (eq >= 0 ? param.substring(0, eq) : param).toLowerCase(Locale.ROOT);
                if (!isTracking(name)) kept.add(param);
            }
        }
        return kept.isEmpty() ? base : base + "?" + String.join("&", kept);
    }

    /**
     * Short platform-prefixed identifier (e.g. {@code tiktok_7301234567890}) for recognized
     * platforms, the canonical URL otherwise.
     */
    public String dedupKey(String url) {
        String canonical = canonicalize(url);
        Platform platform = Platform.classify(canonical);
        Pattern p = ID_PATTERNS.get(platform);
        if (p != null) {
            Matcher m = p.matcher(canonical);
            if (m.find()) {
                return platform.tag() + "_" + m.group(1);
            }
        }
        return canonical;
    }

    private boolean isTracking(String name) {
        for (String t : trackingParameters) {
            if (t.endsWith("_") ? name.startsWith(t) : name.equals(t)) return true;
        }
        return false;
    }

    private static String lowerSchemeAndHost(String base) {
        int sep = base.indexOf("://");
        if (sep < 0) return base;
        String scheme = base.substring(0, sep).toLowerCase(Locale.ROOT);
        String rest = base.substring(sep + 3);
        int slash = rest.indexOf('/');
        String authority = slash >= 0 ? rest.substring(0, slash) : rest;
        String path = slash >= 0 ? rest.substring(slash) : "";
        int at = authority.lastIndexOf('@');
        String host = at >= 0
                ? authority.substring(0, at + 1) + authority.substring(at + 1).toLowerCase(Locale.ROOT)
                : authority.toLowerCase(Locale.ROOT);
        return scheme + "://" + host + path;
    }

    private static String trimTrailingSlashes(String base) {
        int sep = base.indexOf("://");
        int pathStart = sep >= 0 ? base.indexOf('/', sep + 3) : -1;
        if (pathStart < 0) return base;
        String s = base;
        while (s.length() > pathStart + 1 && s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        // a bare "/" path carries no information either
        return s.length() == pathStart + 1 ? s.substring(0, pathStart) : s;
    }
}
