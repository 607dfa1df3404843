package com.grabber.core.url;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the creator handle out of a post or profile URL. Single-mode downloads are
 * grouped into {@code @<creator>} folders with it.
 */
public final class CreatorExtractor {

    private static final Pattern YOUTUBE_HANDLE = Pattern.compile("/@([^/?#]+)");
    private static final Pattern YOUTUBE_CHANNEL = Pattern.compile("/channel/([^/?#]+)");
    private static final Pattern TIKTOK_HANDLE = Pattern.compile("tiktok\\.com/@([^/?#]+)");
    private static final Pattern FIRST_SEGMENT = Pattern.compile("^[a-z][a-z0-9+.-]*://[^/?#]+/([^/?#]+)");
    private static final Pattern UNSAFE = Pattern.compile("[^a-z0-9._-]");

    // First path segments that name a page type rather than an account
    private static final Map<Platform, Set<String>> RESERVED = Map.of(
            Platform.INSTAGRAM, Set.of("p", "reel", "reels", "tv", "stories", "explore"),
            Platform.TWITTER, Set.of("i", "home", "intent", "search", "hashtag"),
            Platform.FACEBOOK, Set.of("watch", "reel", "share", "video.php", "story.php", "photo.php", "permalink.php"));

    private CreatorExtractor() {
    }

    public static Optional<String> creatorOf(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        String lower = url.trim().toLowerCase(Locale.ROOT);
        Platform platform = Platform.classify(lower);

        String creator = null;
        switch (platform) {
            case YOUTUBE:
                creator = firstGroup(YOUTUBE_HANDLE, lower);
                if (creator == null) creator = firstGroup(YOUTUBE_CHANNEL, lower);
                break;
            case TIKTOK:
                creator = firstGroup(TIKTOK_HANDLE, lower);
                break;
            case INSTAGRAM:
            case TWITTER:
            case FACEBOOK:
                creator = firstGroup(FIRST_SEGMENT, lower);
                if (creator != null && RESERVED.get(platform).contains(creator)) creator = null;
                break;
            default:
                break;
        }
        if (creator == null) return Optional.empty();
        creator = UNSAFE.matcher(creator).replaceAll("_");
        if (creator.isEmpty() || creator.chars().allMatch(c -> c == '.')) return Optional.empty();
        return Optional.of(creator);
    }

    private static String firstGroup(Pattern pattern, String s) {
        Matcher m = pattern.matcher(s);
        return m.find() ? m.group(1) : null;
    }
}
