package com.grabber.core.url;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.grabber.common.model.DownloadRequest;
import com.grabber.common.model.LinkSource;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers URLs from free text, link-record collections or HTML and turns them into a
 * deduplicated request list (first-seen order).
 */
public class UrlExtractor {
    private static final Logger logger = LoggerFactory.getLogger(UrlExtractor.class);

    private static final Pattern URL_CANDIDATE = Pattern.compile(
            "((?:https?|ftps?)://[^\\s<>'\"`,;]+|www\\.[^\\s<>'\"`,;]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.-]*://", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOMAIN = Pattern.compile("^[\\w.-]+\\.[a-z]{2,}(?:/[\\w./?=&%+-]*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B-\\u200D\\u2060\\uFEFF]");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s,;]+");
    private static final Pattern HTML_HINT = Pattern.compile("<\\s*(a\\s|html|body|div)", Pattern.CASE_INSENSITIVE);

    private static final String LEADING_JUNK = "'\"<>([{*";
    private static final String TRAILING_JUNK = "'\"<>)]}.,;:!?*";

    private final UrlCanonicalizer canonicalizer;

    public UrlExtractor(UrlCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    /**
     * Extracts URLs from free text. HTML input is detected and its anchors are harvested too.
     */
    public List<String> extract(String rawInput) {
        if (rawInput == null || rawInput.isBlank()) return List.of();
        return dedupe(candidatesFromText(rawInput));
    }

    /**
     * Extracts URLs from link records: maps or JSON objects exposing a {@code url} field,
     * or plain strings (treated as text).
     */
    public List<String> extract(Iterable<?> records) {
        List<String> raw = new ArrayList<>();
        if (records == null) return List.of();
        for (Object item : records) {
            if (item == null) continue;
            if (item instanceof Map<?, ?> map) {
                Object url = map.get("url");
                if (url != null) raw.add(url.toString());
            } else if (item instanceof JsonObject obj) {
                JsonElement url = obj.get("url");
                if (url != null && url.isJsonPrimitive()) raw.add(url.getAsString());
            } else if (item instanceof JsonElement el && el.isJsonPrimitive()) {
                raw.addAll(candidatesFromText(el.getAsString()));
            } else {
                raw.addAll(candidatesFromText(item.toString()));
            }
        }
        return dedupe(raw);
    }

    public List<String> extract(JsonArray records) {
        List<Object> items = new ArrayList<>();
        if (records != null) records.forEach(items::add);
        return extract(items);
    }

    /**
     * Builds the immutable requests for a run from already extracted URLs.
     */
    public List<DownloadRequest> toRequests(List<String> urls, LinkSource source) {
        List<DownloadRequest> requests = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String url : urls) {
            String canonical = canonicalizer.canonicalize(url);
            String key = canonicalizer.dedupKey(canonical);
            if (!seen.add(key)) continue;
            requests.add(new DownloadRequest(url, canonical, key, Platform.classify(canonical), source));
        }
        return requests;
    }

    public UrlCanonicalizer getCanonicalizer() {
        return canonicalizer;
    }

    public List<DownloadRequest> plan(String rawInput) {
        return toRequests(extract(rawInput), null);
    }

    private List<String> candidatesFromText(String rawInput) {
        String text = ZERO_WIDTH.matcher(rawInput).replaceAll("").replace('\r', '\n');
        List<String> found = new ArrayList<>();

        if (HTML_HINT.matcher(text).find()) {
            Document doc = Jsoup.parse(text);
            for (Element a : doc.select("a[href]")) {
                found.add(a.attr("href"));
            }
            text = doc.text();
        }

        Matcher m = URL_CANDIDATE.matcher(text);
        boolean any = false;
        while (m.find()) {
            found.add(m.group(1));
            any = true;
        }
        if (!any) {
            // no scheme or www. anywhere: accept bare domain tokens like example.com/abc
            found.addAll(Arrays.asList(SEPARATORS.split(text)));
        }
        return found;
    }

    private List<String> dedupe(List<String> raw) {
        List<String> cleaned = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String candidate : raw) {
            String url = clean(candidate);
            if (url == null) continue;
            String key = canonicalizer.dedupKey(url);
            if (key.isEmpty() || !seen.add(key)) continue;
            cleaned.add(url);
        }
        logger.debug("Extracted {} distinct URLs from {} candidates", cleaned.size(), raw.size());
        return cleaned;
    }

    private static String clean(String candidate) {
        if (candidate == null) return null;
        String url = ZERO_WIDTH.matcher(candidate).replaceAll("").trim();
        int start = 0;
        int end = url.length();
        while (start < end && LEADING_JUNK.indexOf(url.charAt(start)) >= 0) start++;
        while (end > start && TRAILING_JUNK.indexOf(url.charAt(end - 1)) >= 0) end--;
        url = url.substring(start, end);
        if (url.isEmpty()) return null;

        if (!SCHEME.matcher(url).find()) {
            if (url.toLowerCase(Locale.ROOT).startsWith("www.") || DOMAIN.matcher(url).matches()) {
                url = "https://" + url.replaceFirst("^/+", "");
            } else {
                return null;
            }
        }
        int sep = url.indexOf("://");
        return url.substring(0, sep).toLowerCase(Locale.ROOT) + url.substring(sep);
    }
}
