package com.grabber.core.auth;

import com.grabber.core.url.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;

/**
 * Helpers for Netscape formatted cookie files as consumed by yt-dlp and gallery-dl.
 */
public final class NetscapeCookies {
    private static final Logger logger = LoggerFactory.getLogger(NetscapeCookies.class);

    private static final Map<Platform, String> PLATFORM_DOMAINS = Map.of(
            Platform.INSTAGRAM, ".instagram.com",
            Platform.YOUTUBE, ".youtube.com",
            Platform.TIKTOK, ".tiktok.com",
            Platform.FACEBOOK, ".facebook.com",
            Platform.TWITTER, ".twitter.com");

    private NetscapeCookies() {
    }

    /**
     * Returns a Netscape formatted version of {@code cookieFile}: the file itself when it is
     * already in that layout, a converted copy in the temp cache for simple
     * {@code name=value} files, or empty when the file cannot be used.
     */
    public static Optional<File> ensureNetscape(File cookieFile, Platform platform) {
        List<String> lines = readLines(cookieFile);
        String first = firstDataLine(lines);
        if (first == null) return Optional.empty();
        if (first.chars().filter(c -> c == '\t').count() >= 6 || lines.get(0).startsWith("# Netscape")) {
            return Optional.of(cookieFile);
        }

        Map<String, String> entries = parseSimple(lines);
        String domain = PLATFORM_DOMAINS.get(platform);
        if (entries.isEmpty() || domain == null) return Optional.empty();

        try {
            File cacheDir = new File(System.getProperty("java.io.tmpdir"), "grabber_cookie_cache");
            cacheDir.mkdirs();
            File converted = new File(cacheDir, sha1(cookieFile.getAbsolutePath() + platform.tag()) + ".txt");
            long expiry = System.currentTimeMillis() / 1000 + 365L * 24 * 60 * 60;

            List<String> out = new ArrayList<>();
            out.add("# Netscape HTTP Cookie File");
            out.add("# Converted automatically from simple format");
            out.add("");
            entries.forEach((name, value) ->
                    out.add(String.join("\t", domain, "TRUE", "/", "TRUE", String.valueOf(expiry), name, value)));
            Files.write(converted.toPath(), out, StandardCharsets.UTF_8);
            logger.debug("Converted {} to Netscape format at {}", cookieFile.getName(), converted);
            return Optional.of(converted);
        } catch (IOException e) {
            logger.warn("Could not convert cookie file {}: {}", cookieFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Builds a {@code Cookie} header value from the entries of a Netscape file that apply to
     * {@code host}.
     */
    public static Optional<String> cookieHeader(File cookieFile, String host) {
        if (host == null) return Optional.empty();
        StringJoiner header = new StringJoiner("; ");
        for (String line : readLines(cookieFile)) {
            // curl/yt-dlp mark HttpOnly cookies with this prefix
            String l = line.startsWith("#HttpOnly_") ? line.substring("#HttpOnly_".length()) : line;
            if (l.isBlank() || l.startsWith("#")) continue;
            String[] parts = l.split("\t");
            if (parts.length < 7) continue;
            String domain = parts[0].startsWith(".") ? parts[0].substring(1) : parts[0];
            if (host.equals(domain) || host.endsWith("." + domain)) {
                header.add(parts[5] + "=" + parts[6]);
            }
        }
        return header.length() == 0 ? Optional.empty() : Optional.of(header.toString());
    }

    private static List<String> readLines(File file) {
        try {
            return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Unreadable cookie file {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private static String firstDataLine(List<String> lines) {
        for (String line : lines) {
            String s = line.strip();
            if (!s.isEmpty() && !s.startsWith("#")) return s;
        }
        return null;
    }

    private static Map<String, String> parseSimple(List<String> lines) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (String line : lines) {
            String s = line.strip();
            if (s.isEmpty() || s.startsWith("#")) continue;
            if (s.contains("\t")) return Map.of();
            String[] kv;
            if (s.contains("=")) kv = s.split("=", 2);
            else if (s.contains(" ")) kv = s.split(" ", 2);
            else continue;
            String name = kv[0].strip();
            String value = kv[1].strip();
            if (!name.isEmpty() && !value.isEmpty()) entries.put(name, value);
        }
        return entries;
    }

    private static String sha1(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            return Integer.toHexString(text.hashCode());
        }
    }
}
