package com.grabber.core.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Configuration {
    // --- Download settings ---
    public String outputDir = "downloads";
    public String quality = "best";
    public Integer customBitrate = null; // kbps, overrides quality when set
    public int maxRetries = 2;
    public boolean forceAllBackends = false;
    public int defaultBackendCount = 3;
    public int backendTimeoutSeconds = 1800;
    public int maxSecondsPerUrl = 0; // 0 = no wall-clock ceiling

    // --- Bulk mode ---
    public boolean skipRecentWindow = false;
    public int skipRecentHours = 24;

    // --- Egress / pacing ---
    public String proxyConfigPath = null;
    public List<String> proxies = new ArrayList<>();
    public double defaultRateLimitSeconds = 2.0;
    // Key = platform tag or domain, value = seconds between calls
    public Map<String, Double> rateLimits = new LinkedHashMap<>();

    // --- Credentials ---
    public String cookiesDir = "cookies";
    public String userCookieFile = null; // null = ~/Desktop/cookies.txt

    // --- Strategy table overrides (platform tag -> backend names) ---
    public Map<String, List<String>> strategy = new LinkedHashMap<>();

    // --- Heuristics ---
    public List<String> trackingParameters = new ArrayList<>(List.of(
            "utm_", "fbclid", "gclid", "igshid", "igsh", "si", "mibextid", "ref_src", "ref_url", "_r"));

    public List<String> blockSignatures = new ArrayList<>(List.of(
            "ip address is blocked",
            "ip has been blocked",
            "ip is blocked",
            "blocked your ip",
            "your ip address",
            "not available in your country",
            "not available in your region",
            "geo restricted",
            "geo-restricted",
            "georestricted",
            "http error 403",
            "403 forbidden",
            "403: forbidden",
            "access denied",
            "too many requests",
            "http error 429"));

    public List<String> authSignatures = new ArrayList<>(List.of(
            "login required",
            "log in to",
            "sign in to confirm",
            "http error 401",
            "401 unauthorized",
            "cookies are no longer valid",
            "use --cookies",
            "private video",
            "requested content is not available"));

    // --- Plugin control ---
    // Key = plugin name, value = enabled
    public Map<String, Boolean> plugins = new HashMap<>();

    // Key = plugin name, value = settings map (e.g. "yt_dlp_path" -> "tools/yt-dlp")
    public Map<String, Map<String, String>> pluginConfigs = new HashMap<>();

    public Configuration() {
        rateLimits.put("youtube", 2.0);
        rateLimits.put("instagram", 3.0);
        rateLimits.put("tiktok", 2.5);
        rateLimits.put("facebook", 3.0);
        rateLimits.put("twitter", 2.0);
    }

    // Helper for plugins to get at their settings
    public String getPluginSetting(String pluginName, String key, String defaultValue) {
        if (!pluginConfigs.containsKey(pluginName))
            return defaultValue;
        return pluginConfigs.get(pluginName).getOrDefault(key, defaultValue);
    }

    public void setPluginSetting(String pluginName, String key, String value) {
        pluginConfigs.computeIfAbsent(pluginName, k -> new HashMap<>()).put(key, value);
    }

    /**
     * Format selector for backends: custom bitrate wins over the quality preset.
     */
    public String formatSpec() {
        if (customBitrate != null && customBitrate > 0) {
            return "bestvideo[tbr<=" + customBitrate + "]+bestaudio/best[tbr<=" + customBitrate + "]/best";
        }
        return Quality.fromLabel(quality).map(Quality::formatSpec).orElse(null);
    }
}
