package com.grabber.core.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Rotating pool of egress proxies. The active index only moves on {@link #rotate()}.
 */
public class ProxyPool {
    private static final Logger logger = LoggerFactory.getLogger(ProxyPool.class);

    private final List<ProxyEntry> entries;
    private int activeIndex = 0;

    public ProxyPool(List<ProxyEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static ProxyPool empty() {
        return new ProxyPool(List.of());
    }

    /**
     * Builds the pool from inline configuration entries plus an optional proxy file
     * (one entry per line, # comments). Unparseable lines are logged and dropped.
     */
    public static ProxyPool load(List<String> configured, File proxyFile) {
        List<String> lines = new ArrayList<>();
        if (configured != null) lines.addAll(configured);
        if (proxyFile != null && proxyFile.isFile()) {
            try {
                lines.addAll(Files.readAllLines(proxyFile.toPath(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                logger.error("Failed to read proxy file {}", proxyFile, e);
            }
        }

        List<ProxyEntry> entries = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line == null ? "" : line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            Optional<ProxyEntry> entry = ProxyEntry.parse(trimmed);
            if (entry.isPresent()) {
                if (!entries.contains(entry.get())) entries.add(entry.get());
            } else {
                logger.warn("⚠️ Ignoring malformed proxy entry: {}", trimmed.replaceAll(":[^:@]+@", ":***@"));
            }
        }
        if (!entries.isEmpty()) {
            logger.info("🌐 Proxy pool loaded with {} entr{}", entries.size(), entries.size() == 1 ? "y" : "ies");
        }
        return new ProxyPool(entries);
    }

    public synchronized Optional<ProxyEntry> getCurrent() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(activeIndex));
    }

    /**
     * Advances to the next entry, wrapping around. No-op for pools of size 0 or 1.
     */
    public synchronized void rotate() {
        if (entries.size() <= 1) return;
        activeIndex = (activeIndex + 1) % entries.size();
        logger.info("🔄 Rotated proxy to {}", entries.get(activeIndex));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<ProxyEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }
}
