package com.grabber.core.tracking;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-source download history kept in {@code history.json}, keyed by source name.
 * Read once on construction, written at run end.
 */
public class HistoryStore {
    private static final Logger logger = LoggerFactory.getLogger(HistoryStore.class);

    public static final String FILE_NAME = "history.json";

    private final File historyFile;
    private final Gson gson;
    private Map<String, HistoryEntry> entries;

    public HistoryStore(File historyFile) {
        this.historyFile = historyFile;
        this.gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
        load();
    }

    public static HistoryStore inFolder(File bulkRoot) {
        return new HistoryStore(new File(bulkRoot, FILE_NAME));
    }

    public synchronized HistoryEntry get(String source) {
        HistoryEntry e = entries.get(source);
        return e != null ? e : new HistoryEntry();
    }

    public synchronized Map<String, HistoryEntry> getAll() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * True when the source finished a download inside the given window.
     */
    public synchronized boolean downloadedWithin(String source, Duration window) {
        HistoryEntry e = entries.get(source);
        if (e == null || e.lastDownload == null) return false;
        try {
            LocalDateTime last = LocalDateTime.parse(e.lastDownload);
            return Duration.between(last, LocalDateTime.now()).compareTo(window) < 0;
        } catch (DateTimeParseException ex) {
            logger.debug("Unparseable lastDownload for {}: {}", source, e.lastDownload);
            return false;
        }
    }

    /**
     * Folds one session's tally for a source into its aggregate entry.
     */
    public synchronized void update(String source, int downloaded, int failed) {
        HistoryEntry e = entries.computeIfAbsent(source, k -> new HistoryEntry());
        e.totalDownloaded += downloaded;
        e.lastBatchCount = downloaded;
        e.totalFailed += failed;
        e.lastDownload = LocalDateTime.now().withNano(0).toString();
        if (failed == 0) e.lastStatus = "success";
        else if (downloaded > 0) e.lastStatus = "partial";
        else e.lastStatus = "failed";
    }

    /**
     * Writes the history atomically (temp file + move).
     */
    public synchronized void save() throws IOException {
        File parent = historyFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists()) parent.mkdirs();
        File tmp = new File(historyFile.getAbsolutePath() + ".tmp");
        try (Writer w = Files.newBufferedWriter(tmp.toPath(), StandardCharsets.UTF_8)) {
            gson.toJson(entries, w);
        }
        try {
            Files.move(tmp.toPath(), historyFile.toPath(),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.move(tmp.toPath(), historyFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void load() {
        entries = new LinkedHashMap<>();
        if (!historyFile.isFile()) return;
        try (Reader r = Files.newBufferedReader(historyFile.toPath(), StandardCharsets.UTF_8)) {
            Map<String, HistoryEntry> loaded = gson.fromJson(r, new TypeToken<LinkedHashMap<String, HistoryEntry>>() {
            }.getType());
            if (loaded != null) entries.putAll(loaded);
        } catch (Exception e) {
            logger.error("Failed to load history, starting empty", e);
        }
    }
}
