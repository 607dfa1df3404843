package com.grabber.core.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Bulk-mode tracker: an in-memory key set backed by an append-only text log, one key per
 * line. The log is read once on construction and appended synchronously on every mark.
 */
public class TrackingLog implements DownloadTracker {
    private static final Logger logger = LoggerFactory.getLogger(TrackingLog.class);

    public static final String FILE_NAME = ".downloaded_keys.txt";

    private final File logFile;
    private final Set<String> keys = Collections.synchronizedSet(new HashSet<>());

    public TrackingLog(File logFile) {
        this.logFile = logFile;
        load();
    }

    public static TrackingLog inFolder(File bulkRoot) {
        return new TrackingLog(new File(bulkRoot, FILE_NAME));
    }

    @Override
    public boolean isAlreadyDownloaded(String key) {
        return key != null && keys.contains(key.trim());
    }

    @Override
    public synchronized void markDownloaded(String key) throws IOException {
        if (key == null || key.isBlank()) return;
        String k = key.trim();
        if (keys.contains(k)) return;

        File parent = logFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists()) parent.mkdirs();

        byte[] line = (k + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
        try (FileChannel ch = FileChannel.open(logFile.toPath(),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.APPEND, StandardOpenOption.DSYNC);
             FileLock ignored = ch.lock()) {
            ByteBuffer buf = ByteBuffer.wrap(line);
            while (buf.hasRemaining()) ch.write(buf);
        }
        keys.add(k);
    }

    public int size() {
        return keys.size();
    }

    public File getLogFile() {
        return logFile;
    }

    private void load() {
        if (!logFile.isFile()) return;
        try (BufferedReader reader = Files.newBufferedReader(logFile.toPath(), StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String k = line.trim();
                if (!k.isEmpty()) keys.add(k);
            }
            logger.info("📚 Tracking log loaded: {} known downloads", keys.size());
        } catch (IOException e) {
            logger.error("Failed to read tracking log {}", logFile, e);
        }
    }
}
