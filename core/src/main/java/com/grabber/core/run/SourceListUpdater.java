package com.grabber.core.run;

import com.grabber.core.url.UrlCanonicalizer;
import com.grabber.core.url.UrlExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Removes lines whose URLs were all downloaded from a bulk source list. Lines without URLs
 * (comments, notes) and lines still holding pending URLs are kept.
 */
public class SourceListUpdater {
    private static final Logger logger = LoggerFactory.getLogger(SourceListUpdater.class);

    private final UrlExtractor extractor;
    private final UrlCanonicalizer canonicalizer;

    public SourceListUpdater(UrlExtractor extractor, UrlCanonicalizer canonicalizer) {
        this.extractor = extractor;
        this.canonicalizer = canonicalizer;
    }

    /**
     * @return number of removed lines
     */
    public int removeDownloaded(File linksFile, Set<String> downloadedKeys) throws IOException {
        if (downloadedKeys.isEmpty() || !linksFile.isFile()) return 0;

        List<String> lines = Files.readAllLines(linksFile.toPath(), StandardCharsets.UTF_8);
        List<String> kept = new ArrayList<>(lines.size());
        int removed = 0;
        for (String line : lines) {
            List<String> urls = extractor.extract(line);
            boolean allDone = !urls.isEmpty()
                    && urls.stream().allMatch(u -> downloadedKeys.contains(canonicalizer.dedupKey(u)));
            if (allDone) {
                removed++;
            } else {
                kept.add(line);
            }
        }
        if (removed == 0) return 0;

        File tmp = new File(linksFile.getAbsolutePath() + ".tmp");
        Files.write(tmp.toPath(), kept, StandardCharsets.UTF_8);
        try {
            Files.move(tmp.toPath(), linksFile.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.move(tmp.toPath(), linksFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
        logger.info("🧹 Removed {} downloaded links from {}", removed, linksFile.getName());
        return removed;
    }
}
