package com.grabber.core.run;

import com.grabber.common.model.LinkSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Discovers the sources of a bulk root: every sub-folder holding a links file.
 * {@code links.txt} wins; otherwise every {@code *.txt} that is not a cookie file counts.
 */
public class BulkSourceScanner {
    private static final Logger logger = LoggerFactory.getLogger(BulkSourceScanner.class);

    public static final String DEFAULT_LINKS_FILE = "links.txt";

    public List<LinkSource> scan(File bulkRoot) {
        List<LinkSource> sources = new ArrayList<>();
        File[] folders = bulkRoot.listFiles(f -> f.isDirectory() && !f.getName().startsWith("."));
        if (folders == null) return sources;
        Arrays.sort(folders, Comparator.comparing(File::getName));

        for (File folder : folders) {
            for (File linksFile : linkFilesIn(folder)) {
                sources.add(new LinkSource(folder.getName(), folder, linksFile));
            }
        }
        logger.info("📂 Found {} link lists under {}", sources.size(), bulkRoot);
        return sources;
    }

    static List<File> linkFilesIn(File folder) {
        File preferred = new File(folder, DEFAULT_LINKS_FILE);
        if (preferred.isFile()) return List.of(preferred);

        File[] txt = folder.listFiles(f -> {
            String name = f.getName().toLowerCase(Locale.ROOT);
            return f.isFile() && name.endsWith(".txt") && !name.contains("cookie") && !name.startsWith(".");
        });
        if (txt == null) return List.of();
        Arrays.sort(txt, Comparator.comparing(File::getName));
        return Arrays.asList(txt);
    }
}
