package com.grabber.core.auth;

import com.grabber.core.url.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.*;

/**
 * Finds candidate cookie files for a URL.
 * <p>
 * Priority:
 * 1. cookies/cookies.txt (shared master)
 * 2. cookies/{platform}.txt, cookies/{platform}_cookies.txt
 * 3. cookies.txt in the application root (generic fallback)
 * 4. user convenience file (default ~/Desktop/cookies.txt)
 * 5. *cookie*.txt files inside the source folder
 * <p>
 * The whole valid list is returned so a backend can move on to the next file after an
 * authentication failure.
 */
public class CookieResolver {
    private static final Logger logger = LoggerFactory.getLogger(CookieResolver.class);

    // Anything this small cannot hold a usable cookie line
    static final long MIN_SIZE_BYTES = 10;

    private final File rootDir;
    private final File cookiesDir;
    private final File userCookieFile;

    public CookieResolver(File rootDir, File cookiesDir, File userCookieFile) {
        this.rootDir = rootDir;
        this.cookiesDir = cookiesDir;
        this.userCookieFile = userCookieFile != null
                ? userCookieFile
                : new File(new File(System.getProperty("user.home"), "Desktop"), "cookies.txt");
    }

    public List<File> resolve(String url) {
        return resolve(url, null);
    }

    public List<File> resolve(String url, File sourceFolder) {
        String tag = Platform.classify(url).tag();
        List<File> ordered = new ArrayList<>();

        ordered.add(new File(cookiesDir, "cookies.txt"));
        ordered.add(new File(cookiesDir, tag + ".txt"));
        ordered.add(new File(cookiesDir, tag + "_cookies.txt"));
        ordered.add(new File(rootDir, "cookies.txt"));
        ordered.add(userCookieFile);

        if (sourceFolder != null && sourceFolder.isDirectory()) {
            File[] local = sourceFolder.listFiles((dir, name) -> {
                String l = name.toLowerCase(Locale.ROOT);
                return l.contains("cookie") && l.endsWith(".txt");
            });
            if (local != null) {
                Arrays.sort(local, Comparator.comparing(File::getName));
                ordered.addAll(Arrays.asList(local));
            }
        }

        List<File> valid = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (File f : ordered) {
            if (!isUsable(f)) continue;
            if (seen.add(canonicalPath(f))) valid.add(f);
        }
        if (!valid.isEmpty()) {
            logger.debug("🍪 {} cookie candidate(s) for {}: {}", valid.size(), tag, valid);
        }
        return valid;
    }

    private static boolean isUsable(File f) {
        return f != null && f.isFile() && f.length() > MIN_SIZE_BYTES;
    }

    private static String canonicalPath(File f) {
        try {
            return f.getCanonicalPath();
        } catch (IOException e) {
            return f.getAbsolutePath();
        }
    }
}
