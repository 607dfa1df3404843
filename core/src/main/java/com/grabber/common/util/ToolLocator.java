package com.grabber.common.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds external executables: the bundled {@code tools/} directory first, then {@code PATH}.
 */
public class ToolLocator {
    private static final Logger logger = LoggerFactory.getLogger(ToolLocator.class);

    private static final boolean IS_WINDOWS = System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");

    private final File toolsDir;
    private final String pathVariable;

    public ToolLocator(File toolsDir) {
        this(toolsDir, System.getenv("PATH"));
    }

    public ToolLocator(File toolsDir, String pathVariable) {
        this.toolsDir = toolsDir;
        this.pathVariable = pathVariable;
    }

    /**
     * @param name bare tool name such as {@code yt-dlp}; {@code .exe} is tried on Windows
     */
    public Optional<File> locate(String name) {
        if (name == null || name.isBlank()) return Optional.empty();

        // Explicit path from configuration
        File direct = new File(name);
        if (direct.isAbsolute() || name.contains("/") || name.contains("\\")) {
            return direct.isFile() ? Optional.of(prepare(direct)) : Optional.empty();
        }

        if (toolsDir != null) {
            for (String candidate : candidates(name)) {
                File f = new File(toolsDir, candidate);
                if (f.isFile()) return Optional.of(prepare(f));
            }
        }

        if (pathVariable != null) {
            for (String dir : pathVariable.split(File.pathSeparator)) {
                if (dir.isBlank()) continue;
                for (String candidate : candidates(name)) {
                    File f = new File(dir, candidate);
                    if (f.isFile() && f.canExecute()) return Optional.of(f);
                }
            }
        }
        logger.debug("Tool {} not found in {} or PATH", name, toolsDir);
        return Optional.empty();
    }

    public File getToolsDir() {
        return toolsDir;
    }

    private static String[] candidates(String name) {
        if (IS_WINDOWS && !name.toLowerCase(Locale.ROOT).endsWith(".exe")) {
            return new String[]{name + ".exe", name};
        }
        return new String[]{name};
    }

    private static File prepare(File file) {
        makeExecutable(file);
        return file;
    }

    /**
     * Sets the executable bit on Unix systems.
     */
    public static void makeExecutable(File file) {
        if (IS_WINDOWS || !file.exists()) return;
        if (!file.canExecute() && !file.setExecutable(true)) {
            logger.warn("Could not chmod +x {}", file.getName());
        }
    }

    public static boolean isWindows() {
        return IS_WINDOWS;
    }
}
