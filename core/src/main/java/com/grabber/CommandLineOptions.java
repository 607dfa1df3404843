package com.grabber;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 * Format: {@code [--bulk <root> | --input <file> | --url <url>...] [--out <dir>] [--thorough] [--config <file>]}
 */
public class CommandLineOptions {

    public enum InputMode {
        BULK,
        FILE,
        URLS
    }

    public static final String USAGE =
            "Usage: grabber [--bulk <root> | --input <file> | --url <url>...] [--out <dir>] [--thorough] [--config <file>]\n" +
            "Examples:\n" +
            "  grabber --url https://www.tiktok.com/@user/video/7301234567890\n" +
            "  grabber --input links.txt --out downloads\n" +
            "  grabber --input links.json --thorough\n" +
            "  grabber --bulk \"Links Grabber\"";

    private final InputMode inputMode;
    private final File bulkRoot;
    private final File inputFile;
    private final List<String> urls;
    private final File outDir;
    private final boolean thorough;
    private final File configFile;

    private CommandLineOptions(InputMode inputMode, File bulkRoot, File inputFile, List<String> urls,
                               File outDir, boolean thorough, File configFile) {
        this.inputMode = inputMode;
        this.bulkRoot = bulkRoot;
        this.inputFile = inputFile;
        this.urls = List.copyOf(urls);
        this.outDir = outDir;
        this.thorough = thorough;
        this.configFile = configFile;
    }

    /**
     * @throws IllegalArgumentException with the usage text if the syntax is invalid
     */
    public static CommandLineOptions parse(String[] args) throws IllegalArgumentException {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException(USAGE);
        }

        File bulkRoot = null;
        File inputFile = null;
        List<String> urls = new ArrayList<>();
        File outDir = null;
        boolean thorough = false;
        File configFile = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--bulk" -> bulkRoot = new File(value(args, ++i, arg));
                case "--input" -> inputFile = new File(value(args, ++i, arg));
                case "--url" -> {
                    urls.add(value(args, ++i, arg));
                    // --url a b c
                    while (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        urls.add(args[++i]);
                    }
                }
                case "--out" -> outDir = new File(value(args, ++i, arg));
                case "--thorough" -> thorough = true;
                case "--config" -> configFile = new File(value(args, ++i, arg));
                case "--help", "-h" -> throw new IllegalArgumentException(USAGE);
                default -> throw new IllegalArgumentException("Unknown argument: " + arg + "\n" + USAGE);
            }
        }

        int sources = (bulkRoot != null ? 1 : 0) + (inputFile != null ? 1 : 0) + (urls.isEmpty() ? 0 : 1);
        if (sources != 1) {
            throw new IllegalArgumentException("Exactly one of --bulk, --input or --url is required\n" + USAGE);
        }
        if (bulkRoot != null && outDir != null) {
            throw new IllegalArgumentException("--out cannot be combined with --bulk: media go into the source folders");
        }

        InputMode mode = bulkRoot != null ? InputMode.BULK : inputFile != null ? InputMode.FILE : InputMode.URLS;
        return new CommandLineOptions(mode, bulkRoot, inputFile, urls, outDir, thorough, configFile);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + option + "\n" + USAGE);
        }
        return args[index];
    }

    public InputMode getInputMode() {
        return inputMode;
    }

    public File getBulkRoot() {
        return bulkRoot;
    }

    public File getInputFile() {
        return inputFile;
    }

    public List<String> getUrls() {
        return urls;
    }

    /**
     * @return the --out directory, or null to use the configured output directory
     */
    public File getOutDir() {
        return outDir;
    }

    public boolean isThorough() {
        return thorough;
    }

    public File getConfigFile() {
        return configFile;
    }
}
