package com.grabber;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.grabber.common.model.DownloadRequest;
import com.grabber.core.Kernel;
import com.grabber.core.config.Configuration;
import com.grabber.core.run.DownloadJobRunner;
import com.grabber.core.run.LoggingDownloadListener;
import com.grabber.core.run.RunContext;
import com.grabber.core.run.RunPlanner;
import com.grabber.core.run.RunPreconditionException;
import com.grabber.core.run.RunSummary;
import com.grabber.core.run.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.SimpleDateFormat;
import java.time.Duration;
import java.util.Date;
import java.util.List;
import java.util.Locale;

public class Main {
    // Initialized only after the streams are redirected so the log binding picks up the tee
    private static Logger logger;

    private static final int EXIT_OK = 0;
    private static final int EXIT_FAILED = 1;
    private static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }

        setupGlobalLogging();
        logger = LoggerFactory.getLogger(Main.class);
        logger.info("🚀 Starting Social Media Grabber...");
        logger.info("📄 Log File: logs/latest.log (and session-*.log)");

        System.exit(run(options));
    }

    static int run(CommandLineOptions options) {
        File root = new File(".").getAbsoluteFile();
        Kernel kernel = options.getConfigFile() != null ? new Kernel(root, options.getConfigFile()) : new Kernel(root);
        try {
            kernel.start();
            Configuration config = kernel.getConfigManager().getConfig();
            RunPlanner planner = kernel.newPlanner();
            LoggingDownloadListener listener = new LoggingDownloadListener();

            RunContext ctx;
            List<DownloadRequest> requests;
            if (options.getInputMode() == CommandLineOptions.InputMode.BULK) {
                File bulkRoot = options.getBulkRoot().getAbsoluteFile();
                if (!bulkRoot.isDirectory()) {
                    throw new RunPreconditionException("Bulk root is not a directory: " + bulkRoot);
                }
                ctx = kernel.newRunContext(SessionState.Mode.BULK, bulkRoot, options.isThorough(), listener);
                Duration window = config.skipRecentWindow ? Duration.ofHours(config.skipRecentHours) : null;
                requests = planner.planBulk(bulkRoot, ctx.getHistory(), window);
            } else {
                File out = options.getOutDir() != null ? options.getOutDir() : kernel.resolvePath(config.outputDir);
                ctx = kernel.newRunContext(SessionState.Mode.SINGLE, out.getAbsoluteFile(), options.isThorough(), listener);
                requests = options.getInputMode() == CommandLineOptions.InputMode.FILE
                        ? planFile(planner, options.getInputFile())
                        : planner.planText(String.join("\n", options.getUrls()));
            }

            DownloadJobRunner runner = new DownloadJobRunner(ctx, requests);
            Thread hook = new Thread(() -> {
                runner.cancel();
                try {
                    runner.awaitTermination(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "ShutdownCancel");
            Runtime.getRuntime().addShutdownHook(hook);

            runner.start();
            RunSummary summary = runner.await();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // already shutting down
                log().debug("Shutdown in progress");
            }
            return summary.success() ? EXIT_OK : EXIT_FAILED;
        } catch (RunPreconditionException e) {
            log().error("❌ {}", e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            log().error("❌ Could not read input: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log().warn("Main thread interrupted. Exiting...");
            return EXIT_FAILED;
        } catch (IllegalStateException e) {
            log().error("CRITICAL FAILURE during startup: {}", e.getMessage());
            return EXIT_FAILED;
        } finally {
            kernel.stop();
        }
    }

    /**
     * {@code .json} files are link-record arrays, anything else is text or HTML.
     */
    static List<DownloadRequest> planFile(RunPlanner planner, File inputFile) throws IOException {
        String content = Files.readString(inputFile.toPath(), StandardCharsets.UTF_8);
        if (inputFile.getName().toLowerCase(Locale.ROOT).endsWith(".json")) {
            try {
                JsonElement parsed = JsonParser.parseString(content);
                if (parsed.isJsonArray()) {
                    JsonArray records = parsed.getAsJsonArray();
                    return planner.planRecords(records);
                }
            } catch (JsonParseException e) {
                log().warn("⚠️ {} is not valid JSON, reading it as text", inputFile.getName());
            }
        }
        return planner.planText(content);
    }

    private static Logger log() {
        if (logger == null) logger = LoggerFactory.getLogger(Main.class);
        return logger;
    }

    /**
     * Redirects System.out and System.err into log files BEFORE anything else happens.
     */
    private static void setupGlobalLogging() {
        try {
            File logDir = new File("logs");
            if (!logDir.exists()) logDir.mkdirs();

            String timeStamp = new SimpleDateFormat("yyyy-MM-dd_HH-mm-ss").format(new Date());
            File sessionLog = new File(logDir, "session-" + timeStamp + ".log");
            File latestLog = new File(logDir, "latest.log");

            FileOutputStream sessionStream = new FileOutputStream(sessionLog);
            FileOutputStream latestStream = new FileOutputStream(latestLog);

            // console + session file + latest file
            MultiOutputStream multiOut = new MultiOutputStream(System.out, sessionStream, latestStream);
            MultiOutputStream multiErr = new MultiOutputStream(System.err, sessionStream, latestStream);

            System.setOut(new PrintStream(multiOut, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(multiErr, true, StandardCharsets.UTF_8));
        } catch (IOException e) {
            System.err.println("FATAL: could not initialize logging: " + e.getMessage());
        }
    }

    // Sends output to several targets (tee)
    static class MultiOutputStream extends OutputStream {
        private final OutputStream[] streams;

        MultiOutputStream(OutputStream... streams) {
            this.streams = streams;
        }

        @Override
        public void write(int b) throws IOException {
            for (OutputStream s : streams) s.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            for (OutputStream s : streams) s.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            for (OutputStream s : streams) s.flush();
        }

        @Override
        public void close() throws IOException {
            for (OutputStream s : streams) s.close();
        }
    }
}
