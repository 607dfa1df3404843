package com.grabber.common.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs an external tool with merged stdout/stderr. Output is drained on a helper thread
 * so a chatty process can never block on a full pipe; the process is only killed when it
 * overruns its timeout.
 */
public class ProcessRunner {
    private static final Logger logger = LoggerFactory.getLogger(ProcessRunner.class);

    // Tail kept for diagnostics; progress output of long downloads is huge
    private static final int MAX_KEPT_LINES = 400;

    public record ProcessResult(int exitCode, String output, boolean timedOut) {
        public boolean ok() {
            return !timedOut && exitCode == 0;
        }
    }

    /**
     * @param command      tool and arguments
     * @param workDir      working directory, or null for the current one
     * @param timeout      hard upper bound
     * @param lineConsumer receives every output line as it arrives (may be null)
     * @throws IOException when the tool cannot be started at all
     */
    public ProcessResult run(List<String> command,
                             File workDir,
                             Duration timeout,
                             Consumer<String> lineConsumer) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        if (workDir != null) pb.directory(workDir);

        logger.debug("▶️ {}", String.join(" ", command));
        Process process = pb.start();

        Deque<String> tail = new ArrayDeque<>();
        Thread drainer = new Thread(() -> drain(process, tail, lineConsumer), "ProcessDrain-" + process.pid());
        drainer.setDaemon(true);
        drainer.start();

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            logger.warn("⏹️ Interrupted while waiting for {}, killing it", command.get(0));
            process.destroyForcibly();
            try {
                drainer.join(2000);
            } catch (InterruptedException again) {
                e.addSuppressed(again);
            }
            throw e;
        }
        if (!finished) {
            logger.warn("⏱️ {} exceeded {} s, killing it", command.get(0), timeout.toSeconds());
            process.destroyForcibly();
            process.waitFor(5, TimeUnit.SECONDS);
        }
        drainer.join(2000);

        String output;
        synchronized (tail) {
            output = String.join("\n", tail);
        }
        int exit = finished ? process.exitValue() : -1;
        return new ProcessResult(exit, output, !finished);
    }

    private static void drain(Process process, Deque<String> tail, Consumer<String> lineConsumer) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > MAX_KEPT_LINES) tail.removeFirst();
                }
                if (lineConsumer != null) {
                    try {
                        lineConsumer.accept(line);
                    } catch (RuntimeException e) {
                        logger.debug("Line consumer failed: {}", e.getMessage());
                    }
                }
            }
        } catch (IOException e) {
            // stream closes when the process is killed
            logger.debug("Output stream closed: {}", e.getMessage());
        }
    }
}
