package com.plugins.ytdlp.internal;

import com.grabber.api.DownloadBackend;
import com.grabber.api.DownloadOutcome;
import com.grabber.api.FetchRequest;
import com.grabber.api.TransferListener;
import com.grabber.common.util.ProcessRunner;
import com.grabber.common.util.ToolLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Base for backends that shell out to a command-line downloader. A tool that cannot be
 * located or started yields an UNAVAILABLE outcome, which the core never retries.
 */
public abstract class ExternalToolBackend implements DownloadBackend {
    private static final Logger logger = LoggerFactory.getLogger(ExternalToolBackend.class);

    protected final ToolLocator locator;
    protected final ProcessRunner runner;
    protected final String toolName;

    protected ExternalToolBackend(ToolLocator locator, ProcessRunner runner, String toolName) {
        this.locator = locator;
        this.runner = runner;
        this.toolName = toolName;
    }

    @Override
    public DownloadOutcome fetch(FetchRequest request, TransferListener listener) {
        Optional<File> tool = locator.locate(toolName);
        if (tool.isEmpty()) {
            return DownloadOutcome.unavailable(toolName + " not found in tools/ or PATH");
        }
        File outDir = request.outputDir();
        if (!outDir.exists() && !outDir.mkdirs()) {
            return DownloadOutcome.failure("Cannot create output directory " + outDir, null);
        }
        return execute(tool.get(), request, listener);
    }

    protected abstract DownloadOutcome execute(File tool, FetchRequest request, TransferListener listener);

    /**
     * Runs one tool invocation and maps exit status and timeout to an outcome.
     */
    protected DownloadOutcome runTool(List<String> command, Duration timeout, Consumer<String> lines) {
        try {
            ProcessRunner.ProcessResult result = runner.run(command, null, timeout, lines);
            if (result.timedOut()) {
                return DownloadOutcome.timeout(command.get(0) + " timed out after " + timeout.toSeconds() + " s\n"
                        + result.output(), null);
            }
            if (result.exitCode() == 0) {
                return DownloadOutcome.success(result.output(), null);
            }
            logger.debug("{} exited with {}", getName(), result.exitCode());
            String output = result.output().isBlank() ? "exit code " + result.exitCode() : errorFirst(result.output());
            return DownloadOutcome.failure(output, null);
        } catch (IOException e) {
            return DownloadOutcome.unavailable("Cannot start " + command.get(0) + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DownloadOutcome.failure(getName() + " interrupted", null);
        }
    }

    /**
     * Moves ERROR lines to the front so the short diagnostic shows the actual cause.
     */
    static String errorFirst(String output) {
        StringBuilder errors = new StringBuilder();
        for (String line : output.split("\n")) {
            if (line.startsWith("ERROR") || line.contains("[error]")) {
                errors.append(line.strip()).append('\n');
            }
        }
        return errors.length() == 0 ? output : errors + output;
    }
}
