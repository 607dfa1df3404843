package com.plugins.ytdlp.internal;

import com.grabber.api.DownloadOutcome;
import com.grabber.api.FetchRequest;
import com.grabber.api.TransferListener;
import com.grabber.common.util.ProcessRunner;
import com.grabber.common.util.ToolLocator;
import com.grabber.core.strategy.StrategyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * gallery-dl backend for image posts and carousels that yt-dlp does not handle.
 */
public class GalleryDlBackend extends ExternalToolBackend {
    private static final Logger logger = LoggerFactory.getLogger(GalleryDlBackend.class);

    public GalleryDlBackend(ToolLocator locator, ProcessRunner runner, String toolName) {
        super(locator, runner, toolName);
    }

    @Override
    public String getName() {
        return StrategyTable.GALLERY_DL;
    }

    @Override
    protected DownloadOutcome execute(File tool, FetchRequest request, TransferListener listener) {
        logger.info("🖼️ gallery-dl: {}", request.url());
        DownloadOutcome outcome = runTool(buildCommand(tool.getAbsolutePath(), request), request.timeout(), line -> {
            // gallery-dl prints one path per saved file, "# path" for files it skipped
            if (line.startsWith("[") || line.startsWith("#")) {
                logger.debug("gallery-dl: {}", line);
            } else {
                listener.onLine("Saved " + new File(line.trim()).getName());
            }
        });
        if (outcome.succeeded() && outcome.diagnosticText().isBlank()) {
            // exit 0 without a single file: nothing matched the URL
            return DownloadOutcome.failure("gallery-dl found no media for " + request.url(), null);
        }
        return outcome;
    }

    List<String> buildCommand(String executable, FetchRequest request) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--directory");
        command.add(request.outputDir().getAbsolutePath());
        if (request.proxy() != null) {
            command.add("--proxy");
            command.add(request.proxy().toUri());
        }
        if (request.cookieFile() != null) {
            command.add("--cookies");
            command.add(request.cookieFile().getAbsolutePath());
        }
        for (Map.Entry<String, String> h : request.headers().entrySet()) {
            if (h.getKey().equalsIgnoreCase("User-Agent")) {
                command.add("--user-agent");
                command.add(h.getValue());
            }
        }
        command.add(request.url());
        return command;
    }
}
