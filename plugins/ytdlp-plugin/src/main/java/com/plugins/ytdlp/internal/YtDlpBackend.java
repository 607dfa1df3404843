package com.plugins.ytdlp.internal;

import com.grabber.api.DownloadOutcome;
import com.grabber.api.FetchRequest;
import com.grabber.api.TransferListener;
import com.grabber.common.util.ProcessRunner;
import com.grabber.common.util.ToolLocator;
import com.grabber.core.url.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * yt-dlp backend. One class serves the standard, tuned and generic strategy entries; the
 * {@link YtDlpProfile} only changes the flags.
 */
public class YtDlpBackend extends ExternalToolBackend {
    private static final Logger logger = LoggerFactory.getLogger(YtDlpBackend.class);

    static final String OUTPUT_TEMPLATE = "%(title).80s [%(id)s].%(ext)s";

    private final String name;
    private final YtDlpProfile profile;

    public YtDlpBackend(String name, YtDlpProfile profile, ToolLocator locator, ProcessRunner runner, String toolName) {
        super(locator, runner, toolName);
        this.name = name;
        this.profile = profile;
    }

    @Override
    public String getName() {
        return name;
    }

    public YtDlpProfile getProfile() {
        return profile;
    }

    @Override
    protected DownloadOutcome execute(File tool, FetchRequest request, TransferListener listener) {
        List<String> command = buildCommand(tool.getAbsolutePath(), request);
        logger.info("📱 {}: {}", name, request.url());
        return runTool(command, request.timeout(), line -> onOutput(line, listener));
    }

    public List<String> buildCommand(String executable, FetchRequest request) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--newline");
        command.add("--no-playlist");
        command.add("--no-mtime");
        command.add("--progress-template");
        command.add(YtDlpProgressParser.PROGRESS_TEMPLATE);
        command.add("-o");
        command.add(new File(request.outputDir(), OUTPUT_TEMPLATE).getAbsolutePath());

        if (request.formatSpec() != null && !request.formatSpec().isBlank()) {
            command.add("-f");
            command.add(request.formatSpec());
            command.add("--merge-output-format");
            command.add("mp4");
        }
        if (request.proxy() != null) {
            command.add("--proxy");
            command.add(request.proxy().toUri());
        }
        if (request.cookieFile() != null) {
            command.add("--cookies");
            command.add(request.cookieFile().getAbsolutePath());
        }
        for (Map.Entry<String, String> h : request.headers().entrySet()) {
            command.add("--add-header");
            command.add(h.getKey() + ":" + h.getValue());
        }

        switch (profile) {
            case TUNED -> {
                command.add("--geo-bypass");
                command.add("--no-check-certificate");
                command.add("--prefer-insecure");
                command.add("--retries");
                command.add("15");
                command.add("--fragment-retries");
                command.add("15");
                String extractorArgs = extractorArgsFor(Platform.classify(request.url()));
                if (extractorArgs != null) {
                    command.add("--extractor-args");
                    command.add(extractorArgs);
                }
            }
            case GENERIC -> command.add("--force-generic-extractor");
            default -> {
            }
        }

        command.add(request.url());
        return command;
    }

    static String extractorArgsFor(Platform platform) {
        return switch (platform) {
            case YOUTUBE -> "youtube:player_client=android,web";
            case INSTAGRAM -> "instagram:api_version=2";
            default -> null;
        };
    }

    private void onOutput(String line, TransferListener listener) {
        if (YtDlpProgressParser.isProgressLine(line)) {
            YtDlpProgressParser.parse(line).ifPresent(p -> listener.onBytes(p.downloadedBytes(), p.totalBytes()));
            return;
        }
        if (line.startsWith("ERROR") || line.startsWith("[download] Destination") || line.startsWith("[Merger]")) {
            listener.onLine(line);
        } else {
            logger.debug("yt-dlp: {}", line);
        }
    }
}
