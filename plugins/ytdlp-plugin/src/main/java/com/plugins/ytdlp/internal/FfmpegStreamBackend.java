package com.plugins.ytdlp.internal;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two-step fallback: yt-dlp only resolves the stream ({@code --dump-json}), ffmpeg copies
 * it into an mp4 without re-encoding.
 */
public class FfmpegStreamBackend extends ExternalToolBackend {
    private static final Logger logger = LoggerFactory.getLogger(FfmpegStreamBackend.class);

    private final String ytDlpName;

    /**
     * @param ffmpegName  ffmpeg executable name or path
     * @param ytDlpName   yt-dlp executable name or path, used for stream resolution
     */
    public FfmpegStreamBackend(ToolLocator locator, ProcessRunner runner, String ffmpegName, String ytDlpName) {
        super(locator, runner, ffmpegName);
        this.ytDlpName = ytDlpName;
    }

    @Override
    public String getName() {
        return StrategyTable.FFMPEG_STREAM;
    }

    record StreamInfo(String url, String title, String id, Map<String, String> headers) {
    }

    @Override
    protected DownloadOutcome execute(File ffmpeg, FetchRequest request, TransferListener listener) {
        Optional<File> ytDlp = locator.locate(ytDlpName);
        if (ytDlp.isEmpty()) {
            return DownloadOutcome.unavailable(ytDlpName + " not found in tools/ or PATH");
        }

        DownloadOutcome probe = runTool(probeCommand(ytDlp.get().getAbsolutePath(), request), request.timeout(), null);
        if (!probe.succeeded()) return probe;

        Optional<StreamInfo> info = parseStreamInfo(probe.diagnosticText());
        if (info.isEmpty()) {
            return DownloadOutcome.failure("Could not resolve a stream URL for " + request.url(), null);
        }

        File target = new File(request.outputDir(), fileNameFor(info.get()));
        logger.info("🎞️ ffmpeg stream copy: {} -> {}", request.url(), target.getName());
        List<String> command = copyCommand(ffmpeg.getAbsolutePath(), info.get(), request, target);
        DownloadOutcome copy = runTool(command, request.timeout(), line -> onProgress(line, listener));
        if (copy.succeeded() && (!target.isFile() || target.length() == 0)) {
            return DownloadOutcome.failure("ffmpeg finished but " + target.getName() + " is missing", null);
        }
        return copy;
    }

    List<String> probeCommand(String ytDlp, FetchRequest request) {
        List<String> command = new ArrayList<>();
        command.add(ytDlp);
        command.add("--dump-json");
        command.add("--no-playlist");
        command.add("--no-warnings");
        command.add("-f");
        command.add("best");
        if (request.proxy() != null) {
            command.add("--proxy");
            command.add(request.proxy().toUri());
        }
        if (request.cookieFile() != null) {
            command.add("--cookies");
            command.add(request.cookieFile().getAbsolutePath());
        }
        command.add(request.url());
        return command;
    }

    List<String> copyCommand(String ffmpeg, StreamInfo info, FetchRequest request, File target) {
        List<String> command = new ArrayList<>();
        command.add(ffmpeg);
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add("error");
        command.add("-nostats");
        command.add("-progress");
        command.add("pipe:1");
        if (request.proxy() != null && request.proxy().scheme().startsWith("http")) {
            command.add("-http_proxy");
            command.add(request.proxy().toUri());
        }
        Map<String, String> headers = new LinkedHashMap<>(info.headers());
        headers.putAll(request.headers());
        if (!headers.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            headers.forEach((k, v) -> sb.append(k).append(": ").append(v).append("\r\n"));
            command.add("-headers");
            command.add(sb.toString());
        }
        command.add("-i");
        command.add(info.url());
        command.add("-c");
        command.add("copy");
        command.add("-y");
        command.add(target.getAbsolutePath());
        return command;
    }

    /**
     * Reads the last JSON object of the yt-dlp output. Merged formats carry no top-level
     * {@code url}; the first requested format is used then.
     */
    static Optional<StreamInfo> parseStreamInfo(String output) {
        String[] lines = output.split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].trim();
            if (!line.startsWith("{")) continue;
            try {
                JsonObject json = JsonParser.parseString(line).getAsJsonObject();
                JsonObject source = json;
                if (!json.has("url") && json.has("requested_formats")) {
                    JsonElement first = json.getAsJsonArray("requested_formats").get(0);
                    source = first.getAsJsonObject();
                }
                if (!source.has("url")) return Optional.empty();

                Map<String, String> headers = new LinkedHashMap<>();
                if (source.has("http_headers") && source.get("http_headers").isJsonObject()) {
                    source.getAsJsonObject("http_headers").entrySet()
                            .forEach(e -> headers.put(e.getKey(), e.getValue().getAsString()));
                }
                return Optional.of(new StreamInfo(
                        source.get("url").getAsString(),
                        json.has("title") ? json.get("title").getAsString() : "video",
                        json.has("id") ? json.get("id").getAsString() : null,
                        headers));
            } catch (JsonParseException | IllegalStateException | IndexOutOfBoundsException e) {
                logger.debug("Skipping unparseable yt-dlp JSON line: {}", e.getMessage());
            }
        }
        return Optional.empty();
    }

    static String fileNameFor(StreamInfo info) {
        String title = info.title().replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").strip();
        if (title.length() > 80) title = title.substring(0, 80).strip();
        if (title.isEmpty()) title = "video";
        return info.id() != null ? title + " [" + info.id() + "].mp4" : title + ".mp4";
    }

    private void onProgress(String line, TransferListener listener) {
        // -progress emits key=value blocks; total_size is the bytes written so far
        if (line.startsWith("total_size=")) {
            try {
                listener.onBytes(Long.parseLong(line.substring("total_size=".length()).trim()), -1);
            } catch (NumberFormatException e) {
                logger.debug("ffmpeg total_size not numeric: {}", line);
            }
        } else if (!line.contains("=")) {
            listener.onLine(line);
        }
    }
}
