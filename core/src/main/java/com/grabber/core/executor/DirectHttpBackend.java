package com.grabber.core.executor;

import com.grabber.api.DownloadBackend;
import com.grabber.api.DownloadOutcome;
import com.grabber.api.FetchRequest;
import com.grabber.api.TransferListener;
import com.grabber.core.auth.NetscapeCookies;
import com.grabber.core.net.ProxyEntry;
import com.grabber.core.strategy.StrategyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure-Java backend for URLs that point straight at a media file. Pages (HTML) are
 * rejected so that the next backend in the chain gets its turn.
 */
public class DirectHttpBackend implements DownloadBackend {
    private static final Logger logger = LoggerFactory.getLogger(DirectHttpBackend.class);

    static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36";
    private static final Pattern DISPOSITION_NAME = Pattern.compile("filename\\*?=(?:UTF-8'')?\"?([^\";]+)\"?", Pattern.CASE_INSENSITIVE);
    private static final int CONNECT_TIMEOUT_MS = 15000;
    private static final int READ_TIMEOUT_MS = 30000;

    @Override
    public String getName() {
        return StrategyTable.DIRECT_HTTP;
    }

    @Override
    public DownloadOutcome fetch(FetchRequest request, TransferListener listener) {
        long deadline = System.nanoTime() + request.timeout().toNanos();
        HttpURLConnection conn = null;
        try {
            URL url = URI.create(request.url()).toURL();
            HttpURLConnection http = (HttpURLConnection) url.openConnection(toJavaProxy(request.proxy()));
            conn = http;
            conn.setRequestMethod("GET");
            conn.setInstanceFollowRedirects(true);
            conn.setConnectTimeout(CONNECT_TIMEOUT_MS);
            conn.setReadTimeout(READ_TIMEOUT_MS);
            conn.setRequestProperty("User-Agent", USER_AGENT);
            for (Map.Entry<String, String> h : request.headers().entrySet()) {
                conn.setRequestProperty(h.getKey(), h.getValue());
            }
            if (request.proxy() != null && request.proxy().hasCredentials() && request.proxy().scheme().startsWith("http")) {
                String basic = request.proxy().username() + ":" + request.proxy().password();
                conn.setRequestProperty("Proxy-Authorization",
                        "Basic " + Base64.getEncoder().encodeToString(basic.getBytes(StandardCharsets.UTF_8)));
            }
            if (request.cookieFile() != null) {
                NetscapeCookies.cookieHeader(request.cookieFile(), url.getHost())
                        .ifPresent(c -> http.setRequestProperty("Cookie", c));
            }

            int code = conn.getResponseCode();
            if (code != HttpURLConnection.HTTP_OK) {
                return DownloadOutcome.failure("HTTP Error " + code + ": " + conn.getResponseMessage(), null);
            }
            String type = conn.getContentType();
            if (type != null && type.toLowerCase(Locale.ROOT).startsWith("text/")) {
                return DownloadOutcome.failure("Unsupported content: " + type + " is a page, not a media file", null);
            }

            File outDir = request.outputDir();
            if (!outDir.exists() && !outDir.mkdirs()) {
                return DownloadOutcome.failure("Cannot create output directory " + outDir, null);
            }
            File target = new File(outDir, fileNameFor(conn, url));
            File part = new File(outDir, target.getName() + ".part");
            long total = conn.getContentLengthLong();

            logger.info("⬇️ Direct download: {} | URL: {}", target.getName(), request.url());
            long downloaded = 0;
            try (InputStream in = conn.getInputStream();
                 OutputStream out = new FileOutputStream(part)) {
                byte[] buffer = new byte[8192];
                int count;
                while ((count = in.read(buffer)) != -1) {
                    out.write(buffer, 0, count);
                    downloaded += count;
                    listener.onBytes(downloaded, total);
                    if (System.nanoTime() > deadline) {
                        out.close();
                        Files.deleteIfExists(part.toPath());
                        return DownloadOutcome.timeout("Timed out after " + request.timeout().toSeconds() + " s", null);
                    }
                }
            }
            if (downloaded == 0) {
                Files.deleteIfExists(part.toPath());
                return DownloadOutcome.failure("Empty response body", null);
            }
            Files.move(part.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
            return DownloadOutcome.success("Saved " + target.getName() + " (" + downloaded + " bytes)", null);
        } catch (SocketTimeoutException e) {
            return DownloadOutcome.timeout("Read timed out: " + e.getMessage(), null);
        } catch (IllegalArgumentException e) {
            return DownloadOutcome.failure("Invalid URL: " + e.getMessage(), null);
        } catch (IOException e) {
            return DownloadOutcome.failure("Direct download failed: " + e.getMessage(), null);
        } finally {
            if (conn != null) conn.disconnect();
        }
    }

    static Proxy toJavaProxy(ProxyEntry entry) {
        if (entry == null) return Proxy.NO_PROXY;
        Proxy.Type type = entry.scheme().startsWith("socks") ? Proxy.Type.SOCKS : Proxy.Type.HTTP;
        return new Proxy(type, InetSocketAddress.createUnresolved(entry.host(), entry.port()));
    }

    static String fileNameFor(HttpURLConnection conn, URL url) {
        String disposition = conn.getHeaderField("Content-Disposition");
        if (disposition != null) {
            Matcher m = DISPOSITION_NAME.matcher(disposition);
            if (m.find()) return sanitize(m.group(1));
        }
        return fileNameFromPath(url.getPath());
    }

    static String fileNameFromPath(String path) {
        String name = path == null ? "" : path;
        int slash = name.lastIndexOf('/');
        if (slash >= 0) name = name.substring(slash + 1);
        name = sanitize(name);
        if (name.isEmpty()) name = "download-" + Integer.toHexString(path == null ? 0 : path.hashCode());
        return name;
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9._-]", "_").replaceAll("^\\.+", "");
    }
}
