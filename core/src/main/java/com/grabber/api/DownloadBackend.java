package com.grabber.api;

/**
 * A pluggable extraction tool able to fetch media for a URL.
 * <p>
 * Implementations only build their own invocation parameters, run the tool under the
 * timeout carried by the request and map the result into a {@link DownloadOutcome}.
 * Retry, proxy and cookie decisions are made by the caller.
 */
public interface DownloadBackend {

    /**
     * Name used by the strategy table, e.g. "yt-dlp".
     */
    String getName();

    /**
     * Performs one download attempt.
     *
     * @param request  what to fetch and how
     * @param listener receives byte counters and output lines while the transfer runs
     * @return the normalized outcome, never null
     */
    DownloadOutcome fetch(FetchRequest request, TransferListener listener);
}
