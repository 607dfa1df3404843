package com.grabber.core.tracking;

/**
 * Aggregate statistics for one source (creator folder). Serialized by Gson.
 */
public class HistoryEntry {
    public int totalDownloaded = 0;
    public int lastBatchCount = 0;
    public int totalFailed = 0;
    public String lastDownload = null; // ISO-8601 local date-time
    public String lastStatus = "never"; // success, partial, failed, never
}
