package com.grabber.core.run;

import com.google.gson.JsonArray;
import com.grabber.common.model.DownloadRequest;
import com.grabber.common.model.LinkSource;
import com.grabber.core.tracking.HistoryStore;
import com.grabber.core.url.UrlExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the different input shapes into the request list of a run.
 */
public class RunPlanner {
    private static final Logger logger = LoggerFactory.getLogger(RunPlanner.class);

    private final UrlExtractor extractor;
    private final BulkSourceScanner scanner;

    public RunPlanner(UrlExtractor extractor) {
        this(extractor, new BulkSourceScanner());
    }

    public RunPlanner(UrlExtractor extractor, BulkSourceScanner scanner) {
        this.extractor = extractor;
        this.scanner = scanner;
    }

    public List<DownloadRequest> planText(String text) {
        return extractor.plan(text);
    }

    public List<DownloadRequest> planRecords(JsonArray records) {
        return extractor.toRequests(extractor.extract(records), null);
    }

    /**
     * Plans a bulk run over all sources below {@code bulkRoot}.
     *
     * @param history          history of the bulk root, used for the recent-download window
     * @param skipRecentWithin sources downloaded within this window are left out; null disables
     */
    public List<DownloadRequest> planBulk(File bulkRoot, HistoryStore history, Duration skipRecentWithin) throws IOException {
        List<DownloadRequest> requests = new ArrayList<>();
        Map<String, Integer> positions = new HashMap<>();

        for (LinkSource source : scanner.scan(bulkRoot)) {
            if (skipRecentWithin != null && history != null && history.downloadedWithin(source.name(), skipRecentWithin)) {
                logger.info("⏭️ Skipping {}: downloaded within the last {} h", source.name(), skipRecentWithin.toHours());
                continue;
            }
            String text = Files.readString(source.linksFile().toPath(), StandardCharsets.UTF_8);
            int added = 0;
            for (DownloadRequest r : extractor.toRequests(extractor.extract(text), source)) {
                Integer at = positions.get(r.dedupKey());
                if (at == null) {
                    positions.put(r.dedupKey(), requests.size());
                    requests.add(r);
                    added++;
                } else {
                    // downloaded once, but removed from every list that carries it
                    requests.set(at, requests.get(at).withOtherSource(source));
                }
            }
            logger.info("🔗 {}: {} links from {}", source.name(), added, source.linksFile().getName());
        }
        return requests;
    }
}
