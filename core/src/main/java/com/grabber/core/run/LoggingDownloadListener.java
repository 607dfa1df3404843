package com.grabber.core.run;

import com.grabber.common.model.DownloadRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Listener for the command-line front end: everything goes to the log.
 */
public class LoggingDownloadListener implements DownloadListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingDownloadListener.class);

    private int lastDecile = -1;

    @Override
    public void onLog(String line) {
        logger.info(line);
    }

    @Override
    public void onPercent(double percent) {
        // one line per 10 %
        int decile = (int) (percent / 10);
        if (decile != lastDecile) {
            lastDecile = decile;
            logger.info("📥 {}%", String.format(Locale.ROOT, "%.1f", percent));
        }
    }

    @Override
    public void onSpeed(String speed) {
        logger.debug("Speed: {}", speed);
    }

    @Override
    public void onEta(String eta) {
        logger.debug("ETA: {}", eta);
    }

    @Override
    public void onUrlComplete(DownloadRequest request, boolean success, String detail) {
        lastDecile = -1;
        if (success) {
            logger.info("✅ {} | {}", request.canonicalUrl(), detail);
        } else {
            logger.warn("❌ {} | {}", request.canonicalUrl(), detail);
        }
    }

    @Override
    public void onFinished(boolean success, String summaryMessage) {
        if (success) {
            logger.info("🏁 {}", summaryMessage);
        } else {
            logger.error("🏁 {}", summaryMessage);
        }
    }
}
