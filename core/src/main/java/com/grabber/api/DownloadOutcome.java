package com.grabber.api;

import java.time.Duration;

/**
 * Normalized result of one backend attempt.
 */
public record DownloadOutcome(boolean succeeded, String diagnosticText, Duration elapsed, Kind kind) {

    public enum Kind {
        SUCCESS,
        FAILED,
        TIMEOUT,
        // Backend tool could not be resolved; retrying is pointless
        UNAVAILABLE
    }

    public DownloadOutcome {
        diagnosticText = diagnosticText == null ? "" : diagnosticText;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static DownloadOutcome success(String diagnosticText, Duration elapsed) {
        return new DownloadOutcome(true, diagnosticText, elapsed, Kind.SUCCESS);
    }

    public static DownloadOutcome failure(String diagnosticText, Duration elapsed) {
        return new DownloadOutcome(false, diagnosticText, elapsed, Kind.FAILED);
    }

    public static DownloadOutcome timeout(String diagnosticText, Duration elapsed) {
        return new DownloadOutcome(false, diagnosticText, elapsed, Kind.TIMEOUT);
    }

    public static DownloadOutcome unavailable(String diagnosticText) {
        return new DownloadOutcome(false, diagnosticText, Duration.ZERO, Kind.UNAVAILABLE);
    }

    public DownloadOutcome withElapsed(Duration elapsed) {
        return new DownloadOutcome(succeeded, diagnosticText, elapsed, kind);
    }

    /**
     * First line of the diagnostic, cut to a size that fits into a report line.
     */
    public String shortDiagnostic() {
        String text = diagnosticText.strip();
        int nl = text.indexOf('\n');
        if (nl >= 0) text = text.substring(0, nl);
        return text.length() > 160 ? text.substring(0, 157) + "..." : text;
    }
}
