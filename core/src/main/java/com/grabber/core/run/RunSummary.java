package com.grabber.core.run;

import java.util.List;

/**
 * Final report of a run. A run with at least one download counts as successful even when
 * other URLs failed; only "nothing worked" is a failure.
 */
public record RunSummary(boolean success,
                         String message,
                         int downloaded,
                         int skipped,
                         int failed,
                         List<SessionState.FailedUrl> failures,
                         boolean cancelled) {

    public RunSummary {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static RunSummary of(SessionState session) {
        int downloaded = session.getSuccessCount();
        int skipped = session.getSkippedCount();
        List<SessionState.FailedUrl> failures = session.getFailedUrls();
        int failed = failures.size();
        boolean success = downloaded > 0 || failed == 0;

        StringBuilder sb = new StringBuilder();
        if (session.isCancelled()) sb.append("Cancelled. ");
        if (failed == 0) {
            sb.append("Downloaded ").append(downloaded).append(", skipped ").append(skipped);
        } else if (downloaded > 0) {
            sb.append("Completed with caveats: downloaded ").append(downloaded)
                    .append(", skipped ").append(skipped)
                    .append(", failed ").append(failed);
        } else {
            sb.append("All downloads failed: failed ").append(failed)
                    .append(", skipped ").append(skipped);
        }
        for (SessionState.FailedUrl f : failures) {
            sb.append(System.lineSeparator()).append("  ✗ ").append(f.url()).append(" : ").append(f.diagnostic());
        }
        return new RunSummary(success, sb.toString(), downloaded, skipped, failed, failures, session.isCancelled());
    }
}
