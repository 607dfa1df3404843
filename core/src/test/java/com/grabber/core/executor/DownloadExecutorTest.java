package com.grabber.core.executor;

import com.grabber.api.DownloadBackend;
import com.grabber.api.DownloadOutcome;
import com.grabber.api.FetchRequest;
import com.grabber.api.TransferListener;
import com.grabber.test.ScriptedBackend;
import com.grabber.test.TestBase;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DownloadExecutor
 */
class DownloadExecutorTest extends TestBase {

    private final DownloadExecutor executor = new DownloadExecutor();

    private FetchRequest request() {
        return new FetchRequest("https://example.com/a.mp4", tempDir, null, null, null, Map.of(), Duration.ofSeconds(5));
    }

    @Test
    void testMeasuresElapsedTime() {
        ScriptedBackend backend = ScriptedBackend.alwaysSucceeds("slow").onFetch(r -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        DownloadOutcome outcome = executor.invoke(backend, request(), null);
        assertTrue(outcome.succeeded());
        assertTrue(outcome.elapsed().toMillis() >= 15, "elapsed was " + outcome.elapsed());
    }

    @Test
    void testCrashingBackendBecomesFailure() {
        DownloadBackend crashing = new DownloadBackend() {
            @Override
            public String getName() {
                return "crashy";
            }

            @Override
            public DownloadOutcome fetch(FetchRequest request, TransferListener listener) {
                throw new IllegalStateException("boom");
            }
        };
        DownloadOutcome outcome = executor.invoke(crashing, request(), TransferListener.NONE);
        assertFalse(outcome.succeeded());
        assertEquals(DownloadOutcome.Kind.FAILED, outcome.kind());
        assertTrue(outcome.diagnosticText().contains("boom"));
    }

    @Test
    void testNullOutcomeBecomesFailure() {
        DownloadBackend silent = new DownloadBackend() {
            @Override
            public String getName() {
                return "silent";
            }

            @Override
            public DownloadOutcome fetch(FetchRequest request, TransferListener listener) {
                return null;
            }
        };
        DownloadOutcome outcome = executor.invoke(silent, request(), TransferListener.NONE);
        assertFalse(outcome.succeeded());
        assertEquals("silent returned no outcome", outcome.diagnosticText());
    }

    @Test
    void testShortDiagnosticKeepsFirstLine() {
        DownloadOutcome outcome = DownloadOutcome.failure("ERROR: first\nsecond line", null);
        assertEquals("ERROR: first", outcome.shortDiagnostic());
        assertEquals(160, DownloadOutcome.failure("x".repeat(300), null).shortDiagnostic().length());
    }
}
