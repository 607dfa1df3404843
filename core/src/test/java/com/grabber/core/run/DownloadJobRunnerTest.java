package com.grabber.core.run;

import com.grabber.common.model.DownloadRequest;
import com.grabber.core.config.Configuration;
import com.grabber.core.strategy.BackendRegistry;
import com.grabber.test.ScriptedBackend;
import com.grabber.test.TestBase;
import com.grabber.test.TestContexts;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DownloadJobRunner
 */
class DownloadJobRunnerTest extends TestBase {

    private RunContext context(ScriptedBackend backend) {
        BackendRegistry registry = new BackendRegistry();
        registry.register(backend);
        return TestContexts.builder(tempDir, new Configuration(), registry, List.of(backend.getName()))
                .mode(SessionState.Mode.SINGLE)
                .build();
    }

    private static List<DownloadRequest> plan(RunContext ctx, String text) {
        return new RunPlanner(ctx.getExtractor()).planText(text);
    }

    @Test
    void testRunsOnWorkerThread() throws Exception {
        ScriptedBackend backend = ScriptedBackend.alwaysSucceeds("b1");
        String[] threadName = new String[1];
        backend.onFetch(r -> threadName[0] = Thread.currentThread().getName());
        RunContext ctx = context(backend);

        DownloadJobRunner runner = new DownloadJobRunner(ctx, plan(ctx, "https://example.com/a.mp4"));
        runner.start();
        RunSummary summary = runner.await();

        assertTrue(summary.success());
        assertEquals("DownloadWorker", threadName[0]);
        assertTrue(runner.awaitTermination(5000));
        assertFalse(runner.isRunning());
    }

    @Test
    void testCancelLetsCurrentDownloadFinish() throws Exception {
        CountDownLatch inFlight = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ScriptedBackend backend = ScriptedBackend.alwaysSucceeds("b1").onFetch(r -> {
            inFlight.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        RunContext ctx = context(backend);
        DownloadJobRunner runner = new DownloadJobRunner(ctx,
                plan(ctx, "https://example.com/a.mp4 https://example.com/b.mp4 https://example.com/c.mp4"));

        runner.start();
        assertTrue(inFlight.await(5, TimeUnit.SECONDS));
        runner.cancel();
        release.countDown();
        RunSummary summary = runner.await();

        assertTrue(summary.cancelled());
        assertEquals(1, summary.downloaded(), "the transfer in flight completes");
        assertEquals(1, backend.invocations());
    }

    @Test
    void testPreconditionFailureSurfacesFromAwait() {
        RunContext ctx = context(ScriptedBackend.alwaysSucceeds("b1"));
        DownloadJobRunner runner = new DownloadJobRunner(ctx, List.of());
        runner.start();
        assertThrows(RunPreconditionException.class, runner::await);
    }
}
