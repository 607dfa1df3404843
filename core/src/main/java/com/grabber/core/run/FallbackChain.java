package com.grabber.core.run;

import com.grabber.api.DownloadBackend;
import com.grabber.api.FetchRequest;
import com.grabber.api.TransferListener;
import com.grabber.common.model.DownloadRequest;
import com.grabber.core.retry.FailureType;
import com.grabber.core.retry.RetryController;
import com.grabber.core.strategy.BackendRegistry;
import com.grabber.core.strategy.StrategyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Walks the backend list of a platform until one backend delivers the file. Each backend
 * spends its own retry budget through the {@link RetryController}.
 */
public class FallbackChain {
    private static final Logger logger = LoggerFactory.getLogger(FallbackChain.class);

    private final BackendRegistry registry;
    private final StrategyTable strategyTable;
    private final RetryController retryController;
    private final boolean thorough;

    public record ChainResult(boolean succeeded, String backend, String diagnostic, boolean cancelled) {
    }

    public FallbackChain(BackendRegistry registry, StrategyTable strategyTable,
                         RetryController retryController, boolean thorough) {
        this.registry = registry;
        this.strategyTable = strategyTable;
        this.retryController = retryController;
        this.thorough = thorough;
    }

    public ChainResult execute(DownloadRequest request,
                               FetchRequest base,
                               List<File> cookies,
                               TransferListener listener,
                               long deadlineNanos) throws InterruptedException {
        List<String> names = strategyTable.backendsFor(request.platform(), thorough);
        List<String> trail = new ArrayList<>();
        boolean attempted = false;

        for (String name : names) {
            Optional<DownloadBackend> backend = registry.get(name);
            if (backend.isEmpty()) {
                logger.warn("🔧 Backend '{}' is not registered, skipping it for {}", name, request.platform().tag());
                trail.add(name + ": not registered");
                continue;
            }

            // the first backend always runs; later ones only while the per-URL ceiling holds
            if (attempted && System.nanoTime() > deadlineNanos) {
                logger.warn("⏱️ Time budget for {} spent, not starting {}", request.canonicalUrl(), name);
                trail.add(name + ": not started, time limit reached");
                break;
            }
            attempted = true;

            logger.info("🎬 {} via {}", request.canonicalUrl(), name);
            RetryController.BackendResult result =
                    retryController.run(backend.get(), base, cookies, listener, deadlineNanos);

            if (result.succeeded()) {
                return new ChainResult(true, name, result.outcome().shortDiagnostic(), false);
            }
            String diag = result.outcome() != null ? result.outcome().shortDiagnostic() : "";
            trail.add(name + ": " + result.failure().name().toLowerCase(Locale.ROOT) + (diag.isEmpty() ? "" : " - " + diag));

            if (result.failure() == FailureType.CANCELLED) {
                return new ChainResult(false, name, String.join("; ", trail), true);
            }
            if (result.failure() == FailureType.DEADLINE) {
                break;
            }
            logger.info("↪️ {} exhausted for {} ({})", name, request.canonicalUrl(), result.failure());
        }

        String diagnostic = trail.isEmpty() ? "no backend configured for " + request.platform().tag()
                : String.join("; ", trail);
        return new ChainResult(false, null, diagnostic, false);
    }
}
