package com.grabber.core;

import com.grabber.common.util.ProcessRunner;
import com.grabber.common.util.ToolLocator;
import com.grabber.core.auth.CookieResolver;
import com.grabber.core.config.ConfigManager;
import com.grabber.core.config.ConfigValidator;
import com.grabber.core.config.Configuration;
import com.grabber.core.executor.DirectHttpBackend;
import com.grabber.core.net.ProxyPool;
import com.grabber.core.net.RateLimiter;
import com.grabber.core.plugin.PluginLoader;
import com.grabber.core.retry.FailureClassifier;
import com.grabber.core.retry.RetryPolicy;
import com.grabber.core.run.DownloadListener;
import com.grabber.core.run.RunContext;
import com.grabber.core.run.RunPlanner;
import com.grabber.core.run.SessionState;
import com.grabber.core.strategy.BackendRegistry;
import com.grabber.core.strategy.StrategyTable;
import com.grabber.core.tracking.HistoryStore;
import com.grabber.core.tracking.TrackingLog;
import com.grabber.core.url.UrlCanonicalizer;
import com.grabber.core.url.UrlExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Application host: owns configuration, the backend registry and the plugins, and builds
 * a fresh {@link RunContext} for every run.
 */
public class Kernel {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    private final File rootDir;
    private final File toolsDir;
    private final ConfigManager configManager;
    private final BackendRegistry backendRegistry;
    private final PluginLoader pluginLoader;
    private final ToolLocator toolLocator;
    private final ProcessRunner processRunner;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public Kernel(File rootDir) {
        this(rootDir, new File(rootDir, "config.json"));
    }

    public Kernel(File rootDir, File configFile) {
        this.rootDir = rootDir.getAbsoluteFile();
        this.toolsDir = new File(this.rootDir, "tools");
        this.configManager = new ConfigManager(configFile);
        this.backendRegistry = new BackendRegistry();
        this.pluginLoader = new PluginLoader(this);
        this.toolLocator = new ToolLocator(toolsDir);
        this.processRunner = new ProcessRunner();
    }

    public void start() {
        if (running.getAndSet(true))
            return;
        logger.info("⚛️ Kernel booting...");

        new ConfigValidator().validateAndReport(configManager.getConfig());

        backendRegistry.register(new DirectHttpBackend());
        pluginLoader.loadPlugins();

        logger.info("✅ Kernel active. Backends: {}", backendRegistry.getAll().keySet());
    }

    public void stop() {
        if (!running.getAndSet(false))
            return;
        pluginLoader.disableAll();
        logger.info("👋 Kernel stopped.");
    }

    /**
     * Builds the context of one run. Bulk runs track their downloads and history inside
     * {@code outputRoot}; single runs write nothing but the media.
     */
    public RunContext newRunContext(SessionState.Mode mode, File outputRoot, boolean thorough, DownloadListener listener) {
        Configuration config = configManager.getConfig();
        RunContext.Builder builder = RunContext.builder()
                .config(config)
                .mode(mode)
                .outputRoot(outputRoot)
                .thorough(thorough)
                .proxyPool(ProxyPool.load(config.proxies, resolvePath(config.proxyConfigPath)))
                .rateLimiter(new RateLimiter(config.defaultRateLimitSeconds, config.rateLimits))
                .cookieResolver(new CookieResolver(rootDir, resolvePath(config.cookiesDir), resolvePath(config.userCookieFile)))
                .classifier(new FailureClassifier(config.blockSignatures, config.authSignatures))
                .strategyTable(new StrategyTable(config.strategy, config.defaultBackendCount))
                .registry(backendRegistry)
                .extractor(newExtractor())
                .retryPolicy(RetryPolicy.withBlockedRetries(config.maxRetries))
                .listener(listener);

        if (mode == SessionState.Mode.BULK) {
            builder.tracker(TrackingLog.inFolder(outputRoot))
                    .history(HistoryStore.inFolder(outputRoot));
        }
        return builder.build();
    }

    public UrlExtractor newExtractor() {
        return new UrlExtractor(new UrlCanonicalizer(configManager.getConfig().trackingParameters));
    }

    public RunPlanner newPlanner() {
        return new RunPlanner(newExtractor());
    }

    /**
     * Relative paths in the configuration are relative to the application root.
     */
    public File resolvePath(String path) {
        if (path == null || path.isBlank()) return null;
        File f = new File(path);
        return f.isAbsolute() ? f : new File(rootDir, path);
    }

    // --- Getters ---
    public File getRootDir() {
        return rootDir;
    }

    public File getToolsDir() {
        return toolsDir;
    }

    public ConfigManager getConfigManager() {
        return configManager;
    }

    public BackendRegistry getBackendRegistry() {
        return backendRegistry;
    }

    public PluginLoader getPluginLoader() {
        return pluginLoader;
    }

    public ToolLocator getToolLocator() {
        return toolLocator;
    }

    public ProcessRunner getProcessRunner() {
        return processRunner;
    }
}
