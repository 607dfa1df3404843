package com.grabber.core.strategy;

import com.grabber.api.DownloadBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Backends registered by plugins (and core), addressed by name from the strategy table.
 */
public class BackendRegistry {
    private static final Logger logger = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<String, DownloadBackend> backends = Collections.synchronizedMap(new LinkedHashMap<>());

    public void register(DownloadBackend backend) {
        DownloadBackend previous = backends.put(backend.getName(), backend);
        if (previous != null) {
            logger.warn("Backend {} replaced by {}", backend.getName(), backend.getClass().getSimpleName());
        } else {
            logger.info("Backend registered: {}", backend.getName());
        }
    }

    public void unregister(String name) {
        if (backends.remove(name) != null) {
            logger.info("Backend DEREGISTERED: {}", name);
        }
    }

    public Optional<DownloadBackend> get(String name) {
        return Optional.ofNullable(backends.get(name));
    }

    public Map<String, DownloadBackend> getAll() {
        synchronized (backends) {
            return Map.copyOf(backends);
        }
    }
}
