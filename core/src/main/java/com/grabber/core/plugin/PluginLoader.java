package com.grabber.core.plugin;

import com.grabber.api.MediaPlugin;
import com.grabber.core.Kernel;
import com.grabber.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Discovers {@link MediaPlugin}s through {@link ServiceLoader}: first on the application
 * classpath, then in {@code plugins/*.jar} below the root directory. Each plugin can be
 * switched off in the {@code plugins} section of the configuration.
 */
public class PluginLoader {
    private static final Logger logger = LoggerFactory.getLogger(PluginLoader.class);

    private final Kernel kernel;
    private final Map<String, MediaPlugin> activePlugins = new ConcurrentHashMap<>();
    private final Map<String, URLClassLoader> pluginClassLoaders = new ConcurrentHashMap<>();

    public PluginLoader(Kernel kernel) {
        this.kernel = kernel;
    }

    public void loadPlugins() {
        Configuration config = kernel.getConfigManager().getConfig();
        boolean discovered = false;

        // 1. Classpath
        for (MediaPlugin plugin : ServiceLoader.load(MediaPlugin.class, getClass().getClassLoader())) {
            discovered |= loadPluginSafe(plugin, config, null);
        }

        // 2. External jars
        File pluginDir = new File(kernel.getRootDir(), "plugins");
        File[] jars = pluginDir.listFiles((dir, name) -> name.endsWith(".jar"));
        if (jars != null && jars.length > 0) {
            Arrays.sort(jars, Comparator.comparing(File::getName));
            for (File jar : jars) {
                try {
                    discovered |= loadPluginFromFile(jar, config);
                } catch (IOException e) {
                    logger.error("Failed to load plugin jar: " + jar.getName(), e);
                }
            }
        }

        if (discovered) {
            kernel.getConfigManager().saveConfig();
        }
    }

    /**
     * @return true when a plugin unknown to the configuration was found
     */
    public boolean loadPluginFromFile(File jarFile, Configuration config) throws IOException {
        URL[] urls = new URL[]{jarFile.toURI().toURL()};
        URLClassLoader ucl = new URLClassLoader(urls, getClass().getClassLoader());

        boolean discovered = false;
        boolean anyLoaded = false;
        for (MediaPlugin plugin : ServiceLoader.load(MediaPlugin.class, ucl)) {
            discovered |= loadPluginSafe(plugin, config, ucl);
            anyLoaded |= activePlugins.get(plugin.getName()) == plugin;
        }
        if (!anyLoaded) ucl.close();
        return discovered;
    }

    private boolean loadPluginSafe(MediaPlugin plugin, Configuration config, URLClassLoader ucl) {
        String name = plugin.getName();
        if (activePlugins.containsKey(name)) {
            logger.warn("Plugin {} is already loaded. Skipping duplicate.", name);
            return false;
        }

        boolean discovered = false;
        if (!config.plugins.containsKey(name)) {
            logger.info("✨ New Plugin discovered: {}", name);
            config.plugins.put(name, true);
            discovered = true;
        }

        if (Boolean.TRUE.equals(config.plugins.get(name))) {
            try {
                logger.info("Loading Plugin: {} v{}", name, plugin.getVersion());
                plugin.onEnable(kernel);
                activePlugins.put(name, plugin);
                if (ucl != null) pluginClassLoaders.put(name, ucl);
            } catch (RuntimeException e) {
                logger.error("Failed to enable plugin: " + name, e);
            }
        } else {
            logger.info("Plugin {} is disabled in config.", name);
        }
        return discovered;
    }

    public void unloadPlugin(String name) {
        MediaPlugin plugin = activePlugins.remove(name);
        if (plugin == null) {
            logger.warn("Cannot unload unknown plugin: {}", name);
            return;
        }
        try {
            logger.info("🔌 Disabling plugin: {}", name);
            plugin.onDisable();
        } catch (RuntimeException e) {
            logger.error("Error during onDisable for " + name, e);
        }

        URLClassLoader ucl = pluginClassLoaders.remove(name);
        if (ucl != null) {
            try {
                ucl.close();
            } catch (IOException e) {
                logger.warn("Failed to close ClassLoader for " + name, e);
            }
        }
    }

    public void disableAll() {
        for (String name : new ArrayList<>(activePlugins.keySet())) {
            unloadPlugin(name);
        }
    }

    public Collection<MediaPlugin> getPlugins() {
        return List.copyOf(activePlugins.values());
    }
}
