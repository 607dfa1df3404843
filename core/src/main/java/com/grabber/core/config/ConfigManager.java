package com.grabber.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private static final Set<String> KNOWN_KEYS = knownKeys();

    private final File configFile;
    private final Gson gson;
    private Configuration configuration;

    public ConfigManager(File configFile) {
        this.configFile = configFile;
        this.gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
        load();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public File getConfigFile() {
        return configFile;
    }

    public synchronized void saveConfig() {
        File parent = configFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists()) parent.mkdirs();
        try (Writer writer = Files.newBufferedWriter(configFile.toPath(), StandardCharsets.UTF_8)) {
            gson.toJson(this.configuration, writer);
            logger.debug("Configuration saved to {}", configFile);
        } catch (IOException e) {
            logger.error("Failed to save config", e);
        }
    }

    public void updateConfig(Configuration newConfig) {
        this.configuration = newConfig;
        saveConfig();
    }

    private void load() {
        if (!configFile.exists()) {
            configuration = new Configuration();
            logger.info("No config file found. Created default configuration.");
            saveConfig(); // write defaults
            return;
        }

        try (Reader r = Files.newBufferedReader(configFile.toPath(), StandardCharsets.UTF_8)) {
            JsonElement tree = JsonParser.parseReader(r);
            if (tree == null || !tree.isJsonObject()) {
                logger.warn("Config file {} is not a JSON object, using defaults", configFile);
                configuration = new Configuration();
                return;
            }
            reportUnknownKeys(tree.getAsJsonObject());
            configuration = gson.fromJson(tree, Configuration.class);
            if (configuration == null) configuration = new Configuration();
            repairNulls(configuration);
            logger.info("Configuration loaded from {}", configFile);
        } catch (Exception e) {
            logger.error("Failed to load configuration, using defaults", e);
            configuration = new Configuration();
        }
    }

    // Unknown keys are ignored; sorted so the warnings come out the same every run
    private void reportUnknownKeys(JsonObject json) {
        new TreeSet<>(json.keySet()).stream()
                .filter(key -> !KNOWN_KEYS.contains(key))
                .forEach(key -> logger.warn("⚠️ Ignoring unknown config key: {}", key));
    }

    private static void repairNulls(Configuration c) {
        Configuration defaults = new Configuration();
        if (c.outputDir == null) c.outputDir = defaults.outputDir;
        if (c.quality == null) c.quality = defaults.quality;
        if (c.proxies == null) c.proxies = new ArrayList<>();
        if (c.rateLimits == null) c.rateLimits = new LinkedHashMap<>();
        if (c.cookiesDir == null) c.cookiesDir = defaults.cookiesDir;
        if (c.strategy == null) c.strategy = new LinkedHashMap<>();
        if (c.trackingParameters == null) c.trackingParameters = defaults.trackingParameters;
        if (c.blockSignatures == null) c.blockSignatures = defaults.blockSignatures;
        if (c.authSignatures == null) c.authSignatures = defaults.authSignatures;
        if (c.plugins == null) c.plugins = new HashMap<>();
        if (c.pluginConfigs == null) c.pluginConfigs = new HashMap<>();
    }

    private static Set<String> knownKeys() {
        Set<String> keys = new HashSet<>();
        for (Field f : Configuration.class.getFields()) {
            if (!Modifier.isStatic(f.getModifiers())) keys.add(f.getName());
        }
        return Collections.unmodifiableSet(keys);
    }
}
