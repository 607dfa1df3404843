package com.grabber.core.config;

import com.grabber.test.TestBase;
import org.junit.jupiter.api.Test;

import java.io.File;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigManager
 */
class ConfigManagerTest extends TestBase {

    @Test
    void testMissingFileWritesDefaults() {
        File file = new File(tempDir, "config.json");
        ConfigManager manager = new ConfigManager(file);

        assertNotNull(manager.getConfig(), "Configuration should not be null");
        assertTrue(file.isFile(), "defaults should be written on first start");
        assertEquals("best", manager.getConfig().quality);
        assertEquals(2, manager.getConfig().maxRetries);
        assertEquals(2.5, manager.getConfig().rateLimits.get("tiktok"));
    }

    @Test
    void testLoadsKnownKeysAndIgnoresUnknownOnes() throws Exception {
        File file = writeFile(tempDir, "config.json", "{\n"
                + "  \"quality\": \"hd\",\n"
                + "  \"maxSecondsPerUrl\": 600,\n"
                + "  \"strategy\": {\"tiktok\": [\"gallery-dl\", \"yt-dlp\"]},\n"
                + "  \"telegramToken\": \"leftover\"\n"
                + "}");
        Configuration config = new ConfigManager(file).getConfig();

        assertEquals("hd", config.quality);
        assertEquals(600, config.maxSecondsPerUrl);
        assertEquals(2, config.strategy.get("tiktok").size());
        assertFalse(config.blockSignatures.isEmpty(), "fields missing from the file keep their defaults");
    }

    @Test
    void testExplicitNullsAreRepaired() throws Exception {
        File file = writeFile(tempDir, "config.json",
                "{\"blockSignatures\": null, \"proxies\": null, \"outputDir\": null}");
        Configuration config = new ConfigManager(file).getConfig();

        assertEquals(new Configuration().blockSignatures, config.blockSignatures);
        assertNotNull(config.proxies);
        assertEquals("downloads", config.outputDir);
    }

    @Test
    void testBrokenFileFallsBackToDefaults() throws Exception {
        File file = writeFile(tempDir, "config.json", "{ this is not json");
        Configuration config = new ConfigManager(file).getConfig();
        assertEquals("best", config.quality);
    }

    @Test
    void testSaveRoundTripsPluginSettings() {
        File file = new File(tempDir, "config.json");
        ConfigManager manager = new ConfigManager(file);
        manager.getConfig().setPluginSetting("YtDlp", "yt_dlp_path", "/opt/yt-dlp");
        manager.getConfig().plugins.put("YtDlp", false);
        manager.saveConfig();

        Configuration reloaded = new ConfigManager(file).getConfig();
        assertEquals("/opt/yt-dlp", reloaded.getPluginSetting("YtDlp", "yt_dlp_path", ""));
        assertFalse(reloaded.plugins.get("YtDlp"));
    }

    @Test
    void testPluginSettingDefaultValue() {
        Configuration config = new Configuration();
        String value = config.getPluginSetting("NonExistentPlugin", "nonexistent_key", "default_value");
        assertEquals("default_value", value, "Should return default value for missing setting");
    }

    @Test
    void testFormatSpec() {
        Configuration config = new Configuration();
        config.quality = "hd";
        assertTrue(config.formatSpec().contains("height<=1080"));

        config.customBitrate = 800;
        assertTrue(config.formatSpec().contains("tbr<=800"), "custom bitrate wins over quality");

        config.customBitrate = null;
        config.quality = "potato";
        assertNull(config.formatSpec());
    }
}
