package com.grabber.core.config;

import com.grabber.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigValidator
 */
class ConfigValidatorTest extends TestBase {

    private final ConfigValidator validator = new ConfigValidator();

    @Test
    void testDefaultsAreValid() {
        assertTrue(validator.validate(new Configuration()).isEmpty());
        assertDoesNotThrow(() -> validator.validateAndReport(new Configuration()));
    }

    @Test
    void testWarningsDoNotStopStartup() {
        Configuration config = new Configuration();
        config.quality = "potato";
        config.proxyConfigPath = tempDir.getAbsolutePath() + "/missing-proxies.txt";
        config.strategy.put("youtube", List.of());

        List<ConfigValidator.ValidationError> errors = validator.validate(config);
        assertEquals(3, errors.size());
        assertTrue(errors.stream().allMatch(e -> e.severity.equals("WARNING")));
        assertDoesNotThrow(() -> validator.validateAndReport(config));
    }

    @Test
    void testErrorsStopStartup() {
        Configuration config = new Configuration();
        config.maxRetries = -1;
        config.backendTimeoutSeconds = 0;
        config.rateLimits.put("reddit", -2.0);

        assertEquals(3, validator.validate(config).size());
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validateAndReport(config));
        assertTrue(e.getMessage().contains("3 error(s)"));
    }
}
