package com.grabber.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ConfigValidator - Validates configuration before a run.
 * Catches configuration issues early instead of failing per URL.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    /**
     * Validate configuration and return list of errors/warnings
     */
    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        validateQuality(config, errors);
        validateLimits(config, errors);
        validateProxyFile(config, errors);
        validateStrategy(config, errors);

        return errors;
    }

    private void validateQuality(Configuration config, List<ValidationError> errors) {
        if (Quality.fromLabel(config.quality).isEmpty()) {
            errors.add(new ValidationError(
                    "Unknown quality '" + config.quality + "' - backend default format will be used",
                    "WARNING"));
        }
        if (config.customBitrate != null && config.customBitrate <= 0) {
            errors.add(new ValidationError(
                    "customBitrate must be positive (kbps), got " + config.customBitrate,
                    "ERROR"));
        }
    }

    private void validateLimits(Configuration config, List<ValidationError> errors) {
        if (config.maxRetries < 0) {
            errors.add(new ValidationError("maxRetries must not be negative", "ERROR"));
        }
        if (config.defaultBackendCount < 1) {
            errors.add(new ValidationError("defaultBackendCount must be at least 1", "ERROR"));
        }
        if (config.backendTimeoutSeconds < 1) {
            errors.add(new ValidationError("backendTimeoutSeconds must be at least 1", "ERROR"));
        }
        if (config.maxSecondsPerUrl < 0) {
            errors.add(new ValidationError("maxSecondsPerUrl must not be negative", "ERROR"));
        }
        if (config.defaultRateLimitSeconds < 0) {
            errors.add(new ValidationError("defaultRateLimitSeconds must not be negative", "ERROR"));
        }
        for (Map.Entry<String, Double> e : config.rateLimits.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0) {
                errors.add(new ValidationError("Invalid rate limit for " + e.getKey(), "ERROR"));
            }
        }
        if (config.skipRecentWindow && config.skipRecentHours <= 0) {
            errors.add(new ValidationError(
                    "skipRecentWindow enabled but skipRecentHours is " + config.skipRecentHours,
                    "WARNING"));
        }
    }

    private void validateProxyFile(Configuration config, List<ValidationError> errors) {
        if (config.proxyConfigPath != null && !config.proxyConfigPath.isEmpty()
                && !new File(config.proxyConfigPath).isFile()) {
            errors.add(new ValidationError(
                    "Proxy file not found: " + config.proxyConfigPath + " - running without proxies",
                    "WARNING"));
        }
    }

    private void validateStrategy(Configuration config, List<ValidationError> errors) {
        for (Map.Entry<String, List<String>> e : config.strategy.entrySet()) {
            if (e.getValue() == null || e.getValue().isEmpty()) {
                errors.add(new ValidationError(
                        "Strategy for '" + e.getKey() + "' is empty - default order will be used",
                        "WARNING"));
            }
        }
    }

    /**
     * Validate and report errors to logger.
     * Throws IllegalStateException if critical errors found.
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.severity.equals("ERROR")) {
                logger.error("❌ Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.",
                            errorCount));
        }
    }
}
