package dev.mars.arbiter.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Centralized configuration for Arbiter.
 *
 * <p>Loads configuration from {@code arbiter.properties} with environment variable override support.
 * Environment variables take precedence and use uppercase with underscores
 * (e.g., arbiter.storage.location -> ARBITER_STORAGE_LOCATION).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ArbiterConfig {

    private static final Logger logger = LoggerFactory.getLogger(ArbiterConfig.class);
    public static final String CONFIG_FILE = "arbiter.properties";

    public static final String ENVIRONMENT = "arbiter.environment";
    public static final String STORAGE_LOCATION = "arbiter.storage.location";
    public static final String HEALTH_ENABLED = "arbiter.health.enabled";
    public static final String HEALTH_INTERVAL_MS = "arbiter.health.interval-ms";
    public static final String LEVEL_TIMEOUT_MS = "arbiter.engine.level-timeout-ms";
    public static final String MAX_LEVELS = "arbiter.engine.max-levels";
    public static final String FILEWATCH_DEBOUNCE_MS = "arbiter.filewatch.debounce-ms";
    public static final String SHUTDOWN_HOOK_TIMEOUT_MS = "arbiter.shutdown.hook-timeout-ms";

    private final Properties properties;

    private ArbiterConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads {@value #CONFIG_FILE} from the classpath, falling back to defaults when absent.
     */
    public static ArbiterConfig load() {
        Properties properties = new Properties();
        try (InputStream input = ArbiterConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
        return new ArbiterConfig(properties);
    }

    /**
     * Creates a configuration backed by the given properties. Environment variables and
     * system properties still take precedence.
     */
    public static ArbiterConfig fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new ArbiterConfig(copy);
    }

    // ==================== Environment ====================

    public String getEnvironment() {
        return getString(ENVIRONMENT, "development").toLowerCase(Locale.ROOT);
    }

    public boolean isProduction() {
        return "production".equals(getEnvironment());
    }

    // ==================== Storage ====================

    /**
     * Storage location: {@code memory} or a directory path.
     */
    public String getStorageLocation() {
        return getString(STORAGE_LOCATION, "./data/arbiter");
    }

    // ==================== Health Monitoring ====================

    /**
     * Health monitoring runs in production unless explicitly configured.
     */
    public boolean isHealthMonitoringEnabled() {
        return getBoolean(HEALTH_ENABLED, isProduction());
    }

    public long getHealthIntervalMs() {
        return getLong(HEALTH_INTERVAL_MS, 30000);
    }

    // ==================== Execution Engine ====================

    /**
     * Maximum time a single level may take; 0 disables the bound.
     */
    public long getLevelTimeoutMs() {
        return getLong(LEVEL_TIMEOUT_MS, 300000);
    }

    public int getMaxLevels() {
        return getInt(MAX_LEVELS, 50);
    }

    // ==================== Triggers ====================

    public long getFileWatchDebounceMs() {
        return getLong(FILEWATCH_DEBOUNCE_MS, 100);
    }

    // ==================== Shutdown ====================

    public long getShutdownHookTimeoutMs() {
        return getLong(SHUTDOWN_HOOK_TIMEOUT_MS, 10000);
    }

    // ==================== Core Property Accessors ====================

    /**
     * Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., ARBITER_STORAGE_LOCATION)</li>
     *   <li>System property (e.g., -Darbiter.storage.location=memory)</li>
     *   <li>Properties file or supplied properties</li>
     *   <li>Default value</li>
     * </ol>
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isEmpty()) {
            return sysValue;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public void logConfiguration() {
        logger.info("=== Arbiter Configuration ===");
        logger.info("  Environment:          {}", getEnvironment());
        logger.info("  Storage Location:     {}", getStorageLocation());
        logger.info("  --- Health ---");
        logger.info("  Monitoring Enabled:   {}", isHealthMonitoringEnabled());
        logger.info("  Interval:             {}ms", getHealthIntervalMs());
        logger.info("  --- Engine ---");
        logger.info("  Level Timeout:        {}ms", getLevelTimeoutMs());
        logger.info("  Max Levels:           {}", getMaxLevels());
        logger.info("  --- Triggers ---");
        logger.info("  File Watch Debounce:  {}ms", getFileWatchDebounceMs());
        logger.info("  Shutdown Hook Limit:  {}ms", getShutdownHookTimeoutMs());
        logger.info("==============================");
    }
}
