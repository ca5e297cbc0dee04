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
package dev.mars.subq.api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.*;

/**
 * Configuration management for SubQ clients and transports.
 *
 * <p>Properties are layered, later sources winning:</p>
 * <ol>
 *   <li>{@code /subq-default.properties}</li>
 *   <li>{@code /subq-<profile>.properties}</li>
 *   <li>{@code SUBQ_*} environment variables</li>
 *   <li>{@code subq.*} system properties</li>
 *   <li>explicit overrides passed to the constructor</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class SubQConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SubQConfiguration.class);

    private final Properties properties;
    private final String profile;

    public SubQConfiguration() {
        this(getActiveProfile());
    }

    public SubQConfiguration(String profile) {
        this(profile, Map.of());
    }

    /**
     * Constructor for programmatic configuration. Overrides win over every other source,
     * which lets tests configure a client without touching System properties.
     *
     * @param profile the configuration profile to use
     * @param overrides property overrides, keyed by full property name
     */
    public SubQConfiguration(String profile, Map<String, String> overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach(properties::setProperty);
        validateConfiguration();
        logger.info("Loaded SubQ configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("subq.profile",
               System.getenv("SUBQ_PROFILE") != null ? System.getenv("SUBQ_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/subq-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/subq-" + profile + ".properties");
        }

        // Env first, then system properties so -D wins
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("SUBQ_")) {
                String propKey = key.toLowerCase(Locale.ROOT).replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("subq.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateClientConfig(errors);
        validateBrokerConfig(errors);
        validateDatabaseConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateClientConfig(List<String> errors) {
        Duration operationTimeout = getDuration("subq.client.operation-timeout", Duration.ofSeconds(60));
        if (operationTimeout.isNegative() || operationTimeout.isZero()) {
            errors.add("Operation timeout must be positive");
        }
    }

    private void validateBrokerConfig(List<String> errors) {
        Duration lockDuration = getDuration("subq.broker.lock-duration", Duration.ofSeconds(30));
        if (lockDuration.toMillis() < 1000) {
            errors.add("Lock duration must be at least 1000ms");
        }

        Duration sessionLockDuration = getDuration("subq.broker.session-lock-duration", Duration.ofSeconds(30));
        if (sessionLockDuration.toMillis() < 1000) {
            errors.add("Session lock duration must be at least 1000ms");
        }

        int maxDeliveryCount = getInt("subq.broker.max-delivery-count", 10);
        if (maxDeliveryCount < 1) {
            errors.add("Max delivery count must be at least 1");
        }

        Duration pollInterval = getDuration("subq.broker.poll-interval", Duration.ofMillis(250));
        if (pollInterval.toMillis() < 10) {
            errors.add("Poll interval must be at least 10ms");
        }
    }

    private void validateDatabaseConfig(List<String> errors) {
        int maxPoolSize = getInt("subq.database.pool.max-size", 8);
        if (maxPoolSize < 1) {
            errors.add("Maximum pool size must be at least 1");
        }
        if (getString("subq.database.schema", "public").isBlank()) {
            errors.add("Database schema cannot be blank");
        }
    }

    public String getProfile() {
        return profile;
    }

    // Configuration getters with defaults
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // Typed accessors

    public Duration getOperationTimeout() {
        return getDuration("subq.client.operation-timeout", Duration.ofSeconds(60));
    }

    public boolean isMetricsEnabled() {
        return getBoolean("subq.client.metrics.enabled", true);
    }

    public BrokerConfig getBrokerConfig() {
        return new BrokerConfig(
            getDuration("subq.broker.lock-duration", Duration.ofSeconds(30)),
            getDuration("subq.broker.session-lock-duration", Duration.ofSeconds(30)),
            getInt("subq.broker.max-delivery-count", 10),
            getDuration("subq.broker.poll-interval", Duration.ofMillis(250))
        );
    }

    public int getDatabasePoolMaxSize() {
        return getInt("subq.database.pool.max-size", 8);
    }

    public String getDatabaseSchema() {
        return getString("subq.database.schema", "public");
    }

    /**
     * Broker-side lock and delivery settings applied by transports.
     *
     * @param lockDuration how long a received message stays locked
     * @param sessionLockDuration how long an accepted session stays locked
     * @param maxDeliveryCount abandon count at which a message is dead-lettered
     * @param pollInterval how often waiting receives and accepts re-check the broker
     */
    public record BrokerConfig(Duration lockDuration, Duration sessionLockDuration,
                               int maxDeliveryCount, Duration pollInterval) {
    }
}
