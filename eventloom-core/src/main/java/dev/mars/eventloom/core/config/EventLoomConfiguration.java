package dev.mars.eventloom.core.config;

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

import dev.mars.eventloom.core.concurrency.SerializationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration management for the EventLoom engine.
 *
 * Properties are layered in this order, later sources winning:
 * <ol>
 *   <li>{@code /eventloom-default.properties} on the classpath</li>
 *   <li>{@code /eventloom-{profile}.properties} on the classpath</li>
 *   <li>{@code EVENTLOOM_*} environment variables</li>
 *   <li>{@code eventloom.*} system properties</li>
 *   <li>programmatic overrides passed to the constructor</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class EventLoomConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(EventLoomConfiguration.class);

    public static final String LOAD_TIMEOUT = "eventloom.store.load-timeout";
    public static final String APPEND_TIMEOUT = "eventloom.store.append-timeout";
    public static final String HANDLER_TIMEOUT = "eventloom.dispatch.handler-timeout";
    public static final String REPLAY_HANDLER_TIMEOUT = "eventloom.replay.handler-timeout";
    public static final String SERIALIZATION = "eventloom.command.serialization";
    public static final String METRICS_ENABLED = "eventloom.metrics.enabled";
    public static final String WORKER_THREADS = "eventloom.engine.worker-threads";

    private static final List<String> KNOWN_KEYS = List.of(
        LOAD_TIMEOUT, APPEND_TIMEOUT, HANDLER_TIMEOUT, REPLAY_HANDLER_TIMEOUT, SERIALIZATION, METRICS_ENABLED,
        WORKER_THREADS);

    private final Properties properties;
    private final String profile;

    public EventLoomConfiguration() {
        this(getActiveProfile());
    }

    public EventLoomConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Constructor for programmatic configuration. Overrides win over every other source,
     * which keeps tests from having to touch System properties.
     *
     * @param profile the configuration profile to use
     * @param overrides properties applied last
     */
    public EventLoomConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile, System.getenv());
        overrides.stringPropertyNames().forEach(key -> properties.setProperty(key, overrides.getProperty(key)));
        validateConfiguration();
        logger.info("Loaded EventLoom configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("eventloom.profile",
               System.getenv("EVENTLOOM_PROFILE") != null ? System.getenv("EVENTLOOM_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/eventloom-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/eventloom-" + profile + ".properties");
        }

        // Env names cannot carry '.' or '-', so EVENTLOOM_STORE_LOAD_TIMEOUT maps onto eventloom.store.load-timeout
        environment.forEach((key, value) -> {
            if (key.startsWith("EVENTLOOM_")) {
                props.setProperty(toPropertyKey(key), value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("eventloom.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    static String toPropertyKey(String environmentKey) {
        for (String known : KNOWN_KEYS) {
            if (toEnvironmentKey(known).equals(environmentKey)) {
                return known;
            }
        }
        return environmentKey.toLowerCase(Locale.ROOT).replace("_", ".");
    }

    static String toEnvironmentKey(String propertyKey) {
        return propertyKey.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
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

        validateTimeout(errors, LOAD_TIMEOUT, "Store load timeout");
        validateTimeout(errors, APPEND_TIMEOUT, "Store append timeout");
        validateTimeout(errors, HANDLER_TIMEOUT, "Dispatch handler timeout");
        validateTimeout(errors, REPLAY_HANDLER_TIMEOUT, "Replay handler timeout");

        String mode = properties.getProperty(SERIALIZATION);
        if (mode != null && parseMode(mode) == null) {
            errors.add("Command serialization must be one of LOCAL_QUEUE, OPTIMISTIC but was " + mode);
        }

        String threads = properties.getProperty(WORKER_THREADS);
        if (threads != null) {
            try {
                if (Integer.parseInt(threads.trim()) < 1) {
                    errors.add("Engine worker threads must be at least 1");
                }
            } catch (NumberFormatException e) {
                errors.add("Engine worker threads is not a number: " + threads);
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateTimeout(List<String> errors, String key, String label) {
        String value = properties.getProperty(key);
        if (value == null) {
            return;
        }
        try {
            Duration duration = Duration.parse(value.trim());
            if (duration.isNegative() || duration.isZero()) {
                errors.add(label + " must be positive");
            }
        } catch (Exception e) {
            errors.add(label + " is not an ISO-8601 duration: " + value);
        }
    }

    private static SerializationMode parseMode(String value) {
        try {
            return SerializationMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    // Configuration getters with defaults

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
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

    // Engine settings

    public Duration getLoadTimeout() {
        return getDuration(LOAD_TIMEOUT, Duration.ofSeconds(5));
    }

    public Duration getAppendTimeout() {
        return getDuration(APPEND_TIMEOUT, Duration.ofSeconds(5));
    }

    public Duration getHandlerTimeout() {
        return getDuration(HANDLER_TIMEOUT, Duration.ofSeconds(10));
    }

    public Duration getReplayHandlerTimeout() {
        return getDuration(REPLAY_HANDLER_TIMEOUT, Duration.ofSeconds(30));
    }

    public SerializationMode getSerializationMode() {
        String value = properties.getProperty(SERIALIZATION);
        return value == null ? SerializationMode.LOCAL_QUEUE : parseMode(value);
    }

    /**
     * Size of the engine's worker pool, which runs handler deliveries and timeout continuations.
     */
    public int getWorkerThreads() {
        return getInt(WORKER_THREADS, 8);
    }

    public boolean isMetricsEnabled() {
        return getBoolean(METRICS_ENABLED, true);
    }

    public String getProfile() { return profile; }

    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}
