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
import dev.mars.eventloom.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class EventLoomConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(EventLoomConfiguration.HANDLER_TIMEOUT);
    }

    private static Properties props(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    @DisplayName("Defaults come from eventloom-default.properties")
    void testDefaults() {
        EventLoomConfiguration config = new EventLoomConfiguration("default", new Properties());

        assertEquals("default", config.getProfile());
        assertEquals(Duration.ofSeconds(5), config.getLoadTimeout());
        assertEquals(Duration.ofSeconds(5), config.getAppendTimeout());
        assertEquals(Duration.ofSeconds(10), config.getHandlerTimeout());
        assertEquals(Duration.ofSeconds(30), config.getReplayHandlerTimeout());
        assertEquals(SerializationMode.LOCAL_QUEUE, config.getSerializationMode());
        assertTrue(config.isMetricsEnabled());
        assertEquals(8, config.getWorkerThreads());
    }

    @Test
    void testProfileOverridesDefaults() {
        EventLoomConfiguration config = new EventLoomConfiguration("test");

        assertEquals(Duration.ofSeconds(2), config.getLoadTimeout());
        assertEquals(Duration.ofSeconds(2), config.getReplayHandlerTimeout());
    }

    @Test
    @DisplayName("System properties override profile files, programmatic overrides win over both")
    void testOverrideOrder() {
        System.setProperty(EventLoomConfiguration.HANDLER_TIMEOUT, "PT7S");

        assertEquals(Duration.ofSeconds(7), new EventLoomConfiguration("test").getHandlerTimeout());

        EventLoomConfiguration overridden = new EventLoomConfiguration("test",
            props(EventLoomConfiguration.HANDLER_TIMEOUT, "PT1S", EventLoomConfiguration.SERIALIZATION, "optimistic"));
        assertEquals(Duration.ofSeconds(1), overridden.getHandlerTimeout());
        assertEquals(SerializationMode.OPTIMISTIC, overridden.getSerializationMode());
    }

    @Test
    @DisplayName("Validation reports every invalid setting at once")
    void testValidationCollectsErrors() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> new EventLoomConfiguration("test", props(
                EventLoomConfiguration.LOAD_TIMEOUT, "five seconds",
                EventLoomConfiguration.APPEND_TIMEOUT, "PT0S",
                EventLoomConfiguration.SERIALIZATION, "PESSIMISTIC",
                EventLoomConfiguration.WORKER_THREADS, "0")));

        assertTrue(error.getMessage().contains("Store load timeout"));
        assertTrue(error.getMessage().contains("Store append timeout must be positive"));
        assertTrue(error.getMessage().contains("PESSIMISTIC"));
        assertTrue(error.getMessage().contains("Engine worker threads must be at least 1"));
    }

    @Test
    void testEnvironmentKeyMapping() {
        assertEquals(EventLoomConfiguration.LOAD_TIMEOUT,
            EventLoomConfiguration.toPropertyKey("EVENTLOOM_STORE_LOAD_TIMEOUT"));
        assertEquals(EventLoomConfiguration.SERIALIZATION,
            EventLoomConfiguration.toPropertyKey("EVENTLOOM_COMMAND_SERIALIZATION"));
        assertEquals("eventloom.custom.flag", EventLoomConfiguration.toPropertyKey("EVENTLOOM_CUSTOM_FLAG"));
    }

    @Test
    void testGenericGetters() {
        EventLoomConfiguration config = new EventLoomConfiguration("test", props("eventloom.example.flag", "true"));

        assertTrue(config.getBoolean("eventloom.example.flag", false));
        assertEquals("fallback", config.getString("eventloom.example.missing", "fallback"));
        assertEquals(Duration.ofMinutes(1), config.getDuration("eventloom.example.flag", Duration.ofMinutes(1)));
        assertEquals(3, config.getInt("eventloom.example.flag", 3));
        assertEquals("true", config.getProperties().getProperty("eventloom.example.flag"));
    }
}
