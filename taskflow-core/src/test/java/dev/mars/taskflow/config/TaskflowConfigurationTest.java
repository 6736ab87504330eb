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


package dev.mars.taskflow.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TaskflowConfiguration}.
 */
class TaskflowConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("taskflow.logging.truncate.length");
    }

    @Test
    void testDefaults() {
        TaskflowConfiguration config = new TaskflowConfiguration(new Properties());

        assertEquals(200, config.getLoggingTruncateLength());
        assertTrue(config.getSensitiveKeys().contains("api_key"));
        assertTrue(config.isMetricsEnabled());
        assertEquals("Unnamed Workflow", config.getDefaultWorkflowName());
        assertTrue(config.getDefaultDecoratorNames().isEmpty());
        assertTrue(config.getConfiguredDecoratorTypes().isEmpty());
    }

    @Test
    void testDecoratorNamesWithFallback() {
        Properties properties = new Properties();
        properties.setProperty("taskflow.decorators.default", "timing");
        properties.setProperty("taskflow.decorators.http_get", " timing , logging ,");
        TaskflowConfiguration config = new TaskflowConfiguration(properties);

        assertEquals(List.of("timing", "logging"), config.getDecoratorNames("http_get"));
        assertEquals(List.of("timing"), config.getDecoratorNames("validate_csv"));
        assertEquals(Set.of("http_get"), config.getConfiguredDecoratorTypes());
    }

    @Test
    @DisplayName("Invalid integers fall back to the default")
    void testInvalidInteger() {
        Properties properties = new Properties();
        properties.setProperty("taskflow.logging.truncate.length", "lots");

        assertEquals(200, new TaskflowConfiguration(properties).getLoggingTruncateLength());
    }

    @Test
    void testSensitiveKeysAreLowerCased() {
        Properties properties = new Properties();
        properties.setProperty("taskflow.logging.sensitive.keys", "Password, PIN");

        assertEquals(Set.of("password", "pin"), new TaskflowConfiguration(properties).getSensitiveKeys());
    }

    @Test
    @DisplayName("Later changes to the source properties do not reach a built configuration")
    void testSourcePropertiesAreCopied() {
        Properties properties = new Properties();
        properties.setProperty("taskflow.decorators.http_get", "timing");
        TaskflowConfiguration config = new TaskflowConfiguration(properties);

        properties.setProperty("taskflow.decorators.http_get", "logging");
        properties.setProperty("taskflow.decorators.notify_mock", "timing");

        assertEquals(List.of("timing"), config.getDecoratorNames("http_get"));
        assertEquals(Set.of("http_get"), config.getConfiguredDecoratorTypes());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty("taskflow.logging.truncate.length", "42");

        assertEquals(42, new TaskflowConfiguration().getLoggingTruncateLength());
    }
}
