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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Configuration management for Taskflow.
 * Values are layered: built-in defaults, then the first {@code taskflow.properties} found on disk
 * or on the classpath, then {@code taskflow.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TaskflowConfiguration {
    private static final Logger logger = Logger.getLogger(TaskflowConfiguration.class.getName());

    public static final String PREFIX = "taskflow.";
    public static final String DECORATORS_PREFIX = "taskflow.decorators.";
    public static final String DEFAULT_DECORATORS_KEY = DECORATORS_PREFIX + "default";
    public static final String TRUNCATE_LENGTH_KEY = "taskflow.logging.truncate.length";
    public static final String SENSITIVE_KEYS_KEY = "taskflow.logging.sensitive.keys";
    public static final String METRICS_ENABLED_KEY = "taskflow.monitoring.metrics.enabled";
    public static final String DEFAULT_WORKFLOW_NAME_KEY = "taskflow.workflow.default.name";

    // Default configuration values
    private static final int DEFAULT_TRUNCATE_LENGTH = 200;
    private static final String DEFAULT_SENSITIVE_KEYS = "password,token,api_key,secret,auth";
    private static final String DEFAULT_WORKFLOW_NAME = "Unnamed Workflow";

    private final Properties properties;

    public TaskflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Creates a configuration from defaults overlaid with the given properties only. Files and
     * system properties are not consulted.
     */
    public TaskflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Decorator Configuration

    /**
     * Ordered decorator names for a step type, falling back to {@code taskflow.decorators.default}
     * when the type has no entry of its own. The first name is the innermost wrapper.
     */
    public List<String> getDecoratorNames(String taskType) {
        String value = properties.getProperty(DECORATORS_PREFIX + taskType);
        if (value == null) {
            value = properties.getProperty(DEFAULT_DECORATORS_KEY, "");
        }
        return splitList(value);
    }

    public List<String> getDefaultDecoratorNames() {
        return splitList(properties.getProperty(DEFAULT_DECORATORS_KEY, ""));
    }

    /**
     * Step types that carry an explicit decorator entry.
     */
    public Set<String> getConfiguredDecoratorTypes() {
        Set<String> types = new LinkedHashSet<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(DECORATORS_PREFIX) && !key.equals(DEFAULT_DECORATORS_KEY)) {
                types.add(key.substring(DECORATORS_PREFIX.length()));
            }
        }
        return Collections.unmodifiableSet(types);
    }

    // Logging Decorator Configuration
    public int getLoggingTruncateLength() {
        return getIntProperty(TRUNCATE_LENGTH_KEY, DEFAULT_TRUNCATE_LENGTH);
    }

    public Set<String> getSensitiveKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (String key : splitList(getStringProperty(SENSITIVE_KEYS_KEY, DEFAULT_SENSITIVE_KEYS))) {
            keys.add(key.toLowerCase());
        }
        return Collections.unmodifiableSet(keys);
    }

    // Monitoring Configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED_KEY, true);
    }

    // Workflow Configuration
    public String getDefaultWorkflowName() {
        return getStringProperty(DEFAULT_WORKFLOW_NAME_KEY, DEFAULT_WORKFLOW_NAME);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(TRUNCATE_LENGTH_KEY, String.valueOf(DEFAULT_TRUNCATE_LENGTH));
        properties.setProperty(SENSITIVE_KEYS_KEY, DEFAULT_SENSITIVE_KEYS);
        properties.setProperty(METRICS_ENABLED_KEY, "true");
        properties.setProperty(DEFAULT_WORKFLOW_NAME_KEY, DEFAULT_WORKFLOW_NAME);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "taskflow.properties",
                "config/taskflow.properties",
                System.getProperty("user.home") + "/.taskflow/taskflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("taskflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith(PREFIX))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "TaskflowConfiguration{" +
                "defaultDecorators=" + getDefaultDecoratorNames() +
                ", decoratedTypes=" + getConfiguredDecoratorTypes() +
                ", truncateLength=" + getLoggingTruncateLength() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
