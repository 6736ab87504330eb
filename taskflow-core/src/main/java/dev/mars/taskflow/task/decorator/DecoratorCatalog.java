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


package dev.mars.taskflow.task.decorator;

import dev.mars.taskflow.config.TaskflowConfiguration;
import dev.mars.taskflow.monitoring.TaskMetrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named decorator factories that configuration can refer to.
 * The standard catalog knows {@code timing} and {@code logging}; further names can be added.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class DecoratorCatalog {

    public static final String TIMING = "timing";
    public static final String LOGGING = "logging";

    private final Map<String, DecoratorFactory> factories = new LinkedHashMap<>();

    /**
     * Creates a catalog holding the built-in decorators, set up from the given configuration.
     */
    public static DecoratorCatalog standard(TaskflowConfiguration configuration) {
        TaskMetrics metrics = configuration.isMetricsEnabled() ? TaskMetrics.getInstance() : null;
        return standard(configuration, metrics);
    }

    public static DecoratorCatalog standard(TaskflowConfiguration configuration, TaskMetrics metrics) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        DecoratorCatalog catalog = new DecoratorCatalog();
        catalog.register(TIMING, TimingDecorator.factory(metrics));
        catalog.register(LOGGING, LoggingDecorator.factory(
                configuration.getLoggingTruncateLength(), configuration.getSensitiveKeys()));
        return catalog;
    }

    public DecoratorCatalog register(String name, DecoratorFactory factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Decorator name cannot be null or blank");
        }
        factories.put(name.trim().toLowerCase(), Objects.requireNonNull(factory, "Decorator factory cannot be null"));
        return this;
    }

    /**
     * @throws IllegalArgumentException if no decorator is known under the name
     */
    public DecoratorFactory get(String name) {
        DecoratorFactory factory = name != null ? factories.get(name.trim().toLowerCase()) : null;
        if (factory == null) {
            throw new IllegalArgumentException("Unknown decorator: " + name + " (known: " + factories.keySet() + ")");
        }
        return factory;
    }

    /**
     * Resolves an ordered list of names into a chain.
     */
    public DecoratorChain chainOf(List<String> names) {
        List<DecoratorFactory> resolved = new ArrayList<>(names.size());
        for (String name : names) {
            resolved.add(get(name));
        }
        return DecoratorChain.of(resolved);
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(factories.keySet());
    }
}
