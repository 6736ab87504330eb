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

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Holds the decorator chain to apply for each step type.
 * Types without an entry of their own use the default chain, which is empty unless configured.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class DecoratorRegistry {
    private static final Logger logger = Logger.getLogger(DecoratorRegistry.class.getName());

    private final Map<String, DecoratorChain> chains = new ConcurrentHashMap<>();
    private volatile DecoratorChain defaultChain = DecoratorChain.empty();

    /**
     * Builds a registry from {@code taskflow.decorators.default} and every
     * {@code taskflow.decorators.<type>} entry of the configuration.
     *
     * @throws IllegalArgumentException if a configured decorator name is not in the catalog
     */
    public static DecoratorRegistry fromConfiguration(TaskflowConfiguration configuration, DecoratorCatalog catalog) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        Objects.requireNonNull(catalog, "Decorator catalog cannot be null");

        DecoratorRegistry registry = new DecoratorRegistry();
        registry.setDefaultChain(catalog.chainOf(configuration.getDefaultDecoratorNames()));
        for (String type : configuration.getConfiguredDecoratorTypes()) {
            registry.register(type, catalog.chainOf(configuration.getDecoratorNames(type)));
        }
        logger.info("Loaded decorator configuration for " + registry.chains.size() + " task types");
        return registry;
    }

    public void register(String taskType, DecoratorChain chain) {
        Objects.requireNonNull(taskType, "Task type cannot be null");
        chains.put(taskType, Objects.requireNonNull(chain, "Decorator chain cannot be null"));
        logger.fine("Decorator chain for " + taskType + ": " + chain.size() + " decorators");
    }

    public void setDefaultChain(DecoratorChain chain) {
        this.defaultChain = Objects.requireNonNull(chain, "Decorator chain cannot be null");
    }

    public DecoratorChain getDefaultChain() {
        return defaultChain;
    }

    public DecoratorChain chainFor(String taskType) {
        DecoratorChain chain = taskType != null ? chains.get(taskType) : null;
        return chain != null ? chain : defaultChain;
    }

    public boolean hasChain(String taskType) {
        return taskType != null && chains.containsKey(taskType);
    }
}
