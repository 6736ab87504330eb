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


package dev.mars.taskflow.examples;

import dev.mars.taskflow.config.TaskflowConfiguration;
import dev.mars.taskflow.core.exceptions.TaskRegistrationException;
import dev.mars.taskflow.examples.tasks.HttpGetTask;
import dev.mars.taskflow.examples.tasks.NotifyMockTask;
import dev.mars.taskflow.examples.tasks.TransformSimpleTask;
import dev.mars.taskflow.examples.tasks.ValidateCsvTask;
import dev.mars.taskflow.storage.WorkflowRunRepository;
import dev.mars.taskflow.task.TaskRegistry;
import dev.mars.taskflow.task.decorator.DecoratorCatalog;
import dev.mars.taskflow.task.decorator.DecoratorRegistry;
import dev.mars.taskflow.worker.TaskWorker;
import dev.mars.taskflow.workflow.SequentialWorkflowEngine;
import dev.mars.taskflow.workflow.WorkflowEngine;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Wires the example step types, the configured decorator chains, the worker and the engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class TaskflowBootstrap {

    private static final Logger logger = Logger.getLogger(TaskflowBootstrap.class.getName());

    private TaskflowBootstrap() {
    }

    /**
     * Registers {@code notify_mock}, {@code validate_csv}, {@code http_get} and
     * {@code transform_simple}.
     *
     * @throws TaskRegistrationException if one of the types is already registered
     */
    public static void registerExampleTasks(TaskRegistry registry) throws TaskRegistrationException {
        Objects.requireNonNull(registry, "Task registry cannot be null");
        registry.register(NotifyMockTask.descriptor(), NotifyMockTask::new);
        registry.register(ValidateCsvTask.descriptor(), ValidateCsvTask::new);
        registry.register(HttpGetTask.descriptor(), HttpGetTask::new);
        registry.register(TransformSimpleTask.descriptor(), TransformSimpleTask::new);
        logger.info("Registered " + registry.size() + " task types");
    }

    public static TaskRegistry createRegistry() throws TaskRegistrationException {
        TaskRegistry registry = new TaskRegistry();
        registerExampleTasks(registry);
        return registry;
    }

    /**
     * @throws IllegalArgumentException if the configuration names an unknown decorator
     */
    public static DecoratorRegistry createDecoratorRegistry(TaskflowConfiguration configuration) {
        return DecoratorRegistry.fromConfiguration(configuration, DecoratorCatalog.standard(configuration));
    }

    public static WorkflowEngine createEngine(TaskflowConfiguration configuration, TaskRegistry registry,
                                              WorkflowRunRepository repository) {
        TaskWorker worker = new TaskWorker(registry, createDecoratorRegistry(configuration));
        return new SequentialWorkflowEngine(worker, repository);
    }
}
