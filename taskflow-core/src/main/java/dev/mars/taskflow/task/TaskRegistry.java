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


package dev.mars.taskflow.task;

import dev.mars.taskflow.core.exceptions.TaskRegistrationException;
import dev.mars.taskflow.core.exceptions.UnknownTaskTypeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Maps step types to factories producing their {@link Task} strategies.
 *
 * <p>The registry is an explicit object; callers populate it at bootstrap and pass it to the
 * worker. Descriptors are kept in registration order. Every {@link #create(String)} call asks the
 * factory for a new instance, so tasks may keep per-execution state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TaskRegistry {
    private static final Logger logger = Logger.getLogger(TaskRegistry.class.getName());

    private final Map<String, Registration> registrations = new LinkedHashMap<>();

    public synchronized void register(TaskDescriptor descriptor, Supplier<? extends Task> factory)
            throws TaskRegistrationException {
        if (descriptor == null) {
            throw new TaskRegistrationException(null, "Task descriptor cannot be null");
        }
        String type = descriptor.getType();
        if (type == null || type.isBlank()) {
            throw new TaskRegistrationException(type, "Task type cannot be null or blank");
        }
        if (factory == null) {
            throw new TaskRegistrationException(type, "Task factory cannot be null for type: " + type);
        }
        if (registrations.containsKey(type)) {
            throw new TaskRegistrationException(type, "Task type already registered: " + type);
        }
        registrations.put(type, new Registration(descriptor, factory));
        logger.info("Registered task type: " + type);
    }

    /**
     * Creates a fresh strategy instance for the given type.
     *
     * @throws UnknownTaskTypeException if nothing is registered under the type
     * @throws TaskRegistrationException if the registered factory returns {@code null}
     */
    public Task create(String type) throws TaskRegistrationException {
        Registration registration;
        synchronized (this) {
            registration = type != null ? registrations.get(type) : null;
        }
        if (registration == null) {
            throw new UnknownTaskTypeException(type);
        }
        Task task = registration.factory.get();
        if (task == null) {
            throw new TaskRegistrationException(type, "Task factory returned null for type: " + type);
        }
        return task;
    }

    public synchronized boolean isRegistered(String type) {
        return type != null && registrations.containsKey(type);
    }

    /**
     * Descriptors of all registered types in registration order.
     */
    public synchronized List<TaskDescriptor> list() {
        List<TaskDescriptor> descriptors = new ArrayList<>(registrations.size());
        for (Registration registration : registrations.values()) {
            descriptors.add(registration.descriptor);
        }
        return Collections.unmodifiableList(descriptors);
    }

    public synchronized int size() {
        return registrations.size();
    }

    public synchronized void clear() {
        int removed = registrations.size();
        registrations.clear();
        logger.info("Cleared task registry (" + removed + " types removed)");
    }

    private static final class Registration {
        private final TaskDescriptor descriptor;
        private final Supplier<? extends Task> factory;

        private Registration(TaskDescriptor descriptor, Supplier<? extends Task> factory) {
            this.descriptor = descriptor;
            this.factory = factory;
        }
    }
}
