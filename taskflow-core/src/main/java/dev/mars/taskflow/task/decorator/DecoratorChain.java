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

import dev.mars.taskflow.task.TaskExecutable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered list of decorator factories.
 *
 * <p>{@link #apply(TaskExecutable, String)} folds the list around a base executable from first
 * to last, so the last factory produces the outermost wrapper. A chain of {@code [timing,
 * logging]} therefore runs logging first, then timing, then the task.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class DecoratorChain {

    private static final DecoratorChain EMPTY = new DecoratorChain(List.of());

    private final List<DecoratorFactory> factories;

    private DecoratorChain(List<DecoratorFactory> factories) {
        this.factories = factories;
    }

    public static DecoratorChain empty() {
        return EMPTY;
    }

    public static DecoratorChain of(DecoratorFactory... factories) {
        return of(Arrays.asList(factories));
    }

    public static DecoratorChain of(List<DecoratorFactory> factories) {
        Objects.requireNonNull(factories, "Decorator factories cannot be null");
        if (factories.isEmpty()) {
            return EMPTY;
        }
        List<DecoratorFactory> copy = new ArrayList<>(factories.size());
        for (DecoratorFactory factory : factories) {
            copy.add(Objects.requireNonNull(factory, "Decorator factory cannot be null"));
        }
        return new DecoratorChain(Collections.unmodifiableList(copy));
    }

    /**
     * Returns a new chain with the given factory appended as the new outermost wrapper.
     */
    public DecoratorChain then(DecoratorFactory factory) {
        List<DecoratorFactory> extended = new ArrayList<>(factories);
        extended.add(factory);
        return of(extended);
    }

    public TaskExecutable apply(TaskExecutable base, String taskType) {
        Objects.requireNonNull(base, "Base executable cannot be null");
        TaskExecutable current = base;
        for (DecoratorFactory factory : factories) {
            TaskDecorator decorator = factory.decorate(current, taskType);
            if (decorator == null) {
                throw new IllegalStateException("Decorator factory returned null for task type: " + taskType);
            }
            current = decorator;
        }
        return current;
    }

    public List<DecoratorFactory> getFactories() {
        return factories;
    }

    public int size() {
        return factories.size();
    }

    public boolean isEmpty() {
        return factories.isEmpty();
    }

    @Override
    public String toString() {
        return "DecoratorChain{size=" + factories.size() + "}";
    }
}
