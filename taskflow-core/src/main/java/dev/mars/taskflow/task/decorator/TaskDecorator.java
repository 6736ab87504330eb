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

import java.util.Objects;

/**
 * Base class for cross-cutting wrappers around a {@link TaskExecutable}.
 *
 * <p>A decorator wraps exactly one inner executable and must delegate to it. It may observe the
 * call, measure it or log it, but an exception thrown by the inner executable must leave the
 * decorator unchanged: the worker classifies a step as FAILED only when an exception escapes
 * the outermost wrapper.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public abstract class TaskDecorator implements TaskExecutable {

    private final TaskExecutable inner;
    private final String taskType;

    protected TaskDecorator(TaskExecutable inner, String taskType) {
        this.inner = Objects.requireNonNull(inner, "Inner executable cannot be null");
        this.taskType = taskType;
    }

    public TaskExecutable getInner() {
        return inner;
    }

    /**
     * The step type this decorator was applied for, used as a label in logs and metrics.
     */
    public String getTaskType() {
        return taskType;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + inner + ")";
    }
}
