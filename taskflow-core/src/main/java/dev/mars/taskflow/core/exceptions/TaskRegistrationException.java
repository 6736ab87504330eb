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

package dev.mars.taskflow.core.exceptions;

/**
 * Thrown when a task type cannot be registered: the descriptor has no type, no factory was
 * supplied, or the type is already taken.
 */
public class TaskRegistrationException extends TaskflowException {

    private final String taskType;

    public TaskRegistrationException(String taskType, String message) {
        super(message);
        this.taskType = taskType;
    }

    public TaskRegistrationException(String taskType, String message, Throwable cause) {
        super(message, cause);
        this.taskType = taskType;
    }

    /**
     * The offending task type, or {@code null} when the descriptor did not declare one.
     */
    public String getTaskType() {
        return taskType;
    }
}
