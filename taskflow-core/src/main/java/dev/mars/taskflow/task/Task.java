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

import dev.mars.taskflow.core.exceptions.TaskValidationException;

import java.util.Map;

/**
 * Strategy for one workflow step type.
 * Implementations hold the domain logic of a step (an HTTP call, a file check, a database
 * write) and are created fresh by the {@link TaskRegistry} for every execution.
 *
 * <p>Implementations never sequence their own methods. {@link TaskTemplate} always calls
 * {@link #before}, {@link #validateParams}, {@link #execute} and {@link #after} in that order,
 * and routes any exception or error through {@link #onError} before re-throwing it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface Task {

    /**
     * Validates the step parameters before execution.
     *
     * @param params the step parameters
     * @throws TaskValidationException naming the missing or malformed parameter
     */
    void validateParams(Map<String, Object> params) throws TaskValidationException;

    /**
     * Executes the step.
     *
     * @param context read-only results of previously completed steps
     * @param params the validated step parameters
     * @return the step result
     * @throws Exception any failure during execution
     */
    Object execute(TaskContext context, Map<String, Object> params) throws Exception;

    /**
     * Hook invoked before validation.
     */
    default void before(Map<String, Object> params) throws Exception {
    }

    /**
     * Hook invoked with the result of a successful execution.
     */
    default void after(Object result) throws Exception {
    }

    /**
     * Observes a failure raised by any stage of the template, a failed assertion or other
     * {@link Error} included. Only a {@link VirtualMachineError} bypasses this hook. The failure
     * is re-thrown by the template afterwards whatever this method does.
     */
    default void onError(Throwable error) {
    }
}
