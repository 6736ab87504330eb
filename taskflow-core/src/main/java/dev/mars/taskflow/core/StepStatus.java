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

package dev.mars.taskflow.core;

/**
 * Enumeration of the outcomes a single workflow step can finish with.
 */
public enum StepStatus {

    /**
     * The step strategy returned normally.
     */
    SUCCESS,

    /**
     * The step strategy, its validation or one of its decorators raised an exception.
     */
    FAILED,

    /**
     * The step was never executed because an upstream step failed.
     */
    SKIPPED;

    /**
     * Checks if the step actually ran through the worker.
     */
    public boolean wasExecuted() {
        return this == SUCCESS || this == FAILED;
    }

    public boolean isSuccessful() {
        return this == SUCCESS;
    }
}
