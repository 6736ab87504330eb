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

import java.util.Collection;

/**
 * Enumeration of workflow run statuses.
 */
public enum WorkflowStatus {

    /**
     * The run has been recorded and steps are being executed.
     */
    RUNNING,

    /**
     * Every step finished with {@link StepStatus#SUCCESS}.
     */
    SUCCESS,

    /**
     * At least one step succeeded and at least one did not.
     */
    PARTIAL_SUCCESS,

    /**
     * No step succeeded, or the run was aborted by an orchestration error.
     */
    FAILED;

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }

    public boolean isSuccessful() {
        return this == SUCCESS;
    }

    /**
     * Derives the aggregate status of a finished run from its step statuses.
     * SUCCESS when all steps succeeded, FAILED when none did, PARTIAL_SUCCESS otherwise.
     * A run without steps counts as SUCCESS.
     *
     * @param stepStatuses the statuses of every step in the run
     * @return the aggregate workflow status
     */
    public static WorkflowStatus aggregate(Collection<StepStatus> stepStatuses) {
        if (stepStatuses.isEmpty()) {
            return SUCCESS;
        }

        long successful = stepStatuses.stream()
                .filter(StepStatus::isSuccessful)
                .count();

        if (successful == stepStatuses.size()) {
            return SUCCESS;
        }
        return successful == 0 ? FAILED : PARTIAL_SUCCESS;
    }
}
