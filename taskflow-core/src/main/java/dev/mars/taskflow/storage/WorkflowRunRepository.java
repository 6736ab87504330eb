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


package dev.mars.taskflow.storage;

import dev.mars.taskflow.core.StepOutcome;
import dev.mars.taskflow.core.StepStatus;
import dev.mars.taskflow.core.WorkflowStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Persistence collaborator of the workflow engine.
 *
 * <p>The engine creates one run record before executing anything, records every node outcome
 * as soon as it is final, and updates the run with the aggregate status at the end. Any
 * exception thrown by an implementation aborts the run.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface WorkflowRunRepository {

    /**
     * Creates a run record in {@link WorkflowStatus#RUNNING} state.
     *
     * @param workflowName name of the workflow being executed
     * @return the identifier of the new run
     */
    String createRun(String workflowName);

    /**
     * Sets the final state of a run.
     *
     * @param runId identifier returned by {@link #createRun(String)}
     * @param status aggregate status of the run
     * @param results outcome of every finalized node, in finalization order
     * @param finishedAt completion time
     */
    void updateRun(String runId, WorkflowStatus status, Map<String, StepOutcome> results, Instant finishedAt);

    /**
     * Records the outcome of a single node.
     *
     * @param result the step result for SUCCESS, the error message for FAILED and the skip reason
     *               for SKIPPED
     */
    void recordNodeRun(String runId, String nodeId, String type, StepStatus status,
                       Instant startedAt, Instant finishedAt, Object result);
}
