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


package dev.mars.taskflow.workflow;

/**
 * Executes workflow definitions.
 */
public interface WorkflowEngine {

    /**
     * Runs every node of the definition once, in dependency order.
     *
     * @param definition the workflow to execute
     * @return the aggregate result; step failures are reported here, not thrown
     * @throws WorkflowOrchestrationException if the run cannot complete: unresolvable
     *         dependencies, an unknown step type, or a persistence failure
     */
    WorkflowResult run(WorkflowDefinition definition) throws WorkflowOrchestrationException;
}
