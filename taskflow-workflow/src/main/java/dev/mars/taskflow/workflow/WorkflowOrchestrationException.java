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

import dev.mars.taskflow.core.exceptions.TaskflowException;

import java.util.List;

/**
 * Fatal error that aborts a workflow run: unresolvable dependencies (a cycle, a self dependency
 * or a dangling reference), an unknown step type at dispatch, or a failing persistence
 * collaborator.
 * Ordinary step failures never raise this exception; they become FAILED outcomes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowOrchestrationException extends TaskflowException {

    private final String workflowName;
    private final String runId;
    private final List<String> unresolvedNodeIds;

    public WorkflowOrchestrationException(String workflowName, String runId, String message, Throwable cause) {
        this(workflowName, runId, message, List.of(), cause);
    }

    public WorkflowOrchestrationException(String workflowName, String runId, String message,
                                          List<String> unresolvedNodeIds, Throwable cause) {
        super(message, cause);
        this.workflowName = workflowName;
        this.runId = runId;
        this.unresolvedNodeIds = List.copyOf(unresolvedNodeIds);
    }

    /**
     * Creates the exception raised when pending nodes can no longer make progress.
     */
    public static WorkflowOrchestrationException unresolved(String workflowName, String runId, List<String> nodeIds) {
        return new WorkflowOrchestrationException(workflowName, runId,
                "Workflow '" + workflowName + "' has unresolvable dependencies (cycle or missing node) among: " + nodeIds,
                nodeIds, null);
    }

    /**
     * Creates the exception raised when a definition's dependency structure is broken before any
     * node has run.
     *
     * @param nodeIds nodes that can never run
     * @param issues  the blocking issues found by {@link DependencyGraph#validate()}
     */
    public static WorkflowOrchestrationException invalidStructure(String workflowName, String runId,
                                                                  List<String> nodeIds,
                                                                  List<ValidationResult.DefinitionIssue> issues) {
        StringBuilder message = new StringBuilder("Workflow '").append(workflowName)
                .append("' has unresolvable dependencies (cycle or missing node) among: ").append(nodeIds);
        for (ValidationResult.DefinitionIssue issue : issues) {
            message.append("; ").append(issue.getMessage());
        }
        return new WorkflowOrchestrationException(workflowName, runId, message.toString(), nodeIds, null);
    }

    public String getWorkflowName() {
        return workflowName;
    }

    /**
     * Identifier of the persisted run, or {@code null} when the run record could not be created.
     */
    public String getRunId() {
        return runId;
    }

    /**
     * Nodes that can never run because of a broken dependency structure, in definition order.
     * Empty for failures that are not dependency related.
     */
    public List<String> getUnresolvedNodeIds() {
        return unresolvedNodeIds;
    }
}
