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

import dev.mars.taskflow.core.StepOutcome;
import dev.mars.taskflow.core.StepStatus;
import dev.mars.taskflow.core.WorkflowStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable outcome of a completed workflow run.
 * {@link #getResults()} iterates in the order the node outcomes were finalized.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowResult {

    private final String workflowName;
    private final String runId;
    private final WorkflowStatus status;
    private final Map<String, StepOutcome> results;
    private final Instant startedAt;
    private final Instant finishedAt;

    public WorkflowResult(String workflowName, String runId, WorkflowStatus status,
                          Map<String, StepOutcome> results, Instant startedAt, Instant finishedAt) {
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.runId = runId;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.startedAt = Objects.requireNonNull(startedAt, "Start time cannot be null");
        this.finishedAt = Objects.requireNonNull(finishedAt, "Finish time cannot be null");
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getRunId() {
        return runId;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public Map<String, StepOutcome> getResults() {
        return results;
    }

    public Optional<StepOutcome> getOutcome(String nodeId) {
        return Optional.ofNullable(results.get(nodeId));
    }

    /**
     * Ids of the nodes that finished with the given status, in finalization order.
     */
    public List<String> getNodeIds(StepStatus stepStatus) {
        return results.entrySet().stream()
                .filter(entry -> entry.getValue().getStatus() == stepStatus)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public long count(StepStatus stepStatus) {
        return results.values().stream().filter(outcome -> outcome.getStatus() == stepStatus).count();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    public boolean isSuccessful() {
        return status == WorkflowStatus.SUCCESS;
    }

    @Override
    public String toString() {
        return "WorkflowResult{" +
                "workflowName='" + workflowName + '\'' +
                ", runId='" + runId + '\'' +
                ", status=" + status +
                ", succeeded=" + count(StepStatus.SUCCESS) +
                ", failed=" + count(StepStatus.FAILED) +
                ", skipped=" + count(StepStatus.SKIPPED) +
                '}';
    }
}
