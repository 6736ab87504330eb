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

import dev.mars.taskflow.core.StepStatus;
import dev.mars.taskflow.core.WorkflowStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a stored workflow run.
 */
public final class WorkflowRunRecord {

    private final String runId;
    private final String workflowName;
    private final WorkflowStatus status;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Map<String, StepStatus> summary;

    public WorkflowRunRecord(String runId, String workflowName, WorkflowStatus status,
                             Instant startedAt, Instant finishedAt, Map<String, StepStatus> summary) {
        this.runId = runId;
        this.workflowName = workflowName;
        this.status = status;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.summary = summary != null ? summary : Map.of();
    }

    public String getRunId() { return runId; }
    public String getWorkflowName() { return workflowName; }
    public WorkflowStatus getStatus() { return status; }
    public Instant getStartedAt() { return startedAt; }
    public Optional<Instant> getFinishedAt() { return Optional.ofNullable(finishedAt); }

    /**
     * Node id to status, in finalization order. Empty while the run is in progress.
     */
    public Map<String, StepStatus> getSummary() { return summary; }

    public Optional<Duration> getDuration() {
        return finishedAt != null ? Optional.of(Duration.between(startedAt, finishedAt)) : Optional.empty();
    }

    @Override
    public String toString() {
        return "WorkflowRunRecord{" +
                "runId='" + runId + '\'' +
                ", workflowName='" + workflowName + '\'' +
                ", status=" + status +
                ", nodes=" + summary.size() +
                '}';
    }
}
