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

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of a stored node outcome.
 */
public final class NodeRunRecord {

    private final long id;
    private final String runId;
    private final String nodeId;
    private final String type;
    private final StepStatus status;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Object result;

    public NodeRunRecord(long id, String runId, String nodeId, String type, StepStatus status,
                         Instant startedAt, Instant finishedAt, Object result) {
        this.id = id;
        this.runId = runId;
        this.nodeId = nodeId;
        this.type = type;
        this.status = status;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.result = result;
    }

    public long getId() { return id; }
    public String getRunId() { return runId; }
    public String getNodeId() { return nodeId; }
    public String getType() { return type; }
    public StepStatus getStatus() { return status; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public Object getResult() { return result; }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return "NodeRunRecord{" +
                "runId='" + runId + '\'' +
                ", nodeId='" + nodeId + '\'' +
                ", type='" + type + '\'' +
                ", status=" + status +
                '}';
    }
}
