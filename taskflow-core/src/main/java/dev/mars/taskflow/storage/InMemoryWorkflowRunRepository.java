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

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * {@link WorkflowRunRepository} that keeps runs and node outcomes in memory.
 * Used by tests and the example runner; contents are lost with the instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryWorkflowRunRepository implements WorkflowRunRepository {
    private static final Logger logger = Logger.getLogger(InMemoryWorkflowRunRepository.class.getName());

    private final Map<String, WorkflowRunRecord> runs = new ConcurrentHashMap<>();
    private final Map<String, List<NodeRunRecord>> nodeRuns = new ConcurrentHashMap<>();
    private final AtomicLong runSequence = new AtomicLong();
    private final AtomicLong nodeSequence = new AtomicLong();
    private final Clock clock;

    public InMemoryWorkflowRunRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryWorkflowRunRepository(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public String createRun(String workflowName) {
        String runId = String.valueOf(runSequence.incrementAndGet());
        runs.put(runId, new WorkflowRunRecord(runId, workflowName, WorkflowStatus.RUNNING,
                clock.instant(), null, Map.of()));
        nodeRuns.put(runId, new CopyOnWriteArrayList<>());
        logger.fine("Created workflow run " + runId + " for: " + workflowName);
        return runId;
    }

    @Override
    public void updateRun(String runId, WorkflowStatus status, Map<String, StepOutcome> results, Instant finishedAt) {
        Objects.requireNonNull(status, "Status cannot be null");
        Map<String, StepStatus> summary = new LinkedHashMap<>();
        if (results != null) {
            results.forEach((nodeId, outcome) -> summary.put(nodeId, outcome.getStatus()));
        }
        WorkflowRunRecord updated = runs.computeIfPresent(runId, (id, existing) -> new WorkflowRunRecord(
                id, existing.getWorkflowName(), status, existing.getStartedAt(), finishedAt,
                Collections.unmodifiableMap(summary)));
        if (updated == null) {
            throw new IllegalArgumentException("Unknown workflow run: " + runId);
        }
        logger.fine("Updated workflow run " + runId + " to " + status);
    }

    @Override
    public void recordNodeRun(String runId, String nodeId, String type, StepStatus status,
                              Instant startedAt, Instant finishedAt, Object result) {
        List<NodeRunRecord> records = nodeRuns.get(runId);
        if (records == null) {
            throw new IllegalArgumentException("Unknown workflow run: " + runId);
        }
        records.add(new NodeRunRecord(nodeSequence.incrementAndGet(), runId, nodeId, type, status,
                startedAt, finishedAt, result));
        logger.fine("Recorded node " + nodeId + " (" + status + ") for run " + runId);
    }

    public Optional<WorkflowRunRecord> findRun(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * Node records of a run in the order they were recorded.
     */
    public List<NodeRunRecord> findNodeRuns(String runId) {
        List<NodeRunRecord> records = nodeRuns.get(runId);
        return records != null ? List.copyOf(records) : List.of();
    }

    public List<WorkflowRunRecord> findAllRuns() {
        List<WorkflowRunRecord> all = new ArrayList<>(runs.values());
        all.sort((a, b) -> Long.compare(Long.parseLong(a.getRunId()), Long.parseLong(b.getRunId())));
        return all;
    }

    public int getRunCount() {
        return runs.size();
    }

    public void clearAll() {
        int count = runs.size();
        runs.clear();
        nodeRuns.clear();
        logger.info("Cleared " + count + " workflow runs");
    }
}
