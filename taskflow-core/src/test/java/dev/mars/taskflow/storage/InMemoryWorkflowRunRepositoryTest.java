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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryWorkflowRunRepository}.
 */
@DisplayName("InMemoryWorkflowRunRepository Tests")
class InMemoryWorkflowRunRepositoryTest {

    private static final Instant START = Instant.parse("2025-05-01T08:00:00Z");

    private InMemoryWorkflowRunRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWorkflowRunRepository(Clock.fixed(START, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("New runs start in RUNNING with sequential ids")
    void testCreateRun() {
        String first = repository.createRun("etl");
        String second = repository.createRun("etl");

        assertThat(first).isEqualTo("1");
        assertThat(second).isEqualTo("2");
        WorkflowRunRecord record = repository.findRun(first).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
        assertThat(record.getStartedAt()).isEqualTo(START);
        assertThat(record.getFinishedAt()).isEmpty();
        assertThat(record.getDuration()).isEmpty();
    }

    @Test
    @DisplayName("Update stores final status, duration and per-node summary in order")
    void testUpdateRun() {
        String runId = repository.createRun("etl");
        Map<String, StepOutcome> results = new LinkedHashMap<>();
        results.put("load", StepOutcome.success("ok", START, START.plusSeconds(1)));
        results.put("notify", StepOutcome.failed("smtp down", null, START, START.plusSeconds(2)));
        results.put("report", StepOutcome.skipped("Upstream node 'notify' failed", START.plusSeconds(2)));

        repository.updateRun(runId, WorkflowStatus.PARTIAL_SUCCESS, results, START.plusSeconds(3));

        WorkflowRunRecord record = repository.findRun(runId).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(WorkflowStatus.PARTIAL_SUCCESS);
        assertThat(record.getDuration()).contains(Duration.ofSeconds(3));
        assertThat(record.getSummary().keySet()).containsExactly("load", "notify", "report");
        assertThat(record.getSummary()).containsEntry("report", StepStatus.SKIPPED);
    }

    @Test
    @DisplayName("Node runs are kept per run in recording order")
    void testRecordNodeRun() {
        String runId = repository.createRun("etl");
        repository.recordNodeRun(runId, "a", "http_get", StepStatus.SUCCESS, START, START.plusMillis(40), "body");
        repository.recordNodeRun(runId, "b", "notify_mock", StepStatus.SKIPPED, START, START, "Upstream node 'x' failed");

        assertThat(repository.findNodeRuns(runId))
                .extracting(NodeRunRecord::getNodeId)
                .containsExactly("a", "b");
        NodeRunRecord first = repository.findNodeRuns(runId).get(0);
        assertThat(first.getDuration()).isEqualTo(Duration.ofMillis(40));
        assertThat(first.getResult()).isEqualTo("body");
        assertThat(repository.findNodeRuns("other")).isEmpty();
    }

    @Test
    @DisplayName("Unknown run ids are rejected")
    void testUnknownRun() {
        assertThatThrownBy(() -> repository.updateRun("99", WorkflowStatus.SUCCESS, Map.of(), START))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> repository.recordNodeRun("99", "a", "t", StepStatus.SUCCESS, START, START, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testClearAll() {
        repository.createRun("a");
        repository.createRun("b");
        assertThat(repository.findAllRuns()).extracting(WorkflowRunRecord::getWorkflowName).containsExactly("a", "b");

        repository.clearAll();

        assertThat(repository.getRunCount()).isZero();
    }
}
