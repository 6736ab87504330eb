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


package dev.mars.taskflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the Taskflow workflow engine.
 *
 * Provides 7 workflow metrics:
 * - taskflow.workflow.active (gauge) - Currently running workflows
 * - taskflow.workflow.total (counter) - Total workflows started
 * - taskflow.workflow.finished (counter) - Finished workflows by aggregate status
 * - taskflow.workflow.aborted (counter) - Runs aborted by an orchestration error
 * - taskflow.workflow.steps (counter) - Node outcomes by step type and status
 * - taskflow.workflow.duration.seconds (histogram) - Workflow duration distribution
 * - taskflow.workflow.nodes.per_workflow (histogram) - Nodes per finished workflow
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "taskflow-workflow";

    // Singleton instance
    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsFinished;
    private final LongCounter workflowsAborted;
    private final LongCounter steps;

    // Histograms
    private final DoubleHistogram workflowDuration;
    private final DoubleHistogram nodesPerWorkflow;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> WORKFLOW_STATUS_KEY = AttributeKey.stringKey("workflow.status");
    private static final AttributeKey<String> STEP_TYPE_KEY = AttributeKey.stringKey("step.type");
    private static final AttributeKey<String> STEP_STATUS_KEY = AttributeKey.stringKey("step.status");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    private WorkflowMetrics() {
        this(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    /**
     * Creates metrics backed by an explicit meter, typically one from an SDK test provider.
     */
    public WorkflowMetrics(Meter meter) {
        Objects.requireNonNull(meter, "Meter cannot be null");

        // Initialize counters
        workflowsTotal = meter.counterBuilder("taskflow.workflow.total")
                .setDescription("Total number of workflows started")
                .setUnit("1")
                .build();

        workflowsFinished = meter.counterBuilder("taskflow.workflow.finished")
                .setDescription("Number of finished workflows by aggregate status")
                .setUnit("1")
                .build();

        workflowsAborted = meter.counterBuilder("taskflow.workflow.aborted")
                .setDescription("Number of workflow runs aborted by an orchestration error")
                .setUnit("1")
                .build();

        steps = meter.counterBuilder("taskflow.workflow.steps")
                .setDescription("Number of workflow node outcomes by status")
                .setUnit("1")
                .build();

        // Initialize histograms
        workflowDuration = meter.histogramBuilder("taskflow.workflow.duration.seconds")
                .setDescription("Workflow duration in seconds")
                .setUnit("s")
                .build();

        nodesPerWorkflow = meter.histogramBuilder("taskflow.workflow.nodes.per_workflow")
                .setDescription("Number of nodes per finished workflow")
                .setUnit("1")
                .build();

        // Initialize gauges
        meter.gaugeBuilder("taskflow.workflow.active")
                .setDescription("Number of currently running workflows")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.fine("WorkflowMetrics initialized");
    }

    /**
     * Get the singleton instance of WorkflowMetrics.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    /**
     * Record a workflow started.
     */
    public void recordWorkflowStarted(String workflowName) {
        workflowsTotal.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        activeWorkflows.incrementAndGet();
    }

    /**
     * Record a workflow that ran to completion, whatever its aggregate status.
     */
    public void recordWorkflowFinished(String workflowName, String status, Duration duration, int nodeCount) {
        activeWorkflows.decrementAndGet();

        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(WORKFLOW_STATUS_KEY, status)
                .build();

        workflowsFinished.add(1, attrs);
        workflowDuration.record(duration.toNanos() / 1_000_000_000.0, attrs);
        nodesPerWorkflow.record(nodeCount, attrs);
    }

    /**
     * Record a workflow run aborted by an orchestration error.
     */
    public void recordWorkflowAborted(String workflowName, String failureReason) {
        activeWorkflows.decrementAndGet();

        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();

        workflowsAborted.add(1, attrs);
    }

    /**
     * Record the final outcome of a workflow node.
     */
    public void recordStep(String workflowName, String stepType, String stepStatus) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STEP_TYPE_KEY, stepType)
                .put(STEP_STATUS_KEY, stepStatus)
                .build();

        steps.add(1, attrs);
    }

    /**
     * Get the current number of active workflows.
     */
    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }
}
