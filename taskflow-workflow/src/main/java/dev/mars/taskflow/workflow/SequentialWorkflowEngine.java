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
import dev.mars.taskflow.core.TaskCommand;
import dev.mars.taskflow.core.WorkflowStatus;
import dev.mars.taskflow.core.exceptions.TaskRegistrationException;
import dev.mars.taskflow.storage.WorkflowRunRepository;
import dev.mars.taskflow.worker.TaskWorker;
import dev.mars.taskflow.workflow.observability.WorkflowMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded {@link WorkflowEngine} that runs one node at a time.
 *
 * <p>Before any node runs, the dependency structure is checked; a cycle, a self dependency or a
 * dangling reference aborts the run even when it sits behind a node that would have failed.
 * Execution order is then a fixed-point scan: pending nodes are scanned in definition order and
 * a node runs as soon as every node it depends on has been finalized. When a node fails, all of
 * its transitive dependents that are still pending are finalized as SKIPPED without ever
 * reaching the worker.</p>
 *
 * <p>Every finalized outcome, SKIPPED included, is recorded through the
 * {@link WorkflowRunRepository} as soon as it is known. An aborted run, whatever the throwable,
 * is still updated to FAILED with the outcomes gathered so far before the exception reaches the
 * caller.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SequentialWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(SequentialWorkflowEngine.class.getName());

    private final TaskWorker worker;
    private final WorkflowRunRepository repository;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    public SequentialWorkflowEngine(TaskWorker worker, WorkflowRunRepository repository) {
        this(worker, repository, WorkflowMetrics.getInstance(), Clock.systemUTC());
    }

    public SequentialWorkflowEngine(TaskWorker worker, WorkflowRunRepository repository,
                                    WorkflowMetrics metrics, Clock clock) {
        this.worker = Objects.requireNonNull(worker, "Task worker cannot be null");
        this.repository = Objects.requireNonNull(repository, "Workflow run repository cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Workflow metrics cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public WorkflowResult run(WorkflowDefinition definition) throws WorkflowOrchestrationException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        String workflowName = definition.getName();
        Instant startedAt = clock.instant();

        String runId;
        try {
            runId = repository.createRun(workflowName);
        } catch (RuntimeException e) {
            throw new WorkflowOrchestrationException(workflowName, null,
                    "Failed to create run record for workflow '" + workflowName + "': " + e.getMessage(), e);
        }

        logger.info("Starting workflow '" + workflowName + "' (run " + runId + ", " + definition.size() + " nodes)");
        metrics.recordWorkflowStarted(workflowName);

        Run run = new Run(definition, runId);
        try {
            run.execute();
        } catch (WorkflowOrchestrationException e) {
            abort(run, e, e.getUnresolvedNodeIds().isEmpty() ? e.getClass().getSimpleName() : "unresolved_dependencies");
            throw e;
        } catch (RuntimeException | Error e) {
            abort(run, e, e.getClass().getSimpleName());
            throw e;
        }

        WorkflowStatus status = WorkflowStatus.aggregate(run.statuses());
        Instant finishedAt = clock.instant();
        try {
            repository.updateRun(runId, status, run.outcomes, finishedAt);
        } catch (RuntimeException e) {
            WorkflowOrchestrationException failure = new WorkflowOrchestrationException(workflowName, runId,
                    "Failed to update run record " + runId + ": " + e.getMessage(), e);
            metrics.recordWorkflowAborted(workflowName, "persistence");
            throw failure;
        }

        Duration duration = Duration.between(startedAt, finishedAt);
        metrics.recordWorkflowFinished(workflowName, status.name(), duration, definition.size());
        logger.info("Workflow '" + workflowName + "' (run " + runId + ") completed with status: " + status +
                " in " + duration.toMillis() + "ms");

        return new WorkflowResult(workflowName, runId, status, run.outcomes, startedAt, finishedAt);
    }

    private void abort(Run run, Throwable cause, String reason) {
        String workflowName = run.definition.getName();
        logger.log(Level.SEVERE, "Workflow '" + workflowName + "' (run " + run.runId + ") aborted: " + cause);
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Workflow abort details for run: " + run.runId, cause);
        }
        try {
            repository.updateRun(run.runId, WorkflowStatus.FAILED, run.outcomes, clock.instant());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        metrics.recordWorkflowAborted(workflowName, reason);
    }

    /**
     * Mutable state of a single run.
     */
    private final class Run {
        private final WorkflowDefinition definition;
        private final String runId;
        private final DependencyGraph graph;
        private final ExecutionContext context = new ExecutionContext();
        private final Map<String, WorkflowNode> pending = new LinkedHashMap<>();
        private final Set<String> finalized = new HashSet<>();
        private final Map<String, StepOutcome> outcomes = new LinkedHashMap<>();

        private Run(WorkflowDefinition definition, String runId) {
            this.definition = definition;
            this.runId = runId;
            this.graph = DependencyGraph.of(definition);
            for (WorkflowNode node : definition.getNodes()) {
                pending.put(node.getId(), node);
            }
        }

        void execute() throws WorkflowOrchestrationException {
            ValidationResult structure = graph.validate();
            if (!structure.isValid()) {
                throw WorkflowOrchestrationException.invalidStructure(
                        definition.getName(), runId, graph.findUnresolvableNodes(), structure.getErrors());
            }
            while (!pending.isEmpty()) {
                boolean progress = false;
                for (WorkflowNode node : new ArrayList<>(pending.values())) {
                    // a failure earlier in this scan may have skipped the node already
                    if (pending.containsKey(node.getId()) && isReady(node)) {
                        runNode(node);
                        progress = true;
                    }
                }
                if (!progress) {
                    // unreachable once the structure check passed
                    throw WorkflowOrchestrationException.unresolved(
                            definition.getName(), runId, new ArrayList<>(pending.keySet()));
                }
            }
        }

        private boolean isReady(WorkflowNode node) {
            return finalized.containsAll(node.getDependsOn());
        }

        private void runNode(WorkflowNode node) throws WorkflowOrchestrationException {
            TaskCommand command = TaskCommand.builder()
                    .runId(runId)
                    .nodeKey(node.getId())
                    .type(node.getType())
                    .params(node.getParams())
                    .metadata(Map.of(
                            TaskCommand.METADATA_WORKFLOW_NAME, definition.getName(),
                            TaskCommand.METADATA_WORKFLOW_RUN_ID, runId))
                    .build();

            logger.info("Executing node: " + node.getId() + " (" + node.getType() + ")");
            StepOutcome outcome;
            try {
                outcome = worker.execute(command, context.view());
            } catch (TaskRegistrationException | RuntimeException e) {
                throw new WorkflowOrchestrationException(definition.getName(), runId,
                        "Cannot dispatch node '" + node.getId() + "': " + e.getMessage(), e);
            }

            finalizeNode(node, outcome);
            if (outcome.isSuccessful()) {
                context.record(node.getId(), outcome.getResult());
            } else {
                logger.log(Level.WARNING, "Node '" + node.getId() + "' failed: " +
                        outcome.getErrorMessage().orElse("unknown error"));
                skipDependents(node);
            }
        }

        private void skipDependents(WorkflowNode failed) throws WorkflowOrchestrationException {
            String reason = "Upstream node '" + failed.getId() + "' failed";
            for (String dependentId : graph.findTransitiveDependents(failed.getId())) {
                WorkflowNode dependent = pending.get(dependentId);
                if (dependent != null) {
                    logger.info("Skipping node '" + dependentId + "': " + reason);
                    finalizeNode(dependent, StepOutcome.skipped(reason, clock.instant()));
                }
            }
        }

        private void finalizeNode(WorkflowNode node, StepOutcome outcome) throws WorkflowOrchestrationException {
            pending.remove(node.getId());
            finalized.add(node.getId());
            outcomes.put(node.getId(), outcome);
            metrics.recordStep(definition.getName(), node.getType(), outcome.getStatus().name());
            try {
                repository.recordNodeRun(runId, node.getId(), node.getType(), outcome.getStatus(),
                        outcome.getStartedAt(), outcome.getFinishedAt(), outcome.getPayload());
            } catch (RuntimeException e) {
                throw new WorkflowOrchestrationException(definition.getName(), runId,
                        "Failed to record node '" + node.getId() + "' for run " + runId + ": " + e.getMessage(), e);
            }
        }

        List<StepStatus> statuses() {
            List<StepStatus> statuses = new ArrayList<>(outcomes.size());
            for (StepOutcome outcome : outcomes.values()) {
                statuses.add(outcome.getStatus());
            }
            return statuses;
        }
    }
}
