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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Structural problems found in a workflow definition. Each issue carries its {@link IssueKind}
 * and the ids of the nodes it concerns, so callers can react per node instead of parsing
 * messages.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ValidationResult {

    /**
     * Kind of structural problem. All kinds except {@link #EMPTY_WORKFLOW} prevent the
     * workflow from running.
     */
    public enum IssueKind {
        DANGLING_DEPENDENCY("dangling dependency", true),
        SELF_DEPENDENCY("self dependency", true),
        CYCLE("cycle", true),
        EMPTY_WORKFLOW("empty workflow", false);

        private final String label;
        private final boolean blocking;

        IssueKind(String label, boolean blocking) {
            this.label = label;
            this.blocking = blocking;
        }

        public String getLabel() {
            return label;
        }

        public boolean isBlocking() {
            return blocking;
        }
    }

    private final List<DefinitionIssue> issues = new ArrayList<>();

    /**
     * Records that {@code nodeId} lists {@code missingId} in its dependencies although no such
     * node exists.
     */
    public void addDanglingDependency(String nodeId, String missingId) {
        issues.add(new DefinitionIssue(IssueKind.DANGLING_DEPENDENCY, List.of(nodeId),
                "Node '" + nodeId + "' depends on unknown node '" + missingId + "'"));
    }

    public void addSelfDependency(String nodeId) {
        issues.add(new DefinitionIssue(IssueKind.SELF_DEPENDENCY, List.of(nodeId),
                "Node '" + nodeId + "' depends on itself"));
    }

    /**
     * Records nodes that can never run because they sit on, or behind, a dependency cycle.
     */
    public void addCycle(List<String> nodeIds) {
        issues.add(new DefinitionIssue(IssueKind.CYCLE, nodeIds,
                "Circular dependencies detected; nodes that can never run: " + nodeIds));
    }

    public void addEmptyWorkflow() {
        issues.add(new DefinitionIssue(IssueKind.EMPTY_WORKFLOW, List.of(), "Workflow has no nodes"));
    }

    public List<DefinitionIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public List<DefinitionIssue> getIssues(IssueKind kind) {
        List<DefinitionIssue> matching = new ArrayList<>();
        for (DefinitionIssue issue : issues) {
            if (issue.getKind() == kind) {
                matching.add(issue);
            }
        }
        return matching;
    }

    /**
     * Issues that prevent the workflow from running.
     */
    public List<DefinitionIssue> getErrors() {
        List<DefinitionIssue> errors = new ArrayList<>();
        for (DefinitionIssue issue : issues) {
            if (issue.getKind().isBlocking()) {
                errors.add(issue);
            }
        }
        return errors;
    }

    public List<DefinitionIssue> getWarnings() {
        List<DefinitionIssue> warnings = new ArrayList<>();
        for (DefinitionIssue issue : issues) {
            if (!issue.getKind().isBlocking()) {
                warnings.add(issue);
            }
        }
        return warnings;
    }

    public boolean isValid() {
        return getErrors().isEmpty();
    }

    public boolean hasWarnings() {
        return !getWarnings().isEmpty();
    }

    @Override
    public String toString() {
        return "ValidationResult{issues=" + issues + '}';
    }

    /**
     * A single problem in a workflow definition.
     */
    public static final class DefinitionIssue {
        private final IssueKind kind;
        private final List<String> nodeIds;
        private final String message;

        public DefinitionIssue(IssueKind kind, List<String> nodeIds, String message) {
            this.kind = Objects.requireNonNull(kind, "Issue kind cannot be null");
            this.nodeIds = List.copyOf(nodeIds);
            this.message = Objects.requireNonNull(message, "Issue message cannot be null");
        }

        public IssueKind getKind() {
            return kind;
        }

        /**
         * Ids of the definition's nodes this issue concerns, in definition order.
         */
        public List<String> getNodeIds() {
            return nodeIds;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return kind.getLabel() + ": " + message;
        }
    }
}
