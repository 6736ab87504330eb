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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable workflow definition: a name, an optional external id and the nodes in definition
 * order. Definition order is significant; the engine uses it to break ties between nodes that
 * become runnable at the same time.
 *
 * <p>Construction only checks node identity. Dangling or circular dependencies are reported by
 * {@link WorkflowDefinitionParser#validate(WorkflowDefinition)} and detected again by the
 * engine at run time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowDefinition {

    private final String name;
    private final String id;
    private final List<WorkflowNode> nodes;
    private final Map<String, WorkflowNode> nodesById;

    /**
     * @throws IllegalArgumentException if the name is blank or two nodes share an id
     */
    public WorkflowDefinition(String name, String id, List<WorkflowNode> nodes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name cannot be null or blank");
        }
        this.name = name;
        this.id = id;

        Map<String, WorkflowNode> byId = new LinkedHashMap<>();
        for (WorkflowNode node : Objects.requireNonNull(nodes, "Nodes cannot be null")) {
            Objects.requireNonNull(node, "Node cannot be null");
            if (byId.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.getId());
            }
        }
        this.nodes = List.copyOf(byId.values());
        this.nodesById = Collections.unmodifiableMap(byId);
    }

    public WorkflowDefinition(String name, List<WorkflowNode> nodes) {
        this(name, null, nodes);
    }

    public static WorkflowDefinition of(String name, WorkflowNode... nodes) {
        return new WorkflowDefinition(name, null, new ArrayList<>(Arrays.asList(nodes)));
    }

    public String getName() {
        return name;
    }

    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    public List<WorkflowNode> getNodes() {
        return nodes;
    }

    public Optional<WorkflowNode> getNode(String nodeId) {
        return Optional.ofNullable(nodesById.get(nodeId));
    }

    public boolean containsNode(String nodeId) {
        return nodesById.containsKey(nodeId);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(id, that.id) &&
               Objects.equals(nodes, that.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, id, nodes);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "name='" + name + '\'' +
               (id != null ? ", id='" + id + '\'' : "") +
               ", nodes=" + nodesById.keySet() +
               '}';
    }
}
