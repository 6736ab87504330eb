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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Dependency graph over the nodes of a workflow definition.
 * Provides the execution order, dependent lookup and structural checks. All collections it
 * returns follow definition order.
 */
public class DependencyGraph {

    private final Map<String, List<String>> dependencies;

    public DependencyGraph() {
        this.dependencies = new LinkedHashMap<>();
    }

    /**
     * Builds the graph of all nodes of a definition.
     */
    public static DependencyGraph of(WorkflowDefinition definition) {
        DependencyGraph graph = new DependencyGraph();
        for (WorkflowNode node : definition.getNodes()) {
            graph.addNode(node);
        }
        return graph;
    }

    /**
     * Adds a node to the dependency graph.
     *
     * @param node the node to add
     */
    public void addNode(WorkflowNode node) {
        Objects.requireNonNull(node, "Workflow node cannot be null");
        dependencies.put(node.getId(), node.getDependsOn());
    }

    /**
     * Every node that depends on the given node directly or through other nodes, in definition
     * order. The node itself is only included when it sits on a cycle.
     */
    public Set<String> findTransitiveDependents(String nodeId) {
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            for (String dependent : directDependents(queue.poll())) {
                if (reached.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        Set<String> ordered = new LinkedHashSet<>();
        for (String id : dependencies.keySet()) {
            if (reached.contains(id)) {
                ordered.add(id);
            }
        }
        return ordered;
    }

    /**
     * Returns the order in which the sequential engine runs the nodes when every step succeeds:
     * repeated scans in definition order, where a node runs as soon as all of its dependencies
     * have run, including those that ran earlier in the same scan. Nodes that can never run are
     * left out; see {@link #findUnresolvableNodes()}.
     *
     * @return node ids in execution order
     */
    public List<String> executionOrder() {
        List<String> ordered = new ArrayList<>();
        scan(false, ordered);
        return ordered;
    }

    /**
     * Nodes that can never run: those with a dangling or circular dependency and everything
     * downstream of them.
     *
     * @return node ids in definition order, empty when the graph is sound
     */
    public List<String> findUnresolvableNodes() {
        return scan(false, new ArrayList<>());
    }

    /**
     * Checks the graph for dangling dependencies, self dependencies and cycles between
     * distinct nodes.
     *
     * @return validation result
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();

        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            String nodeId = entry.getKey();
            for (String dependency : entry.getValue()) {
                if (!dependencies.containsKey(dependency)) {
                    result.addDanglingDependency(nodeId, dependency);
                }
            }
        }

        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(entry.getKey())) {
                result.addSelfDependency(entry.getKey());
            }
        }

        // dangling and self edges are reported above; what is still blocked is a real cycle
        List<String> blocked = scan(true, new ArrayList<>());
        if (!blocked.isEmpty()) {
            result.addCycle(blocked);
        }

        return result;
    }

    private Set<String> directDependents(String nodeId) {
        Set<String> dependents = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(nodeId)) {
                dependents.add(entry.getKey());
            }
        }
        return dependents;
    }

    /**
     * Runs the fixed-point scan, appending resolved node ids to {@code ordered}.
     *
     * @param ignoreReported treat dangling and self dependencies as satisfied
     * @return ids of the nodes left unresolved, in definition order
     */
    private List<String> scan(boolean ignoreReported, List<String> ordered) {
        Set<String> done = new LinkedHashSet<>();
        List<String> pending = new ArrayList<>(dependencies.keySet());
        boolean progress = true;
        while (!pending.isEmpty() && progress) {
            progress = false;
            for (Iterator<String> it = pending.iterator(); it.hasNext(); ) {
                String nodeId = it.next();
                if (isReady(nodeId, done, ignoreReported)) {
                    done.add(nodeId);
                    ordered.add(nodeId);
                    it.remove();
                    progress = true;
                }
            }
        }
        return pending;
    }

    private boolean isReady(String nodeId, Set<String> done, boolean ignoreReported) {
        for (String dependency : dependencies.get(nodeId)) {
            if (done.contains(dependency)) {
                continue;
            }
            if (ignoreReported && (dependency.equals(nodeId) || !dependencies.containsKey(dependency))) {
                continue;
            }
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "DependencyGraph{dependencies=" + dependencies + '}';
    }
}
