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

import dev.mars.taskflow.workflow.ValidationResult.DefinitionIssue;
import dev.mars.taskflow.workflow.ValidationResult.IssueKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    @Test
    void testEmptyGraph() {
        assertTrue(graph.executionOrder().isEmpty());
        assertTrue(graph.findUnresolvableNodes().isEmpty());
        assertTrue(graph.validate().isValid());
        assertTrue(graph.validate().getIssues().isEmpty());
    }

    @Test
    void testLinearDependency() {
        graph.addNode(node("c", "b"));
        graph.addNode(node("b", "a"));
        graph.addNode(node("a"));

        assertEquals(List.of("a", "b", "c"), graph.executionOrder());
        assertTrue(graph.findUnresolvableNodes().isEmpty());
    }

    @Test
    void testScanOrderFollowsDefinitionOrder() {
        // a node that becomes ready mid-scan runs in the same scan
        graph.addNode(node("a"));
        graph.addNode(node("b", "a"));
        graph.addNode(node("d", "e"));
        graph.addNode(node("e"));
        graph.addNode(node("c", "b"));

        assertEquals(List.of("a", "b", "e", "c", "d"), graph.executionOrder());
    }

    @Test
    void testFindTransitiveDependentsInDefinitionOrder() {
        graph.addNode(node("a"));
        graph.addNode(node("d", "c"));
        graph.addNode(node("b", "a"));
        graph.addNode(node("c", "b"));
        graph.addNode(node("x"));

        assertEquals(List.of("d", "b", "c"), List.copyOf(graph.findTransitiveDependents("a")));
        assertTrue(graph.findTransitiveDependents("x").isEmpty());
    }

    @Test
    void testDirectAndIndirectDependentsOfFanOut() {
        graph.addNode(node("extract"));
        graph.addNode(node("validate", "extract"));
        graph.addNode(node("transform", "extract"));
        graph.addNode(node("load", "transform"));

        assertEquals(List.of("validate", "transform", "load"), List.copyOf(graph.findTransitiveDependents("extract")));
        assertTrue(graph.findTransitiveDependents("load").isEmpty());
    }

    @Test
    void testCycleDetection() {
        graph.addNode(node("a", "b"));
        graph.addNode(node("b", "a"));
        graph.addNode(node("c"));

        assertEquals(List.of("c"), graph.executionOrder());
        assertEquals(List.of("a", "b"), graph.findUnresolvableNodes());

        ValidationResult result = graph.validate();
        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        DefinitionIssue cycle = result.getErrors().get(0);
        assertEquals(IssueKind.CYCLE, cycle.getKind());
        assertEquals(List.of("a", "b"), cycle.getNodeIds());
        assertTrue(cycle.getMessage().contains("Circular dependencies detected"));
    }

    @Test
    void testCycleBehindAnotherNodeIsStillReported() {
        graph.addNode(node("a"));
        graph.addNode(node("b", "a", "c"));
        graph.addNode(node("c", "b"));
        graph.addNode(node("d", "c"));

        ValidationResult result = graph.validate();
        assertEquals(List.of(IssueKind.CYCLE), kinds(result));
        assertEquals(List.of("b", "c", "d"), result.getErrors().get(0).getNodeIds());
        assertEquals(List.of("b", "c", "d"), graph.findUnresolvableNodes());
    }

    @Test
    void testMissingDependencyIsNotACycle() {
        graph.addNode(node("a", "ghost"));
        graph.addNode(node("b", "a"));

        ValidationResult result = graph.validate();
        assertEquals(List.of(IssueKind.DANGLING_DEPENDENCY), kinds(result));
        DefinitionIssue dangling = result.getErrors().get(0);
        assertEquals(List.of("a"), dangling.getNodeIds());
        assertEquals("Node 'a' depends on unknown node 'ghost'", dangling.getMessage());
        assertTrue(graph.executionOrder().isEmpty());
        assertEquals(List.of("a", "b"), graph.findUnresolvableNodes());
    }

    @Test
    void testSelfDependency() {
        graph.addNode(node("a", "a"));
        graph.addNode(node("b", "a"));

        ValidationResult result = graph.validate();
        assertEquals(List.of(IssueKind.SELF_DEPENDENCY), kinds(result));
        assertEquals("Node 'a' depends on itself", result.getErrors().get(0).getMessage());
        assertEquals(List.of("a", "b"), graph.findUnresolvableNodes());
        assertTrue(graph.findTransitiveDependents("a").contains("a"));
    }

    @Test
    void testEveryProblemIsReported() {
        graph.addNode(node("x", "a", "ghost"));
        graph.addNode(node("a"));
        graph.addNode(node("s", "s"));
        graph.addNode(node("p", "q"));
        graph.addNode(node("q", "p"));

        ValidationResult result = graph.validate();
        assertEquals(List.of(IssueKind.DANGLING_DEPENDENCY, IssueKind.SELF_DEPENDENCY, IssueKind.CYCLE), kinds(result));
        assertEquals(List.of("p", "q"), result.getIssues(IssueKind.CYCLE).get(0).getNodeIds());
        assertEquals(List.of("x", "s", "p", "q"), graph.findUnresolvableNodes());
    }

    @Test
    void testOfDefinition() {
        WorkflowDefinition definition = WorkflowDefinition.of("etl",
                node("load", "extract"), node("extract"));

        DependencyGraph fromDefinition = DependencyGraph.of(definition);

        assertEquals(List.of("extract", "load"), fromDefinition.executionOrder());
        assertEquals(List.of("load"), List.copyOf(fromDefinition.findTransitiveDependents("extract")));
    }

    private static WorkflowNode node(String id, String... dependsOn) {
        return WorkflowNode.builder(id, "noop").dependsOn(dependsOn).build();
    }

    private static List<IssueKind> kinds(ValidationResult result) {
        return result.getIssues().stream().map(DefinitionIssue::getKind).collect(Collectors.toList());
    }
}
