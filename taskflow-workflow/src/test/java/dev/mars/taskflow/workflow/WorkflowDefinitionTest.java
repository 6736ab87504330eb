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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowDefinitionTest {

    @Test
    void testNodesKeepDefinitionOrder() {
        WorkflowDefinition definition = WorkflowDefinition.of("ordered",
                new WorkflowNode("z", "noop"),
                new WorkflowNode("a", "noop"),
                new WorkflowNode("m", "noop"));

        List<String> ids = new ArrayList<>();
        definition.getNodes().forEach(node -> ids.add(node.getId()));
        assertEquals(List.of("z", "a", "m"), ids);
        assertTrue(definition.containsNode("a"));
        assertTrue(definition.getNode("missing").isEmpty());
        assertThrows(UnsupportedOperationException.class,
                () -> definition.getNodes().add(new WorkflowNode("x", "noop")));
    }

    @Test
    void testDuplicateIdRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> WorkflowDefinition.of("dup", new WorkflowNode("a", "t1"), new WorkflowNode("a", "t2")));
        assertEquals("Duplicate node id: a", e.getMessage());
    }

    @Test
    void testBlankNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WorkflowDefinition(" ", List.of()));
        assertThrows(IllegalArgumentException.class, () -> new WorkflowDefinition(null, List.of()));
    }

    @Test
    void testDanglingDependencyAllowedAtConstruction() {
        WorkflowDefinition definition = WorkflowDefinition.of("dangling",
                WorkflowNode.builder("a", "noop").dependsOn("ghost").build());

        assertEquals(1, definition.size());
    }

    @Test
    void testNodeRequiresIdAndType() {
        assertThrows(IllegalArgumentException.class, () -> new WorkflowNode("", "noop"));
        assertThrows(IllegalArgumentException.class, () -> new WorkflowNode("a", null));
    }

    @Test
    void testNodeCollapsesDuplicateDependencies() {
        WorkflowNode node = WorkflowNode.builder("c", "noop").dependsOn("b", "a", "b").build();

        assertEquals(List.of("b", "a"), node.getDependsOn());
        assertTrue(node.hasDependencies());
    }

    @Test
    void testNodeParamsAreCopied() {
        Map<String, Object> params = new HashMap<>();
        params.put("key", "value");
        params.put("nothing", null);

        WorkflowNode node = new WorkflowNode("a", "noop", params, null);
        params.put("key", "changed");

        assertEquals("value", node.getParams().get("key"));
        assertTrue(node.getParams().containsKey("nothing"));
        assertTrue(node.getDependsOn().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> node.getParams().put("other", 1));
    }
}
