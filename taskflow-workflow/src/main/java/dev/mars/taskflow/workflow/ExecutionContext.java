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

import dev.mars.taskflow.task.TaskContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Shared results of one workflow run, keyed by node id.
 *
 * <p>Owned by the engine for the duration of a run. Each successful node writes its result
 * exactly once; steps only ever see the read-only {@link #view()}.</p>
 */
public final class ExecutionContext {

    private final Map<String, Object> results = new LinkedHashMap<>();
    private final Map<String, Object> readOnly = Collections.unmodifiableMap(results);
    private final TaskContext view = new View();

    /**
     * @throws IllegalStateException if a result was already recorded for the node
     */
    public void record(String nodeId, Object result) {
        if (results.containsKey(nodeId)) {
            throw new IllegalStateException("Result already recorded for node: " + nodeId);
        }
        results.put(nodeId, result);
    }

    public boolean contains(String nodeId) {
        return results.containsKey(nodeId);
    }

    public TaskContext view() {
        return view;
    }

    /**
     * Copy of the current results in recording order.
     */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    @Override
    public String toString() {
        return "ExecutionContext" + results.keySet();
    }

    private final class View implements TaskContext {
        @Override
        public Object get(String nodeId) {
            return results.get(nodeId);
        }

        @Override
        public boolean contains(String nodeId) {
            return results.containsKey(nodeId);
        }

        @Override
        public Set<String> nodeIds() {
            return readOnly.keySet();
        }

        @Override
        public Map<String, Object> asMap() {
            return readOnly;
        }

        @Override
        public String toString() {
            return "TaskContext" + results.keySet();
        }
    }
}
