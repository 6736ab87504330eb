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

package dev.mars.taskflow.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of the results produced by the steps that already completed in the current
 * workflow run, keyed by node id.
 *
 * <p>The workflow engine owns the writable side; tasks only ever see this view.</p>
 */
public interface TaskContext {

    /**
     * Returns the result recorded for the given node, or {@code null} when the node has not
     * completed or produced a {@code null} payload. Use {@link #contains(String)} to tell the two
     * apart.
     */
    Object get(String nodeId);

    boolean contains(String nodeId);

    /**
     * Node ids in the order their results were recorded.
     */
    Set<String> nodeIds();

    /**
     * Unmodifiable view of all recorded results.
     */
    Map<String, Object> asMap();

    default int size() {
        return nodeIds().size();
    }

    default boolean isEmpty() {
        return nodeIds().isEmpty();
    }

    /**
     * Typed access to a node result.
     *
     * @throws ClassCastException if the recorded result is not of the requested type
     */
    default <T> T get(String nodeId, Class<T> type) {
        return type.cast(get(nodeId));
    }

    static TaskContext empty() {
        return of(Map.of());
    }

    /**
     * Creates a context over a private copy of the given results, mainly for running tasks
     * outside a workflow.
     */
    static TaskContext of(Map<String, Object> results) {
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        return new TaskContext() {
            @Override
            public Object get(String nodeId) {
                return copy.get(nodeId);
            }

            @Override
            public boolean contains(String nodeId) {
                return copy.containsKey(nodeId);
            }

            @Override
            public Set<String> nodeIds() {
                return copy.keySet();
            }

            @Override
            public Map<String, Object> asMap() {
                return copy;
            }

            @Override
            public String toString() {
                return "TaskContext" + copy.keySet();
            }
        };
    }
}
