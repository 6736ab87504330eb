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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single step of a workflow: a unique id, the step type resolved through the task registry,
 * the step parameters and the ids of the nodes it depends on.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowNode {

    private final String id;
    private final String type;
    private final Map<String, Object> params;
    private final List<String> dependsOn;

    /**
     * @throws IllegalArgumentException if the id or type is null or blank
     */
    public WorkflowNode(String id, String type, Map<String, Object> params, List<String> dependsOn) {
        this.id = requireText(id, "Node id");
        this.type = requireText(type, "Node type for '" + id + "'");
        this.params = params == null || params.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        // duplicates collapse, first occurrence keeps its position
        this.dependsOn = dependsOn == null || dependsOn.isEmpty()
                ? List.of()
                : List.copyOf(new LinkedHashSet<>(dependsOn));
    }

    public WorkflowNode(String id, String type) {
        this(id, type, Map.of(), List.of());
    }

    public static Builder builder(String id, String type) {
        return new Builder(id, type);
    }

    private static String requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be null or blank");
        }
        return value;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowNode that = (WorkflowNode) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(type, that.type) &&
               Objects.equals(params, that.params) &&
               Objects.equals(dependsOn, that.dependsOn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, params, dependsOn);
    }

    @Override
    public String toString() {
        return "WorkflowNode{" +
               "id='" + id + '\'' +
               ", type='" + type + '\'' +
               ", dependsOn=" + dependsOn +
               '}';
    }

    public static class Builder {
        private final String id;
        private final String type;
        private final Map<String, Object> params = new LinkedHashMap<>();
        private final List<String> dependsOn = new ArrayList<>();

        private Builder(String id, String type) {
            this.id = id;
            this.type = type;
        }

        public Builder param(String key, Object value) {
            params.put(key, value);
            return this;
        }

        public Builder params(Map<String, Object> values) {
            params.putAll(values);
            return this;
        }

        public Builder dependsOn(String... nodeIds) {
            Collections.addAll(dependsOn, nodeIds);
            return this;
        }

        public WorkflowNode build() {
            return new WorkflowNode(id, type, params, dependsOn);
        }
    }
}
