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

package dev.mars.taskflow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request to execute one workflow step, handed from the workflow engine to the worker.
 *
 * <p>A command is built per step per run and is owned by the single worker call it feeds.
 * It is never persisted. Parameter maps may carry {@code null} values, so they are copied
 * into unmodifiable {@link LinkedHashMap}s rather than {@code Map.copyOf}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class TaskCommand {

    public static final String METADATA_WORKFLOW_NAME = "workflowName";
    public static final String METADATA_WORKFLOW_RUN_ID = "workflowRunId";

    private final String runId;
    private final String nodeKey;
    private final String type;
    private final Map<String, Object> params;
    private final Map<String, Object> metadata;

    private TaskCommand(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "Run ID cannot be null");
        this.nodeKey = Objects.requireNonNull(builder.nodeKey, "Node key cannot be null");
        this.type = Objects.requireNonNull(builder.type, "Task type cannot be null");
        this.params = copy(builder.params);
        this.metadata = copy(builder.metadata);
    }

    public String getRunId() {
        return runId;
    }

    public String getNodeKey() {
        return nodeKey;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskCommand that = (TaskCommand) o;
        return Objects.equals(runId, that.runId) &&
               Objects.equals(nodeKey, that.nodeKey) &&
               Objects.equals(type, that.type) &&
               Objects.equals(params, that.params) &&
               Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, nodeKey, type, params, metadata);
    }

    @Override
    public String toString() {
        return "TaskCommand{" +
               "type='" + type + '\'' +
               ", node='" + nodeKey + '\'' +
               ", run='" + runId + '\'' +
               '}';
    }

    public static class Builder {
        private String runId;
        private String nodeKey;
        private String type;
        private Map<String, Object> params = Map.of();
        private Map<String, Object> metadata = Map.of();

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder nodeKey(String nodeKey) {
            this.nodeKey = nodeKey;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public TaskCommand build() {
            return new TaskCommand(this);
        }
    }
}
