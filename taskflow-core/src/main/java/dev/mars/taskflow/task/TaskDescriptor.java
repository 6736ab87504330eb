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
import java.util.Objects;

/**
 * Registration metadata for a step type. The {@code type} is the discriminator used in workflow
 * definitions; the remaining fields describe the step to tooling and are never interpreted by
 * the engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class TaskDescriptor {

    private final String type;
    private final String displayName;
    private final String description;
    private final String category;
    private final String icon;
    private final Map<String, Object> paramsSchema;

    private TaskDescriptor(Builder builder) {
        this.type = builder.type;
        this.displayName = builder.displayName != null ? builder.displayName : builder.type;
        this.description = builder.description != null ? builder.description : "";
        this.category = builder.category != null ? builder.category : "general";
        this.icon = builder.icon;
        this.paramsSchema = builder.paramsSchema == null || builder.paramsSchema.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.paramsSchema));
    }

    /**
     * Shorthand for a descriptor that only carries a type.
     */
    public static TaskDescriptor of(String type) {
        return builder().type(type).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getType() {
        return type;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public String getIcon() {
        return icon;
    }

    /**
     * JSON-schema shaped description of the accepted parameters.
     */
    public Map<String, Object> getParamsSchema() {
        return paramsSchema;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskDescriptor that = (TaskDescriptor) o;
        return Objects.equals(type, that.type) &&
               Objects.equals(displayName, that.displayName) &&
               Objects.equals(description, that.description) &&
               Objects.equals(category, that.category) &&
               Objects.equals(icon, that.icon) &&
               Objects.equals(paramsSchema, that.paramsSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, displayName, description, category, icon, paramsSchema);
    }

    @Override
    public String toString() {
        return "TaskDescriptor{" +
               "type='" + type + '\'' +
               ", displayName='" + displayName + '\'' +
               ", category='" + category + '\'' +
               '}';
    }

    public static class Builder {
        private String type;
        private String displayName;
        private String description;
        private String category;
        private String icon;
        private Map<String, Object> paramsSchema;

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder icon(String icon) {
            this.icon = icon;
            return this;
        }

        public Builder paramsSchema(Map<String, Object> paramsSchema) {
            this.paramsSchema = paramsSchema;
            return this;
        }

        /**
         * Builds the descriptor. A missing type is not rejected here; the registry refuses it
         * at registration time.
         */
        public TaskDescriptor build() {
            return new TaskDescriptor(this);
        }
    }
}
