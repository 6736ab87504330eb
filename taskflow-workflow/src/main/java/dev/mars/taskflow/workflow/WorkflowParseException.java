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

import dev.mars.taskflow.core.exceptions.TaskflowException;

/**
 * Exception thrown when a workflow source cannot be read or is structurally malformed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowParseException extends TaskflowException {

    private final String workflowName;
    private final String fieldPath;

    public WorkflowParseException(String message) {
        this(null, null, message, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public WorkflowParseException(String workflowName, String fieldPath, String message) {
        this(workflowName, fieldPath, message, null);
    }

    public WorkflowParseException(String workflowName, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.workflowName = workflowName;
        this.fieldPath = fieldPath;
    }

    /**
     * Name of the workflow being parsed, when it was known at the point of failure.
     */
    public String getWorkflowName() {
        return workflowName;
    }

    /**
     * Path of the offending field, for example {@code nodes[2].type}.
     */
    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * The message without workflow name and field path decoration.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (workflowName != null) {
            sb.append("Workflow '").append(workflowName).append("': ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
