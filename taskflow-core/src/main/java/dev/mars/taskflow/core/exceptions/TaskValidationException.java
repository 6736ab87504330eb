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

package dev.mars.taskflow.core.exceptions;

/**
 * Thrown by a task's parameter validation when a required parameter is missing or malformed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TaskValidationException extends TaskflowException {

    private final String fieldName;

    public TaskValidationException(String fieldName, String message) {
        super(message);
        this.fieldName = fieldName;
    }

    /**
     * Convenience factory for the most common case of an absent parameter.
     */
    public static TaskValidationException missing(String fieldName) {
        return new TaskValidationException(fieldName, "required parameter is missing");
    }

    public String getFieldName() {
        return fieldName;
    }

    @Override
    public String getMessage() {
        if (fieldName == null) {
            return super.getMessage();
        }
        return String.format("Invalid parameter '%s': %s", fieldName, super.getMessage());
    }
}
