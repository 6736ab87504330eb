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


package dev.mars.taskflow.examples.tasks;

import dev.mars.taskflow.core.exceptions.TaskValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parameter accessors shared by the example tasks. Each one reports the offending key through
 * {@link TaskValidationException}.
 */
final class TaskParams {

    private TaskParams() {
    }

    static String requireText(Map<String, Object> params, String key) throws TaskValidationException {
        if (!params.containsKey(key) || params.get(key) == null) {
            throw TaskValidationException.missing(key);
        }
        Object value = params.get(key);
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new TaskValidationException(key, "must be a non-empty string");
        }
        return (String) value;
    }

    /**
     * Returns the list under {@code key}, or {@code null} when absent.
     *
     * @throws TaskValidationException if present but not a non-empty list of strings
     */
    static List<String> optionalTextList(Map<String, Object> params, String key) throws TaskValidationException {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List) || ((List<?>) value).isEmpty()) {
            throw new TaskValidationException(key, "must be a non-empty list");
        }
        List<String> items = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof String)) {
                throw new TaskValidationException(key, "must only contain strings");
            }
            items.add((String) item);
        }
        return items;
    }

    static List<String> requireTextList(Map<String, Object> params, String key) throws TaskValidationException {
        List<String> items = optionalTextList(params, key);
        if (items == null) {
            throw TaskValidationException.missing(key);
        }
        return items;
    }

    static boolean optionalBoolean(Map<String, Object> params, String key, boolean defaultValue)
            throws TaskValidationException {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean)) {
            throw new TaskValidationException(key, "must be a boolean");
        }
        return (Boolean) value;
    }

    static double optionalNumber(Map<String, Object> params, String key, double defaultValue, double min, double max)
            throws TaskValidationException {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number)) {
            throw new TaskValidationException(key, "must be a number");
        }
        double number = ((Number) value).doubleValue();
        if (number < min || number > max) {
            throw new TaskValidationException(key, "must be between " + min + " and " + max);
        }
        return number;
    }
}
