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

import dev.mars.taskflow.core.exceptions.TaskExecutionException;
import dev.mars.taskflow.core.exceptions.TaskValidationException;
import dev.mars.taskflow.task.Task;
import dev.mars.taskflow.task.TaskContext;
import dev.mars.taskflow.task.TaskDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Checks that a CSV file exists, has data rows and carries the expected columns.
 *
 * <p>Parameters: {@code path}, {@code columns} (non-empty list of expected column names) and
 * optional {@code allow_extra_columns} (default {@code true}). The result describes the file and
 * keeps its {@code path}, which lets a downstream {@code transform_simple} step read the rows.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ValidateCsvTask implements Task {

    private static final Logger logger = Logger.getLogger(ValidateCsvTask.class.getName());

    public static final String TYPE = "validate_csv";

    public static TaskDescriptor descriptor() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("path", Map.of("type", "string", "title", "CSV file path",
                "description", "Absolute or relative path"));
        properties.put("columns", Map.of("type", "array", "title", "Expected columns",
                "items", Map.of("type", "string"), "minItems", 1));
        properties.put("allow_extra_columns", Map.of("type", "boolean", "title", "Allow extra columns",
                "default", true));

        return TaskDescriptor.builder()
                .type(TYPE)
                .displayName("Validate CSV")
                .description("Verifies that a CSV file has the expected columns")
                .category("Validation")
                .icon("file-text")
                .paramsSchema(Map.of("type", "object", "properties", properties,
                        "required", List.of("path", "columns")))
                .build();
    }

    @Override
    public void validateParams(Map<String, Object> params) throws TaskValidationException {
        TaskParams.requireText(params, "path");
        TaskParams.requireTextList(params, "columns");
        TaskParams.optionalBoolean(params, "allow_extra_columns", true);
    }

    @Override
    public void before(Map<String, Object> params) {
        logger.fine("Validating CSV: " + params.get("path"));
    }

    @Override
    public Object execute(TaskContext context, Map<String, Object> params) throws Exception {
        String path = TaskParams.requireText(params, "path");
        List<String> expected = TaskParams.requireTextList(params, "columns");
        boolean allowExtra = TaskParams.optionalBoolean(params, "allow_extra_columns", true);

        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            throw new TaskExecutionException(TYPE, "File not found: " + path);
        }

        List<String> actual;
        int rows;
        try {
            actual = CsvSupport.readHeader(file);
            if (actual.isEmpty()) {
                throw new TaskExecutionException(TYPE, "CSV file is empty: " + path);
            }
            rows = CsvSupport.readRows(file).size();
        } catch (IOException | RuntimeException e) {
            throw new TaskExecutionException(TYPE, "Error reading CSV: " + e.getMessage(), e);
        }
        if (rows == 0) {
            throw new TaskExecutionException(TYPE, "CSV file contains no data rows: " + path);
        }

        List<String> missing = new ArrayList<>(expected);
        missing.removeAll(actual);
        if (!missing.isEmpty()) {
            throw new TaskExecutionException(TYPE, "Missing columns: " + missing +
                    ". Expected: " + expected + ", found: " + actual);
        }

        List<String> extra = new ArrayList<>(actual);
        extra.removeAll(expected);
        if (!allowExtra && !extra.isEmpty()) {
            throw new TaskExecutionException(TYPE, "Unexpected columns: " + extra);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("valid", true);
        result.put("path", path);
        result.put("rows", rows);
        result.put("columns", actual);
        result.put("expected_columns", expected);
        result.put("has_extra_columns", !extra.isEmpty());
        return result;
    }

    @Override
    public void after(Object result) {
        Map<?, ?> summary = (Map<?, ?>) result;
        logger.info("CSV valid: " + summary.get("rows") + " rows, " + ((List<?>) summary.get("columns")).size() + " columns");
    }

    @Override
    public void onError(Throwable error) {
        logger.warning("CSV validation failed: " + error.getMessage());
    }
}
