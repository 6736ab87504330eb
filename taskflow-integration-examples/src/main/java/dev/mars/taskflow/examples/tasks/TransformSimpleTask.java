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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.taskflow.core.exceptions.TaskExecutionException;
import dev.mars.taskflow.core.exceptions.TaskValidationException;
import dev.mars.taskflow.task.Task;
import dev.mars.taskflow.task.TaskContext;
import dev.mars.taskflow.task.TaskDescriptor;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Turns rows produced by an upstream step into a SQL script: one {@code CREATE TABLE IF NOT
 * EXISTS} statement with column types inferred from the data, followed by one {@code INSERT}
 * per row.
 *
 * <p>Rows are taken from the first context result, in completion order, that carries them:
 * a {@code data} entry (as produced by {@code http_get} for JSON bodies), a {@code body} entry
 * holding a document or JSON text, or a {@code path} entry naming a CSV file (as produced by
 * {@code validate_csv}). A document that wraps its rows in a nested {@code data} field is
 * unwrapped once.</p>
 *
 * <p>Parameters: {@code table_name} (SQL identifier), optional {@code select_columns} and
 * optional {@code output_dir} (default {@value #DEFAULT_OUTPUT_DIR}).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TransformSimpleTask implements Task {

    private static final Logger logger = Logger.getLogger(TransformSimpleTask.class.getName());

    public static final String TYPE = "transform_simple";
    public static final String DEFAULT_OUTPUT_DIR = "data";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Clock clock;

    public TransformSimpleTask() {
        this(Clock.systemDefaultZone());
    }

    public TransformSimpleTask(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public static TaskDescriptor descriptor() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("table_name", Map.of("type", "string", "title", "SQL table name", "default", "data_table"));
        properties.put("select_columns", Map.of("type", "array", "title", "Columns to include",
                "items", Map.of("type", "string"),
                "description", "Columns to include in the SQL; all columns when omitted"));
        properties.put("output_dir", Map.of("type", "string", "title", "Output directory",
                "default", DEFAULT_OUTPUT_DIR));

        return TaskDescriptor.builder()
                .type(TYPE)
                .displayName("Transform to SQL")
                .description("Converts JSON or CSV rows into SQL INSERT statements")
                .category("Transformation")
                .icon("wand-2")
                .paramsSchema(Map.of("type", "object", "properties", properties, "required", List.of("table_name")))
                .build();
    }

    @Override
    public void validateParams(Map<String, Object> params) throws TaskValidationException {
        String tableName = TaskParams.requireText(params, "table_name");
        if (!IDENTIFIER.matcher(tableName).matches()) {
            throw new TaskValidationException("table_name", "must be a plain SQL identifier");
        }
        TaskParams.optionalTextList(params, "select_columns");
        if (params.get("output_dir") != null) {
            TaskParams.requireText(params, "output_dir");
        }
    }

    @Override
    public void before(Map<String, Object> params) {
        logger.fine("Transforming upstream rows to SQL for table '" + params.get("table_name") + "'");
    }

    @Override
    public Object execute(TaskContext context, Map<String, Object> params) throws Exception {
        String tableName = (String) params.get("table_name");
        List<String> selectColumns = TaskParams.optionalTextList(params, "select_columns");
        Path outputDir = Path.of(params.get("output_dir") != null ? (String) params.get("output_dir") : DEFAULT_OUTPUT_DIR);

        Source source = findSource(context);
        List<Map<String, Object>> rows = source.rows;
        if (rows.isEmpty()) {
            throw new TaskExecutionException(TYPE, "Upstream node '" + source.nodeId + "' produced no rows");
        }

        List<String> originalColumns = columnsOf(rows);
        List<String> columns = originalColumns;
        if (selectColumns != null) {
            List<String> missing = new ArrayList<>(selectColumns);
            missing.removeAll(originalColumns);
            if (!missing.isEmpty()) {
                throw new TaskExecutionException(TYPE, "Missing columns: " + missing + ". Available: " + originalColumns);
            }
            columns = selectColumns;
        }
        for (String column : columns) {
            if (!IDENTIFIER.matcher(column).matches()) {
                throw new TaskExecutionException(TYPE, "Column name is not a plain SQL identifier: " + column);
            }
        }

        String createTable = createTableStatement(tableName, columns, rows);
        List<String> inserts = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            inserts.add(insertStatement(tableName, columns, row));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        String fileName = tableName + "_" + now.format(FILE_TIMESTAMP) + "_"
                + UUID.randomUUID().toString().replace("-", "").substring(0, 6) + ".sql";
        Path outputPath = outputDir.resolve(fileName);
        try {
            Files.createDirectories(outputDir);
            Files.write(outputPath, script(source.nodeId, tableName, columns, now, createTable, inserts),
                    StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TaskExecutionException(TYPE, "Failed to write SQL file " + outputPath + ": " + e.getMessage(), e);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("source_node", source.nodeId);
        result.put("output_path", outputPath.toString());
        result.put("output_filename", fileName);
        result.put("table_name", tableName);
        result.put("rows", inserts.size());
        result.put("columns", columns);
        result.put("original_columns", originalColumns);
        result.put("statements_generated", inserts.size());
        return result;
    }

    @Override
    public void after(Object result) {
        Map<?, ?> summary = (Map<?, ?>) result;
        logger.info("Generated " + summary.get("statements_generated") + " INSERT statements from node '"
                + summary.get("source_node") + "' into " + summary.get("output_filename"));
    }

    @Override
    public void onError(Throwable error) {
        logger.warning("SQL transformation failed: " + error.getMessage());
    }

    private Source findSource(TaskContext context) throws TaskExecutionException {
        for (Map.Entry<String, Object> entry : context.asMap().entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            Map<?, ?> result = (Map<?, ?>) entry.getValue();
            String nodeId = entry.getKey();
            if (result.containsKey("data")) {
                return new Source(nodeId, toRows(nodeId, unwrap(result.get("data"))));
            }
            if (result.containsKey("body")) {
                return new Source(nodeId, toRows(nodeId, unwrap(parseBody(result.get("body")))));
            }
            if (result.get("path") instanceof String) {
                Path csv = Path.of((String) result.get("path"));
                if (!Files.isRegularFile(csv)) {
                    logger.warning("CSV file from node '" + nodeId + "' not found: " + csv);
                    continue;
                }
                try {
                    return new Source(nodeId, CsvSupport.readTypedRows(csv));
                } catch (IOException | RuntimeException e) {
                    throw new TaskExecutionException(TYPE, "Error reading CSV from node '" + nodeId + "': " + e.getMessage(), e);
                }
            }
        }

        StringBuilder message = new StringBuilder("No rows found in the context; connect this node to an ")
                .append("http_get or validate_csv node. Available nodes: ").append(context.nodeIds());
        for (Map.Entry<String, Object> entry : context.asMap().entrySet()) {
            if (entry.getValue() instanceof Map) {
                message.append("; ").append(entry.getKey()).append(" has keys ")
                        .append(((Map<?, ?>) entry.getValue()).keySet());
            }
        }
        throw new TaskExecutionException(TYPE, message.toString());
    }

    private static Object unwrap(Object document) {
        if (document instanceof Map && ((Map<?, ?>) document).containsKey("data")) {
            return ((Map<?, ?>) document).get("data");
        }
        return document;
    }

    private static Object parseBody(Object body) {
        if (!(body instanceof String)) {
            return body;
        }
        try {
            return objectMapper.readValue((String) body, Object.class);
        } catch (JsonProcessingException e) {
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Body is not JSON", e);
            }
            return body;
        }
    }

    private static List<Map<String, Object>> toRows(String nodeId, Object data) throws TaskExecutionException {
        List<?> items;
        if (data instanceof List) {
            items = (List<?>) data;
        } else if (data instanceof Map) {
            items = List.of(data);
        } else {
            String type = data == null ? "null" : data.getClass().getSimpleName();
            throw new TaskExecutionException(TYPE, "Data from node '" + nodeId
                    + "' must be a list of objects or an object, got " + type);
        }

        List<Map<String, Object>> rows = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof Map)) {
                throw new TaskExecutionException(TYPE, "Data from node '" + nodeId + "' contains a non-object row: " + item);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            ((Map<?, ?>) item).forEach((key, value) -> row.put(String.valueOf(key), value));
            rows.add(row);
        }
        return rows;
    }

    private static List<String> columnsOf(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
        }
        return new ArrayList<>(columns);
    }

    static String createTableStatement(String tableName, List<String> columns, List<Map<String, Object>> rows) {
        List<String> definitions = new ArrayList<>(columns.size());
        for (String column : columns) {
            definitions.add(column + " " + sqlType(firstValue(column, rows)));
        }
        return "CREATE TABLE IF NOT EXISTS " + tableName + " (\n  " + String.join(",\n  ", definitions) + "\n);";
    }

    static String insertStatement(String tableName, List<String> columns, Map<String, Object> row) {
        List<String> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            values.add(sqlLiteral(row.get(column)));
        }
        return "INSERT INTO " + tableName + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", values) + ");";
    }

    private static Object firstValue(String column, List<Map<String, Object>> rows) {
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String sqlType(Object sample) {
        if (sample instanceof Integer || sample instanceof Long || sample instanceof Short
                || sample instanceof BigInteger) {
            return "INTEGER";
        }
        if (sample instanceof Double || sample instanceof Float || sample instanceof BigDecimal) {
            return "REAL";
        }
        return "TEXT";
    }

    private static String sqlLiteral(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    private static List<String> script(String sourceNode, String tableName, List<String> columns,
                                       LocalDateTime generatedAt, String createTable, List<String> inserts) {
        List<String> lines = new ArrayList<>();
        lines.add("-- SQL INSERT statements generated from node: " + sourceNode);
        lines.add("-- Table: " + tableName);
        lines.add("-- Rows: " + inserts.size());
        lines.add("-- Columns: " + String.join(", ", columns));
        lines.add("-- Generated: " + generatedAt.format(FILE_TIMESTAMP));
        lines.add("");
        lines.add(createTable);
        lines.add("");
        lines.addAll(inserts);
        return lines;
    }

    private static final class Source {
        private final String nodeId;
        private final List<Map<String, Object>> rows;

        private Source(String nodeId, List<Map<String, Object>> rows) {
            this.nodeId = nodeId;
            this.rows = rows;
        }
    }
}
