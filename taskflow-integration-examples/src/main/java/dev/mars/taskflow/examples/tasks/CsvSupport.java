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

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads header-first CSV files with Jackson's CSV module.
 */
final class CsvSupport {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");

    private CsvSupport() {
    }

    /**
     * Column names from the first line, empty for an empty file.
     */
    static List<String> readHeader(Path file) throws IOException {
        try (MappingIterator<String[]> lines = CSV_MAPPER
                .readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(file.toFile())) {
            return lines.hasNext() ? List.of(lines.next()) : List.of();
        }
    }

    /**
     * Data rows keyed by column name in header order, every cell kept as text.
     */
    static List<Map<String, String>> readRows(Path file) throws IOException {
        try (MappingIterator<Map<String, String>> rows = CSV_MAPPER
                .readerFor(Map.class)
                .with(HEADER_SCHEMA)
                .readValues(file.toFile())) {
            return rows.readAll();
        }
    }

    /**
     * Data rows with numeric cells converted to {@link Long} or {@link Double} and empty cells
     * to {@code null}.
     */
    static List<Map<String, Object>> readTypedRows(Path file) throws IOException {
        List<Map<String, Object>> typed = new ArrayList<>();
        for (Map<String, String> row : readRows(file)) {
            Map<String, Object> converted = new LinkedHashMap<>();
            row.forEach((column, cell) -> converted.put(column, convert(cell)));
            typed.add(converted);
        }
        return typed;
    }

    static Object convert(String cell) {
        if (cell == null || cell.isEmpty()) {
            return null;
        }
        if (!NUMBER.matcher(cell).matches()) {
            return cell;
        }
        try {
            return Long.parseLong(cell);
        } catch (NumberFormatException e) {
            // decimals, exponents and values beyond long range
            return Double.parseDouble(cell);
        }
    }
}
