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

import dev.mars.taskflow.config.TaskflowConfiguration;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads workflow definitions from a declarative source.
 *
 * <p>The source shape is {@code {name, id?, nodes: [{id, type, params?, depends_on? | dependsOn?}]}}.
 * Structural problems fail parsing; dependency consistency is checked separately by
 * {@link #validate(WorkflowDefinition)} so that a definition can be inspected before it runs.</p>
 */
public interface WorkflowDefinitionParser {

    WorkflowDefinition parse(Path file) throws WorkflowParseException;

    WorkflowDefinition parseFromString(String content) throws WorkflowParseException;

    /**
     * Reports dangling, self and circular dependencies as errors and an empty workflow as a
     * warning.
     */
    ValidationResult validate(WorkflowDefinition definition);

    /**
     * Picks a parser from the file extension: {@code .json} for JSON, anything else for YAML.
     */
    static WorkflowDefinitionParser forFile(Path file) {
        return isJson(file) ? new JsonWorkflowDefinitionParser() : new YamlWorkflowDefinitionParser();
    }

    /**
     * Same as {@link #forFile(Path)}, with the default workflow name taken from the configuration.
     */
    static WorkflowDefinitionParser forFile(Path file, TaskflowConfiguration configuration) {
        return isJson(file)
                ? new JsonWorkflowDefinitionParser(configuration)
                : new YamlWorkflowDefinitionParser(configuration);
    }

    private static boolean isJson(Path file) {
        String fileName = file.getFileName() != null ? file.getFileName().toString() : "";
        return fileName.toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
