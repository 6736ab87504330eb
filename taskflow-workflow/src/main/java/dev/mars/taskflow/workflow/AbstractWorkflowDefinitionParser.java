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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Shared part of the JSON and YAML parsers: both turn their source into plain maps and lists,
 * and this class maps that tree onto a {@link WorkflowDefinition}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public abstract class AbstractWorkflowDefinitionParser implements WorkflowDefinitionParser {
    private static final Logger logger = Logger.getLogger(AbstractWorkflowDefinitionParser.class.getName());

    public static final String DEFAULT_WORKFLOW_NAME = "Unnamed Workflow";

    private final String defaultWorkflowName;

    protected AbstractWorkflowDefinitionParser() {
        this(DEFAULT_WORKFLOW_NAME);
    }

    protected AbstractWorkflowDefinitionParser(TaskflowConfiguration configuration) {
        this(configuration.getDefaultWorkflowName());
    }

    protected AbstractWorkflowDefinitionParser(String defaultWorkflowName) {
        this.defaultWorkflowName = Objects.requireNonNull(defaultWorkflowName, "Default workflow name cannot be null");
    }

    /**
     * Reads the raw source into a tree of maps, lists and scalars.
     */
    protected abstract Object readTree(String content) throws WorkflowParseException;

    /**
     * Short format name used in messages.
     */
    protected abstract String formatName();

    @Override
    public WorkflowDefinition parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            WorkflowDefinition definition = parseFromString(content);
            logger.fine("Parsed workflow '" + definition.getName() + "' from " + file);
            return definition;
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read " + formatName() + " file: " + file, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String content) throws WorkflowParseException {
        if (content == null || content.isBlank()) {
            throw new WorkflowParseException("Empty " + formatName() + " content");
        }
        Object tree = readTree(content);
        if (!(tree instanceof Map)) {
            throw new WorkflowParseException("Workflow " + formatName() + " must be an object with 'name' and 'nodes'");
        }
        return toDefinition(asStringKeyedMap(tree, null, "$"));
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = DependencyGraph.of(definition).validate();
        if (definition.isEmpty()) {
            result.addEmptyWorkflow();
        }
        return result;
    }

    private WorkflowDefinition toDefinition(Map<String, Object> data) throws WorkflowParseException {
        String name = getStringValue(data, "name");
        if (name == null || name.isBlank()) {
            name = defaultWorkflowName;
        }
        String id = getStringValue(data, "id");

        Object nodesValue = data.get("nodes");
        List<WorkflowNode> nodes = new ArrayList<>();
        if (nodesValue != null) {
            if (!(nodesValue instanceof List)) {
                throw new WorkflowParseException(name, "nodes", "must be a list");
            }
            List<?> nodeList = (List<?>) nodesValue;
            for (int i = 0; i < nodeList.size(); i++) {
                nodes.add(toNode(name, "nodes[" + i + "]", nodeList.get(i)));
            }
        }

        try {
            return new WorkflowDefinition(name, id, nodes);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(name, "nodes", e.getMessage(), e);
        }
    }

    private WorkflowNode toNode(String workflowName, String path, Object value) throws WorkflowParseException {
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(workflowName, path, "must be an object");
        }
        Map<String, Object> data = asStringKeyedMap(value, workflowName, path);

        String id = requireText(data, "id", workflowName, path);
        String type = requireText(data, "type", workflowName, path);

        Object paramsValue = data.get("params");
        Map<String, Object> params = Map.of();
        if (paramsValue != null) {
            if (!(paramsValue instanceof Map)) {
                throw new WorkflowParseException(workflowName, path + ".params", "must be an object");
            }
            params = asStringKeyedMap(paramsValue, workflowName, path + ".params");
        }

        String dependsKey = data.containsKey("depends_on") ? "depends_on" : "dependsOn";
        List<String> dependsOn = toStringList(data.get(dependsKey), workflowName, path + "." + dependsKey);

        return new WorkflowNode(id, type, params, dependsOn);
    }

    private static String requireText(Map<String, Object> data, String key, String workflowName, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            throw new WorkflowParseException(workflowName, path + "." + key, "is required");
        }
        if (!(value instanceof String) && !(value instanceof Number)) {
            throw new WorkflowParseException(workflowName, path + "." + key, "must be a string");
        }
        String text = value.toString();
        if (text.isBlank()) {
            throw new WorkflowParseException(workflowName, path + "." + key, "cannot be blank");
        }
        return text;
    }

    private static List<String> toStringList(Object value, String workflowName, String path)
            throws WorkflowParseException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(workflowName, path, "must be a list of node ids");
        }
        List<String> items = new ArrayList<>();
        List<?> list = (List<?>) value;
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            if (item == null || item instanceof Map || item instanceof List) {
                throw new WorkflowParseException(workflowName, path + "[" + i + "]", "must be a node id");
            }
            items.add(item.toString());
        }
        return items;
    }

    private static Map<String, Object> asStringKeyedMap(Object value, String workflowName, String path)
            throws WorkflowParseException {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (entry.getKey() == null) {
                throw new WorkflowParseException(workflowName, path, "contains a null key");
            }
            result.put(entry.getKey().toString(), entry.getValue());
        }
        return result;
    }

    private static String getStringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }
}
