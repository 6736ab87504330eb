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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.taskflow.config.TaskflowConfiguration;

/**
 * JSON implementation of {@link WorkflowDefinitionParser} backed by Jackson.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class JsonWorkflowDefinitionParser extends AbstractWorkflowDefinitionParser {

    private final ObjectMapper objectMapper;

    public JsonWorkflowDefinitionParser() {
        super();
        this.objectMapper = createObjectMapper();
    }

    public JsonWorkflowDefinitionParser(TaskflowConfiguration configuration) {
        super(configuration);
        this.objectMapper = createObjectMapper();
    }

    private static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    protected Object readTree(String content) throws WorkflowParseException {
        try {
            return objectMapper.readValue(content, Object.class);
        } catch (JsonProcessingException e) {
            String location = e.getLocation() != null
                    ? " at line " + e.getLocation().getLineNr() + ", column " + e.getLocation().getColumnNr()
                    : "";
            throw new WorkflowParseException("JSON parsing failed" + location + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    protected String formatName() {
        return "JSON";
    }
}
