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


package dev.mars.taskflow.examples;

import dev.mars.taskflow.config.TaskflowConfiguration;
import dev.mars.taskflow.core.StepOutcome;
import dev.mars.taskflow.storage.InMemoryWorkflowRunRepository;
import dev.mars.taskflow.storage.NodeRunRecord;
import dev.mars.taskflow.workflow.ValidationResult;
import dev.mars.taskflow.workflow.WorkflowDefinition;
import dev.mars.taskflow.workflow.WorkflowDefinitionParser;
import dev.mars.taskflow.workflow.WorkflowEngine;
import dev.mars.taskflow.workflow.WorkflowResult;
import dev.mars.taskflow.workflow.YamlWorkflowDefinitionParser;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Basic example of an offline CSV pipeline. This example shows how to:
 * 1. Parse a YAML workflow definition
 * 2. Validate its dependency graph
 * 3. Run it with the example task types and inspect the persisted node runs
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class BasicWorkflowExample {

    public static void main(String[] args) {
        System.out.println("=== Taskflow Basic Workflow Example ===");

        try {
            BasicWorkflowExample example = new BasicWorkflowExample();
            WorkflowResult result = example.runExample(Files.createTempDirectory("taskflow-example"));
            System.out.println("\n=== Example finished with status " + result.getStatus() + " ===");
        } catch (Exception e) {
            System.err.println("Example failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    public WorkflowResult runExample(Path workDir) throws Exception {
        // 1. Prepare input data
        System.out.println("1. Writing sample CSV...");
        Path csv = workDir.resolve("payments.csv");
        Files.writeString(csv, """
                id,name,amount
                1,Alice,10.5
                2,Bob,20
                3,O'Brien,
                """);

        // 2. Parse the workflow
        System.out.println("2. Parsing workflow...");
        WorkflowDefinitionParser parser = new YamlWorkflowDefinitionParser();
        WorkflowDefinition workflow = parser.parseFromString(createSampleWorkflow(csv, workDir.resolve("sql")));
        System.out.println("   Workflow: " + workflow.getName());
        System.out.println("   Nodes: " + workflow.size());

        // 3. Validate the workflow
        System.out.println("3. Validating workflow...");
        ValidationResult validation = parser.validate(workflow);
        if (!validation.isValid()) {
            validation.getErrors().forEach(error -> System.err.println("  - " + error.getMessage()));
            throw new IllegalStateException("Sample workflow is invalid");
        }
        System.out.println("   Workflow is valid!");

        // 4. Run it
        System.out.println("4. Running workflow...");
        InMemoryWorkflowRunRepository repository = new InMemoryWorkflowRunRepository();
        WorkflowEngine engine = TaskflowBootstrap.createEngine(
                new TaskflowConfiguration(), TaskflowBootstrap.createRegistry(), repository);
        WorkflowResult result = engine.run(workflow);

        // 5. Report
        System.out.println("5. Results:");
        for (Map.Entry<String, StepOutcome> entry : result.getResults().entrySet()) {
            System.out.println("   " + entry.getKey() + ": " + entry.getValue().getStatus());
        }
        for (NodeRunRecord record : repository.findNodeRuns(result.getRunId())) {
            System.out.println("   persisted " + record);
        }
        return result;
    }

    private static String createSampleWorkflow(Path csv, Path outputDir) {
        return """
                name: Offline CSV Pipeline
                nodes:
                  - id: validate
                    type: validate_csv
                    params:
                      path: "%s"
                      columns: [id, name, amount]
                  - id: transform
                    type: transform_simple
                    params:
                      table_name: payments
                      output_dir: "%s"
                    depends_on: [validate]
                  - id: notify
                    type: notify_mock
                    params:
                      channel: console
                      message: Payments exported
                      delay: 0
                    depends_on: [transform]
                """.formatted(yamlPath(csv), yamlPath(outputDir));
    }

    private static String yamlPath(Path path) {
        return path.toAbsolutePath().toString().replace("\\", "\\\\");
    }
}
