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
import dev.mars.taskflow.core.exceptions.TaskRegistrationException;
import dev.mars.taskflow.storage.InMemoryWorkflowRunRepository;
import dev.mars.taskflow.task.TaskRegistry;
import dev.mars.taskflow.workflow.DependencyGraph;
import dev.mars.taskflow.workflow.ValidationResult;
import dev.mars.taskflow.workflow.WorkflowDefinition;
import dev.mars.taskflow.workflow.WorkflowDefinitionParser;
import dev.mars.taskflow.workflow.WorkflowEngine;
import dev.mars.taskflow.workflow.WorkflowOrchestrationException;
import dev.mars.taskflow.workflow.WorkflowParseException;
import dev.mars.taskflow.workflow.WorkflowResult;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Command-line tool that parses a JSON or YAML workflow file, runs it with the example task
 * types and prints one line per node.
 *
 * Usage:
 *   java WorkflowRunnerCLI [options] <workflow.yaml|workflow.json>
 *   java WorkflowRunnerCLI --help
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowRunnerCLI {

    private static final String VERSION = "1.0.0";
    private static final String USAGE = """
            Taskflow Workflow Runner v%s

            USAGE:
              java WorkflowRunnerCLI [options] <workflow.yaml|workflow.json>
              java WorkflowRunnerCLI --help
              java WorkflowRunnerCLI --version

            OPTIONS:
              --help             Show this help message
              --version          Show version information
              --validate-only    Parse and validate the workflow without running it
              --config FILE      Load taskflow properties from FILE instead of the default locations
              --quiet            Only print the final status
              --verbose          Print stack traces for errors

            EXAMPLES:
              # Run a workflow
              java WorkflowRunnerCLI etl-pipeline.yaml

              # Check a workflow file without running it
              java WorkflowRunnerCLI --validate-only etl-pipeline.json

            EXIT CODES:
              0  Workflow finished with status SUCCESS (or is valid with --validate-only)
              1  Workflow finished with status PARTIAL_SUCCESS or FAILED
              2  Invalid command line arguments
              3  File, parse, validation or orchestration error
            """.formatted(VERSION);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_WORKFLOW_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_ERROR = 3;

    private static final int DETAIL_LENGTH = 80;

    private final PrintStream out;
    private final PrintStream err;

    private boolean quiet = false;
    private boolean verbose = false;
    private boolean validateOnly = false;

    public WorkflowRunnerCLI() {
        this(System.out, System.err);
    }

    WorkflowRunnerCLI(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        WorkflowRunnerCLI cli = new WorkflowRunnerCLI();
        System.exit(cli.run(args));
    }

    public int run(String[] args) {
        if (args.length == 0) {
            err.println("Error: No workflow file specified");
            err.println();
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            return processArguments(Arrays.asList(args));
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return EXIT_ERROR;
        }
    }

    private int processArguments(List<String> args) throws Exception {
        if (args.contains("--help") || args.contains("-h")) {
            out.println(USAGE);
            return EXIT_SUCCESS;
        }
        if (args.contains("--version") || args.contains("-v")) {
            out.println("Taskflow Workflow Runner v" + VERSION);
            return EXIT_SUCCESS;
        }

        quiet = args.contains("--quiet");
        verbose = args.contains("--verbose");
        validateOnly = args.contains("--validate-only");

        String configFile = null;
        int configIndex = args.indexOf("--config");
        if (configIndex >= 0) {
            if (configIndex + 1 >= args.size() || args.get(configIndex + 1).startsWith("--")) {
                err.println("Error: --config requires a file path");
                return EXIT_USAGE;
            }
            configFile = args.get(configIndex + 1);
        }

        List<String> files = getFileArguments(args, configFile);
        if (files.size() != 1) {
            err.println("Error: Expected exactly one workflow file, got " + files.size());
            return EXIT_USAGE;
        }
        for (String arg : args) {
            if (arg.startsWith("--") && !isKnownOption(arg)) {
                err.println("Error: Unknown option: " + arg);
                return EXIT_USAGE;
            }
        }

        TaskflowConfiguration configuration = configFile != null
                ? loadConfiguration(Paths.get(configFile))
                : new TaskflowConfiguration();
        return runWorkflow(Paths.get(files.get(0)), configuration);
    }

    private static boolean isKnownOption(String arg) {
        return List.of("--quiet", "--verbose", "--validate-only", "--config").contains(arg);
    }

    private static List<String> getFileArguments(List<String> args, String configFile) {
        int configIndex = args.indexOf("--config");
        return IntStream.range(0, args.size())
                .filter(i -> !args.get(i).startsWith("-"))
                .filter(i -> configFile == null || i != configIndex + 1)
                .mapToObj(args::get)
                .collect(Collectors.toList());
    }

    private static TaskflowConfiguration loadConfiguration(Path file) throws IOException {
        Properties properties = new Properties();
        try (InputStream input = Files.newInputStream(file)) {
            properties.load(input);
        }
        return new TaskflowConfiguration(properties);
    }

    private int runWorkflow(Path file, TaskflowConfiguration configuration)
            throws TaskRegistrationException {
        if (!Files.isRegularFile(file)) {
            err.println("Error: File not found: " + file);
            return EXIT_ERROR;
        }

        WorkflowDefinitionParser parser = WorkflowDefinitionParser.forFile(file, configuration);
        WorkflowDefinition definition;
        try {
            definition = parser.parse(file);
        } catch (WorkflowParseException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        ValidationResult validation = parser.validate(definition);
        if (!validation.isValid()) {
            err.println("Workflow '" + definition.getName() + "' is invalid:");
            validation.getErrors().forEach(issue -> err.println("  - " + describe(issue)));
            return EXIT_ERROR;
        }
        if (!quiet) {
            validation.getWarnings().forEach(issue -> out.println("Warning: " + describe(issue)));
        }
        if (validateOnly) {
            out.println("Workflow '" + definition.getName() + "' is valid (" + definition.size() + " nodes)");
            if (!quiet) {
                out.println("Execution order: " + String.join(" -> ", DependencyGraph.of(definition).executionOrder()));
            }
            return EXIT_SUCCESS;
        }

        TaskRegistry registry = TaskflowBootstrap.createRegistry();
        WorkflowEngine engine = TaskflowBootstrap.createEngine(configuration, registry, new InMemoryWorkflowRunRepository());

        WorkflowResult result;
        try {
            result = engine.run(definition);
        } catch (WorkflowOrchestrationException e) {
            err.println("Error: " + e.getMessage());
            if (!e.getUnresolvedNodeIds().isEmpty()) {
                err.println("Unresolved nodes: " + String.join(", ", e.getUnresolvedNodeIds()));
            }
            if (verbose) {
                e.printStackTrace(err);
            }
            return EXIT_ERROR;
        }

        printResult(result);
        return result.isSuccessful() ? EXIT_SUCCESS : EXIT_WORKFLOW_FAILED;
    }

    private void printResult(WorkflowResult result) {
        if (!quiet) {
            out.println("Workflow: " + result.getWorkflowName() + " (run " + result.getRunId() + ")");
            out.println(String.format("%-24s %-8s %10s  %s", "NODE", "STATUS", "DURATION", "DETAIL"));
            for (Map.Entry<String, StepOutcome> entry : result.getResults().entrySet()) {
                StepOutcome outcome = entry.getValue();
                out.println(String.format("%-24s %-8s %8dms  %s", entry.getKey(), outcome.getStatus(),
                        outcome.getDuration().toMillis(), detail(outcome)));
            }
        }
        out.println("Status: " + result.getStatus() + " in " + result.getDuration().toMillis() + "ms");
    }

    private static String detail(StepOutcome outcome) {
        Object payload = outcome.getPayload();
        String text = payload != null ? payload.toString().replace('\n', ' ') : "";
        return text.length() > DETAIL_LENGTH ? text.substring(0, DETAIL_LENGTH) + "..." : text;
    }

    private static String describe(ValidationResult.DefinitionIssue issue) {
        return "[" + issue.getKind().getLabel() + "] " + issue.getMessage();
    }
}
