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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WorkflowRunnerCLI Tests")
class WorkflowRunnerCLITest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private WorkflowRunnerCLI cli;
    private String configFile;

    @BeforeEach
    void setUp() throws Exception {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new WorkflowRunnerCLI(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        configFile = Files.writeString(tempDir.resolve("taskflow.properties"),
                "taskflow.decorators.default=timing\n").toString();
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static String workflow(String name) throws URISyntaxException {
        return Path.of(WorkflowRunnerCLITest.class.getResource("/workflows/" + name).toURI()).toString();
    }

    private int run(String... args) {
        return cli.run(args);
    }

    @Nested
    @DisplayName("Arguments")
    class Arguments {

        @Test
        @DisplayName("No arguments is a usage error")
        void noArguments() {
            assertThat(run()).isEqualTo(WorkflowRunnerCLI.EXIT_USAGE);
            assertThat(stderr()).contains("No workflow file specified", "USAGE:");
        }

        @Test
        @DisplayName("Help and version exit successfully")
        void helpAndVersion() {
            assertThat(run("--help")).isEqualTo(WorkflowRunnerCLI.EXIT_SUCCESS);
            assertThat(stdout()).contains("EXIT CODES:");

            assertThat(run("-v")).isEqualTo(WorkflowRunnerCLI.EXIT_SUCCESS);
            assertThat(stdout()).contains("Taskflow Workflow Runner v1.0.0");
        }

        @Test
        @DisplayName("Unknown options and extra files are usage errors")
        void badArguments() throws Exception {
            assertThat(run("--fast", workflow("notify-chain.yaml"))).isEqualTo(WorkflowRunnerCLI.EXIT_USAGE);
            assertThat(stderr()).contains("Unknown option: --fast");

            assertThat(run(workflow("notify-chain.yaml"), workflow("cyclic.yaml")))
                    .isEqualTo(WorkflowRunnerCLI.EXIT_USAGE);
            assertThat(run("--config")).isEqualTo(WorkflowRunnerCLI.EXIT_USAGE);
        }
    }

    @Nested
    @DisplayName("Running workflows")
    class Running {

        @Test
        @DisplayName("A successful workflow prints every node and exits with 0")
        void successfulRun() throws Exception {
            int exitCode = run("--config", configFile, workflow("notify-chain.yaml"));

            assertThat(exitCode).isEqualTo(WorkflowRunnerCLI.EXIT_SUCCESS);
            assertThat(stdout())
                    .contains("Workflow: Notify Chain")
                    .containsPattern("first\\s+SUCCESS")
                    .containsPattern("second\\s+SUCCESS")
                    .contains("Status: SUCCESS");
        }

        @Test
        @DisplayName("A failed node yields exit code 1 and skips its dependents")
        void failedRun() throws Exception {
            int exitCode = run("--config", configFile, workflow("bad-channel.yaml"));

            assertThat(exitCode).isEqualTo(WorkflowRunnerCLI.EXIT_WORKFLOW_FAILED);
            assertThat(stdout())
                    .containsPattern("announce\\s+FAILED")
                    .containsPattern("follow_up\\s+SKIPPED")
                    .contains("Upstream node 'announce' failed")
                    .contains("Status: FAILED");
        }

        @Test
        @DisplayName("Quiet mode prints only the final status")
        void quietRun() throws Exception {
            run("--quiet", "--config", configFile, workflow("notify-chain.yaml"));

            assertThat(stdout().trim()).startsWith("Status: SUCCESS").doesNotContain("NODE");
        }

        @Test
        @DisplayName("An unregistered step type aborts the run")
        void unknownType() throws Exception {
            assertThat(run("--config", configFile, workflow("unknown-type.json"))).isEqualTo(WorkflowRunnerCLI.EXIT_ERROR);
            assertThat(stderr()).contains("send_fax");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Validate-only reports a valid workflow without running it")
        void validateOnly() throws Exception {
            int exitCode = run("--validate-only", "--config", configFile, workflow("notify-chain.yaml"));

            assertThat(exitCode).isEqualTo(WorkflowRunnerCLI.EXIT_SUCCESS);
            assertThat(stdout())
                    .contains("Workflow 'Notify Chain' is valid (2 nodes)")
                    .contains("Execution order: first -> second")
                    .doesNotContain("Status:");
        }

        @Test
        @DisplayName("A cyclic workflow is rejected before running")
        void cyclicWorkflow() throws Exception {
            assertThat(run("--config", configFile, workflow("cyclic.yaml"))).isEqualTo(WorkflowRunnerCLI.EXIT_ERROR);
            assertThat(stderr())
                    .contains("Workflow 'Cyclic' is invalid:")
                    .contains("[cycle] Circular dependencies detected; nodes that can never run: [a, b]");
        }

        @Test
        @DisplayName("A dependency on an unknown node is reported with the node that declares it")
        void danglingDependency() throws Exception {
            Path file = Files.writeString(tempDir.resolve("dangling.yaml"), String.join("\n",
                    "name: Dangling",
                    "nodes:",
                    "  - id: send",
                    "    type: notify_mock",
                    "    params: {channel: console, message: hi, delay: 0}",
                    "    depends_on: [fetch]",
                    ""));

            assertThat(run("--config", configFile, file.toString())).isEqualTo(WorkflowRunnerCLI.EXIT_ERROR);
            assertThat(stderr()).contains("[dangling dependency] Node 'send' depends on unknown node 'fetch'");
        }

        @Test
        @DisplayName("Malformed and missing files are errors")
        void unreadableFiles() throws Exception {
            assertThat(run("--config", configFile, workflow("malformed.yaml"))).isEqualTo(WorkflowRunnerCLI.EXIT_ERROR);

            String missing = tempDir.resolve("missing.yaml").toString();
            assertThat(run("--config", configFile, missing)).isEqualTo(WorkflowRunnerCLI.EXIT_ERROR);
            assertThat(stderr()).contains("File not found: " + missing);
        }
    }
}
