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
import dev.mars.taskflow.core.exceptions.TaskRegistrationException;
import dev.mars.taskflow.examples.tasks.NotifyMockTask;
import dev.mars.taskflow.task.TaskDescriptor;
import dev.mars.taskflow.task.TaskRegistry;
import dev.mars.taskflow.task.decorator.DecoratorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TaskflowBootstrap Tests")
class TaskflowBootstrapTest {

    @Test
    @DisplayName("Registers the example types in a fixed order")
    void registersExampleTypes() throws Exception {
        TaskRegistry registry = TaskflowBootstrap.createRegistry();

        assertThat(registry.list())
                .extracting(TaskDescriptor::getType)
                .containsExactly("notify_mock", "validate_csv", "http_get", "transform_simple");
        assertThat(registry.create(NotifyMockTask.TYPE)).isInstanceOf(NotifyMockTask.class);
    }

    @Test
    @DisplayName("Registering twice into the same registry fails")
    void duplicateRegistration() throws Exception {
        TaskRegistry registry = TaskflowBootstrap.createRegistry();

        assertThatThrownBy(() -> TaskflowBootstrap.registerExampleTasks(registry))
                .isInstanceOf(TaskRegistrationException.class)
                .hasMessageContaining("notify_mock");
    }

    @Test
    @DisplayName("Decorator chains follow the configuration")
    void decoratorChainsFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(TaskflowConfiguration.DEFAULT_DECORATORS_KEY, "timing");
        properties.setProperty(TaskflowConfiguration.DECORATORS_PREFIX + "http_get", "logging, timing");

        DecoratorRegistry decorators = TaskflowBootstrap.createDecoratorRegistry(new TaskflowConfiguration(properties));

        assertThat(decorators.hasChain("http_get")).isTrue();
        assertThat(decorators.chainFor("http_get").size()).isEqualTo(2);
        assertThat(decorators.chainFor("notify_mock").size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Shipped configuration times every example type and logs all but notify_mock")
    void shippedDecoratorConfiguration() throws Exception {
        Properties shipped = new Properties();
        try (InputStream input = TaskflowBootstrap.class.getResourceAsStream("/taskflow.properties")) {
            assertThat(input).isNotNull();
            shipped.load(input);
        }
        TaskflowConfiguration configuration = new TaskflowConfiguration(shipped);

        for (String type : List.of("http_get", "validate_csv", "transform_simple")) {
            assertThat(configuration.getDecoratorNames(type)).containsExactly("timing", "logging");
        }
        assertThat(configuration.getDecoratorNames("notify_mock")).containsExactly("timing");

        DecoratorRegistry decorators = TaskflowBootstrap.createDecoratorRegistry(configuration);
        assertThat(decorators.chainFor("http_get").size()).isEqualTo(2);
        assertThat(decorators.chainFor("validate_csv").size()).isEqualTo(2);
        assertThat(decorators.chainFor("transform_simple").size()).isEqualTo(2);
        assertThat(decorators.chainFor("notify_mock").size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unknown decorator names are rejected")
    void unknownDecorator() {
        Properties properties = new Properties();
        properties.setProperty(TaskflowConfiguration.DEFAULT_DECORATORS_KEY, "retry");

        assertThatThrownBy(() -> TaskflowBootstrap.createDecoratorRegistry(new TaskflowConfiguration(properties)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown decorator: retry");
    }
}
