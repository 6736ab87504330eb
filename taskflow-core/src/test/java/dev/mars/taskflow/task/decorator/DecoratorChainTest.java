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


package dev.mars.taskflow.task.decorator;

import dev.mars.taskflow.core.StepOutcome;
import dev.mars.taskflow.core.StepStatus;
import dev.mars.taskflow.core.TaskCommand;
import dev.mars.taskflow.task.Task;
import dev.mars.taskflow.task.TaskContext;
import dev.mars.taskflow.task.TaskDescriptor;
import dev.mars.taskflow.task.TaskExecutable;
import dev.mars.taskflow.task.TaskRegistry;
import dev.mars.taskflow.worker.TaskWorker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DecoratorChain}.
 */
@DisplayName("DecoratorChain Tests")
class DecoratorChainTest {

    private final List<String> trace = new ArrayList<>();

    private DecoratorFactory tracing(String name) {
        return (inner, taskType) -> new TaskDecorator(inner, taskType) {
            @Override
            public Object run(TaskContext context, Map<String, Object> params) throws Exception {
                trace.add(name + ":enter");
                try {
                    return getInner().run(context, params);
                } finally {
                    trace.add(name + ":exit");
                }
            }
        };
    }

    private TaskExecutable base() {
        return (context, params) -> {
            trace.add("task");
            return "done";
        };
    }

    @Test
    @DisplayName("Empty chain returns the base executable itself")
    void testEmptyChain() {
        TaskExecutable base = base();

        assertThat(DecoratorChain.empty().apply(base, "t")).isSameAs(base);
        assertThat(DecoratorChain.of(List.of())).isSameAs(DecoratorChain.empty());
    }

    @Test
    @DisplayName("Last factory in the list is the outermost wrapper")
    void testOrdering() throws Exception {
        TaskExecutable chain = DecoratorChain.of(tracing("first"), tracing("second")).apply(base(), "t");

        Object result = chain.run(TaskContext.empty(), Map.of());

        assertThat(result).isEqualTo("done");
        assertThat(trace).containsExactly(
                "second:enter", "first:enter", "task", "first:exit", "second:exit");
        assertThat(chain).isInstanceOf(TaskDecorator.class);
        assertThat(((TaskDecorator) chain).getInner()).isInstanceOf(TaskDecorator.class);
    }

    @Test
    @DisplayName("then() appends a new outermost wrapper without changing the original chain")
    void testThen() throws Exception {
        DecoratorChain original = DecoratorChain.of(tracing("inner"));
        DecoratorChain extended = original.then(tracing("outer"));

        extended.apply(base(), "t").run(TaskContext.empty(), Map.of());

        assertThat(original.size()).isEqualTo(1);
        assertThat(extended.size()).isEqualTo(2);
        assertThat(trace).startsWith("outer:enter", "inner:enter");
    }

    @Test
    @DisplayName("Exceptions propagate through every decorator unchanged")
    void testExceptionPropagation() {
        IllegalStateException failure = new IllegalStateException("task failed");
        TaskExecutable chain = DecoratorChain.of(tracing("a"), tracing("b"))
                .apply((context, params) -> { throw failure; }, "t");

        assertThatThrownBy(() -> chain.run(TaskContext.empty(), Map.of())).isSameAs(failure);
        assertThat(trace).containsExactly("b:enter", "a:enter", "a:exit", "b:exit");
    }

    @Test
    @DisplayName("A factory returning null is rejected")
    void testNullDecorator() {
        DecoratorChain chain = DecoratorChain.of((inner, taskType) -> null);

        assertThatThrownBy(() -> chain.apply(base(), "t"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A decorator that swallows exceptions breaks failure classification")
    void testSuppressingDecoratorCorruptsClassification() throws Exception {
        TaskRegistry registry = new TaskRegistry();
        registry.register(TaskDescriptor.of("failing"), () -> new Task() {
            @Override
            public void validateParams(Map<String, Object> params) {
            }

            @Override
            public Object execute(TaskContext context, Map<String, Object> params) {
                throw new IllegalStateException("disk full");
            }
        });
        TaskCommand command = TaskCommand.builder()
                .runId("1").nodeKey("n1").type("failing").build();

        DecoratorRegistry honest = new DecoratorRegistry();
        honest.register("failing", DecoratorChain.of(tracing("honest")));
        StepOutcome classified = new TaskWorker(registry, honest).execute(command, TaskContext.empty());

        DecoratorRegistry swallowing = new DecoratorRegistry();
        swallowing.register("failing", DecoratorChain.of((inner, taskType) -> new TaskDecorator(inner, taskType) {
            @Override
            public Object run(TaskContext context, Map<String, Object> params) {
                try {
                    return getInner().run(context, params);
                } catch (Exception e) {
                    return null;
                }
            }
        }));
        StepOutcome corrupted = new TaskWorker(registry, swallowing).execute(command, TaskContext.empty());

        assertThat(classified.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(classified.getErrorMessage()).contains("disk full");
        // the worker can no longer see the failure
        assertThat(corrupted.getStatus()).isEqualTo(StepStatus.SUCCESS);
        assertThat(corrupted.getResult()).isNull();
    }
}
