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


package dev.mars.taskflow.worker;

import dev.mars.taskflow.core.StepOutcome;
import dev.mars.taskflow.core.StepStatus;
import dev.mars.taskflow.core.TaskCommand;
import dev.mars.taskflow.core.exceptions.TaskValidationException;
import dev.mars.taskflow.core.exceptions.UnknownTaskTypeException;
import dev.mars.taskflow.task.Task;
import dev.mars.taskflow.task.TaskContext;
import dev.mars.taskflow.task.TaskRegistry;
import dev.mars.taskflow.task.decorator.DecoratorChain;
import dev.mars.taskflow.task.decorator.DecoratorRegistry;
import dev.mars.taskflow.task.decorator.TaskDecorator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link TaskWorker}.
 */
@DisplayName("TaskWorker Tests")
class TaskWorkerTest {

    @Mock
    private TaskRegistry taskRegistry;

    @Mock
    private Task task;

    private TaskWorker worker;
    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        worker = new TaskWorker(taskRegistry, new DecoratorRegistry(), clock);
    }

    private static TaskCommand command(String type, Map<String, Object> params) {
        return TaskCommand.builder()
                .runId("run-1")
                .nodeKey("node-1")
                .type(type)
                .params(params)
                .build();
    }

    @Test
    @DisplayName("Normal return becomes SUCCESS carrying the result")
    void testSuccess() throws Exception {
        Map<String, Object> params = Map.of("url", "https://example.org");
        TaskContext context = TaskContext.of(Map.of("upstream", "value"));
        when(taskRegistry.create("http_get")).thenReturn(task);
        when(task.execute(context, params)).thenReturn("body");

        StepOutcome outcome = worker.execute(command("http_get", params), context);

        assertThat(outcome.getStatus()).isEqualTo(StepStatus.SUCCESS);
        assertThat(outcome.getResult()).isEqualTo("body");
        assertThat(outcome.getStartedAt()).isEqualTo(clock.instant());
        verify(task).validateParams(params);
    }

    @Test
    @DisplayName("Validation failure becomes FAILED without executing")
    void testValidationFailure() throws Exception {
        when(taskRegistry.create("http_get")).thenReturn(task);
        doThrow(TaskValidationException.missing("url")).when(task).validateParams(anyMap());

        StepOutcome outcome = worker.execute(command("http_get", Map.of()), TaskContext.empty());

        assertThat(outcome.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(outcome.getErrorMessage()).contains("Invalid parameter 'url': required parameter is missing");
        assertThat(outcome.getCause()).get().isInstanceOf(TaskValidationException.class);
        verify(task, never()).execute(any(), anyMap());
        verify(task).onError(any(TaskValidationException.class));
    }

    @Test
    @DisplayName("Exception without message is normalized to its simple class name")
    void testNullMessageNormalized() throws Exception {
        when(taskRegistry.create("boom")).thenReturn(task);
        when(task.execute(any(), anyMap())).thenThrow(new NullPointerException());

        StepOutcome outcome = worker.execute(command("boom", Map.of()), TaskContext.empty());

        assertThat(outcome.getErrorMessage()).contains("NullPointerException");
    }

    @Test
    @DisplayName("A failed assertion inside the task becomes FAILED and reaches onError")
    void testAssertionErrorBecomesFailed() throws Exception {
        AssertionError assertion = new AssertionError("expected 3 rows");
        when(taskRegistry.create("check")).thenReturn(task);
        when(task.execute(any(), anyMap())).thenThrow(assertion);

        StepOutcome outcome = worker.execute(command("check", Map.of()), TaskContext.empty());

        assertThat(outcome.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(outcome.getErrorMessage()).contains("expected 3 rows");
        assertThat(outcome.getCause()).containsSame(assertion);
        verify(task).onError(assertion);
    }

    @Test
    @DisplayName("Error without message is normalized to its simple class name")
    void testErrorWithoutMessageNormalized() throws Exception {
        when(taskRegistry.create("linkage")).thenReturn(task);
        when(task.execute(any(), anyMap())).thenThrow(new NoClassDefFoundError());

        StepOutcome outcome = worker.execute(command("linkage", Map.of()), TaskContext.empty());

        assertThat(outcome.getErrorMessage()).contains("NoClassDefFoundError");
    }

    @Test
    @DisplayName("Virtual machine errors are not step failures and propagate")
    void testVirtualMachineErrorPropagates() throws Exception {
        when(taskRegistry.create("deep")).thenReturn(task);
        when(task.execute(any(), anyMap())).thenThrow(new StackOverflowError());

        assertThatThrownBy(() -> worker.execute(command("deep", Map.of()), TaskContext.empty()))
                .isInstanceOf(StackOverflowError.class);
        verify(task, never()).onError(any());
    }

    @Test
    @DisplayName("Unknown task type propagates instead of producing an outcome")
    void testUnknownTypePropagates() throws Exception {
        when(taskRegistry.create("missing")).thenThrow(new UnknownTaskTypeException("missing"));

        assertThatThrownBy(() -> worker.execute(command("missing", Map.of()), TaskContext.empty()))
                .isInstanceOf(UnknownTaskTypeException.class)
                .hasMessage("Unknown task type: missing");
    }

    @Test
    @DisplayName("Configured decorator chain wraps the templated task")
    void testDecoratorChainApplied() throws Exception {
        AtomicInteger decoratorCalls = new AtomicInteger();
        DecoratorRegistry decorators = new DecoratorRegistry();
        decorators.register("http_get", DecoratorChain.of((inner, type) -> new TaskDecorator(inner, type) {
            @Override
            public Object run(TaskContext context, Map<String, Object> params) throws Exception {
                decoratorCalls.incrementAndGet();
                return getInner().run(context, params);
            }
        }));
        when(taskRegistry.create("http_get")).thenReturn(task);
        when(task.execute(any(), anyMap())).thenReturn("ok");

        StepOutcome outcome = new TaskWorker(taskRegistry, decorators, clock)
                .execute(command("http_get", Map.of()), TaskContext.empty());

        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(decoratorCalls).hasValue(1);
    }

    @Test
    @DisplayName("Each execution asks the registry for a new task instance")
    void testFreshInstancePerExecution() throws Exception {
        when(taskRegistry.create("http_get")).thenReturn(task);

        worker.execute(command("http_get", Map.of()), TaskContext.empty());
        worker.execute(command("http_get", Map.of()), TaskContext.empty());

        verify(taskRegistry, times(2)).create("http_get");
    }
}
