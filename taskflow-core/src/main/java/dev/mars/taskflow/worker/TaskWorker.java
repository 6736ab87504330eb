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
import dev.mars.taskflow.core.TaskCommand;
import dev.mars.taskflow.core.exceptions.TaskRegistrationException;
import dev.mars.taskflow.task.Task;
import dev.mars.taskflow.task.TaskContext;
import dev.mars.taskflow.task.TaskExecutable;
import dev.mars.taskflow.task.TaskRegistry;
import dev.mars.taskflow.task.TaskTemplate;
import dev.mars.taskflow.task.decorator.DecoratorRegistry;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes a single {@link TaskCommand}.
 *
 * <p>The worker resolves a fresh strategy from the {@link TaskRegistry}, wraps it in the
 * {@link TaskTemplate} and then in the decorator chain configured for the command type, and
 * invokes the outermost wrapper. This is the one place step failures are caught: any exception
 * or error escaping the chain, a failed assertion included, becomes a FAILED
 * {@link StepOutcome}, a normal return a SUCCESS one. A {@link VirtualMachineError} is not a
 * step failure and propagates.</p>
 *
 * <p>Registration problems are not step failures. An unknown type, or a factory returning
 * {@code null}, propagates to the caller.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TaskWorker {
    private static final Logger logger = Logger.getLogger(TaskWorker.class.getName());

    private final TaskRegistry taskRegistry;
    private final DecoratorRegistry decoratorRegistry;
    private final Clock clock;

    public TaskWorker(TaskRegistry taskRegistry) {
        this(taskRegistry, new DecoratorRegistry());
    }

    public TaskWorker(TaskRegistry taskRegistry, DecoratorRegistry decoratorRegistry) {
        this(taskRegistry, decoratorRegistry, Clock.systemUTC());
    }

    public TaskWorker(TaskRegistry taskRegistry, DecoratorRegistry decoratorRegistry, Clock clock) {
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "Task registry cannot be null");
        this.decoratorRegistry = Objects.requireNonNull(decoratorRegistry, "Decorator registry cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Executes the command against the given context.
     *
     * @param command the step to execute
     * @param context read-only results of previously completed steps
     * @return SUCCESS with the step result, or FAILED with the normalized error message
     * @throws TaskRegistrationException if the command type cannot be instantiated; an unknown
     *         type surfaces as {@link dev.mars.taskflow.core.exceptions.UnknownTaskTypeException}
     */
    public StepOutcome execute(TaskCommand command, TaskContext context) throws TaskRegistrationException {
        Objects.requireNonNull(command, "Command cannot be null");
        Objects.requireNonNull(context, "Context cannot be null");

        Task task = taskRegistry.create(command.getType());
        TaskExecutable executable = decoratorRegistry.chainFor(command.getType())
                .apply(new TaskTemplate(task), command.getType());

        logger.fine("Executing " + command);
        Instant startedAt = clock.instant();
        try {
            Object result = executable.run(context, command.getParams());
            return StepOutcome.success(result, startedAt, clock.instant());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String message = normalizeMessage(e);
            logger.warning("Task " + command.getNodeKey() + " (" + command.getType() + ") failed: " + message);
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Task failure details for " + command.getNodeKey(), e);
            }
            return StepOutcome.failed(message, e, startedAt, clock.instant());
        }
    }

    /**
     * The failure message, or the class simple name when there is none.
     */
    static String normalizeMessage(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
