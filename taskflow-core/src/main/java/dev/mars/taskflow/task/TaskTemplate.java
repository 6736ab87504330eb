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


package dev.mars.taskflow.task;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed execution template around a {@link Task}.
 *
 * <p>This is the only place the step lifecycle is sequenced:
 * {@code before -> validateParams -> execute -> after}. Any exception or error raised by a stage
 * is shown to {@link Task#onError(Throwable)} and then re-thrown unchanged. A failure inside
 * {@code onError} never replaces the original one; it is attached as suppressed.
 * {@link VirtualMachineError}s are re-thrown without notifying the task.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class TaskTemplate implements TaskExecutable {

    private static final Logger logger = Logger.getLogger(TaskTemplate.class.getName());

    private final Task task;

    public TaskTemplate(Task task) {
        this.task = Objects.requireNonNull(task, "Task cannot be null");
    }

    public Task getTask() {
        return task;
    }

    @Override
    public Object run(TaskContext context, Map<String, Object> params) throws Exception {
        try {
            task.before(params);
            task.validateParams(params);
            Object result = task.execute(context, params);
            task.after(result);
            return result;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            notifyError(e);
            throw e;
        }
    }

    private void notifyError(Throwable error) {
        try {
            task.onError(error);
        } catch (RuntimeException hookFailure) {
            logger.log(Level.FINE, "onError hook of " + task.getClass().getSimpleName() + " failed", hookFailure);
            error.addSuppressed(hookFailure);
        }
    }

    @Override
    public String toString() {
        return "TaskTemplate{" + task.getClass().getSimpleName() + '}';
    }
}
