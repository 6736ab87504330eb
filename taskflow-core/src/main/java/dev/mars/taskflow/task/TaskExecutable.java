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

/**
 * The single call boundary shared by a templated task and every decorator wrapped around it.
 * Because both sides implement the same method, decorators nest to any depth and the worker
 * always invokes the outermost one.
 */
@FunctionalInterface
public interface TaskExecutable {

    /**
     * Runs the unit of work.
     *
     * @param context results of previously completed steps
     * @param params the step parameters from the workflow definition
     * @return the step result, an opaque payload that may be {@code null}
     * @throws Exception any failure; the worker turns it into a FAILED outcome
     */
    Object run(TaskContext context, Map<String, Object> params) throws Exception;
}
