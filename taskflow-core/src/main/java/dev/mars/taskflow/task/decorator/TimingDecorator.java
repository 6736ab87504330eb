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

import dev.mars.taskflow.monitoring.TaskMetrics;
import dev.mars.taskflow.task.TaskContext;
import dev.mars.taskflow.task.TaskExecutable;

import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Measures the wall-clock duration of the inner executable, logs it and records it on
 * {@link TaskMetrics}. Results and exceptions pass through untouched.
 */
public class TimingDecorator extends TaskDecorator {
    private static final Logger logger = Logger.getLogger(TimingDecorator.class.getName());

    private final TaskMetrics metrics;

    /**
     * @param metrics metrics sink, or {@code null} to only log durations
     */
    public TimingDecorator(TaskExecutable inner, String taskType, TaskMetrics metrics) {
        super(inner, taskType);
        this.metrics = metrics;
    }

    public static DecoratorFactory factory(TaskMetrics metrics) {
        return (inner, taskType) -> new TimingDecorator(inner, taskType, metrics);
    }

    @Override
    public Object run(TaskContext context, Map<String, Object> params) throws Exception {
        long start = System.nanoTime();
        logger.fine("[" + getTaskType() + "] Starting execution");
        try {
            Object result = getInner().run(context, params);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            logger.info(String.format("[%s] Completed in %.3fs", getTaskType(), seconds(elapsed)));
            if (metrics != null) {
                metrics.recordSuccess(getTaskType(), elapsed);
            }
            return result;
        } catch (Exception | Error e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            logger.warning(String.format("[%s] Failed after %.3fs", getTaskType(), seconds(elapsed)));
            if (metrics != null) {
                metrics.recordFailure(getTaskType(), elapsed, e.getClass().getSimpleName());
            }
            throw e;
        }
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
