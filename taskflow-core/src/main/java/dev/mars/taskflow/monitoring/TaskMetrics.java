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


package dev.mars.taskflow.monitoring;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for task executions, fed by the timing decorator.
 *
 * Provides 3 task metrics:
 * - taskflow.task.executions (counter) - Task executions by type and outcome
 * - taskflow.task.failures (counter) - Failed task executions by type and error type
 * - taskflow.task.duration.seconds (histogram) - Task execution duration distribution
 *
 * <p>An in-process snapshot of the same figures is kept alongside and exposed through
 * {@link #toMap()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TaskMetrics {

    private static final Logger logger = Logger.getLogger(TaskMetrics.class.getName());
    private static final String METER_NAME = "taskflow-core";

    private static TaskMetrics instance;

    private final LongCounter executions;
    private final LongCounter failures;
    private final DoubleHistogram duration;

    // Snapshot counters
    private final LongAdder totalExecutions = new LongAdder();
    private final LongAdder successfulExecutions = new LongAdder();
    private final LongAdder failedExecutions = new LongAdder();
    private final LongAdder totalDurationMs = new LongAdder();
    private final AtomicLong minDurationMs = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxDurationMs = new AtomicLong(0);
    private final Map<String, LongAdder> executionsByType = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> errorCounts = new ConcurrentHashMap<>();

    private static final AttributeKey<String> TASK_TYPE_KEY = AttributeKey.stringKey("task.type");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("task.outcome");
    private static final AttributeKey<String> ERROR_TYPE_KEY = AttributeKey.stringKey("error.type");

    private TaskMetrics() {
        this(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    /**
     * Creates metrics backed by an explicit meter, typically one from an SDK test provider.
     */
    public TaskMetrics(Meter meter) {
        Objects.requireNonNull(meter, "Meter cannot be null");

        executions = meter.counterBuilder("taskflow.task.executions")
                .setDescription("Number of task executions")
                .setUnit("1")
                .build();

        failures = meter.counterBuilder("taskflow.task.failures")
                .setDescription("Number of failed task executions")
                .setUnit("1")
                .build();

        duration = meter.histogramBuilder("taskflow.task.duration.seconds")
                .setDescription("Task execution duration in seconds")
                .setUnit("s")
                .build();

        logger.fine("TaskMetrics initialized");
    }

    /**
     * Get the singleton instance bound to the global OpenTelemetry meter.
     */
    public static synchronized TaskMetrics getInstance() {
        if (instance == null) {
            instance = new TaskMetrics();
        }
        return instance;
    }

    /**
     * Record a task execution that returned normally.
     */
    public void recordSuccess(String taskType, Duration elapsed) {
        record(taskType, elapsed, "success");
        successfulExecutions.increment();
    }

    /**
     * Record a task execution that raised an exception.
     */
    public void recordFailure(String taskType, Duration elapsed, String errorType) {
        record(taskType, elapsed, "failure");
        failedExecutions.increment();

        String error = errorType != null ? errorType : "unknown";
        failures.add(1, Attributes.builder()
                .put(TASK_TYPE_KEY, taskType)
                .put(ERROR_TYPE_KEY, error)
                .build());
        errorCounts.computeIfAbsent(error, k -> new LongAdder()).increment();
    }

    private void record(String taskType, Duration elapsed, String outcome) {
        Attributes attrs = Attributes.builder()
                .put(TASK_TYPE_KEY, taskType)
                .put(OUTCOME_KEY, outcome)
                .build();
        executions.add(1, attrs);
        duration.record(elapsed.toNanos() / 1_000_000_000.0, attrs);

        long durationMs = elapsed.toMillis();
        totalExecutions.increment();
        totalDurationMs.add(durationMs);
        minDurationMs.updateAndGet(current -> Math.min(current, durationMs));
        maxDurationMs.updateAndGet(current -> Math.max(current, durationMs));
        executionsByType.computeIfAbsent(taskType, k -> new LongAdder()).increment();
    }

    /**
     * Get current metrics as a map.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> metrics = new HashMap<>();

        long total = totalExecutions.sum();
        metrics.put("totalExecutions", total);
        metrics.put("successfulExecutions", successfulExecutions.sum());
        metrics.put("failedExecutions", failedExecutions.sum());

        if (total > 0) {
            metrics.put("averageDurationMs", totalDurationMs.sum() / total);
            metrics.put("minDurationMs", minDurationMs.get() == Long.MAX_VALUE ? 0L : minDurationMs.get());
            metrics.put("maxDurationMs", maxDurationMs.get());
        }

        Map<String, Long> byType = new HashMap<>();
        executionsByType.forEach((type, count) -> byType.put(type, count.sum()));
        metrics.put("executionsByType", byType);

        if (!errorCounts.isEmpty()) {
            Map<String, Long> errors = new HashMap<>();
            errorCounts.forEach((type, count) -> errors.put(type, count.sum()));
            metrics.put("errors", errors);
        }

        return metrics;
    }
}
