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

import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TaskMetrics}.
 */
class TaskMetricsTest {

    private TaskMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new TaskMetrics(OpenTelemetry.noop().getMeter("test"));
    }

    @Test
    void testInitialState() {
        Map<String, Object> map = metrics.toMap();

        assertEquals(0L, map.get("totalExecutions"));
        assertEquals(0L, map.get("failedExecutions"));
        assertNull(map.get("averageDurationMs"));
        assertNull(map.get("errors"));
    }

    @Test
    void testDurations() {
        metrics.recordSuccess("a", Duration.ofMillis(50));
        metrics.recordSuccess("a", Duration.ofMillis(150));
        metrics.recordFailure("b", Duration.ofMillis(100), "IOException");

        Map<String, Object> map = metrics.toMap();
        assertEquals(3L, map.get("totalExecutions"));
        assertEquals(2L, map.get("successfulExecutions"));
        assertEquals(100L, map.get("averageDurationMs"));
        assertEquals(50L, map.get("minDurationMs"));
        assertEquals(150L, map.get("maxDurationMs"));
        assertEquals(Map.of("a", 2L, "b", 1L), map.get("executionsByType"));
    }

    @Test
    void testUnknownErrorType() {
        metrics.recordFailure("a", Duration.ZERO, null);

        assertEquals(Map.of("unknown", 1L), metrics.toMap().get("errors"));
    }

    @Test
    void testSingleton() {
        assertSame(TaskMetrics.getInstance(), TaskMetrics.getInstance());
    }
}
