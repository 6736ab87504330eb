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


package dev.mars.taskflow.examples.tasks;

import dev.mars.taskflow.core.exceptions.TaskValidationException;
import dev.mars.taskflow.task.TaskContext;
import dev.mars.taskflow.task.TaskTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NotifyMockTask Tests")
class NotifyMockTaskTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:30:00Z"), ZoneOffset.UTC);
    private final NotifyMockTask task = new NotifyMockTask(clock);

    @ParameterizedTest
    @ValueSource(strings = {"email", "slack", "console", "webhook"})
    @DisplayName("Every supported channel is accepted")
    void supportedChannels(String channel) throws Exception {
        Object result = new TaskTemplate(task).run(TaskContext.empty(),
                Map.of("channel", channel, "message", "hello", "delay", 0));

        assertThat(result).isEqualTo(Map.of(
                "sent", true,
                "channel", channel,
                "message", "hello",
                "timestamp", "2025-03-01 12:30:00"));
    }

    @Test
    @DisplayName("Unknown channel is rejected before execution")
    void unknownChannel() {
        assertThatThrownBy(() -> task.validateParams(Map.of("channel", "pager", "message", "hi")))
                .isInstanceOf(TaskValidationException.class)
                .hasMessageStartingWith("Invalid parameter 'channel'");
    }

    @Test
    @DisplayName("Missing or empty message is rejected")
    void missingMessage() {
        assertThatThrownBy(() -> task.validateParams(Map.of("channel", "email")))
                .isInstanceOf(TaskValidationException.class)
                .hasMessage("Invalid parameter 'message': required parameter is missing");
        assertThatThrownBy(() -> task.validateParams(Map.of("channel", "email", "message", "")))
                .isInstanceOf(TaskValidationException.class);
    }

    @Test
    @DisplayName("Message length and delay range are bounded")
    void bounds() {
        Map<String, Object> params = new HashMap<>();
        params.put("channel", "slack");
        params.put("message", "x".repeat(NotifyMockTask.MAX_MESSAGE_LENGTH + 1));
        assertThatThrownBy(() -> task.validateParams(params)).isInstanceOf(TaskValidationException.class);

        params.put("message", "ok");
        params.put("delay", 11);
        assertThatThrownBy(() -> task.validateParams(params))
                .isInstanceOf(TaskValidationException.class)
                .hasMessageContaining("delay");

        params.put("delay", "soon");
        assertThatThrownBy(() -> task.validateParams(params)).isInstanceOf(TaskValidationException.class);
    }

    @Test
    @DisplayName("Descriptor advertises the channel enumeration")
    void descriptor() {
        assertThat(NotifyMockTask.descriptor().getType()).isEqualTo(NotifyMockTask.TYPE);
        assertThat(NotifyMockTask.descriptor().getParamsSchema()).containsKeys("properties", "required");
    }
}
