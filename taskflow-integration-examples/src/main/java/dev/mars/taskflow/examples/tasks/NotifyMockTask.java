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
import dev.mars.taskflow.task.Task;
import dev.mars.taskflow.task.TaskContext;
import dev.mars.taskflow.task.TaskDescriptor;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Simulates sending a notification to a channel. Sleeps for {@code delay} seconds to stand in
 * for network latency and returns what would have been sent.
 *
 * <p>Parameters: {@code channel} (one of {@link #CHANNELS}), {@code message} (1 to 500
 * characters) and optional {@code delay} in seconds (0 to 10, default 0.5).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class NotifyMockTask implements Task {

    private static final Logger logger = Logger.getLogger(NotifyMockTask.class.getName());

    public static final String TYPE = "notify_mock";
    public static final List<String> CHANNELS = List.of("email", "slack", "console", "webhook");
    public static final int MAX_MESSAGE_LENGTH = 500;
    public static final double DEFAULT_DELAY_SECONDS = 0.5;

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public NotifyMockTask() {
        this(Clock.systemDefaultZone());
    }

    public NotifyMockTask(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public static TaskDescriptor descriptor() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("channel", Map.of("type", "string", "title", "Notification channel", "enum", CHANNELS));
        properties.put("message", Map.of("type", "string", "title", "Message", "minLength", 1,
                "maxLength", MAX_MESSAGE_LENGTH));
        properties.put("delay", Map.of("type", "number", "title", "Delay in seconds",
                "default", DEFAULT_DELAY_SECONDS, "minimum", 0, "maximum", 10));

        return TaskDescriptor.builder()
                .type(TYPE)
                .displayName("Mock Notification")
                .description("Simulates sending a notification to a channel such as Slack or email")
                .category("Notification")
                .icon("bell")
                .paramsSchema(Map.of("type", "object", "properties", properties,
                        "required", List.of("channel", "message")))
                .build();
    }

    @Override
    public void validateParams(Map<String, Object> params) throws TaskValidationException {
        String channel = TaskParams.requireText(params, "channel");
        if (!CHANNELS.contains(channel)) {
            throw new TaskValidationException("channel", "must be one of " + CHANNELS);
        }
        String message = TaskParams.requireText(params, "message");
        if (message.length() > MAX_MESSAGE_LENGTH) {
            throw new TaskValidationException("message", "must be at most " + MAX_MESSAGE_LENGTH + " characters");
        }
        TaskParams.optionalNumber(params, "delay", DEFAULT_DELAY_SECONDS, 0, 10);
    }

    @Override
    public void before(Map<String, Object> params) {
        logger.fine("Sending notification to " + params.get("channel"));
    }

    @Override
    public Object execute(TaskContext context, Map<String, Object> params) throws Exception {
        String channel = (String) params.get("channel");
        String message = (String) params.get("message");
        double delay = TaskParams.optionalNumber(params, "delay", DEFAULT_DELAY_SECONDS, 0, 10);

        Thread.sleep(Math.round(delay * 1000));

        logger.info("Notification sent to " + channel + ": " + preview(message));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("sent", true);
        result.put("channel", channel);
        result.put("message", message);
        result.put("timestamp", LocalDateTime.now(clock).format(TIMESTAMP_FORMAT));
        return result;
    }

    @Override
    public void onError(Throwable error) {
        logger.warning("Notification failed: " + error.getMessage());
    }

    private static String preview(String message) {
        return message.length() > 50 ? message.substring(0, 50) + "..." : message;
    }
}
