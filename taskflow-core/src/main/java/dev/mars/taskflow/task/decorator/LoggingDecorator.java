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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.taskflow.task.TaskContext;
import dev.mars.taskflow.task.TaskExecutable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs the parameters going into the inner executable and the result or error coming out.
 *
 * <p>Parameters whose key contains one of the configured sensitive fragments (case-insensitive)
 * are replaced by {@value #HIDDEN}. Top-level string values longer than the truncation limit are
 * cut and suffixed with {@code "..."}. Only the logged copy is altered; the inner executable
 * receives the original parameters and the caller the original result.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class LoggingDecorator extends TaskDecorator {
    private static final Logger logger = Logger.getLogger(LoggingDecorator.class.getName());

    public static final String HIDDEN = "***HIDDEN***";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private final int truncateLength;
    private final Set<String> sensitiveKeys;

    public LoggingDecorator(TaskExecutable inner, String taskType, int truncateLength, Set<String> sensitiveKeys) {
        super(inner, taskType);
        if (truncateLength <= 0) {
            throw new IllegalArgumentException("Truncate length must be positive: " + truncateLength);
        }
        this.truncateLength = truncateLength;
        this.sensitiveKeys = Set.copyOf(sensitiveKeys);
    }

    public static DecoratorFactory factory(int truncateLength, Set<String> sensitiveKeys) {
        return (inner, taskType) -> new LoggingDecorator(inner, taskType, truncateLength, sensitiveKeys);
    }

    @Override
    public Object run(TaskContext context, Map<String, Object> params) throws Exception {
        if (logger.isLoggable(Level.INFO)) {
            logger.info("[" + getTaskType() + "] Parameters:\n" + render(sanitize(params)));
        }
        try {
            Object result = getInner().run(context, params);
            if (logger.isLoggable(Level.INFO)) {
                logger.info("[" + getTaskType() + "] Result:\n" + render(truncate(result)));
            }
            return result;
        } catch (Exception | Error e) {
            logger.warning("[" + getTaskType() + "] Error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            throw e;
        }
    }

    /**
     * Copy of the parameters with sensitive values hidden and long strings truncated.
     */
    Map<String, Object> sanitize(Map<String, Object> params) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        if (params == null) {
            return sanitized;
        }
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            if (isSensitive(entry.getKey())) {
                sanitized.put(entry.getKey(), HIDDEN);
            } else {
                sanitized.put(entry.getKey(), truncateValue(entry.getValue()));
            }
        }
        return sanitized;
    }

    Object truncate(Object result) {
        if (result instanceof Map) {
            Map<Object, Object> truncated = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) result).entrySet()) {
                truncated.put(entry.getKey(), truncateValue(entry.getValue()));
            }
            return truncated;
        }
        return truncateValue(result);
    }

    private Object truncateValue(Object value) {
        if (value instanceof String) {
            String text = (String) value;
            if (text.length() > truncateLength) {
                return text.substring(0, truncateLength) + "...";
            }
        }
        return value;
    }

    private boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase();
        for (String fragment : sensitiveKeys) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private static String render(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.log(Level.FINE, "Falling back to toString rendering", e);
            return String.valueOf(value);
        }
    }
}
