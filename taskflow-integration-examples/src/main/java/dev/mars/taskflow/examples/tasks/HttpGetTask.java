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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.taskflow.core.exceptions.TaskValidationException;
import dev.mars.taskflow.task.Task;
import dev.mars.taskflow.task.TaskContext;
import dev.mars.taskflow.task.TaskDescriptor;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Performs an HTTP GET request.
 *
 * <p>Parameters: {@code url} (http or https), optional {@code headers} (map of strings) and
 * optional {@code timeout_seconds} (default 30). The result holds the {@code status_code}, the
 * first {@value #BODY_PREVIEW_LENGTH} characters of the {@code body} and, when the body is a JSON
 * object or array, the parsed document under {@code data}. Non-2xx responses are returned, not
 * thrown.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class HttpGetTask implements Task {

    private static final Logger logger = Logger.getLogger(HttpGetTask.class.getName());

    public static final String TYPE = "http_get";
    public static final int BODY_PREVIEW_LENGTH = 500;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final HttpClient httpClient;

    public HttpGetTask() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpGetTask(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "HTTP client cannot be null");
    }

    public static TaskDescriptor descriptor() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("url", Map.of("type", "string", "title", "URL", "format", "uri"));
        properties.put("headers", Map.of("type", "object", "title", "Headers",
                "additionalProperties", Map.of("type", "string")));
        properties.put("timeout_seconds", Map.of("type", "integer", "title", "Timeout in seconds",
                "default", DEFAULT_TIMEOUT_SECONDS, "minimum", 1));

        return TaskDescriptor.builder()
                .type(TYPE)
                .displayName("HTTP GET Request")
                .description("Performs an HTTP GET request against a URL")
                .category("Input")
                .icon("globe")
                .paramsSchema(Map.of("type", "object", "properties", properties, "required", List.of("url")))
                .build();
    }

    @Override
    public void validateParams(Map<String, Object> params) throws TaskValidationException {
        toUri(TaskParams.requireText(params, "url"));
        headers(params);
        timeout(params);
    }

    @Override
    public Object execute(TaskContext context, Map<String, Object> params) throws Exception {
        URI uri = toUri((String) params.get("url"));
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout(params))
                .GET();
        headers(params).forEach(request::header);

        logger.fine("GET " + uri);
        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        String body = response.body() != null ? response.body() : "";
        logger.info("GET " + uri + " returned HTTP " + response.statusCode());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status_code", response.statusCode());
        result.put("body", body.length() > BODY_PREVIEW_LENGTH ? body.substring(0, BODY_PREVIEW_LENGTH) : body);
        Object data = parseJson(body);
        if (data != null) {
            result.put("data", data);
        }
        return result;
    }

    private static URI toUri(String url) throws TaskValidationException {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw new TaskValidationException("url", "must be an absolute http or https URL");
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new TaskValidationException("url", "is not a valid URI: " + e.getMessage());
        }
    }

    private static Map<String, String> headers(Map<String, Object> params) throws TaskValidationException {
        Object value = params.get("headers");
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new TaskValidationException("headers", "must be an object");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (!(entry.getValue() instanceof String)) {
                throw new TaskValidationException("headers", "value of '" + entry.getKey() + "' must be a string");
            }
            headers.put(String.valueOf(entry.getKey()), (String) entry.getValue());
        }
        return headers;
    }

    private static Duration timeout(Map<String, Object> params) throws TaskValidationException {
        double seconds = TaskParams.optionalNumber(params, "timeout_seconds", DEFAULT_TIMEOUT_SECONDS, 1, 3600);
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    /**
     * Parsed JSON object or array, or {@code null} when the body is not one.
     */
    private static Object parseJson(String body) {
        String trimmed = body.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return null;
        }
        try {
            return objectMapper.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            logger.fine("Response body is not JSON: " + e.getOriginalMessage());
            return null;
        }
    }
}
