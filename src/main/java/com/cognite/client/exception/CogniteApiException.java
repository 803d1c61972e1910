/*
 * Copyright (c) 2020 Cognite AS
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.cognite.client.exception;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Raised when the Cognite API responds with a non-successful status code.
 *
 * The exception carries the http status code, the request id (when the api reports one) and the
 * {@code missing} / {@code duplicated} items from the error payload. Items are represented
 * as maps, e.g. {@code {"externalId": "my-id"}}.
 */
public class CogniteApiException extends CogniteException {
    private static final Logger LOG = LoggerFactory.getLogger(CogniteApiException.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final int code;
    @Nullable
    private final String requestId;
    private final ImmutableList<Map<String, Object>> missing;
    private final ImmutableList<Map<String, Object>> duplicated;

    public CogniteApiException(String message,
                               int code,
                               @Nullable String requestId,
                               List<Map<String, Object>> missing,
                               List<Map<String, Object>> duplicated) {
        super(message);
        this.code = code;
        this.requestId = requestId;
        this.missing = ImmutableList.copyOf(missing);
        this.duplicated = ImmutableList.copyOf(duplicated);
    }

    public CogniteApiException(String message, int code, @Nullable String requestId) {
        this(message, code, requestId, ImmutableList.of(), ImmutableList.of());
    }

    /**
     * Builds an exception from an api error response.
     *
     * The body is expected to follow the api error format:
     * {@code {"error": {"code": 400, "message": "...", "missing": [...], "duplicated": [...]}}}. A body which
     * cannot be parsed is used verbatim as the message.
     *
     * @param code The http status code.
     * @param responseBody The response body.
     * @param requestId The {@code x-request-id} header value.
     * @return the exception.
     */
    public static CogniteApiException fromResponse(int code, String responseBody, @Nullable String requestId) {
        String message = responseBody;
        List<Map<String, Object>> missing = new ArrayList<>();
        List<Map<String, Object>> duplicated = new ArrayList<>();
        try {
            JsonNode error = objectMapper.readTree(responseBody).path("error");
            if (error.path("message").isTextual()) {
                message = error.path("message").textValue();
            }
            missing = parseItems(error.path("missing"));
            duplicated = parseItems(error.path("duplicated"));
        } catch (Exception e) {
            LOG.debug("Error response is not a json error payload. Using the raw body as message: {}", e.getMessage());
        }

        return new CogniteApiException(message, code, requestId, missing, duplicated);
    }

    private static List<Map<String, Object>> parseItems(JsonNode node) {
        List<Map<String, Object>> items = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isObject()) {
                    items.add(ImmutableMap.copyOf(objectMapper.convertValue(item, Map.class)));
                }
            }
        }
        return items;
    }

    public int getCode() {
        return code;
    }

    @Nullable
    public String getRequestId() {
        return requestId;
    }

    public ImmutableList<Map<String, Object>> getMissing() {
        return missing;
    }

    public ImmutableList<Map<String, Object>> getDuplicated() {
        return duplicated;
    }

    @Override
    public String getMessage() {
        return String.format("%s | code: %d | X-Request-ID: %s", super.getMessage(), code, requestId);
    }
}
