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

package com.cognite.client.servicesV1.parser;

import com.cognite.client.dto.ClientCredentials;
import com.cognite.client.dto.CreatedSession;
import com.cognite.client.dto.Session;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Parses sessions between Cognite api Json and typed objects.
 */
public class SessionParser {
    static final String logPrefix = "SessionParser - ";
    static final ObjectMapper objectMapper = new ObjectMapper();

    public static Session parseSession(String json) throws Exception {
        JsonNode root = objectMapper.readTree(json);
        Session.Builder builder = Session.builder()
                .setId(requireId(root, json))
                .setType(requireText(root, "type", json))
                .setStatus(requireText(root, "status", json));

        if (root.path("creationTime").isIntegralNumber()) {
            builder.setCreationTime(root.get("creationTime").longValue());
        }
        if (root.path("expirationTime").isIntegralNumber()) {
            builder.setExpirationTime(root.get("expirationTime").longValue());
        }
        if (root.path("clientId").isTextual()) {
            builder.setClientId(root.get("clientId").textValue());
        }
        return builder.build();
    }

    public static CreatedSession parseCreatedSession(String json) throws Exception {
        JsonNode root = objectMapper.readTree(json);
        CreatedSession.Builder builder = CreatedSession.builder()
                .setId(requireId(root, json))
                .setType(requireText(root, "type", json))
                .setStatus(requireText(root, "status", json))
                .setNonce(requireText(root, "nonce", json));

        if (root.path("clientId").isTextual()) {
            builder.setClientId(root.get("clientId").textValue());
        }
        return builder.build();
    }

    /**
     * Builds the create item for a client credentials session.
     */
    public static Map<String, Object> toRequestCreateItem(ClientCredentials credentials) {
        return ImmutableMap.of(
                "clientId", credentials.getClientId(),
                "clientSecret", credentials.getClientSecret());
    }

    private static long requireId(JsonNode root, String json) throws Exception {
        if (!root.path("id").isIntegralNumber()) {
            throw new Exception(logPrefix + "Unable to parse attribute: id. Item: " + json);
        }
        return root.get("id").longValue();
    }

    private static String requireText(JsonNode root, String attribute, String json) throws Exception {
        if (!root.path(attribute).isTextual()) {
            throw new Exception(logPrefix + "Unable to parse attribute: " + attribute + ". Item excerpt: "
                    + json.substring(0, Math.min(json.length(), 200)));
        }
        return root.get(attribute).textValue();
    }
}
