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

package com.cognite.client.servicesV1.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Parses the {@code items} array and the {@code nextCursor} of a Json response.
 *
 * Each item is returned as its Json string. Textual items (i.e. the cursors returned by the Raw cursors
 * endpoint) are returned as their text value.
 */
@AutoValue
public abstract class JsonItemResponseParser implements ResponseParser<String> {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Logger LOG = LoggerFactory.getLogger(JsonItemResponseParser.class);

    public static JsonItemResponseParser create() {
        return new AutoValue_JsonItemResponseParser();
    }

    @Override
    public Optional<String> extractNextCursor(byte[] payload) throws Exception {
        JsonNode node = objectMapper.readTree(payload).path("nextCursor");
        if (node.isTextual() && !node.textValue().isEmpty()) {
            LOG.debug("Next cursor found: {}", node.textValue());
            return Optional.of(node.textValue());
        }
        return Optional.empty();
    }

    @Override
    public ImmutableList<String> extractItems(byte[] payload) throws Exception {
        JsonNode items = objectMapper.readTree(payload).path("items");
        if (!items.isArray()) {
            LOG.debug("No items array found in the response.");
            return ImmutableList.of();
        }

        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (JsonNode item : items) {
            if (item.isTextual()) {
                builder.add(item.textValue());
            } else {
                builder.add(item.toString());
            }
        }
        return builder.build();
    }
}
