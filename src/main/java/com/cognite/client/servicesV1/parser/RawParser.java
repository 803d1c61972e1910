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

import com.cognite.client.dto.RawRow;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * This class contains a set of methods to help parsing raw rows between Cognite api representations
 * (json) and typed objects.
 */
public class RawParser {
    static final String logPrefix = "RawParser - ";
    static final int MAX_LOG_ELEMENT_LENGTH = 1000;
    static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses a raw row json string to a {@link RawRow}.
     *
     * @param dbName the database the row belongs to.
     * @param tableName the table the row belongs to.
     * @param json the row json.
     * @return the parsed row.
     * @throws Exception if the json does not represent a row.
     */
    public static RawRow parseRawRow(String dbName, String tableName, String json) throws Exception {
        Preconditions.checkNotNull(dbName, logPrefix + "Database name cannot be null");
        Preconditions.checkNotNull(tableName, logPrefix + "Table name cannot be null");

        JsonNode root = objectMapper.readTree(json);
        RawRow.Builder rowBuilder = RawRow.builder()
                .setDbName(dbName)
                .setTableName(tableName);

        if (root.path("key").isTextual()) {
            rowBuilder.setKey(root.get("key").textValue());
        } else {
            throw new Exception(logPrefix + "Unable to parse attribute: key. Item excerpt: "
                    + json.substring(0, Math.min(json.length(), MAX_LOG_ELEMENT_LENGTH)));
        }

        if (root.path("lastUpdatedTime").isIntegralNumber()) {
            rowBuilder.setLastUpdatedTime(root.get("lastUpdatedTime").longValue());
        }

        if (root.path("columns").isObject()) {
            Map<String, Object> columns = objectMapper.convertValue(root.get("columns"),
                    new TypeReference<LinkedHashMap<String, Object>>() {});
            rowBuilder.setColumns(columns);
        }

        return rowBuilder.build();
    }

    /**
     * Parses the name of a Raw database or table item.
     *
     * @param json the database or table json.
     * @return the name.
     * @throws Exception if the json does not carry a name.
     */
    public static String parseName(String json) throws Exception {
        JsonNode root = objectMapper.readTree(json);
        if (root.path("name").isTextual()) {
            return root.get("name").textValue();
        }
        throw new Exception(logPrefix + "Unable to parse attribute: name. Item excerpt: "
                + json.substring(0, Math.min(json.length(), MAX_LOG_ELEMENT_LENGTH)));
    }

    /**
     * Builds a request insert item object from {@link RawRow}.
     *
     * @param element the row.
     * @return the insert item.
     */
    public static Map<String, Object> toRequestInsertItem(RawRow element) {
        Preconditions.checkArgument(null != element.getKey() && !element.getKey().isEmpty(),
                logPrefix + "The row key cannot be empty.");
        return ImmutableMap.<String, Object>builder()
                .put("key", element.getKey())
                .put("columns", element.getColumns())
                .build();
    }
}
