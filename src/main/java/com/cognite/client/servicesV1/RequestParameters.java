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

package com.cognite.client.servicesV1;

import com.cognite.client.config.AuthConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.*;

/**
 * This class represents the query / request parameters of an api request.
 *
 * The parameters mirror the Cognite API Json request body, with {@code Map<String, Object>} as the Json object
 * and {@code List} as the Json array. Request providers decide which root parameters end up in the url path,
 * the query string or the request body.
 */
@AutoValue
public abstract class RequestParameters implements Serializable {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static Builder builder() {
        return new AutoValue_RequestParameters.Builder()
                .setRequestParameters(ImmutableMap.of())
                .setAuthConfig(AuthConfig.create());
    }

    public static RequestParameters create() {
        return RequestParameters.builder().build();
    }

    /**
     * Returns the root level request parameters.
     */
    public abstract ImmutableMap<String, Object> getRequestParameters();

    /**
     * Returns the host, project and credentials of the request.
     */
    public abstract AuthConfig getAuthConfig();

    abstract Builder toBuilder();

    /**
     * Returns the list of items. This is typically the main payload of a write request (create or delete).
     *
     * @return the items, or an empty list if no items have been set.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getItems() {
        Object items = getRequestParameters().get("items");
        if (items instanceof List) {
            return (List<Map<String, Object>>) items;
        }
        return Collections.emptyList();
    }

    public String getRequestParametersAsJson() throws JsonProcessingException {
        return objectMapper.writeValueAsString(getRequestParameters());
    }

    /**
     * Adds a new parameter to the root level. An existing parameter with the same key is replaced.
     *
     * Valid values are String, Integer, Long, Double, Boolean, Map (Json object) and List (Json array).
     *
     * @param key the parameter name.
     * @param value the parameter value.
     * @return the request parameters with the parameter added.
     */
    public RequestParameters withRootParameter(String key, Object value) {
        checkNotNull(key, "Key cannot be null");
        checkNotNull(value, "Value cannot be null for key: " + key);
        Map<String, Object> parameters = new LinkedHashMap<>(getRequestParameters());
        parameters.put(key, value);
        return toBuilder().setRequestParameters(ImmutableMap.copyOf(parameters)).build();
    }

    /**
     * Returns the request parameters without the given root parameter.
     *
     * @param key the parameter name.
     * @return the request parameters with the parameter removed.
     */
    public RequestParameters withoutRootParameter(String key) {
        Map<String, Object> parameters = new LinkedHashMap<>(getRequestParameters());
        parameters.remove(key);
        return toBuilder().setRequestParameters(ImmutableMap.copyOf(parameters)).build();
    }

    /**
     * Sets the items array. Each {@code Map} represents a Json object and may contain {@code null} values.
     *
     * @param items the items.
     * @return the request parameters with the items set.
     */
    public RequestParameters withItems(List<? extends Map<String, Object>> items) {
        checkNotNull(items, "Items cannot be null");
        List<Map<String, Object>> itemsCopy = new ArrayList<>(items.size());
        for (Map<String, Object> item : items) {
            itemsCopy.add(Collections.unmodifiableMap(new LinkedHashMap<>(item)));
        }
        return withRootParameter("items", Collections.unmodifiableList(itemsCopy));
    }

    /**
     * Sets the host, project and credentials of the request.
     *
     * @param config the auth config.
     * @return the request parameters with the config set.
     */
    public RequestParameters withAuthConfig(AuthConfig config) {
        checkNotNull(config, "Auth config cannot be null");
        return toBuilder().setAuthConfig(config).build();
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setRequestParameters(ImmutableMap<String, Object> value);
        abstract Builder setAuthConfig(AuthConfig value);

        abstract RequestParameters build();
    }
}
