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

package com.cognite.client.servicesV1.request;

import com.cognite.client.servicesV1.ConnectorConstants;
import com.cognite.client.servicesV1.RequestParameters;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.util.Map;
import java.util.Optional;

/**
 * Builds POST requests with a Json body.
 *
 * The root request parameters become the request body, except path parameters and the parameters named in
 * {@code queryParameterNames}, which are sent as query parameters. A cursor is added to the body.
 */
@AutoValue
public abstract class PostJsonRequestProvider extends GenericRequestProvider {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final MediaType JSON = MediaType.get("application/json");

    public static Builder builder() {
        return new AutoValue_PostJsonRequestProvider.Builder()
                .setRequestParameters(RequestParameters.create())
                .setQueryParameterNames(ImmutableSet.of())
                .setSdkIdentifier(ConnectorConstants.SDK_IDENTIFIER)
                .setAppIdentifier(ConnectorConstants.DEFAULT_APP_IDENTIFIER)
                .setSessionIdentifier(ConnectorConstants.DEFAULT_SESSION_IDENTIFIER);
    }

    public abstract Builder toBuilder();
    public abstract ImmutableSet<String> getQueryParameterNames();

    public PostJsonRequestProvider withRequestParameters(RequestParameters parameters) {
        Preconditions.checkNotNull(parameters, "Request parameters cannot be null.");
        return toBuilder().setRequestParameters(parameters).build();
    }

    public Request buildRequest(Optional<String> cursor) throws Exception {
        Request.Builder requestBuilder = buildGenericRequest();
        HttpUrl.Builder urlBuilder = buildGenericUrl();

        Map<String, Object> body = getNonPathParameters();
        for (String name : getQueryParameterNames()) {
            Object value = body.remove(name);
            if (null != value) {
                urlBuilder.addQueryParameter(name, toQueryValue(value));
            }
        }
        cursor.ifPresent(value -> body.put("cursor", value));

        String outputJson = objectMapper.writeValueAsString(body);
        LOG.trace("Request body [{}]: {}", randomIdString, outputJson);
        return requestBuilder
                .url(urlBuilder.build())
                .post(RequestBody.Companion.create(outputJson, JSON))
                .build();
    }

    @AutoValue.Builder
    public static abstract class Builder extends GenericRequestProvider.Builder<Builder> {
        public abstract Builder setQueryParameterNames(ImmutableSet<String> value);

        public abstract PostJsonRequestProvider build();
    }
}
