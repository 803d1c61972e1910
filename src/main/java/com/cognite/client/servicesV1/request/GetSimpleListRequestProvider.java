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
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import okhttp3.HttpUrl;
import okhttp3.Request;

import java.util.Map;
import java.util.Optional;

/**
 * Builds GET requests. The root request parameters (except path parameters) are sent as query parameters,
 * together with the cursor.
 */
@AutoValue
public abstract class GetSimpleListRequestProvider extends GenericRequestProvider {

    public static Builder builder() {
        return new AutoValue_GetSimpleListRequestProvider.Builder()
                .setRequestParameters(RequestParameters.create())
                .setSdkIdentifier(ConnectorConstants.SDK_IDENTIFIER)
                .setAppIdentifier(ConnectorConstants.DEFAULT_APP_IDENTIFIER)
                .setSessionIdentifier(ConnectorConstants.DEFAULT_SESSION_IDENTIFIER);
    }

    public abstract Builder toBuilder();

    public GetSimpleListRequestProvider withRequestParameters(RequestParameters parameters) {
        Preconditions.checkNotNull(parameters, "Request parameters cannot be null.");
        return toBuilder().setRequestParameters(parameters).build();
    }

    public Request buildRequest(Optional<String> cursor) throws Exception {
        Request.Builder requestBuilder = buildGenericRequest();
        HttpUrl.Builder urlBuilder = buildGenericUrl();

        for (Map.Entry<String, Object> entry : getNonPathParameters().entrySet()) {
            urlBuilder.addQueryParameter(entry.getKey(), toQueryValue(entry.getValue()));
        }
        cursor.ifPresent(value -> urlBuilder.setQueryParameter("cursor", value));

        return requestBuilder.url(urlBuilder.build()).get().build();
    }

    @AutoValue.Builder
    public static abstract class Builder extends GenericRequestProvider.Builder<Builder> {
        public abstract GetSimpleListRequestProvider build();
    }
}
