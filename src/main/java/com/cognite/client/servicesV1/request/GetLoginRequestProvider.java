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
import okhttp3.Request;

import java.util.Optional;

/**
 * Requests the login status of the credentials: {@code GET {host}/login/status}. This endpoint is not
 * project scoped.
 */
@AutoValue
public abstract class GetLoginRequestProvider extends GenericRequestProvider {

    public static Builder builder() {
        return new AutoValue_GetLoginRequestProvider.Builder()
                .setEndpoint("login/status")
                .setRequestParameters(RequestParameters.create())
                .setSdkIdentifier(ConnectorConstants.SDK_IDENTIFIER)
                .setAppIdentifier(ConnectorConstants.DEFAULT_APP_IDENTIFIER)
                .setSessionIdentifier(ConnectorConstants.DEFAULT_SESSION_IDENTIFIER);
    }

    public abstract Builder toBuilder();

    public GetLoginRequestProvider withRequestParameters(RequestParameters parameters) {
        Preconditions.checkNotNull(parameters, "Request parameters cannot be null.");
        return toBuilder().setRequestParameters(parameters).build();
    }

    @Override
    protected okhttp3.HttpUrl.Builder buildGenericUrl() {
        return buildHostUrl().addPathSegments(getEndpoint());
    }

    public Request buildRequest(Optional<String> cursor) throws Exception {
        return buildGenericRequest().get().build();
    }

    @AutoValue.Builder
    public static abstract class Builder extends GenericRequestProvider.Builder<Builder> {
        public abstract GetLoginRequestProvider build();
    }
}
