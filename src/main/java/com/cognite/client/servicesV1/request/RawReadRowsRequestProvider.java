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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads rows from a CDF.Raw table.
 *
 * The {@code columns} parameter is a list of column names. An empty list selects no columns (only the
 * row keys) and is sent as {@code ","}.
 */
@AutoValue
public abstract class RawReadRowsRequestProvider extends GenericRequestProvider {
    private static final String ENDPOINT = "raw/dbs/{dbName}/tables/{tableName}/rows";

    public static Builder builder() {
        return new AutoValue_RawReadRowsRequestProvider.Builder()
                .setEndpoint(ENDPOINT)
                .setRequestParameters(RequestParameters.create())
                .setSdkIdentifier(ConnectorConstants.SDK_IDENTIFIER)
                .setAppIdentifier(ConnectorConstants.DEFAULT_APP_IDENTIFIER)
                .setSessionIdentifier(ConnectorConstants.DEFAULT_SESSION_IDENTIFIER);
    }

    public abstract Builder toBuilder();

    public RawReadRowsRequestProvider withRequestParameters(RequestParameters parameters) {
        Preconditions.checkNotNull(parameters, "Request parameters cannot be null.");
        Preconditions.checkArgument(parameters.getRequestParameters().get("dbName") instanceof String,
                "Request parameters must include dbName with a string value");
        Preconditions.checkArgument(parameters.getRequestParameters().get("tableName") instanceof String,
                "Request parameters must include tableName with a string value");
        return toBuilder().setRequestParameters(parameters).build();
    }

    public Request buildRequest(Optional<String> cursor) throws Exception {
        Request.Builder requestBuilder = buildGenericRequest();
        HttpUrl.Builder urlBuilder = buildGenericUrl();

        for (Map.Entry<String, Object> entry : getNonPathParameters().entrySet()) {
            if (entry.getKey().equals("columns")) {
                urlBuilder.addQueryParameter("columns", toColumnsValue(entry.getValue()));
            } else {
                urlBuilder.addQueryParameter(entry.getKey(), toQueryValue(entry.getValue()));
            }
        }
        cursor.ifPresent(value -> urlBuilder.setQueryParameter("cursor", value));

        return requestBuilder.url(urlBuilder.build()).get().build();
    }

    private static String toColumnsValue(Object columns) {
        if (columns instanceof List && ((List<?>) columns).isEmpty()) {
            return ",";
        }
        return toQueryValue(columns);
    }

    @AutoValue.Builder
    public static abstract class Builder extends GenericRequestProvider.Builder<Builder> {
        public abstract RawReadRowsRequestProvider build();
    }
}
