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

import com.cognite.client.config.AuthConfig;
import com.cognite.client.servicesV1.RequestParameters;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Base class for request providers targeting {@code {host}/api/v1/projects/{project}/{endpoint}}.
 *
 * The endpoint may contain path parameters in braces, i.e. {@code raw/dbs/{dbName}/tables}. They are resolved
 * from the root request parameters, url encoded as single path segments and excluded from the query string and
 * the request body.
 */
abstract class GenericRequestProvider implements RequestProvider, Serializable {
    protected static final String apiVersion = "v1";

    protected final Logger LOG = LoggerFactory.getLogger(getClass());
    // Logger identifier per instance
    protected final String randomIdString = RandomStringUtils.randomAlphanumeric(5);

    public abstract String getSdkIdentifier();
    public abstract String getAppIdentifier();
    public abstract String getSessionIdentifier();
    public abstract String getEndpoint();
    public abstract RequestParameters getRequestParameters();

    protected Request.Builder buildGenericRequest() throws Exception {
        Preconditions.checkState(this.getAppIdentifier().length() < 40
                , "App identifier out of range. Length must be < 40.");
        Preconditions.checkState(this.getSdkIdentifier().length() < 40
                , "SDK identifier out of range. Length must be < 40.");
        Preconditions.checkState(this.getSessionIdentifier().length() < 40
                , "Session identifier out of range. Length must be < 40.");
        AuthConfig authConfig = getRequestParameters().getAuthConfig();
        Preconditions.checkState(null != authConfig.getCredentials(),
                "No credentials are configured for the request.");

        return new Request.Builder()
                .header("Accept", "application/json")
                .header(authConfig.getCredentials().getHeaderName(), authConfig.getCredentials().getHeaderValue())
                .header("x-cdp-sdk", this.getSdkIdentifier())
                .header("x-cdp-app", this.getAppIdentifier())
                .header("x-cdp-clienttag", this.getSessionIdentifier())
                .url(buildGenericUrl().build());
    }

    /**
     * Returns a url builder for the host root, without any path.
     */
    protected HttpUrl.Builder buildHostUrl() {
        HttpUrl hostUrl = HttpUrl.parse(getRequestParameters().getAuthConfig().getHost());
        Preconditions.checkState(null != hostUrl,
                "Invalid host url: " + getRequestParameters().getAuthConfig().getHost());
        return hostUrl.newBuilder()
                .encodedPath("/")
                .query(null);
    }

    protected HttpUrl.Builder buildGenericUrl() {
        String project = getRequestParameters().getAuthConfig().getProject();
        Preconditions.checkState(null != project && !project.isEmpty(),
                "No project is configured for the request.");

        HttpUrl.Builder urlBuilder = buildHostUrl()
                .addPathSegment("api")
                .addPathSegment(apiVersion)
                .addPathSegment("projects")
                .addPathSegment(project);

        for (String segment : getEndpoint().split("/")) {
            if (isPathParameter(segment)) {
                String name = segment.substring(1, segment.length() - 1);
                Object value = getRequestParameters().getRequestParameters().get(name);
                Preconditions.checkState(value instanceof String && !((String) value).isEmpty(),
                        "Request parameters must include " + name + " with a non-empty string value.");
                urlBuilder.addPathSegment((String) value);
            } else if (!segment.isEmpty()) {
                urlBuilder.addPathSegment(segment);
            }
        }
        return urlBuilder;
    }

    /**
     * Returns the names of the path parameters of the endpoint.
     */
    protected ImmutableSet<String> getPathParameterNames() {
        ImmutableSet.Builder<String> names = ImmutableSet.builder();
        for (String segment : getEndpoint().split("/")) {
            if (isPathParameter(segment)) {
                names.add(segment.substring(1, segment.length() - 1));
            }
        }
        return names.build();
    }

    /**
     * Returns the root request parameters which are not consumed by the url path.
     */
    protected Map<String, Object> getNonPathParameters() {
        Map<String, Object> parameters = new LinkedHashMap<>(getRequestParameters().getRequestParameters());
        parameters.keySet().removeAll(getPathParameterNames());
        return parameters;
    }

    /**
     * Formats a parameter value for the query string. Lists are comma separated.
     */
    protected static String toQueryValue(Object value) {
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(","));
        }
        return String.valueOf(value);
    }

    private static boolean isPathParameter(String segment) {
        return segment.length() > 2 && segment.startsWith("{") && segment.endsWith("}");
    }

    abstract static class Builder<B extends Builder<B>> {
        public abstract B setSdkIdentifier(String value);
        public abstract B setAppIdentifier(String value);
        public abstract B setSessionIdentifier(String value);
        public abstract B setEndpoint(String value);
        public abstract B setRequestParameters(RequestParameters value);
    }
}
