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

package com.cognite.client.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Authenticates requests with an access token obtained via the OAuth 2.0 client credentials grant.
 *
 * The token is cached and refreshed when it is within {@code tokenExpiryLeeway} of its expiry.
 * Instances are thread safe.
 */
@AutoValue
public abstract class OAuthClientCredentials implements CredentialProvider {
    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final Duration DEFAULT_TOKEN_EXPIRY_LEEWAY = Duration.ofSeconds(30);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final OkHttpClient DEFAULT_HTTP_CLIENT = new OkHttpClient.Builder()
            .connectTimeout(90, TimeUnit.SECONDS)
            .readTimeout(90, TimeUnit.SECONDS)
            .writeTimeout(90, TimeUnit.SECONDS)
            .build();

    private final Logger LOG = LoggerFactory.getLogger(this.getClass());
    private final String loggingPrefix = "OAuthClientCredentials [" + RandomStringUtils.randomAlphanumeric(5) + "] -";

    @Nullable
    private transient String accessToken = null;
    @Nullable
    private transient Instant tokenExpiry = null;

    private static Builder builder() {
        return new AutoValue_OAuthClientCredentials.Builder()
                .setTokenExpiryLeeway(DEFAULT_TOKEN_EXPIRY_LEEWAY)
                .setHttpClient(DEFAULT_HTTP_CLIENT);
    }

    /**
     * Creates client credentials for the given OAuth client.
     *
     * @param clientId the client id.
     * @param clientSecret the client secret.
     * @param tokenUrl the token endpoint of the identity provider.
     * @param scopes the scopes to request.
     * @return the credentials object.
     */
    public static OAuthClientCredentials of(String clientId,
                                            String clientSecret,
                                            String tokenUrl,
                                            List<String> scopes) {
        Preconditions.checkArgument(null != clientId && !clientId.isEmpty(), "The client id cannot be empty.");
        Preconditions.checkArgument(null != clientSecret && !clientSecret.isEmpty(),
                "The client secret cannot be empty.");
        Preconditions.checkArgument(null != tokenUrl && !tokenUrl.isEmpty(), "The token url cannot be empty.");
        Preconditions.checkNotNull(scopes, "The scopes cannot be null.");

        return OAuthClientCredentials.builder()
                .setClientId(clientId)
                .setClientSecret(clientSecret)
                .setTokenUrl(tokenUrl)
                .setScopes(ImmutableList.copyOf(scopes))
                .build();
    }

    abstract Builder toBuilder();
    public abstract String getClientId();
    public abstract String getClientSecret();
    public abstract String getTokenUrl();
    public abstract ImmutableList<String> getScopes();
    public abstract Duration getTokenExpiryLeeway();
    abstract OkHttpClient getHttpClient();

    /**
     * Sets the leeway before token expiry at which the token is refreshed.
     *
     * @param leeway the refresh leeway.
     * @return the credentials object with the setting applied.
     */
    public OAuthClientCredentials withTokenExpiryLeeway(Duration leeway) {
        Preconditions.checkArgument(null != leeway && !leeway.isNegative(), "The leeway cannot be negative.");
        return toBuilder().setTokenExpiryLeeway(leeway).build();
    }

    /**
     * Sets the http client used for calling the token endpoint.
     *
     * @param client the http client.
     * @return the credentials object with the setting applied.
     */
    public OAuthClientCredentials withHttpClient(OkHttpClient client) {
        Preconditions.checkNotNull(client, "The http client cannot be null.");
        return toBuilder().setHttpClient(client).build();
    }

    @Override
    public String getHeaderName() {
        return AUTHORIZATION_HEADER;
    }

    @Override
    public synchronized String getHeaderValue() throws Exception {
        if (null == accessToken || null == tokenExpiry
                || Instant.now().plus(getTokenExpiryLeeway()).isAfter(tokenExpiry)) {
            refreshToken();
        }
        return "Bearer " + accessToken;
    }

    private void refreshToken() throws Exception {
        Instant startInstant = Instant.now();
        LOG.debug(loggingPrefix + "Requesting a new access token from {}", getTokenUrl());

        FormBody.Builder formBuilder = new FormBody.Builder()
                .add("grant_type", "client_credentials")
                .add("client_id", getClientId())
                .add("client_secret", getClientSecret());
        if (!getScopes().isEmpty()) {
            formBuilder.add("scope", String.join(" ", getScopes()));
        }

        Request request = new Request.Builder()
                .url(getTokenUrl())
                .header("Accept", "application/json")
                .post(formBuilder.build())
                .build();

        try (Response response = getHttpClient().newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                String message = String.format(loggingPrefix + "Failed to obtain access token. Response code: %d. %s",
                        response.code(), body);
                LOG.error(message);
                throw new Exception(message);
            }

            JsonNode root = objectMapper.readTree(body);
            if (!root.path("access_token").isTextual()) {
                String message = loggingPrefix + "The token response does not contain an access token.";
                LOG.error(message);
                throw new Exception(message);
            }
            accessToken = root.path("access_token").textValue();
            tokenExpiry = Instant.now().plusSeconds(root.path("expires_in").asLong(3600));
        }

        LOG.info(loggingPrefix + "Obtained a new access token. Expires at {}. Duration: {}",
                tokenExpiry,
                Duration.between(startInstant, Instant.now()));
    }

    @Override
    public String toString() {
        return "OAuthClientCredentials{clientId=" + getClientId() + ", tokenUrl=" + getTokenUrl()
                + ", scopes=" + getScopes() + "}";
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setClientId(String value);
        abstract Builder setClientSecret(String value);
        abstract Builder setTokenUrl(String value);
        abstract Builder setScopes(ImmutableList<String> value);
        abstract Builder setTokenExpiryLeeway(Duration value);
        abstract Builder setHttpClient(OkHttpClient value);

        abstract OAuthClientCredentials build();
    }
}
