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

package com.cognite.client;

import com.cognite.client.config.OAuthClientCredentials;
import com.cognite.client.config.ResourceType;
import com.cognite.client.dto.ClientCredentials;
import com.cognite.client.dto.CreatedSession;
import com.cognite.client.dto.Session;
import com.cognite.client.dto.SessionStatus;
import com.cognite.client.dto.SessionType;
import com.cognite.client.servicesV1.ConnectorConstants;
import com.cognite.client.servicesV1.ConnectorServiceV1;
import com.cognite.client.servicesV1.RequestParameters;
import com.cognite.client.servicesV1.ResponseItems;
import com.cognite.client.servicesV1.parser.SessionParser;
import com.cognite.client.util.TaskExecutor;
import com.cognite.client.util.TasksSummary;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * This class represents the Cognite sessions api endpoint.
 *
 * A session lets a service act on behalf of the caller. Creating a session returns a nonce which can be
 * handed over to the service.
 */
@AutoValue
public abstract class Sessions extends ApiBase {
    private static final int MAX_REVOKE_BATCH_SIZE = 100;

    private static Builder builder() {
        return new AutoValue_Sessions.Builder();
    }

    /**
     * Constructs a new {@link Sessions} object using the provided client configuration.
     *
     * This method is intended for internal use--SDK clients should always use {@link CogniteClient}
     * as the entry point to this class.
     *
     * @param client The {@link CogniteClient} to use for configuration settings.
     * @return the sessions api object.
     */
    public static Sessions of(CogniteClient client) {
        return Sessions.builder()
                .setClient(client)
                .build();
    }

    /**
     * Creates a session based on the credentials of the client.
     *
     * A client authenticating with OAuth client credentials creates a client credentials session. Otherwise,
     * a token exchange session is created.
     *
     * @return the created session.
     * @throws Exception
     */
    public CreatedSession create() throws Exception {
        return create(null, SessionType.DEFAULT);
    }

    /**
     * Creates a session from a set of client credentials.
     *
     * @param credentials the client credentials.
     * @return the created session.
     * @throws Exception
     */
    public CreatedSession create(ClientCredentials credentials) throws Exception {
        return create(credentials, SessionType.CLIENT_CREDENTIALS);
    }

    /**
     * Creates a session of the given type.
     *
     * @param sessionType the session type.
     * @return the created session.
     * @throws Exception
     */
    public CreatedSession create(SessionType sessionType) throws Exception {
        return create(null, sessionType);
    }

    /**
     * Creates a session.
     *
     * @param credentials the client credentials. Required for {@link SessionType#CLIENT_CREDENTIALS}.
     * @param sessionType the session type.
     * @return the created session.
     * @throws Exception
     */
    public CreatedSession create(@Nullable ClientCredentials credentials, SessionType sessionType) throws Exception {
        String loggingPrefix = "create() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkNotNull(sessionType, "The session type cannot be null.");

        SessionType type = sessionType;
        ClientCredentials clientCredentials = credentials;
        if (type == SessionType.DEFAULT) {
            if (null != clientCredentials) {
                type = SessionType.CLIENT_CREDENTIALS;
            } else if (getClient().getCredentials() instanceof OAuthClientCredentials) {
                OAuthClientCredentials oAuth = (OAuthClientCredentials) getClient().getCredentials();
                clientCredentials = ClientCredentials.of(oAuth.getClientId(), oAuth.getClientSecret());
                type = SessionType.CLIENT_CREDENTIALS;
            } else {
                type = SessionType.TOKEN_EXCHANGE;
            }
        }

        Map<String, Object> createItem;
        switch (type) {
            case CLIENT_CREDENTIALS:
                Preconditions.checkArgument(null != clientCredentials,
                        "Client credentials are required for a client credentials session.");
                createItem = SessionParser.toRequestCreateItem(clientCredentials);
                break;
            case TOKEN_EXCHANGE:
                createItem = ImmutableMap.<String, Object>of("tokenExchange", true);
                break;
            case ONESHOT_TOKEN_EXCHANGE:
                createItem = ImmutableMap.<String, Object>of("oneshotTokenExchange", true);
                break;
            default:
                throw new IllegalArgumentException("Not a supported session type: " + type);
        }

        RequestParameters request = RequestParameters.create()
                .withItems(List.of(createItem));
        List<String> results = getClient().getConnectorService()
                .createSessions()
                .getItems(addAuthInfo(request))
                .getResultsItems();
        if (results.isEmpty()) {
            String message = loggingPrefix + "The api did not return the created session.";
            LOG.error(message);
            throw new Exception(message);
        }

        CreatedSession session = SessionParser.parseCreatedSession(results.get(0));
        LOG.info(loggingPrefix + "Created session {} of type {}. Duration: {}",
                session.getId(),
                type,
                Duration.between(startInstant, Instant.now()));
        return session;
    }

    /**
     * Returns all sessions.
     *
     * @return an {@link Iterator} to page through the sessions.
     * @throws Exception
     */
    public Iterator<List<Session>> list() throws Exception {
        return list(null);
    }

    /**
     * Returns the sessions with the given status.
     *
     * @param status the status to filter on. {@code null} returns all sessions.
     * @return an {@link Iterator} to page through the sessions.
     * @throws Exception
     */
    public Iterator<List<Session>> list(@Nullable SessionStatus status) throws Exception {
        RequestParameters request = RequestParameters.create()
                .withRootParameter("limit", ConnectorConstants.DEFAULT_MAX_BATCH_SIZE);
        if (null != status) {
            request = request.withRootParameter("status", status.name());
        }
        return AdapterIterator.of(listJson(ResourceType.SESSION, request, null, null), this::parseSession);
    }

    /**
     * Retrieves sessions by id.
     *
     * @param ids the session ids.
     * @return the sessions.
     * @throws Exception
     */
    public List<Session> retrieve(List<Long> ids) throws Exception {
        String loggingPrefix = "retrieve() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkNotNull(ids, "The id list cannot be null.");
        if (ids.isEmpty()) {
            return List.of();
        }

        RequestParameters request = RequestParameters.create()
                .withItems(toIdItems(ids));
        List<String> results = getClient().getConnectorService()
                .readSessionsById()
                .getItems(addAuthInfo(request))
                .getResultsItems();

        List<Session> sessions = new ArrayList<>(results.size());
        for (String json : results) {
            sessions.add(SessionParser.parseSession(json));
        }
        LOG.info(loggingPrefix + "Retrieved {} sessions. Duration: {}",
                sessions.size(),
                Duration.between(startInstant, Instant.now()));
        return sessions;
    }

    /**
     * Revokes sessions. The services acting on behalf of the sessions lose access.
     *
     * @param ids the ids of the sessions to revoke.
     * @return the revoked sessions.
     * @throws Exception
     */
    public List<Session> revoke(List<Long> ids) throws Exception {
        String loggingPrefix = "revoke() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkNotNull(ids, "The id list cannot be null.");

        ConnectorServiceV1.ItemWriter revokeWriter = getClient().getConnectorService().revokeSessions();
        List<List<Long>> batches = Lists.partition(ids, MAX_REVOKE_BATCH_SIZE);
        TasksSummary<List<Long>, List<Session>> summary = TaskExecutor.execute(batch -> {
                    RequestParameters request = RequestParameters.create()
                            .withItems(toIdItems(batch));
                    ResponseItems<String> response = revokeWriter.writeItems(addAuthInfo(request));
                    if (!response.isSuccessful()) {
                        throw response.toApiException();
                    }
                    List<Session> revoked = new ArrayList<>();
                    for (String json : response.getResultsItems()) {
                        revoked.add(SessionParser.parseSession(json));
                    }
                    return revoked;
                },
                batches,
                getClient().getTaskExecutor());

        summary.<Long>throwCompoundExceptionIfFailedTasks(batch -> batch, id -> id);
        List<Session> revoked = summary.joinedResults(batchResult -> batchResult);
        LOG.info(loggingPrefix + "Revoked {} sessions. Duration: {}",
                revoked.size(),
                Duration.between(startInstant, Instant.now()));
        return revoked;
    }

    private static List<Map<String, Object>> toIdItems(List<Long> ids) {
        return ids.stream()
                .map(id -> ImmutableMap.<String, Object>of("id", id))
                .collect(Collectors.toList());
    }

    /*
    Wrapping the parser because we need to handle the exception--an ugly workaround since lambdas don't
    deal very well with exceptions.
     */
    private Session parseSession(String json) {
        try {
            return SessionParser.parseSession(json);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    @AutoValue.Builder
    abstract static class Builder extends ApiBase.Builder<Builder> {
        abstract Sessions build();
    }
}
