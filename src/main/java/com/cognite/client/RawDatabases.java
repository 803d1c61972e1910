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

import com.cognite.client.config.ResourceType;
import com.cognite.client.servicesV1.ConnectorConstants;
import com.cognite.client.servicesV1.ConnectorServiceV1;
import com.cognite.client.servicesV1.RequestParameters;
import com.cognite.client.servicesV1.ResponseItems;
import com.cognite.client.servicesV1.parser.RawParser;
import com.cognite.client.util.TaskExecutor;
import com.cognite.client.util.TasksSummary;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * This class represents the Cognite Raw databases endpoint.
 *
 * It provides methods for listing, creating and deleting databases.
 */
@AutoValue
public abstract class RawDatabases extends ApiBase {
    private static final int MAX_DELETE_BATCH_SIZE = 1000;

    private static Builder builder() {
        return new AutoValue_RawDatabases.Builder();
    }

    /**
     * Constructs a new {@link RawDatabases} object using the provided client configuration.
     *
     * This method is intended for internal use--SDK clients should always use {@link CogniteClient}
     * as the entry point to this class.
     *
     * @param client The {@link CogniteClient} to use for configuration settings.
     * @return the databases api object.
     */
    public static RawDatabases of(CogniteClient client) {
        return RawDatabases.builder()
                .setClient(client)
                .build();
    }

    /**
     * Returns all database names.
     *
     * @return an {@link Iterator} to page through the database names.
     * @throws Exception
     */
    public Iterator<List<String>> list() throws Exception {
        return list(null);
    }

    /**
     * Returns database names, up to a total limit.
     *
     * @param limit the max number of names to return. {@code null} returns all databases.
     * @return an {@link Iterator} to page through the database names.
     * @throws Exception
     */
    public Iterator<List<String>> list(@Nullable Long limit) throws Exception {
        Preconditions.checkArgument(null == limit || limit >= 0, "The limit cannot be negative.");
        RequestParameters request = RequestParameters.create()
                .withRootParameter("limit", ConnectorConstants.DEFAULT_MAX_BATCH_SIZE);
        return AdapterIterator.of(listJson(ResourceType.RAW_DB, request, null, limit), RawDatabases::parseName);
    }

    /**
     * Creates databases in Raw.
     *
     * @param databases The names of the databases to create.
     * @return The created database names.
     * @throws Exception
     */
    public List<String> create(List<String> databases) throws Exception {
        String loggingPrefix = "create() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkNotNull(databases, "The database list cannot be null.");
        if (databases.isEmpty()) {
            return databases;
        }

        ConnectorServiceV1.ItemWriter createWriter = getClient().getConnectorService().writeRawDbNames();
        RequestParameters request = RequestParameters.create()
                .withItems(toNameItems(databases));
        ResponseItems<String> response = createWriter.writeItems(addAuthInfo(request));
        if (!response.isSuccessful()) {
            LOG.error(loggingPrefix + "Failed to create databases. {}", response.getResponseBodyAsString());
            throw response.toApiException();
        }

        LOG.info(loggingPrefix + "Created {} databases. Duration: {}",
                databases.size(),
                Duration.between(startInstant, Instant.now()));
        return databases;
    }

    /**
     * Deletes a set of databases. The databases must be empty.
     *
     * @param databases The names of the databases to delete.
     * @return The deleted database names.
     * @throws Exception
     */
    public List<String> delete(List<String> databases) throws Exception {
        return delete(databases, false);
    }

    /**
     * Deletes a set of databases.
     *
     * @param databases The names of the databases to delete.
     * @param recursive Set to true to also delete all tables in the databases.
     * @return The deleted database names.
     * @throws Exception
     */
    public List<String> delete(List<String> databases, boolean recursive) throws Exception {
        String loggingPrefix = "delete() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkNotNull(databases, "The database list cannot be null.");

        ConnectorServiceV1.ItemWriter deleteWriter = getClient().getConnectorService().deleteRawDbNames();
        List<List<String>> batches = Lists.partition(databases, MAX_DELETE_BATCH_SIZE);
        TasksSummary<List<String>, List<String>> summary = TaskExecutor.execute(batch -> {
                    RequestParameters request = RequestParameters.create()
                            .withItems(toNameItems(batch))
                            .withRootParameter("recursive", recursive);
                    ResponseItems<String> response = deleteWriter.writeItems(addAuthInfo(request));
                    if (!response.isSuccessful()) {
                        throw response.toApiException();
                    }
                    return batch;
                },
                batches,
                getClient().getTaskExecutor());

        summary.<String>throwCompoundExceptionIfFailedTasks(batch -> batch, name -> name);
        LOG.info(loggingPrefix + "Deleted {} databases. Duration: {}",
                databases.size(),
                Duration.between(startInstant, Instant.now()));
        return databases;
    }

    /*
    Wrapping the parser because we need to handle the exception--an ugly workaround since lambdas don't
    deal very well with exceptions.
     */
    static String parseName(String json) {
        try {
            return RawParser.parseName(json);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    static List<Map<String, Object>> toNameItems(List<String> names) {
        return names.stream()
                .map(name -> ImmutableMap.<String, Object>of("name", name))
                .collect(Collectors.toList());
    }

    @AutoValue.Builder
    abstract static class Builder extends ApiBase.Builder<Builder> {
        abstract RawDatabases build();
    }
}
