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
import com.cognite.client.util.TaskExecutor;
import com.cognite.client.util.TasksSummary;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;

/**
 * This class represents the Cognite Raw tables endpoint.
 *
 * It provides methods for listing, creating and deleting the tables of a database.
 */
@AutoValue
public abstract class RawTables extends ApiBase {
    private static final int MAX_DELETE_BATCH_SIZE = 1000;

    private static Builder builder() {
        return new AutoValue_RawTables.Builder();
    }

    /**
     * Constructs a new {@link RawTables} object using the provided client configuration.
     *
     * This method is intended for internal use--SDK clients should always use {@link CogniteClient}
     * as the entry point to this class.
     *
     * @param client The {@link CogniteClient} to use for configuration settings.
     * @return the tables api object.
     */
    public static RawTables of(CogniteClient client) {
        return RawTables.builder()
                .setClient(client)
                .build();
    }

    /**
     * Returns all tables (names) in a database.
     *
     * @param dbName the data base to list tables for.
     * @return an {@link Iterator} to page through the table names.
     * @throws Exception
     */
    public Iterator<List<String>> list(String dbName) throws Exception {
        return list(dbName, null);
    }

    /**
     * Returns table names in a database, up to a total limit.
     *
     * @param dbName the data base to list tables for.
     * @param limit the max number of names to return. {@code null} returns all tables.
     * @return an {@link Iterator} to page through the table names.
     * @throws Exception
     */
    public Iterator<List<String>> list(String dbName, @Nullable Long limit) throws Exception {
        Preconditions.checkArgument(null != dbName && !dbName.isEmpty(),
                "You must specify a data base name.");
        Preconditions.checkArgument(null == limit || limit >= 0, "The limit cannot be negative.");
        RequestParameters request = RequestParameters.create()
                .withRootParameter("dbName", dbName)
                .withRootParameter("limit", ConnectorConstants.DEFAULT_MAX_BATCH_SIZE);
        return AdapterIterator.of(listJson(ResourceType.RAW_TABLE, request, null, limit), RawDatabases::parseName);
    }

    /**
     * Creates tables in a Raw database.
     *
     * @param dbName The Raw database to create tables in.
     * @param tables The tables to create.
     * @param ensureParent If set to true, will create the database if it doesn't exist from before.
     * @return The created table names.
     * @throws Exception
     */
    public List<String> create(String dbName, List<String> tables, boolean ensureParent) throws Exception {
        String loggingPrefix = "create() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkArgument(null != dbName && !dbName.isEmpty(),
                "You must specify a data base name.");
        Preconditions.checkNotNull(tables, "The table list cannot be null.");
        if (tables.isEmpty()) {
            return tables;
        }

        ConnectorServiceV1.ItemWriter createWriter = getClient().getConnectorService().writeRawTableNames();
        RequestParameters request = RequestParameters.create()
                .withRootParameter("dbName", dbName)
                .withRootParameter("ensureParent", ensureParent)
                .withItems(RawDatabases.toNameItems(tables));
        ResponseItems<String> response = createWriter.writeItems(addAuthInfo(request));
        if (!response.isSuccessful()) {
            LOG.error(loggingPrefix + "Failed to create tables in {}. {}", dbName, response.getResponseBodyAsString());
            throw response.toApiException();
        }

        LOG.info(loggingPrefix + "Created {} tables in {}. Duration: {}",
                tables.size(),
                dbName,
                Duration.between(startInstant, Instant.now()));
        return tables;
    }

    /**
     * Deletes a set of tables from a Raw database.
     *
     * @param dbName The Raw database to delete tables from.
     * @param tables The tables to delete.
     * @return The deleted table names.
     * @throws Exception
     */
    public List<String> delete(String dbName, List<String> tables) throws Exception {
        String loggingPrefix = "delete() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkArgument(null != dbName && !dbName.isEmpty(),
                "You must specify a data base name.");
        Preconditions.checkNotNull(tables, "The table list cannot be null.");

        ConnectorServiceV1.ItemWriter deleteWriter = getClient().getConnectorService().deleteRawTableNames();
        List<List<String>> batches = Lists.partition(tables, MAX_DELETE_BATCH_SIZE);
        TasksSummary<List<String>, List<String>> summary = TaskExecutor.execute(batch -> {
                    RequestParameters request = RequestParameters.create()
                            .withRootParameter("dbName", dbName)
                            .withItems(RawDatabases.toNameItems(batch));
                    ResponseItems<String> response = deleteWriter.writeItems(addAuthInfo(request));
                    if (!response.isSuccessful()) {
                        throw response.toApiException();
                    }
                    return batch;
                },
                batches,
                getClient().getTaskExecutor());

        summary.<String>throwCompoundExceptionIfFailedTasks(batch -> batch, name -> name);
        LOG.info(loggingPrefix + "Deleted {} tables from {}. Duration: {}",
                tables.size(),
                dbName,
                Duration.between(startInstant, Instant.now()));
        return tables;
    }

    @AutoValue.Builder
    abstract static class Builder extends ApiBase.Builder<Builder> {
        abstract RawTables build();
    }
}
