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

import com.cognite.client.config.ClientConfig;
import com.cognite.client.config.ListConfig;
import com.cognite.client.config.ResourceType;
import com.cognite.client.dto.RawRow;
import com.cognite.client.exception.CogniteApiException;
import com.cognite.client.servicesV1.ConnectorConstants;
import com.cognite.client.servicesV1.ConnectorServiceV1;
import com.cognite.client.servicesV1.ItemReader;
import com.cognite.client.servicesV1.RequestParameters;
import com.cognite.client.servicesV1.ResponseItems;
import com.cognite.client.servicesV1.parser.RawParser;
import com.cognite.client.util.TaskExecutor;
import com.cognite.client.util.TasksSummary;
import com.google.auto.value.AutoValue;
import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.math.LongMath;

import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * This class represents the Cognite Raw rows endpoint.
 *
 * It provides methods for interacting with the Raw row endpoint.
 */
@AutoValue
public abstract class RawRows extends ApiBase {
    private static final int MAX_WRITE_BATCH_SIZE = 5000;
    private static final int MAX_DELETE_BATCH_SIZE = 1000;
    // Concurrent reads use at most one partition per this many rows of a finite limit.
    private static final long MIN_ROWS_PER_PARTITION = 20_000L;
    private static final int MIN_CONCURRENT_CHUNK_SIZE = 1000;

    private static Builder builder() {
        return new AutoValue_RawRows.Builder();
    }

    /**
     * Constructs a new {@link RawRows} object using the provided client configuration.
     *
     * This method is intended for internal use--SDK clients should always use {@link CogniteClient}
     * as the entry point to this class.
     *
     * @param client The {@link CogniteClient} to use for configuration settings.
     * @return the rows api object.
     */
    public static RawRows of(CogniteClient client) {
        return RawRows.builder()
                .setClient(client)
                .build();
    }

    /**
     * Returns all rows from a table.
     *
     * The rows are read concurrently over {@link ClientConfig#getNoListPartitions()} partitions.
     *
     * @param dbName the database to list rows from.
     * @param tableName the table to list rows from.
     * @return an iterator to page through the rows. Close it if you stop reading before the end.
     * @throws Exception
     */
    public CloseableIterator<List<RawRow>> list(String dbName,
                                                String tableName) throws Exception {
        return list(dbName, tableName, RequestParameters.create());
    }

    /**
     * Returns a set of rows from a table.
     *
     * The rows are read concurrently over {@link ClientConfig#getNoListPartitions()} partitions. The request
     * parameters may specify {@code minLastUpdatedTime} (exclusive), {@code maxLastUpdatedTime} (inclusive)
     * and {@code columns}.
     *
     * @param dbName the database to list rows from.
     * @param tableName the table to list rows from.
     * @param requestParameters the column and filter specification for the rows.
     * @return an iterator to page through the rows. Close it if you stop reading before the end.
     * @throws Exception
     */
    public CloseableIterator<List<RawRow>> list(String dbName,
                                                String tableName,
                                                RequestParameters requestParameters) throws Exception {
        return list(dbName, tableName, requestParameters, ListConfig.create()
                .withPartitions(getClient().getClientConfig().getNoListPartitions()));
    }

    /**
     * Returns a set of rows from a table.
     *
     * <p>When {@link ListConfig#getPartitions()} is not set, the rows are read serially. Each result list holds
     * exactly {@code chunkSize} rows when a chunk size is set (the last one may hold fewer).
     *
     * <p>When partitions are set, the table is split into key ranges via the cursors endpoint and the ranges
     * are read concurrently. No ordering is guaranteed across partitions. The number of partitions is capped
     * by the number of workers and, for a finite limit, by one partition per 20 000 rows. The chunk size is
     * at least 1000 (default 10 000) and a finite limit must not be smaller than an explicit chunk size.
     *
     * <p>In both cases the total number of rows is capped by {@link ListConfig#getLimit()}.
     *
     * @param dbName the database to list rows from.
     * @param tableName the table to list rows from.
     * @param requestParameters the column and filter specification for the rows.
     * @param listConfig the chunking, limit and concurrency settings.
     * @return an iterator to page through the rows. Close it if you stop reading before the end.
     * @throws Exception
     */
    public CloseableIterator<List<RawRow>> list(String dbName,
                                                String tableName,
                                                RequestParameters requestParameters,
                                                ListConfig listConfig) throws Exception {
        Preconditions.checkArgument(dbName != null && !dbName.isEmpty(),
                "You must specify a data base name.");
        Preconditions.checkArgument(tableName != null && !tableName.isEmpty(),
                "You must specify a table name.");
        Preconditions.checkNotNull(requestParameters, "The request parameters cannot be null.");
        Preconditions.checkNotNull(listConfig, "The list config cannot be null.");

        if (null == listConfig.getPartitions()) {
            return listSerial(dbName, tableName, requestParameters, listConfig);
        }
        return listConcurrent(dbName, tableName, requestParameters, listConfig);
    }

    /**
     * Returns the rows read from an explicit set of cursors.
     *
     * This is intended for advanced use cases where you need granular control of the parallel retrieval from
     * Raw--for example in distributed processing frameworks. The cursors are obtained via
     * {@link #retrieveCursors(String, String, RequestParameters)} and are read concurrently.
     *
     * @param dbName the database to list rows from.
     * @param tableName the table to list rows from.
     * @param requestParameters the column specification for the rows.
     * @param cursors the cursors to read.
     * @return an iterator to page through the rows. Close it if you stop reading before the end.
     * @throws Exception
     */
    public CloseableIterator<List<RawRow>> list(String dbName,
                                                String tableName,
                                                RequestParameters requestParameters,
                                                String... cursors) throws Exception {
        Preconditions.checkArgument(dbName != null && !dbName.isEmpty(),
                "You must specify a data base name.");
        Preconditions.checkArgument(tableName != null && !tableName.isEmpty(),
                "You must specify a table name.");
        Preconditions.checkArgument(null != cursors && cursors.length > 0,
                "You must specify at least one cursor.");

        return FanOutIterator.of(partitionReaders(dbName, tableName, requestParameters, Arrays.asList(cursors),
                        ConnectorConstants.DEFAULT_MAX_BATCH_SIZE_RAW), getClient().getPartitionExecutor())
                .withBackpressureUnit(getClient().getClientConfig().getBackpressureUnit());
    }

    /**
     * Returns the rows from a table as a single list.
     *
     * When {@link ListConfig#getPartitions()} is not set, an unlimited read is concurrent over
     * {@link ClientConfig#getNoListPartitions()} partitions while a limited read is serial.
     *
     * @param dbName the database to list rows from.
     * @param tableName the table to list rows from.
     * @param requestParameters the column and filter specification for the rows.
     * @param listConfig the limit and concurrency settings.
     * @return the rows.
     * @throws Exception
     */
    public List<RawRow> listAll(String dbName,
                                String tableName,
                                RequestParameters requestParameters,
                                ListConfig listConfig) throws Exception {
        String loggingPrefix = "listAll() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkNotNull(listConfig, "The list config cannot be null.");

        ListConfig config = listConfig;
        if (null == listConfig.getPartitions()) {
            if (null == listConfig.getLimit()) {
                config = listConfig.withPartitions(getClient().getClientConfig().getNoListPartitions());
            } else if (listConfig.getLimit() > 0) {
                // Serial read without splitting the result into small chunks.
                config = listConfig.withChunkSize((int) Math.min(listConfig.getLimit(), Integer.MAX_VALUE));
            }
        }

        List<RawRow> results = new ArrayList<>();
        try (CloseableIterator<List<RawRow>> iterator = list(dbName, tableName, requestParameters, config)) {
            iterator.forEachRemaining(results::addAll);
        }
        LOG.info(loggingPrefix + "Retrieved {} rows from {}.{}. Duration: {}",
                results.size(),
                dbName,
                tableName,
                Duration.between(startInstant, Instant.now()));
        return results;
    }

    /**
     * Retrieves cursors for parallel retrieval of rows from Raw.
     *
     * This is intended for advanced use cases where you need granular control of the parallel retrieval from
     * Raw--for example in distributed processing frameworks. Most scenarios should just use
     * {@code list} directly as that will automatically handle parallelization for you.
     *
     * @param dbName The database to retrieve row cursors from.
     * @param tableName The table to retrieve row cursors from.
     * @param requestParameters Hosts query parameters like max and min time stamps and number of cursors to request.
     * @return A list of cursors.
     * @throws Exception
     */
    public List<String> retrieveCursors(String dbName,
                                        String tableName,
                                                 RequestParameters requestParameters) throws Exception {
        String loggingPrefix = "retrieveCursors() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkArgument(dbName != null && !dbName.isEmpty(),
                "You must specify a data base name.");
        Preconditions.checkArgument(tableName != null && !tableName.isEmpty(),
                "You must specify a table name.");

        // Build request
        RequestParameters request = requestParameters
                .withRootParameter("dbName", dbName)
                .withRootParameter("tableName", tableName);

        ConnectorServiceV1 connector = getClient().getConnectorService();
        ItemReader<String> cursorItemReader = connector.readCursorsRawRows();
        List<String> results = cursorItemReader
                .getItems(addAuthInfo(request))
                .getResultsItems();

        LOG.info(loggingPrefix + "Retrieved {} cursors. Duration: {}",
                results.size(),
                Duration.between(startInstant, Instant.now()));

        return results;
    }

    /**
     * Retrieves a single row by key.
     *
     * @param dbName The database to read from.
     * @param tableName The table to read from.
     * @param key The row key.
     * @return The row, or an empty {@link Optional} if the row does not exist.
     * @throws Exception
     */
    public Optional<RawRow> retrieve(String dbName, String tableName, String key) throws Exception {
        String loggingPrefix = "retrieve() - ";
        Preconditions.checkArgument(dbName != null && !dbName.isEmpty(),
                "You must specify a data base name.");
        Preconditions.checkArgument(tableName != null && !tableName.isEmpty(),
                "You must specify a table name.");
        Preconditions.checkArgument(key != null && !key.isEmpty(),
                "You must specify a row key.");

        RequestParameters request = RequestParameters.create()
                .withRootParameter("dbName", dbName)
                .withRootParameter("tableName", tableName)
                .withRootParameter("key", key);
        try {
            List<String> results = getClient().getConnectorService()
                    .readRawRow()
                    .getItems(addAuthInfo(request))
                    .getResultsItems();
            if (results.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(RawParser.parseRawRow(dbName, tableName, results.get(0)));
        } catch (CogniteApiException e) {
            if (e.getCode() == 404) {
                LOG.debug(loggingPrefix + "Row {} not found in {}.{}", key, dbName, tableName);
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Creates rows in raw tables.
     *
     * The rows are de-duplicated on database, table and key. If a row key appears several times, the last
     * occurrence is written.
     *
     * @param rows The rows to upsert.
     * @param ensureParent Set to true to create the row tables if they don't already exist.
     * @return The upserted rows.
     * @throws Exception
     */
    public List<RawRow> upsert(List<RawRow> rows, boolean ensureParent) throws Exception {
        String loggingPrefix = "upsert() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkArgument(null != rows,
                "Rows list cannot be null.");
        LOG.info(loggingPrefix + "Received {} rows to upsert.",
                rows.size());

        ConnectorServiceV1.ItemWriter upsertWriter = getClient().getConnectorService().writeRawRows();
        List<List<RawRow>> upsertBatches = groupAndBatch(rows, MAX_WRITE_BATCH_SIZE);

        TasksSummary<List<RawRow>, List<RawRow>> summary = TaskExecutor.execute(batch -> {
                    List<Map<String, Object>> upsertItems = batch.stream()
                            .map(RawParser::toRequestInsertItem)
                            .collect(Collectors.toList());
                    RequestParameters request = RequestParameters.create()
                            .withItems(upsertItems)
                            .withRootParameter("ensureParent", ensureParent)
                            .withRootParameter("dbName", batch.get(0).getDbName())
                            .withRootParameter("tableName", batch.get(0).getTableName());

                    ResponseItems<String> response = upsertWriter.writeItems(addAuthInfo(request));
                    if (!response.isSuccessful()) {
                        LOG.debug(loggingPrefix + "Upsert items request failed: {}", response.getResponseBodyAsString());
                        throw response.toApiException();
                    }
                    return batch;
                },
                upsertBatches,
                getClient().getTaskExecutor());

        if (!summary.getExceptions().isEmpty()) {
            LOG.error(loggingPrefix + "Failed to upsert rows. {} batches failed, {} batches unknown, "
                            + "{} batches completed.",
                    summary.getFailedTasks().size(),
                    summary.getUnknownTasks().size(),
                    summary.getSuccessfulTasks().size());
        }
        summary.<RawRow>throwCompoundExceptionIfFailedTasks(batch -> batch, RawRow::getKey);

        LOG.info(loggingPrefix + "Successfully upserted {} rows within a duration of {}.",
                rows.size(),
                Duration.between(startInstant, Instant.now()).toString());
        return rows;
    }

    /**
     * Creates rows in raw tables.
     *
     * If the row tables don't exist from before, they will also be created.
     *
     * @param rows The rows to upsert.
     * @return The upserted rows.
     * @throws Exception
     */
    public List<RawRow> upsert(List<RawRow> rows) throws Exception {
        return upsert(rows, true);
    }

    /**
     * Deletes a set of rows from a Raw table.
     *
     * @param dbName The database to delete rows from.
     * @param tableName The table to delete rows from.
     * @param keys The keys of the rows to delete.
     * @return The deleted rows
     * @throws Exception
     */
    public List<RawRow> delete(String dbName, String tableName, List<String> keys) throws Exception {
        Preconditions.checkNotNull(keys, "The key list cannot be null.");
        List<RawRow> rows = keys.stream()
                .map(key -> RawRow.of(dbName, tableName, key, ImmutableMap.of()))
                .collect(Collectors.toList());
        return delete(rows);
    }

    /**
     * Deletes a set of rows from Raw tables.
     *
     * @param rows The row keys to delete.
     * @return The deleted rows
     * @throws Exception
     */
    public List<RawRow> delete(List<RawRow> rows) throws Exception {
        String loggingPrefix = "delete() - ";
        Instant startInstant = Instant.now();
        Preconditions.checkArgument(null != rows,
                "Rows list cannot be null.");
        LOG.info(loggingPrefix + "Received {} rows to delete.",
                rows.size());

        ConnectorServiceV1.ItemWriter deleteWriter = getClient().getConnectorService().deleteRawRows();
        List<List<RawRow>> deleteBatches = groupAndBatch(rows, MAX_DELETE_BATCH_SIZE);

        TasksSummary<List<RawRow>, List<RawRow>> summary = TaskExecutor.execute(batch -> {
                    List<Map<String, Object>> deleteItems = batch.stream()
                            .map(row -> ImmutableMap.<String, Object>of("key", row.getKey()))
                            .collect(Collectors.toList());
                    RequestParameters request = RequestParameters.create()
                            .withItems(deleteItems)
                            .withRootParameter("dbName", batch.get(0).getDbName())
                            .withRootParameter("tableName", batch.get(0).getTableName());

                    ResponseItems<String> response = deleteWriter.writeItems(addAuthInfo(request));
                    if (!response.isSuccessful()) {
                        LOG.debug(loggingPrefix + "Delete items request failed: {}", response.getResponseBodyAsString());
                        throw response.toApiException();
                    }
                    return batch;
                },
                deleteBatches,
                getClient().getTaskExecutor());

        if (!summary.getExceptions().isEmpty()) {
            LOG.error(loggingPrefix + "Failed to delete rows. {} batches failed, {} batches unknown, "
                            + "{} batches completed.",
                    summary.getFailedTasks().size(),
                    summary.getUnknownTasks().size(),
                    summary.getSuccessfulTasks().size());
        }
        summary.<RawRow>throwCompoundExceptionIfFailedTasks(batch -> batch, RawRow::getKey);

        LOG.info(loggingPrefix + "Successfully deleted {} rows within a duration of {}.",
                rows.size(),
                Duration.between(startInstant, Instant.now()).toString());
        return rows;
    }

    private CloseableIterator<List<RawRow>> listSerial(String dbName,
                                                       String tableName,
                                                       RequestParameters requestParameters,
                                                       ListConfig listConfig) throws Exception {
        Integer chunkSize = listConfig.getChunkSize();
        int pageSize = Math.min(null == chunkSize ? ConnectorConstants.DEFAULT_MAX_BATCH_SIZE_RAW : chunkSize,
                ConnectorConstants.DEFAULT_MAX_BATCH_SIZE_RAW);
        LOG.debug("listSerial() - Reading rows from {}.{} with page size {} and limit {}",
                dbName, tableName, pageSize, listConfig.getLimit());

        RequestParameters request = requestParameters
                .withRootParameter("dbName", dbName)
                .withRootParameter("tableName", tableName)
                .withRootParameter("limit", pageSize);

        Iterator<List<RawRow>> results = AdapterIterator.of(
                listJson(ResourceType.RAW_ROW, request, null, listConfig.getLimit()),
                RawRowParser.of(dbName, tableName));
        if (null != chunkSize) {
            results = ChunkingIterator.of(results, chunkSize);
        }
        return CloseableIterator.wrap(results);
    }

    private CloseableIterator<List<RawRow>> listConcurrent(String dbName,
                                                           String tableName,
                                                           RequestParameters requestParameters,
                                                           ListConfig listConfig) throws Exception {
        String loggingPrefix = "listConcurrent() - ";
        Long limit = listConfig.getLimit();
        Integer chunkSize = listConfig.getChunkSize();
        if (null != limit && null != chunkSize && limit < chunkSize) {
            throw new IllegalArgumentException(String.format("When using partitions, a finite limit (%d) must be "
                    + "at least as large as the chunk size (%d).", limit, chunkSize));
        }
        if (null != limit && limit == 0L) {
            return CloseableIterator.wrap(Collections.<List<RawRow>>emptyIterator());
        }

        ClientConfig clientConfig = getClient().getClientConfig();
        int noPartitions = Math.min(listConfig.getPartitions(), clientConfig.getNoWorkers());
        if (null != limit) {
            noPartitions = (int) Math.min(noPartitions,
                    LongMath.divide(limit, MIN_ROWS_PER_PARTITION, RoundingMode.CEILING));
        }
        int chunk = Math.max(MIN_CONCURRENT_CHUNK_SIZE,
                null == chunkSize ? ConnectorConstants.DEFAULT_MAX_BATCH_SIZE_RAW : chunkSize);

        RequestParameters cursorRequest = RequestParameters.create()
                .withRootParameter("numberOfCursors", noPartitions);
        for (String timeFilter : ImmutableList.of("minLastUpdatedTime", "maxLastUpdatedTime")) {
            Object value = requestParameters.getRequestParameters().get(timeFilter);
            if (null != value) {
                cursorRequest = cursorRequest.withRootParameter(timeFilter, value);
            }
        }
        List<String> cursors = retrieveCursors(dbName, tableName, cursorRequest);
        LOG.info(loggingPrefix + "Reading rows from {}.{} over {} partitions. Chunk size: {}, limit: {}",
                dbName, tableName, cursors.size(), chunk, limit);
        if (cursors.isEmpty()) {
            return CloseableIterator.wrap(Collections.<List<RawRow>>emptyIterator());
        }

        return FanOutIterator.of(partitionReaders(dbName, tableName, requestParameters, cursors, chunk),
                        getClient().getPartitionExecutor())
                .withLimit(limit)
                .withBackpressureUnit(clientConfig.getBackpressureUnit());
    }

    /*
    Builds one reader per cursor. The cursor carries the time filters, so only the columns are added to the
    partition requests.
     */
    private List<Iterator<List<RawRow>>> partitionReaders(String dbName,
                                                          String tableName,
                                                          RequestParameters requestParameters,
                                                          List<String> cursors,
                                                          int chunkSize) throws Exception {
        RequestParameters request = RequestParameters.create()
                .withRootParameter("dbName", dbName)
                .withRootParameter("tableName", tableName)
                .withRootParameter("limit", Math.min(chunkSize, ConnectorConstants.DEFAULT_MAX_BATCH_SIZE_RAW));
        Object columns = requestParameters.getRequestParameters().get("columns");
        if (null != columns) {
            request = request.withRootParameter("columns", columns);
        }

        List<Iterator<List<RawRow>>> readers = new ArrayList<>(cursors.size());
        for (String cursor : cursors) {
            readers.add(ChunkingIterator.of(
                    AdapterIterator.of(listJson(ResourceType.RAW_ROW, request, cursor, null),
                            RawRowParser.of(dbName, tableName)),
                    chunkSize));
        }
        return readers;
    }

    /**
     * Group and batch {@link RawRow}.
     *
     * The rows will be de-duplicated and grouped by database and table. This aligns well with upsert and delete operations
     * where each API request must target a specific db and table.
     *
     * @param rows The rows to group and batch
     * @param maxBatchSize The max batch size of the output.
     * @return A list of batches with rows.
     */
    private List<List<RawRow>> groupAndBatch(Collection<RawRow> rows, int maxBatchSize) {
        String loggingPrefix = "groupAndBatch() - ";
        Instant startInstant = Instant.now();
        LOG.debug(loggingPrefix + "Received {} rows to group and batch.",
                rows.size());

        Collection<RawRow> deduplicated = deduplicate(rows);

        // Group by db and table
        Map<List<String>, List<RawRow>> tableMap = new LinkedHashMap<>();
        for (RawRow row : deduplicated) {
            tableMap.computeIfAbsent(ImmutableList.of(row.getDbName(), row.getTableName()), key -> new ArrayList<>())
                    .add(row);
        }

        // Split into batches
        List<List<RawRow>> allBatches = new ArrayList<>();
        for (List<RawRow> group : tableMap.values()) {
            List<RawRow> batch = new ArrayList<>();
            for (RawRow row : group) {
                batch.add(row);
                if (batch.size() >= maxBatchSize) {
                    allBatches.add(batch);
                    batch = new ArrayList<>();
                }
            }
            if (batch.size() > 0) {
                allBatches.add(batch);
            }
        }

        LOG.debug(loggingPrefix + "Finished grouping {} rows into {} batches. Duration: {}",
                rows.size(),
                allBatches.size(),
                Duration.between(startInstant, Instant.now()).toString());

        return allBatches;
    }

    /**
     * Deduplicates a collection of {@link RawRow}.
     *
     * The rows are deduplicated based on a natural key of dbName, tableName and row key. The last row wins.
     *
     * @param rows The rows to deduplicate.
     * @return The deduplicated rows.
     */
    private Collection<RawRow> deduplicate(Collection<RawRow> rows) {
        String loggingPrefix = "deduplicate() - ";
        Instant startInstant = Instant.now();
        LOG.debug(loggingPrefix + "Received {} rows to deduplicate.",
                rows.size());

        // Group by db, table and row key
        Map<List<String>, RawRow> keyMap = new LinkedHashMap<>();
        for (RawRow row : rows) {
            keyMap.put(ImmutableList.of(row.getDbName(), row.getTableName(), row.getKey()), row);
        }

        LOG.debug(loggingPrefix + "Finished deduplicating {} input rows into {} resulting rows. Duration: {}",
                rows.size(),
                keyMap.size(),
                Duration.between(startInstant, Instant.now()).toString());

        return keyMap.values();
    }

    /*
    Helper class to parse raw rows from Json representation to typed objects.
     */
    @AutoValue
    abstract static class RawRowParser implements Function<String, RawRow> {

        private static Builder builder() {
            return new AutoValue_RawRows_RawRowParser.Builder();
        }

        public static RawRowParser of(String dbName, String tableName) {
            return RawRowParser.builder()
                    .setDbName(dbName)
                    .setTableName(tableName)
                    .build();
        }

        abstract String getDbName();
        abstract String getTableName();

        @Override
        public RawRow apply(String json) {
            try {
                return RawParser.parseRawRow(getDbName(), getTableName(), json);
            } catch (Exception e) {
                throw new RuntimeException(e);
            }

        }

        @AutoValue.Builder
        abstract static class Builder {
            abstract Builder setDbName(String value);
            abstract Builder setTableName(String value);

            abstract RawRowParser build();
        }
    }

    @AutoValue.Builder
    abstract static class Builder extends ApiBase.Builder<Builder> {
        abstract RawRows build();
    }
}
