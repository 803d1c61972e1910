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

package com.cognite.client.servicesV1;

import com.cognite.client.config.AuthConfig;
import com.cognite.client.config.CredentialProvider;
import com.cognite.client.dto.LoginStatus;
import com.cognite.client.servicesV1.executor.RequestExecutor;
import com.cognite.client.servicesV1.parser.LoginStatusParser;
import com.cognite.client.servicesV1.request.*;
import com.cognite.client.servicesV1.response.JsonItemResponseParser;
import com.cognite.client.servicesV1.response.JsonResponseParser;
import com.cognite.client.servicesV1.response.ResponseParser;
import com.cognite.client.util.TaskExecutor;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * The reader service handles connections to the Cognite REST api.
 *
 * Each endpoint is exposed as a reader or writer composed of a {@link RequestProvider}, which builds the
 * http request, and a {@link ResponseParser}, which extracts the items and cursor from the response.
 */
@AutoValue
public abstract class ConnectorServiceV1 {
    protected final Logger LOG = LoggerFactory.getLogger(this.getClass());
    // Logger identifier per instance
    private final String randomIdString = RandomStringUtils.randomAlphanumeric(5);
    private final String loggingPrefix = "ConnectorService [" + randomIdString + "] -";

    static final OkHttpClient DEFAULT_CLIENT = new OkHttpClient.Builder()
            .connectTimeout(90, TimeUnit.SECONDS)
            .readTimeout(90, TimeUnit.SECONDS)
            .writeTimeout(90, TimeUnit.SECONDS)
            .build();

    public static Builder builder() {
        return new AutoValue_ConnectorServiceV1.Builder()
                .setMaxRetries(ConnectorConstants.DEFAULT_MAX_RETRIES)
                .setMaxRetryBackoff(ConnectorConstants.DEFAULT_MAX_RETRY_BACKOFF)
                .setAppIdentifier(ConnectorConstants.DEFAULT_APP_IDENTIFIER)
                .setSessionIdentifier(ConnectorConstants.DEFAULT_SESSION_IDENTIFIER)
                .setHttpClient(DEFAULT_CLIENT)
                .setExecutorService(ForkJoinPool.commonPool());
    }

    public static ConnectorServiceV1 create() {
        return ConnectorServiceV1.builder().build();
    }

    public static ConnectorServiceV1 create(int newMaxRetries,
                                            String appIdentifier,
                                            String sessionIdentifier) {
        return ConnectorServiceV1.builder()
                .setMaxRetries(newMaxRetries)
                .setAppIdentifier(appIdentifier)
                .setSessionIdentifier(sessionIdentifier)
                .build();
    }

    public abstract int getMaxRetries();
    public abstract Duration getMaxRetryBackoff();
    public abstract String getAppIdentifier();
    public abstract String getSessionIdentifier();
    abstract OkHttpClient getHttpClient();
    abstract ExecutorService getExecutorService();

    abstract Builder toBuilder();

    /**
     * Sets the http client to use for api requests. Returns a {@link ConnectorServiceV1} with
     * the setting applied.
     *
     * @param client The {@link OkHttpClient} to use.
     * @return a {@link ConnectorServiceV1} object with the configuration applied.
     */
    public ConnectorServiceV1 withHttpClient(OkHttpClient client) {
        Preconditions.checkNotNull(client, "The http client cannot be null.");
        return toBuilder().setHttpClient(client).build();
    }

    /**
     * Sets the {@link ExecutorService} to use for multi-threaded api requests. Returns a {@link ConnectorServiceV1}
     * with the setting applied.
     *
     * @param executorService The {@link ExecutorService} to use.
     * @return a {@link ConnectorServiceV1} object with the configuration applied.
     */
    public ConnectorServiceV1 withExecutorService(ExecutorService executorService) {
        Preconditions.checkNotNull(executorService, "The executor service cannot be null.");
        return toBuilder().setExecutorService(executorService).build();
    }

    /**
     * Sets the upper bound of the backoff between retries.
     *
     * @param maxBackoff the max backoff.
     * @return a {@link ConnectorServiceV1} object with the configuration applied.
     */
    public ConnectorServiceV1 withMaxRetryBackoff(Duration maxBackoff) {
        return toBuilder().setMaxRetryBackoff(maxBackoff).build();
    }

    private RequestExecutor buildRequestExecutor() {
        return RequestExecutor.of(getHttpClient())
                .withExecutor(getExecutorService())
                .withMaxRetries(getMaxRetries())
                .withMaxRetryBackoff(getMaxRetryBackoff());
    }

    private GetSimpleListRequestProvider getRequestProvider(String endpoint, RequestParameters parameters) {
        return GetSimpleListRequestProvider.builder()
                .setEndpoint(endpoint)
                .setRequestParameters(parameters)
                .setSdkIdentifier(ConnectorConstants.SDK_IDENTIFIER)
                .setAppIdentifier(getAppIdentifier())
                .setSessionIdentifier(getSessionIdentifier())
                .build();
    }

    private PostJsonRequestProvider postRequestProvider(String endpoint, ImmutableSet<String> queryParameterNames) {
        return PostJsonRequestProvider.builder()
                .setEndpoint(endpoint)
                .setQueryParameterNames(queryParameterNames)
                .setSdkIdentifier(ConnectorConstants.SDK_IDENTIFIER)
                .setAppIdentifier(getAppIdentifier())
                .setSessionIdentifier(getSessionIdentifier())
                .build();
    }

    private ItemWriter itemWriter(RequestProvider requestProvider) {
        return ItemWriter.builder()
                .setRequestProvider(requestProvider)
                .setRequestExecutor(buildRequestExecutor()
                        .withValidResponseCodes(ItemWriter.DEFAULT_VALID_RESPONSE_CODES))
                .build();
    }

    private <T> SingleRequestItemReader<T> itemReader(RequestProvider requestProvider,
                                                      ResponseParser<T> responseParser) {
        return SingleRequestItemReader.<T>builder()
                .setRequestProvider(requestProvider)
                .setResponseParser(responseParser)
                .setRequestExecutor(buildRequestExecutor())
                .build();
    }

    private <T> ResultFutureIterator<T> resultIterator(RequestProvider requestProvider,
                                                       ResponseParser<T> responseParser) {
        return ResultFutureIterator.<T>builder()
                .setRequestProvider(requestProvider)
                .setResponseParser(responseParser)
                .setRequestExecutor(buildRequestExecutor())
                .build();
    }

    /**
     * List the Raw database names from Cognite.
     *
     * @param queryParameters The parameters for the query, i.e. {@code limit}.
     * @return an iterator over the result pages.
     */
    public ResultFutureIterator<String> readRawDbNames(RequestParameters queryParameters) {
        LOG.debug(loggingPrefix + "Initiating read raw database names service.");
        return resultIterator(getRequestProvider("raw/dbs", queryParameters), JsonItemResponseParser.create());
    }

    /**
     * Create Raw databases in Cognite.
     */
    public ItemWriter writeRawDbNames() {
        LOG.debug(loggingPrefix + "Initiating write raw database names service.");
        return itemWriter(postRequestProvider("raw/dbs", ImmutableSet.of()));
    }

    /**
     * Delete Raw databases in Cognite. The request supports the {@code recursive} flag.
     */
    public ItemWriter deleteRawDbNames() {
        LOG.debug(loggingPrefix + "Initiating delete raw database names service.");
        return itemWriter(postRequestProvider("raw/dbs/delete", ImmutableSet.of()));
    }

    /**
     * List the Raw tables for a given database. The request parameters must contain {@code dbName}.
     *
     * @param queryParameters The parameters for the query.
     * @return an iterator over the result pages.
     */
    public ResultFutureIterator<String> readRawTableNames(RequestParameters queryParameters) {
        LOG.debug(loggingPrefix + "Initiating read raw table names service.");
        return resultIterator(getRequestProvider("raw/dbs/{dbName}/tables", queryParameters),
                JsonItemResponseParser.create());
    }

    /**
     * Create Raw tables in a database. The request parameters must contain {@code dbName} and may contain
     * {@code ensureParent}.
     */
    public ItemWriter writeRawTableNames() {
        LOG.debug(loggingPrefix + "Initiating write raw table names service.");
        return itemWriter(postRequestProvider("raw/dbs/{dbName}/tables", ImmutableSet.of("ensureParent")));
    }

    /**
     * Delete Raw tables in a database. The request parameters must contain {@code dbName}.
     */
    public ItemWriter deleteRawTableNames() {
        LOG.debug(loggingPrefix + "Initiating delete raw table names service.");
        return itemWriter(postRequestProvider("raw/dbs/{dbName}/tables/delete", ImmutableSet.of()));
    }

    /**
     * Fetch Raw rows from Cognite.
     *
     * @param queryParameters The parameters for the raw query.
     * @return an iterator over the result pages.
     */
    public ResultFutureIterator<String> readRawRows(RequestParameters queryParameters) {
        LOG.debug(loggingPrefix + "Initiating read raw rows service.");

        RawReadRowsRequestProvider requestProvider = RawReadRowsRequestProvider.builder()
                .setRequestParameters(queryParameters)
                .setSdkIdentifier(ConnectorConstants.SDK_IDENTIFIER)
                .setAppIdentifier(getAppIdentifier())
                .setSessionIdentifier(getSessionIdentifier())
                .build();

        return resultIterator(requestProvider, JsonItemResponseParser.create());
    }

    /**
     * Read cursors for retrieving rows in parallel. The results set is split into n partitions.
     */
    public ItemReader<String> readCursorsRawRows() {
        LOG.debug(loggingPrefix + "Initiating read raw cursors service.");
        return itemReader(getRequestProvider("raw/dbs/{dbName}/tables/{tableName}/cursors", RequestParameters.create()),
                JsonItemResponseParser.create());
    }

    /**
     * Read a single row by key. The request parameters must contain {@code dbName}, {@code tableName}
     * and {@code key}.
     */
    public ItemReader<String> readRawRow() {
        LOG.debug(loggingPrefix + "Initiating read raw row service.");
        return itemReader(getRequestProvider("raw/dbs/{dbName}/tables/{tableName}/rows/{key}",
                RequestParameters.create()), JsonResponseParser.create());
    }

    /**
     * Write rows to Raw in Cognite.
     */
    public ItemWriter writeRawRows() {
        LOG.debug(loggingPrefix + "Initiating write raw rows service.");
        return itemWriter(postRequestProvider("raw/dbs/{dbName}/tables/{tableName}/rows",
                ImmutableSet.of("ensureParent")));
    }

    /**
     * Delete rows from Raw in Cognite.
     */
    public ItemWriter deleteRawRows() {
        LOG.debug(loggingPrefix + "Initiating delete raw rows service.");
        return itemWriter(postRequestProvider("raw/dbs/{dbName}/tables/{tableName}/rows/delete",
                ImmutableSet.of()));
    }

    /**
     * List sessions, optionally filtered by {@code status}.
     *
     * @param queryParameters The parameters for the query.
     * @return an iterator over the result pages.
     */
    public ResultFutureIterator<String> readSessions(RequestParameters queryParameters) {
        LOG.debug(loggingPrefix + "Initiating read sessions service.");
        return resultIterator(getRequestProvider("sessions", queryParameters), JsonItemResponseParser.create());
    }

    /**
     * Read sessions by id.
     */
    public ItemReader<String> readSessionsById() {
        LOG.debug(loggingPrefix + "Initiating read sessions by id service.");
        return itemReader(postRequestProvider("sessions/byids", ImmutableSet.of()), JsonItemResponseParser.create());
    }

    /**
     * Create sessions.
     */
    public ItemReader<String> createSessions() {
        LOG.debug(loggingPrefix + "Initiating create sessions service.");
        return itemReader(postRequestProvider("sessions", ImmutableSet.of()), JsonItemResponseParser.create());
    }

    /**
     * Revoke sessions.
     */
    public ItemWriter revokeSessions() {
        LOG.debug(loggingPrefix + "Initiating revoke sessions service.");
        return itemWriter(postRequestProvider("sessions/revoke", ImmutableSet.of()));
    }

    /**
     * Fetches the login status of a set of credentials. Used to resolve the project of an api key.
     *
     * @param host the Cognite host, i.e. {@code https://api.cognitedata.com}.
     * @param credentials the credentials to check.
     * @return the login status.
     * @throws Exception on api errors.
     */
    public LoginStatus readLoginStatus(String host, CredentialProvider credentials) throws Exception {
        LOG.debug(loggingPrefix + "Getting login status for host [{}].", host);
        Preconditions.checkArgument(null != host && !host.isEmpty(), "The host cannot be empty.");
        Preconditions.checkNotNull(credentials, "The credentials cannot be null.");

        GetLoginRequestProvider requestProvider = GetLoginRequestProvider.builder()
                .setSdkIdentifier(ConnectorConstants.SDK_IDENTIFIER)
                .setAppIdentifier(getAppIdentifier())
                .setSessionIdentifier(getSessionIdentifier())
                .build();

        RequestParameters request = RequestParameters.create()
                .withAuthConfig(AuthConfig.create()
                        .withHost(host)
                        .withCredentials(credentials));

        ImmutableList<String> loginResponse = itemReader(requestProvider, JsonResponseParser.create())
                .getItems(request)
                .getResultsItems();

        return LoginStatusParser.parseLoginStatus(loginResponse.get(0));
    }

    /*
    Strips the future wrappers from exceptions raised by a blocking join.
     */
    private static Exception unwrapCompletionException(CompletionException e) {
        Throwable cause = TaskExecutor.unwrap(e);
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        return e;
    }

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setMaxRetries(int value);
        public abstract Builder setMaxRetryBackoff(Duration value);
        public abstract Builder setAppIdentifier(String value);
        public abstract Builder setSessionIdentifier(String value);
        public abstract Builder setHttpClient(OkHttpClient value);
        public abstract Builder setExecutorService(ExecutorService value);

        abstract ConnectorServiceV1 autoBuild();

        public ConnectorServiceV1 build() {
            ConnectorServiceV1 service = autoBuild();
            Preconditions.checkState(service.getMaxRetries() <= ConnectorConstants.MAX_MAX_RETRIES
                            && service.getMaxRetries() >= ConnectorConstants.MIN_MAX_RETRIES
                    , "Max retries out of range. Must be between 1 and 20");
            Preconditions.checkState(service.getAppIdentifier().length() < 40
                    , "App identifier out of range. Length must be < 40.");
            Preconditions.checkState(service.getSessionIdentifier().length() < 40
                    , "Session identifier out of range. Length must be < 40.");
            return service;
        }
    }

    /**
     * Base class for read and write requests.
     */
    abstract static class ConnectorBase {
        final Logger LOG = LoggerFactory.getLogger(this.getClass());

        abstract RequestProvider getRequestProvider();
        abstract RequestExecutor getRequestExecutor();

        abstract static class Builder<B extends Builder<B>> {
            abstract B setRequestProvider(RequestProvider value);
            abstract B setRequestExecutor(RequestExecutor value);
        }
    }

    /**
     * Iterator for paging through requests based on response cursors.
     *
     * This iterator is based on async request, and will return a {@link CompletableFuture} on each
     * {@code next()} call.
     *
     * However, {@code hasNext()} needs to wait for the current request to complete before being
     * able to evaluate if it carries a cursor to the next page.
     *
     * The iterator can start from an initial cursor and can be capped at a total number of items. When capped,
     * the {@code limit} of each request is reduced to the remaining number of items.
     *
     * @param <T>
     */
    @AutoValue
    public abstract static class ResultFutureIterator<T>
            extends ConnectorBase implements Iterator<CompletableFuture<ResponseItems<T>>> {
        private final String randomIdString = RandomStringUtils.randomAlphanumeric(5);
        private final String loggingPrefix = "ResultFutureIterator [" + randomIdString + "] -";

        private CompletableFuture<ResponseItems<T>> currentResponseFuture = null;
        private long noItemsBeforeCurrent = 0L;

        private static <T> Builder<T> builder() {
            return new AutoValue_ConnectorServiceV1_ResultFutureIterator.Builder<T>();
        }

        abstract Builder<T> toBuilder();
        abstract ResponseParser<T> getResponseParser();
        @Nullable
        abstract String getInitialCursor();
        @Nullable
        abstract Long getTotalLimit();

        /**
         * Starts the iteration from the given cursor instead of the beginning of the result set.
         *
         * @param cursor the cursor to start from. {@code null} starts from the beginning.
         * @return The iterator configured with the initial cursor.
         */
        public ResultFutureIterator<T> withInitialCursor(@Nullable String cursor) {
            return toBuilder().setInitialCursor(cursor).build();
        }

        /**
         * Caps the total number of items returned by the iterator.
         *
         * @param limit the max number of items. {@code null} means no cap.
         * @return The iterator configured with the limit.
         */
        public ResultFutureIterator<T> withTotalLimit(@Nullable Long limit) {
            Preconditions.checkArgument(null == limit || limit >= 0, "The limit cannot be negative.");
            return toBuilder().setTotalLimit(limit).build();
        }

        @Override
        public boolean hasNext() {
            // must wrap the logic in a try-catch since <hasNext> does not allow us to just re-throw the exceptions.
            try {
                if (currentResponseFuture == null) {
                    // Have not issued any request yet.
                    return null == getTotalLimit() || getTotalLimit() > 0;
                }
                ResponseItems<T> current = currentResponseFuture.join();
                if (null != getTotalLimit()
                        && noItemsBeforeCurrent + current.getResultsItems().size() >= getTotalLimit()) {
                    return false;
                }
                return getResponseParser().extractNextCursor(
                        current.getResponseBinary().getResponseBodyBytes().toByteArray()).isPresent();
            } catch (Exception e) {
                LOG.error(loggingPrefix + "Error when executing check for <hasNext>.", e);
                throw new RuntimeException(loggingPrefix + "Error when executing check for <hasNext>.",
                        TaskExecutor.unwrap(e));
            }
        }

        @Override
        public CompletableFuture<ResponseItems<T>> next() throws NoSuchElementException {
            if (!this.hasNext()) {
                LOG.warn(loggingPrefix + "Client calling next() when no more elements are left to iterate over");
                throw new NoSuchElementException("No more elements to iterate over.");
            }
            try {
                Optional<String> nextCursor;
                if (null != currentResponseFuture) {
                    ResponseItems<T> current = currentResponseFuture.join();
                    noItemsBeforeCurrent += current.getResultsItems().size();
                    nextCursor = getResponseParser().extractNextCursor(
                            current.getResponseBinary().getResponseBodyBytes().toByteArray());
                    LOG.debug(loggingPrefix + "More items to iterate over. Building next api request based on cursor: {}",
                            nextCursor.orElse("could not identify cursor--should be investigated"));

                    // should not happen, but let's check just in case.
                    if (!nextCursor.isPresent()) {
                        String message = loggingPrefix + "Invalid state. <hasNext()> indicated one more element,"
                                + " but no next cursor is found.";
                        LOG.error(message);
                        throw new Exception(message);
                    }
                } else {
                    LOG.debug(loggingPrefix + "Building first api request of the iterator.");
                    nextCursor = Optional.ofNullable(getInitialCursor());
                }

                RequestProvider requestProvider = getRequestProvider();
                if (null != getTotalLimit()) {
                    RequestParameters parameters = requestProvider.getRequestParameters();
                    long pageSize = ConnectorConstants.DEFAULT_MAX_BATCH_SIZE;
                    Object limitParameter = parameters.getRequestParameters().get("limit");
                    if (limitParameter instanceof Number) {
                        pageSize = ((Number) limitParameter).longValue();
                    }
                    int requestLimit = (int) Math.min(pageSize, getTotalLimit() - noItemsBeforeCurrent);
                    requestProvider = requestProvider
                            .withRequestParameters(parameters.withRootParameter("limit", requestLimit));
                }

                Request request = requestProvider.buildRequest(nextCursor);
                LOG.debug(loggingPrefix + "Built request for URL: {}", request.url().toString());

                // Execute the request and get the response future
                CompletableFuture<ResponseItems<T>> responseItemsFuture = getRequestExecutor()
                        .executeRequestAsync(request)
                        .thenApply(responseBinary ->
                            ResponseItems.of(getResponseParser(), responseBinary));

                currentResponseFuture = responseItemsFuture;
                return responseItemsFuture;

            } catch (Exception e) {
                String message = loggingPrefix + "Failed to get more elements when requesting new batch from Fusion: ";
                LOG.error(message, e);
                throw new RuntimeException(message + e.getMessage(), TaskExecutor.unwrap(e));
            }
        }

        @AutoValue.Builder
        abstract static class Builder<T> extends ConnectorBase.Builder<Builder<T>> {
            abstract Builder<T> setResponseParser(ResponseParser<T> value);
            abstract Builder<T> setInitialCursor(String value);
            abstract Builder<T> setTotalLimit(Long value);

            abstract ResultFutureIterator<T> build();
        }
    }

    /**
     * Reads items from the Cognite API.
     *
     * This reader targets API endpoints which complete its operation in a single request. Error responses
     * raise a {@link com.cognite.client.exception.CogniteApiException}.
     */
    @AutoValue
    public static abstract class SingleRequestItemReader<T> extends ConnectorBase implements ItemReader<T> {

        static <T> Builder<T> builder() {
            return new AutoValue_ConnectorServiceV1_SingleRequestItemReader.Builder<T>();
        }

        abstract ResponseParser<T> getResponseParser();

        /**
         * Executes a request to get items and blocks the thread until all items have been downloaded.
         *
         * @param items the request parameters.
         * @return the response.
         * @throws Exception on api errors.
         */
        public ResponseItems<T> getItems(RequestParameters items) throws Exception {
            try {
                return this.getItemsAsync(items).join();
            } catch (CompletionException e) {
                throw unwrapCompletionException(e);
            }
        }

        /**
         * Executes an item-based request to get items asynchronously.
         *
         * @param items the request parameters.
         * @return the response future.
         * @throws Exception if the request cannot be built.
         */
        public CompletableFuture<ResponseItems<T>> getItemsAsync(RequestParameters items) throws Exception {
            Preconditions.checkNotNull(items, "Input cannot be null.");

            return getRequestExecutor()
                    .executeRequestAsync(getRequestProvider()
                            .withRequestParameters(items)
                            .buildRequest(Optional.empty()))
                    .thenApply(responseBinary ->
                        ResponseItems.of(getResponseParser(), responseBinary));
        }

        @AutoValue.Builder
        abstract static class Builder<T> extends ConnectorBase.Builder<Builder<T>> {
            abstract Builder<T> setResponseParser(ResponseParser<T> value);

            abstract SingleRequestItemReader<T> build();
        }
    }

    /**
     * Writes items to the Cognite API.
     *
     * Responses with status 400, 409 and 422 are returned as unsuccessful {@link ResponseItems} so the caller
     * can inspect the missing or duplicated items.
     */
    @AutoValue
    public static abstract class ItemWriter extends ConnectorBase {
        static final ImmutableList<Integer> DEFAULT_VALID_RESPONSE_CODES = ImmutableList.of(400, 409, 422);
        private static final ResponseParser<String> DEFAULT_RESPONSE_PARSER = JsonItemResponseParser.create();

        static Builder builder() {
            return new AutoValue_ConnectorServiceV1_ItemWriter.Builder();
        }

        /**
         * Executes an item-based write request.
         *
         * This method will block until the response is ready. The async version of this method is
         * {@code writeItemsAsync}.
         *
         * @param items the request parameters.
         * @return the response.
         * @throws Exception on api errors other than 400, 409 and 422.
         */
        public ResponseItems<String> writeItems(RequestParameters items) throws Exception {
            Preconditions.checkNotNull(items, "Input cannot be null.");
            try {
                return this.writeItemsAsync(items).join();
            } catch (CompletionException e) {
                throw unwrapCompletionException(e);
            }
        }

        /**
         * Executes an item-based write request asynchronously.
         *
         * @param items the request parameters.
         * @return the response future.
         * @throws Exception if the request cannot be built.
         */
        public CompletableFuture<ResponseItems<String>> writeItemsAsync(RequestParameters items) throws Exception {
            Preconditions.checkNotNull(items, "Input cannot be null.");

            return getRequestExecutor().executeRequestAsync(getRequestProvider()
                    .withRequestParameters(items)
                    .buildRequest(Optional.empty()))
                    .thenApply(responseBinary -> ResponseItems.of(DEFAULT_RESPONSE_PARSER, responseBinary));
        }

        @AutoValue.Builder
        abstract static class Builder extends ConnectorBase.Builder<Builder> {
            abstract ItemWriter build();
        }
    }
}
