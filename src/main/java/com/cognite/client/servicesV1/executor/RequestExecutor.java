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

package com.cognite.client.servicesV1.executor;

import com.cognite.client.exception.CogniteApiException;
import com.cognite.client.exception.CogniteConnectionException;
import com.cognite.client.servicesV1.ConnectorConstants;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.ByteString;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Executes http requests against the Cognite API with retries.
 *
 * A request is retried on I/O errors, on the status codes 429, 502, 503 and 504, and on responses carrying
 * the {@code cdf-is-auto-retryable: true} header. The backoff before retry {@code n} (zero based) is
 * {@code 100ms + uniform(0, min(500ms * 2^n, maxRetryBackoff))}.
 *
 * Successful responses and responses with a status code listed in {@code validResponseCodes} are returned
 * to the caller. Other responses raise a {@link CogniteApiException}. When the retries are exhausted after
 * I/O errors, a {@link CogniteConnectionException} is raised.
 */
@AutoValue
public abstract class RequestExecutor {
    private static final ImmutableList<Integer> RETRYABLE_RESPONSE_CODES = ImmutableList.of(429, 502, 503, 504);
    private static final String AUTO_RETRYABLE_HEADER = "cdf-is-auto-retryable";
    private static final String REQUEST_ID_HEADER = "x-request-id";
    private static final long INITIAL_DELAY_MILLIS = 100L;
    private static final long BACKOFF_FACTOR_MILLIS = 500L;

    protected final Logger LOG = LoggerFactory.getLogger(this.getClass());
    private final String loggingPrefix = "RequestExecutor [" + RandomStringUtils.randomAlphanumeric(5) + "] -";

    private static Builder builder() {
        return new AutoValue_RequestExecutor.Builder()
                .setExecutor(ForkJoinPool.commonPool())
                .setMaxRetries(ConnectorConstants.DEFAULT_MAX_RETRIES)
                .setMaxRetryBackoff(ConnectorConstants.DEFAULT_MAX_RETRY_BACKOFF)
                .setValidResponseCodes(ImmutableList.of());
    }

    public static RequestExecutor of(OkHttpClient client) {
        Preconditions.checkNotNull(client, "The http client cannot be null.");
        return RequestExecutor.builder()
                .setHttpClient(client)
                .build();
    }

    abstract Builder toBuilder();
    abstract OkHttpClient getHttpClient();
    abstract ExecutorService getExecutor();
    public abstract int getMaxRetries();
    public abstract Duration getMaxRetryBackoff();
    public abstract ImmutableList<Integer> getValidResponseCodes();

    public RequestExecutor withHttpClient(OkHttpClient client) {
        Preconditions.checkNotNull(client, "The http client cannot be null.");
        return toBuilder().setHttpClient(client).build();
    }

    public RequestExecutor withExecutor(ExecutorService executor) {
        Preconditions.checkNotNull(executor, "The executor cannot be null.");
        return toBuilder().setExecutor(executor).build();
    }

    public RequestExecutor withMaxRetries(int retries) {
        Preconditions.checkArgument(retries <= ConnectorConstants.MAX_MAX_RETRIES
                        && retries >= ConnectorConstants.MIN_MAX_RETRIES,
                "Max retries out of range. Must be between "
                        + ConnectorConstants.MIN_MAX_RETRIES + " and " + ConnectorConstants.MAX_MAX_RETRIES);
        return toBuilder().setMaxRetries(retries).build();
    }

    public RequestExecutor withMaxRetryBackoff(Duration maxBackoff) {
        Preconditions.checkArgument(null != maxBackoff && !maxBackoff.isNegative(),
                "Max retry backoff cannot be negative.");
        return toBuilder().setMaxRetryBackoff(maxBackoff).build();
    }

    /**
     * Sets the non-2xx response codes which are returned to the caller instead of raising an exception.
     *
     * @param codes the response codes.
     * @return the executor with the setting applied.
     */
    public RequestExecutor withValidResponseCodes(ImmutableList<Integer> codes) {
        Preconditions.checkNotNull(codes, "Response codes cannot be null.");
        return toBuilder().setValidResponseCodes(codes).build();
    }

    /**
     * Executes the request asynchronously on the configured executor.
     *
     * Failures complete the future exceptionally with a {@link CompletionException} wrapping the cause.
     *
     * @param request the request to execute.
     * @return the response future.
     */
    public CompletableFuture<ResponseBinary> executeRequestAsync(Request request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return executeRequest(request);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, getExecutor());
    }

    /**
     * Executes the request and blocks until a response is available or the retries are exhausted.
     *
     * @param request the request to execute.
     * @return the response.
     * @throws CogniteApiException if the api responds with a non-retryable error.
     * @throws CogniteConnectionException if the request fails with I/O errors after all retries.
     * @throws InterruptedException if interrupted during backoff.
     */
    public ResponseBinary executeRequest(Request request) throws Exception {
        Instant startInstant = Instant.now();
        IOException lastIoException = null;

        for (int attempt = 0; attempt <= getMaxRetries(); attempt++) {
            if (attempt > 0) {
                long backoffMillis = computeBackoffMillis(attempt - 1);
                LOG.debug(loggingPrefix + "Retry {} of {} for {}. Backing off {} ms.",
                        attempt, getMaxRetries(), request.url(), backoffMillis);
                Thread.sleep(backoffMillis);
            }

            try (Response response = getHttpClient().newCall(request).execute()) {
                ResponseBody body = response.body();
                ByteString bodyBytes = null == body ? ByteString.EMPTY : body.byteString();
                String requestId = response.header(REQUEST_ID_HEADER);
                int code = response.code();

                if (response.isSuccessful() || getValidResponseCodes().contains(code)) {
                    LOG.debug(loggingPrefix + "{} {} completed with status {}. Duration: {}",
                            request.method(), request.url(), code, Duration.between(startInstant, Instant.now()));
                    return ResponseBinary.of(code, requestId, bodyBytes);
                }

                boolean autoRetryable = "true".equalsIgnoreCase(response.header(AUTO_RETRYABLE_HEADER));
                if ((RETRYABLE_RESPONSE_CODES.contains(code) || autoRetryable) && attempt < getMaxRetries()) {
                    LOG.warn(loggingPrefix + "{} {} failed with retryable status {}. X-Request-ID: {}",
                            request.method(), request.url(), code, requestId);
                    continue;
                }

                CogniteApiException exception = CogniteApiException.fromResponse(code, bodyBytes.utf8(), requestId);
                LOG.error(loggingPrefix + "{} {} failed. {}", request.method(), request.url(), exception.getMessage());
                throw exception;
            } catch (IOException e) {
                lastIoException = e;
                LOG.warn(loggingPrefix + "{} {} failed with an I/O error: {}",
                        request.method(), request.url(), e.getMessage());
            }
        }

        String message = String.format(loggingPrefix + "%s %s failed after %d retries. Duration: %s",
                request.method(), request.url(), getMaxRetries(), Duration.between(startInstant, Instant.now()));
        LOG.error(message);
        throw new CogniteConnectionException(message, lastIoException);
    }

    private long computeBackoffMillis(int retry) {
        long cap = Math.min(BACKOFF_FACTOR_MILLIS * (1L << Math.min(retry, 30)), getMaxRetryBackoff().toMillis());
        return INITIAL_DELAY_MILLIS + ThreadLocalRandom.current().nextLong(cap + 1);
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setHttpClient(OkHttpClient value);
        abstract Builder setExecutor(ExecutorService value);
        abstract Builder setMaxRetries(int value);
        abstract Builder setMaxRetryBackoff(Duration value);
        abstract Builder setValidResponseCodes(ImmutableList<Integer> value);

        abstract RequestExecutor build();
    }
}
