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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

import java.io.Serializable;
import java.time.Duration;

/**
 * This class represents the configuration settings of the {@link com.cognite.client.CogniteClient}.
 *
 * The settings cover the identification of the client (app and session identifiers), the retry strategy
 * and the concurrency settings for multi-threaded api requests.
 */
@AutoValue
public abstract class ClientConfig implements Serializable {
    private static final String DEFAULT_APP_IDENTIFIER = "cognite-java-sdk";
    private static final String DEFAULT_SESSION_IDENTIFIER = "cognite-java-sdk";
    private static final int DEFAULT_MAX_RETRIES = 5;
    private static final int MIN_MAX_RETRIES = 1;
    private static final int MAX_MAX_RETRIES = 20;
    private static final int DEFAULT_NO_WORKERS = 8;
    private static final int DEFAULT_NO_LIST_PARTITIONS = 8;
    private static final Duration DEFAULT_MAX_RETRY_BACKOFF = Duration.ofSeconds(60);
    private static final Duration DEFAULT_BACKPRESSURE_UNIT = Duration.ofSeconds(1);

    private static Builder builder() {
        return new AutoValue_ClientConfig.Builder()
                .setAppIdentifier(DEFAULT_APP_IDENTIFIER)
                .setSessionIdentifier(DEFAULT_SESSION_IDENTIFIER)
                .setMaxRetries(DEFAULT_MAX_RETRIES)
                .setNoWorkers(DEFAULT_NO_WORKERS)
                .setNoListPartitions(DEFAULT_NO_LIST_PARTITIONS)
                .setMaxRetryBackoff(DEFAULT_MAX_RETRY_BACKOFF)
                .setBackpressureUnit(DEFAULT_BACKPRESSURE_UNIT);
    }

    /**
     * Returns a {@link ClientConfig} object with default settings.
     *
     * @return the config object.
     */
    public static ClientConfig create() {
        return ClientConfig.builder().build();
    }

    abstract Builder toBuilder();

    public abstract String getAppIdentifier();
    public abstract String getSessionIdentifier();
    public abstract int getMaxRetries();
    public abstract int getNoWorkers();
    public abstract int getNoListPartitions();
    public abstract Duration getMaxRetryBackoff();
    public abstract Duration getBackpressureUnit();

    /**
     * Set the app identifier. The identifier is encoded in the api calls to the Cognite instance and can be
     * used for tracing and statistics.
     *
     * @param identifier the application identifier. Must be less than 40 characters.
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withAppIdentifier(String identifier) {
        Preconditions.checkArgument(null != identifier && identifier.length() < 40,
                "App identifier out of range. Length must be < 40.");
        return toBuilder().setAppIdentifier(identifier).build();
    }

    /**
     * Set the session identifier. The identifier is encoded in the api calls to the Cognite instance and can be
     * used for tracing and statistics.
     *
     * @param identifier the session identifier. Must be less than 40 characters.
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withSessionIdentifier(String identifier) {
        Preconditions.checkArgument(null != identifier && identifier.length() < 40,
                "Session identifier out of range. Length must be < 40.");
        return toBuilder().setSessionIdentifier(identifier).build();
    }

    /**
     * Sets the maximum number of retries when sending requests to the Cognite API.
     *
     * The default setting is 5. This should be a robust setting for most scenarios.
     *
     * @param retries the max number of retries. Must be between 1 and 20.
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withMaxRetries(int retries) {
        Preconditions.checkArgument(retries <= MAX_MAX_RETRIES && retries >= MIN_MAX_RETRIES,
                String.format("Max retries out of range. Must be between %d and %d", MIN_MAX_RETRIES, MAX_MAX_RETRIES));
        return toBuilder().setMaxRetries(retries).build();
    }

    /**
     * Specifies the maximum number of worker threads used for parallel requests. This also caps the
     * number of partitions used when reading Raw rows in parallel.
     *
     * @param noWorkers the max number of worker threads
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withNoWorkers(int noWorkers) {
        Preconditions.checkArgument(noWorkers >= 1, "Number of workers should be >= 1");
        return toBuilder().setNoWorkers(noWorkers).build();
    }

    /**
     * Specifies the default number of partitions (parallel cursor streams) when listing all items.
     *
     * @param noPartitions the default number of list partitions
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withNoListPartitions(int noPartitions) {
        Preconditions.checkArgument(noPartitions >= 1, "Number of list partitions should be >= 1");
        return toBuilder().setNoListPartitions(noPartitions).build();
    }

    /**
     * Sets the upper bound of the backoff between retries.
     *
     * @param maxBackoff the max backoff duration
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withMaxRetryBackoff(Duration maxBackoff) {
        Preconditions.checkArgument(null != maxBackoff && !maxBackoff.isNegative(),
                "Max retry backoff cannot be negative");
        return toBuilder().setMaxRetryBackoff(maxBackoff).build();
    }

    /**
     * Sets the unit of the backpressure sleep of parallel readers.
     *
     * When the consumer of a parallel read does not keep up, each reader thread sleeps for a random
     * duration between zero and {@code number of partitions x unit} before checking the buffer again.
     *
     * @param unit the backpressure unit
     * @return the {@link ClientConfig} with the setting applied
     */
    public ClientConfig withBackpressureUnit(Duration unit) {
        Preconditions.checkArgument(null != unit && !unit.isNegative() && !unit.isZero(),
                "Backpressure unit must be positive");
        return toBuilder().setBackpressureUnit(unit).build();
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setAppIdentifier(String value);
        abstract Builder setSessionIdentifier(String value);
        abstract Builder setMaxRetries(int value);
        abstract Builder setNoWorkers(int value);
        abstract Builder setNoListPartitions(int value);
        abstract Builder setMaxRetryBackoff(Duration value);
        abstract Builder setBackpressureUnit(Duration value);

        abstract ClientConfig build();
    }
}
