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

import java.time.Duration;

/**
 * Constants shared by the api services.
 */
public final class ConnectorConstants {
    public static final String SDK_IDENTIFIER = "cognite-java-sdk-0.9.0";
    public static final String DEFAULT_APP_IDENTIFIER = "cognite-java-sdk";
    public static final String DEFAULT_SESSION_IDENTIFIER = "cognite-java-sdk";

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final int MIN_MAX_RETRIES = 1;
    public static final int MAX_MAX_RETRIES = 20;
    public static final Duration DEFAULT_MAX_RETRY_BACKOFF = Duration.ofSeconds(60);

    public static final int DEFAULT_MAX_BATCH_SIZE = 1000;
    public static final int DEFAULT_MAX_BATCH_SIZE_RAW = 10000;

    private ConnectorConstants() {
    }
}
