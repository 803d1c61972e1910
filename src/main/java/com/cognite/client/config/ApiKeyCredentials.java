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

/**
 * Authenticates requests with a Cognite api key.
 */
@AutoValue
public abstract class ApiKeyCredentials implements CredentialProvider {
    private static final String API_KEY_HEADER = "api-key";

    public static ApiKeyCredentials of(String apiKey) {
        Preconditions.checkArgument(null != apiKey && !apiKey.isEmpty(),
                "The api key cannot be empty.");
        return new AutoValue_ApiKeyCredentials(apiKey);
    }

    abstract String getApiKey();

    @Override
    public String getHeaderName() {
        return API_KEY_HEADER;
    }

    @Override
    public String getHeaderValue() {
        return getApiKey();
    }

    @Override
    public String toString() {
        return "ApiKeyCredentials{apiKey=*****}";
    }
}
