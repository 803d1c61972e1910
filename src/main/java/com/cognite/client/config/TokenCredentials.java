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
import java.util.function.Supplier;

/**
 * Authenticates requests with a bearer token.
 *
 * The token is obtained from a {@link Supplier} on every request so that callers can plug in their own
 * token refresh logic.
 */
@AutoValue
public abstract class TokenCredentials implements CredentialProvider {
    private static final String AUTHORIZATION_HEADER = "Authorization";

    /**
     * Creates credentials from a static token.
     *
     * @param token the bearer token.
     * @return the credentials object.
     */
    public static TokenCredentials of(String token) {
        Preconditions.checkArgument(null != token && !token.isEmpty(),
                "The token cannot be empty.");
        return new AutoValue_TokenCredentials((Supplier<String> & Serializable) () -> token);
    }

    /**
     * Creates credentials from a token supplier.
     *
     * @param tokenSupplier supplies the current bearer token.
     * @return the credentials object.
     */
    public static TokenCredentials of(Supplier<String> tokenSupplier) {
        Preconditions.checkNotNull(tokenSupplier, "The token supplier cannot be null.");
        return new AutoValue_TokenCredentials(tokenSupplier);
    }

    abstract Supplier<String> getTokenSupplier();

    @Override
    public String getHeaderName() {
        return AUTHORIZATION_HEADER;
    }

    @Override
    public String getHeaderValue() throws Exception {
        String token = getTokenSupplier().get();
        if (null == token || token.isEmpty()) {
            throw new Exception("The token supplier did not return a token.");
        }
        return "Bearer " + token;
    }
}
