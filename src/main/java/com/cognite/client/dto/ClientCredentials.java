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

package com.cognite.client.dto;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

import java.io.Serializable;

/**
 * The OAuth client credentials a session is created from.
 */
@AutoValue
public abstract class ClientCredentials implements Serializable {

    public static ClientCredentials of(String clientId, String clientSecret) {
        Preconditions.checkArgument(null != clientId && !clientId.isEmpty(), "The client id cannot be empty.");
        Preconditions.checkArgument(null != clientSecret && !clientSecret.isEmpty(),
                "The client secret cannot be empty.");
        return new AutoValue_ClientCredentials(clientId, clientSecret);
    }

    public abstract String getClientId();
    public abstract String getClientSecret();

    @Override
    public String toString() {
        return "ClientCredentials{clientId=" + getClientId() + ", clientSecret=*****}";
    }
}
