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

import com.google.auto.value.AutoValue;
import okio.ByteString;

import javax.annotation.Nullable;

/**
 * The status code, request id and body of a completed http response.
 */
@AutoValue
public abstract class ResponseBinary {

    public static ResponseBinary of(int responseCode, @Nullable String requestId, ByteString responseBodyBytes) {
        return new AutoValue_ResponseBinary(responseCode, requestId, responseBodyBytes);
    }

    public abstract int getResponseCode();
    @Nullable
    public abstract String getRequestId();
    public abstract ByteString getResponseBodyBytes();

    public boolean isSuccessful() {
        return getResponseCode() >= 200 && getResponseCode() < 300;
    }
}
