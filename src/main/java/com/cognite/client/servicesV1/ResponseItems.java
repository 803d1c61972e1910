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

import com.cognite.client.exception.CogniteApiException;
import com.cognite.client.servicesV1.executor.ResponseBinary;
import com.cognite.client.servicesV1.response.ResponseParser;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A response from the Cognite API together with the parser for its items.
 *
 * @param <T> the item type
 */
@AutoValue
public abstract class ResponseItems<T> {
    public static <T> ResponseItems<T> of(ResponseParser<T> parser, ResponseBinary response) {
        return new AutoValue_ResponseItems<>(parser, response);
    }

    public abstract ResponseParser<T> getResponseParser();
    public abstract ResponseBinary getResponseBinary();

    public boolean isSuccessful() {
        return getResponseBinary().isSuccessful();
    }

    /**
     * Returns the result items of a successful response. An unsuccessful response has no result items.
     */
    public ImmutableList<T> getResultsItems() throws Exception {
        if (!isSuccessful()) {
            return ImmutableList.of();
        }
        return getResponseParser().extractItems(getResponseBinary().getResponseBodyBytes().toByteArray());
    }

    public String getResponseBodyAsString() {
        return getResponseBinary().getResponseBodyBytes().utf8();
    }

    /**
     * Builds the api exception describing an unsuccessful response.
     */
    public CogniteApiException toApiException() {
        return CogniteApiException.fromResponse(getResponseBinary().getResponseCode(),
                getResponseBodyAsString(),
                getResponseBinary().getRequestId());
    }
}
