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

package com.cognite.client.servicesV1.response;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Returns the complete response body as a single item. Used for endpoints returning a single object.
 */
@AutoValue
public abstract class JsonResponseParser implements ResponseParser<String> {

    public static JsonResponseParser create() {
        return new AutoValue_JsonResponseParser();
    }

    @Override
    public Optional<String> extractNextCursor(byte[] payload) {
        return Optional.empty();
    }

    @Override
    public ImmutableList<String> extractItems(byte[] payload) {
        return ImmutableList.of(new String(payload, StandardCharsets.UTF_8));
    }
}
