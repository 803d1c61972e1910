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

import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * Parses the payload of an api response into a cursor and a list of items.
 *
 * @param <T> the item type
 */
public interface ResponseParser<T> {

    /**
     * Extracts the cursor to the next page of results.
     *
     * @param payload the response body.
     * @return the next cursor, or an empty {@link Optional} if there are no more pages.
     * @throws Exception if the payload cannot be parsed.
     */
    Optional<String> extractNextCursor(byte[] payload) throws Exception;

    /**
     * Extracts the result items.
     *
     * @param payload the response body.
     * @return the items.
     * @throws Exception if the payload cannot be parsed.
     */
    ImmutableList<T> extractItems(byte[] payload) throws Exception;
}
