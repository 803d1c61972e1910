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

import java.util.concurrent.CompletableFuture;

/**
 * Reads items from the Cognite API based on a set of request parameters.
 *
 * @param <T> the item type
 */
public interface ItemReader<T> {

    ResponseItems<T> getItems(RequestParameters items) throws Exception;

    CompletableFuture<ResponseItems<T>> getItemsAsync(RequestParameters items) throws Exception;
}
