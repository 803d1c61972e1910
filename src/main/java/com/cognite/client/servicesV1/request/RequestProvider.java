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

package com.cognite.client.servicesV1.request;

import com.cognite.client.servicesV1.RequestParameters;
import okhttp3.Request;

import java.io.Serializable;
import java.util.Optional;

/**
 * Builds http requests for an api endpoint from a set of {@link RequestParameters} and an optional cursor.
 */
public interface RequestProvider extends Serializable {

    RequestProvider withRequestParameters(RequestParameters parameters);

    RequestParameters getRequestParameters();

    Request buildRequest(Optional<String> cursor) throws Exception;
}
