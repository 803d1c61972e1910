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

import java.io.Serializable;

/**
 * Supplies the authentication header for requests to Cognite Data Fusion.
 */
public interface CredentialProvider extends Serializable {

    /**
     * The name of the http header carrying the credential.
     */
    String getHeaderName();

    /**
     * The value of the http header carrying the credential. Implementations may have to
     * perform network calls (i.e. fetching an access token) to produce the value.
     *
     * @return the header value.
     * @throws Exception if the credential cannot be produced.
     */
    String getHeaderValue() throws Exception;
}
