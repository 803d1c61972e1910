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

package com.cognite.client.servicesV1.parser;

import com.cognite.client.dto.LoginStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class LoginStatusParser {
    static final String logPrefix = "LoginStatusParser - ";
    static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses the response of the {@code login/status} endpoint.
     *
     * @param json the response body.
     * @return the login status.
     * @throws Exception if the response does not contain a login status.
     */
    public static LoginStatus parseLoginStatus(String json) throws Exception {
        JsonNode data = objectMapper.readTree(json).path("data");
        if (!data.isObject()) {
            throw new Exception(logPrefix + "Unable to parse login status. No data node found.");
        }
        return LoginStatus.of(
                data.path("user").asText(""),
                data.path("loggedIn").asBoolean(false),
                data.path("project").asText(""),
                data.path("projectId").asLong(-1L));
    }
}
