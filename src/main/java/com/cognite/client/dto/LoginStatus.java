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

import java.io.Serializable;

/**
 * The login status of a set of credentials.
 */
@AutoValue
public abstract class LoginStatus implements Serializable {

    public static LoginStatus of(String user, boolean loggedIn, String project, long projectId) {
        return new AutoValue_LoginStatus(user, loggedIn, project, projectId);
    }

    public abstract String getUser();
    public abstract boolean isLoggedIn();
    public abstract String getProject();
    public abstract long getProjectId();
}
