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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.io.Serializable;

/**
 * The host, project and credentials used to authenticate and route a request.
 */
@AutoValue
public abstract class AuthConfig implements Serializable {
    private final static String DEFAULT_HOST = "https://api.cognitedata.com";

    private static Builder builder() {
        return new AutoValue_AuthConfig.Builder()
                .setHost(DEFAULT_HOST);
    }

    public static AuthConfig create() {
        return AuthConfig.builder().build();
    }

    abstract Builder toBuilder();

    public abstract String getHost();
    @Nullable
    public abstract String getProject();
    @Nullable
    public abstract CredentialProvider getCredentials();

    public AuthConfig withHost(String host) {
        Preconditions.checkArgument(null != host && !host.isEmpty(), "The host cannot be empty.");
        return toBuilder().setHost(host).build();
    }

    public AuthConfig withProject(String project) {
        Preconditions.checkArgument(null != project && !project.isEmpty(), "The project cannot be empty.");
        return toBuilder().setProject(project).build();
    }

    public AuthConfig withCredentials(CredentialProvider credentials) {
        Preconditions.checkNotNull(credentials, "The credentials cannot be null.");
        return toBuilder().setCredentials(credentials).build();
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setHost(String value);
        abstract Builder setProject(String value);
        abstract Builder setCredentials(CredentialProvider value);

        abstract AuthConfig build();
    }
}
