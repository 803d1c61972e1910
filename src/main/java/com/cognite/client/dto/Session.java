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

import javax.annotation.Nullable;
import java.io.Serializable;

/**
 * A session as returned by the list and retrieve operations. Does not carry the nonce.
 */
@AutoValue
public abstract class Session implements Serializable {

    public static Builder builder() {
        return new AutoValue_Session.Builder();
    }

    public abstract long getId();
    public abstract String getType();
    public abstract String getStatus();
    @Nullable
    public abstract Long getCreationTime();
    @Nullable
    public abstract Long getExpirationTime();
    @Nullable
    public abstract String getClientId();

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setId(long value);
        public abstract Builder setType(String value);
        public abstract Builder setStatus(String value);
        public abstract Builder setCreationTime(Long value);
        public abstract Builder setExpirationTime(Long value);
        public abstract Builder setClientId(String value);

        public abstract Session build();
    }
}
