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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A row in a CDF.Raw table.
 *
 * The columns map a column name to a Json compatible value: String, Number, Boolean, Map, List or {@code null}.
 */
@AutoValue
public abstract class RawRow implements Serializable {

    public static Builder builder() {
        return new AutoValue_RawRow.Builder()
                .setColumns(Collections.emptyMap());
    }

    /**
     * Convenience factory for a row without a last updated time.
     */
    public static RawRow of(String dbName, String tableName, String key, Map<String, Object> columns) {
        return RawRow.builder()
                .setDbName(dbName)
                .setTableName(tableName)
                .setKey(key)
                .setColumns(columns)
                .build();
    }

    public abstract String getDbName();
    public abstract String getTableName();
    public abstract String getKey();
    public abstract Map<String, Object> getColumns();
    @Nullable
    public abstract Long getLastUpdatedTime();

    public abstract Builder toBuilder();

    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setDbName(String value);
        public abstract Builder setTableName(String value);
        public abstract Builder setKey(String value);
        public abstract Builder setColumns(Map<String, Object> value);
        public abstract Builder setLastUpdatedTime(Long value);

        abstract Map<String, Object> getColumns();
        abstract RawRow autoBuild();

        public RawRow build() {
            // Column values may be null, so the map cannot be an ImmutableMap.
            setColumns(Collections.unmodifiableMap(new LinkedHashMap<>(getColumns())));
            return autoBuild();
        }
    }
}
