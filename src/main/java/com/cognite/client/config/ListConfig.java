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

/**
 * Controls how a list operation pages through the results.
 *
 * <ul>
 *     <li>{@code chunkSize}: the number of items per returned batch. Unset means the default page size.</li>
 *     <li>{@code limit}: the max total number of items to return. Unset means all items.</li>
 *     <li>{@code partitions}: the number of parallel cursor streams. Unset means serial pagination.</li>
 * </ul>
 */
@AutoValue
public abstract class ListConfig {

    private static Builder builder() {
        return new AutoValue_ListConfig.Builder();
    }

    /**
     * Returns a config with no chunk size, no limit and no partitions.
     */
    public static ListConfig create() {
        return ListConfig.builder().build();
    }

    abstract Builder toBuilder();

    @Nullable
    public abstract Integer getChunkSize();
    @Nullable
    public abstract Long getLimit();
    @Nullable
    public abstract Integer getPartitions();

    public ListConfig withChunkSize(int chunkSize) {
        Preconditions.checkArgument(chunkSize >= 1, "Chunk size must be >= 1");
        return toBuilder().setChunkSize(chunkSize).build();
    }

    public ListConfig withLimit(long limit) {
        Preconditions.checkArgument(limit >= 0, "Limit cannot be negative");
        return toBuilder().setLimit(limit).build();
    }

    public ListConfig withPartitions(int partitions) {
        Preconditions.checkArgument(partitions >= 1, "Partitions must be >= 1");
        return toBuilder().setPartitions(partitions).build();
    }

    @AutoValue.Builder
    abstract static class Builder {
        abstract Builder setChunkSize(Integer value);
        abstract Builder setLimit(Long value);
        abstract Builder setPartitions(Integer value);

        abstract ListConfig build();
    }
}
