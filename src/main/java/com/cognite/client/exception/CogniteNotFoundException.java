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

package com.cognite.client.exception;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Raised when the api reports one or more referenced items as missing (400 / 422 with {@code missing}).
 */
public class CogniteNotFoundException extends CogniteCompoundException {
    private final ImmutableList<Map<String, Object>> notFound;

    public CogniteNotFoundException(List<Map<String, Object>> notFound,
                                    @Nullable Throwable cause,
                                    List<?> successful,
                                    List<?> failed,
                                    List<?> unknown,
                                    List<? extends Throwable> exceptions) {
        super("Not found: " + notFound, cause, successful, failed, unknown, exceptions);
        this.notFound = ImmutableList.copyOf(notFound);
    }

    public ImmutableList<Map<String, Object>> getNotFound() {
        return notFound;
    }
}
