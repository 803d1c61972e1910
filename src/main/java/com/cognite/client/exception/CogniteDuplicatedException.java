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
 * Raised when the api reports one or more items as duplicates (409 with {@code duplicated}).
 */
public class CogniteDuplicatedException extends CogniteCompoundException {
    private final ImmutableList<Map<String, Object>> duplicated;

    public CogniteDuplicatedException(List<Map<String, Object>> duplicated,
                                      @Nullable Throwable cause,
                                      List<?> successful,
                                      List<?> failed,
                                      List<?> unknown,
                                      List<? extends Throwable> exceptions) {
        super("Duplicated: " + duplicated, cause, successful, failed, unknown, exceptions);
        this.duplicated = ImmutableList.copyOf(duplicated);
    }

    public ImmutableList<Map<String, Object>> getDuplicated() {
        return duplicated;
    }
}
