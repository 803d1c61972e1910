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
import java.util.Optional;

/**
 * Raised when one or more tasks of a multi-request operation fail.
 *
 * A write operation is often split into several api requests. When some of them fail, this exception
 * reports which items were written ({@code successful}), which were rejected by the api ({@code failed})
 * and which have an unknown outcome ({@code unknown}). The last group covers requests that failed with a
 * server error (5xx); the items may or may not have been written.
 *
 * The three lists are disjoint and together cover all input items.
 */
public class CogniteCompoundException extends CogniteException {
    private final ImmutableList<Object> successful;
    private final ImmutableList<Object> failed;
    private final ImmutableList<Object> unknown;
    private final ImmutableList<Throwable> exceptions;

    public CogniteCompoundException(String message,
                                    @Nullable Throwable cause,
                                    List<?> successful,
                                    List<?> failed,
                                    List<?> unknown,
                                    List<? extends Throwable> exceptions) {
        super(message, cause);
        this.successful = ImmutableList.copyOf(successful);
        this.failed = ImmutableList.copyOf(failed);
        this.unknown = ImmutableList.copyOf(unknown);
        this.exceptions = ImmutableList.copyOf(exceptions);
    }

    /**
     * Returns the items that were successfully processed.
     */
    public ImmutableList<Object> getSuccessful() {
        return successful;
    }

    /**
     * Returns the items that were not processed.
     */
    public ImmutableList<Object> getFailed() {
        return failed;
    }

    /**
     * Returns the items with an unknown outcome.
     */
    public ImmutableList<Object> getUnknown() {
        return unknown;
    }

    /**
     * Returns all exceptions raised by the failed tasks.
     */
    public ImmutableList<Throwable> getExceptions() {
        return exceptions;
    }

    /**
     * Returns the http status code of the underlying api error, if the cause is an api error.
     */
    public Optional<Integer> getCode() {
        if (getCause() instanceof CogniteApiException) {
            return Optional.of(((CogniteApiException) getCause()).getCode());
        }
        return Optional.empty();
    }

    @Override
    public String getMessage() {
        return String.format("%s%nThe api calls completed for %d items, failed for %d items "
                        + "and have an unknown outcome for %d items.",
                super.getMessage(),
                successful.size(),
                failed.size(),
                unknown.size());
    }
}
