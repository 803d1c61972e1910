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

package com.cognite.client;

import com.cognite.client.config.ResourceType;
import com.cognite.client.servicesV1.ConnectorServiceV1;
import com.cognite.client.servicesV1.RequestParameters;
import com.cognite.client.servicesV1.ResponseItems;
import com.cognite.client.util.TaskExecutor;
import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for the api endpoint classes. Hosts the shared logic for reading paginated results.
 */
abstract class ApiBase {
    protected final Logger LOG = LoggerFactory.getLogger(this.getClass());

    public abstract CogniteClient getClient();

    /**
     * Reads the Json items of a paginated endpoint, one list per result page.
     *
     * @param resourceType the resource type to read.
     * @param requestParameters the query parameters.
     * @param cursor the cursor to start from. {@code null} starts from the beginning.
     * @param limit the max total number of items. {@code null} reads all items.
     * @return an {@link Iterator} over the result pages.
     * @throws Exception if the request cannot be built.
     */
    protected Iterator<List<String>> listJson(ResourceType resourceType,
                                              RequestParameters requestParameters,
                                              @Nullable String cursor,
                                              @Nullable Long limit) throws Exception {
        Preconditions.checkNotNull(resourceType, "The resource type cannot be null.");
        Preconditions.checkNotNull(requestParameters, "The request parameters cannot be null.");

        RequestParameters request = addAuthInfo(requestParameters);
        ConnectorServiceV1 connector = getClient().getConnectorService();
        ConnectorServiceV1.ResultFutureIterator<String> futureIterator;
        switch (resourceType) {
            case RAW_DB:
                futureIterator = connector.readRawDbNames(request);
                break;
            case RAW_TABLE:
                futureIterator = connector.readRawTableNames(request);
                break;
            case RAW_ROW:
                futureIterator = connector.readRawRows(request);
                break;
            case SESSION:
                futureIterator = connector.readSessions(request);
                break;
            default:
                throw new IllegalArgumentException("Not a supported resource type: " + resourceType);
        }

        return Iterators.transform(futureIterator
                        .withInitialCursor(cursor)
                        .withTotalLimit(limit),
                ApiBase::joinResults);
    }

    /**
     * Adds the auth info (host, project and credentials) of the client to the request.
     *
     * @param parameters the request parameters.
     * @return the request parameters with auth info.
     * @throws Exception if the project cannot be resolved.
     */
    protected RequestParameters addAuthInfo(RequestParameters parameters) throws Exception {
        return parameters.withAuthConfig(getClient().buildAuthConfig());
    }

    /*
    Waits for a page and returns its items. Lambdas don't deal well with checked exceptions, so failures are
    re-thrown as runtime exceptions carrying the original cause.
     */
    private static List<String> joinResults(CompletableFuture<ResponseItems<String>> future) {
        try {
            return future.join().getResultsItems();
        } catch (Exception e) {
            Throwable cause = TaskExecutor.unwrap(e);
            throw new RuntimeException("Failed to read a result page: " + cause.getMessage(), cause);
        }
    }

    abstract static class Builder<B extends Builder<B>> {
        abstract B setClient(CogniteClient value);
    }
}
