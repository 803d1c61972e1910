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

package com.cognite.client.util;

import com.cognite.client.exception.CogniteApiException;
import com.cognite.client.exception.CogniteCompoundException;
import com.cognite.client.exception.CogniteDuplicatedException;
import com.cognite.client.exception.CogniteNotFoundException;
import com.google.auto.value.AutoValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The outcome of running a set of tasks with {@link TaskExecutor}.
 *
 * Every submitted task ends up in exactly one of the successful, failed or unknown lists.
 * Unknown means the request may or may not have taken effect server side (i.e. a 5xx response).
 *
 * @param <T> the task type
 * @param <R> the result type
 */
@AutoValue
public abstract class TasksSummary<T, R> {
    private static final Logger LOG = LoggerFactory.getLogger(TasksSummary.class);

    static <T, R> TasksSummary<T, R> of(List<T> successfulTasks,
                                        List<T> failedTasks,
                                        List<T> unknownTasks,
                                        List<R> results,
                                        List<Throwable> exceptions) {
        return new AutoValue_TasksSummary<>(
                Collections.unmodifiableList(new ArrayList<>(successfulTasks)),
                Collections.unmodifiableList(new ArrayList<>(failedTasks)),
                Collections.unmodifiableList(new ArrayList<>(unknownTasks)),
                Collections.unmodifiableList(new ArrayList<>(results)),
                Collections.unmodifiableList(new ArrayList<>(exceptions)));
    }

    public abstract List<T> getSuccessfulTasks();
    public abstract List<T> getFailedTasks();
    public abstract List<T> getUnknownTasks();

    /**
     * The results of the successful tasks, in task order.
     */
    public abstract List<R> getResults();
    public abstract List<Throwable> getExceptions();

    /**
     * Flattens the results into a single list.
     *
     * @param unwrap extracts the elements from a single result.
     * @param <E> the element type.
     * @return all result elements, in task order.
     */
    public <E> List<E> joinedResults(Function<? super R, ? extends Collection<? extends E>> unwrap) {
        List<E> joined = new ArrayList<>();
        for (R result : getResults()) {
            joined.addAll(unwrap.apply(result));
        }
        return joined;
    }

    /**
     * Raises a compound exception if any task failed. The tasks themselves are reported as the
     * successful, failed and unknown elements.
     *
     * @throws CogniteCompoundException if at least one task raised an exception.
     */
    public void throwCompoundExceptionIfFailedTasks() throws CogniteCompoundException {
        this.<T>throwCompoundExceptionIfFailedTasks(task -> List.of(task), element -> element);
    }

    /**
     * Raises a compound exception if any task failed.
     *
     * Each task is expanded to its elements via {@code taskUnwrap} and each element is mapped via
     * {@code elementUnwrap} (i.e. from a row to its key) before being reported. The exception type depends on the
     * api errors observed:
     * <ul>
     *     <li>{@link CogniteNotFoundException} when the only errors are 400/422 responses listing missing items.</li>
     *     <li>{@link CogniteDuplicatedException} when the only errors are 409 responses listing duplicated items.</li>
     *     <li>{@link CogniteCompoundException} otherwise.</li>
     * </ul>
     *
     * @param taskUnwrap expands a task into its elements.
     * @param elementUnwrap maps an element to its reported form.
     * @param <E> the element type.
     * @throws CogniteCompoundException if at least one task raised an exception.
     */
    public <E> void throwCompoundExceptionIfFailedTasks(Function<? super T, ? extends Collection<? extends E>> taskUnwrap,
                                                       Function<? super E, ?> elementUnwrap)
            throws CogniteCompoundException {
        if (getExceptions().isEmpty()) {
            return;
        }

        List<Object> successful = unwrapTasks(getSuccessfulTasks(), taskUnwrap, elementUnwrap);
        List<Object> failed = unwrapTasks(getFailedTasks(), taskUnwrap, elementUnwrap);
        List<Object> unknown = unwrapTasks(getUnknownTasks(), taskUnwrap, elementUnwrap);

        List<Map<String, Object>> missing = new ArrayList<>();
        List<Map<String, Object>> duplicated = new ArrayList<>();
        CogniteApiException missingException = null;
        CogniteApiException duplicatedException = null;
        Throwable unknownException = null;

        for (Throwable exception : getExceptions()) {
            if (exception instanceof CogniteApiException) {
                CogniteApiException apiException = (CogniteApiException) exception;
                int code = apiException.getCode();
                if ((code == 400 || code == 422) && !apiException.getMissing().isEmpty()) {
                    missing.addAll(apiException.getMissing());
                    missingException = apiException;
                } else if (code == 409 && !apiException.getDuplicated().isEmpty()) {
                    duplicated.addAll(apiException.getDuplicated());
                    duplicatedException = apiException;
                } else {
                    unknownException = apiException;
                }
            } else {
                unknownException = exception;
            }
        }

        LOG.debug("Tasks completed with exceptions. Successful: {}, failed: {}, unknown: {}",
                getSuccessfulTasks().size(), getFailedTasks().size(), getUnknownTasks().size());

        if (null != unknownException) {
            throw new CogniteCompoundException(String.valueOf(unknownException.getMessage()), unknownException,
                    successful, failed, unknown, getExceptions());
        }
        if (null != missingException) {
            throw new CogniteNotFoundException(missing, missingException,
                    successful, failed, unknown, getExceptions());
        }
        throw new CogniteDuplicatedException(duplicated, duplicatedException,
                successful, failed, unknown, getExceptions());
    }

    private static <T, E> List<Object> unwrapTasks(List<T> tasks,
                                                   Function<? super T, ? extends Collection<? extends E>> taskUnwrap,
                                                   Function<? super E, ?> elementUnwrap) {
        List<Object> elements = new ArrayList<>();
        for (T task : tasks) {
            for (E element : taskUnwrap.apply(task)) {
                elements.add(elementUnwrap.apply(element));
            }
        }
        return elements;
    }
}
