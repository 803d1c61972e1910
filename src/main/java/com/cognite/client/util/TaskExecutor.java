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
import com.google.common.base.Preconditions;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs a function over a list of tasks in parallel and collects the outcome in a {@link TasksSummary}.
 *
 * Failed tasks do not stop the other tasks. The outcome of each task is classified as:
 * <ul>
 *     <li>successful: the function returned normally.</li>
 *     <li>failed: a {@link CogniteApiException} with a code below 500, or any other exception.</li>
 *     <li>unknown: a {@link CogniteApiException} with a code of 500 or above.</li>
 * </ul>
 */
public final class TaskExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(TaskExecutor.class);

    private TaskExecutor() {
    }

    /**
     * A task function which may throw checked exceptions.
     *
     * @param <T> the task type
     * @param <R> the result type
     */
    @FunctionalInterface
    public interface TaskFunction<T, R> {
        R apply(T task) throws Exception;
    }

    /**
     * Executes the tasks at the default priority.
     *
     * @see #execute(TaskFunction, List, ExecutorService, int)
     */
    public static <T, R> TasksSummary<T, R> execute(TaskFunction<T, R> function,
                                                    List<T> tasks,
                                                    ExecutorService executor) throws InterruptedException {
        return execute(function, tasks, executor, PriorityThreadPoolExecutor.DEFAULT_PRIORITY);
    }

    /**
     * Executes {@code function} for each task on the executor and blocks until all tasks have completed.
     *
     * The priority is honored when the executor is a {@link PriorityThreadPoolExecutor}.
     *
     * @param function the function to run per task.
     * @param tasks the tasks.
     * @param executor the executor to run the tasks on.
     * @param priority the task priority, {@code >= 0}.
     * @param <T> the task type.
     * @param <R> the result type.
     * @return the summary of the task outcomes.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public static <T, R> TasksSummary<T, R> execute(TaskFunction<T, R> function,
                                                    List<T> tasks,
                                                    ExecutorService executor,
                                                    int priority) throws InterruptedException {
        final String loggingPrefix = "execute() - " + RandomStringUtils.randomAlphanumeric(5) + " - ";
        Instant startInstant = Instant.now();
        Preconditions.checkNotNull(function, "The function cannot be null.");
        Preconditions.checkNotNull(tasks, "The task list cannot be null.");
        Preconditions.checkNotNull(executor, "The executor cannot be null.");
        Preconditions.checkArgument(priority >= 0, "Priority must be >= 0.");

        List<Future<R>> futures = new ArrayList<>(tasks.size());
        for (T task : tasks) {
            if (executor instanceof PriorityThreadPoolExecutor) {
                futures.add(((PriorityThreadPoolExecutor) executor).submit(() -> function.apply(task), priority));
            } else {
                futures.add(executor.submit(() -> function.apply(task)));
            }
        }
        LOG.debug(loggingPrefix + "Submitted {} tasks.", tasks.size());

        List<T> successful = new ArrayList<>();
        List<T> failed = new ArrayList<>();
        List<T> unknown = new ArrayList<>();
        List<R> results = new ArrayList<>();
        List<Throwable> exceptions = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            T task = tasks.get(i);
            try {
                results.add(futures.get(i).get());
                successful.add(task);
            } catch (ExecutionException e) {
                Throwable cause = unwrap(e);
                exceptions.add(cause);
                if (cause instanceof CogniteApiException && ((CogniteApiException) cause).getCode() >= 500) {
                    unknown.add(task);
                } else {
                    failed.add(task);
                }
                LOG.debug(loggingPrefix + "Task {} failed: {}", i, cause.getMessage());
            }
        }

        LOG.info(loggingPrefix + "Executed {} tasks. Successful: {}, failed: {}, unknown: {}. Duration: {}",
                tasks.size(),
                successful.size(),
                failed.size(),
                unknown.size(),
                Duration.between(startInstant, Instant.now()));

        return TasksSummary.of(successful, failed, unknown, results, exceptions);
    }

    /**
     * Strips the {@link ExecutionException} and {@link CompletionException} wrappers from an exception.
     *
     * @param throwable the exception to unwrap.
     * @return the root exception raised by the task.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable result = throwable;
        while ((result instanceof ExecutionException || result instanceof CompletionException)
                && null != result.getCause()) {
            result = result.getCause();
        }
        return result;
    }
}
