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

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RunnableFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A fixed size thread pool that schedules queued tasks by priority.
 *
 * Lower values mean higher priority, {@code 0} being the highest. Tasks with equal priority run in
 * submission order. The plain {@code submit} and {@code execute} methods use priority {@code 0}.
 *
 * Priorities only matter once all worker threads are busy and tasks start queueing.
 */
public class PriorityThreadPoolExecutor extends ThreadPoolExecutor {
    public static final int DEFAULT_PRIORITY = 0;
    private static final long KEEP_ALIVE_SECONDS = 60L;

    private final AtomicLong sequence = new AtomicLong();

    /**
     * Creates a pool with {@code maxWorkers} daemon threads.
     *
     * @param maxWorkers the number of worker threads.
     */
    public PriorityThreadPoolExecutor(int maxWorkers) {
        super(maxWorkers, maxWorkers, KEEP_ALIVE_SECONDS, TimeUnit.SECONDS, new PriorityBlockingQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("cognite-worker-%d")
                        .setDaemon(true)
                        .build());
        allowCoreThreadTimeOut(true);
    }

    /**
     * Submits a task with the given priority.
     *
     * @param task the task to run.
     * @param priority the priority. Must be {@code >= 0}, lower is more urgent.
     * @param <T> the result type.
     * @return the future of the task.
     */
    public <T> Future<T> submit(Callable<T> task, int priority) {
        Preconditions.checkNotNull(task, "The task cannot be null.");
        Preconditions.checkArgument(priority >= 0, "Priority must be >= 0. Got: " + priority);
        PriorityTask<T> priorityTask = new PriorityTask<>(task, priority, sequence.getAndIncrement());
        execute(priorityTask);
        return priorityTask;
    }

    /**
     * Changes the number of worker threads.
     *
     * @param maxWorkers the new number of worker threads.
     */
    public void resize(int maxWorkers) {
        Preconditions.checkArgument(maxWorkers >= 1, "Max workers must be >= 1");
        if (maxWorkers > getMaximumPoolSize()) {
            setMaximumPoolSize(maxWorkers);
            setCorePoolSize(maxWorkers);
        } else {
            setCorePoolSize(maxWorkers);
            setMaximumPoolSize(maxWorkers);
        }
    }

    @Override
    public void execute(Runnable command) {
        if (command instanceof PriorityTask) {
            super.execute(command);
        } else {
            super.execute(new PriorityTask<Void>(command, null, DEFAULT_PRIORITY, sequence.getAndIncrement()));
        }
    }

    @Override
    protected <T> RunnableFuture<T> newTaskFor(Callable<T> callable) {
        return new PriorityTask<>(callable, DEFAULT_PRIORITY, sequence.getAndIncrement());
    }

    @Override
    protected <T> RunnableFuture<T> newTaskFor(Runnable runnable, T value) {
        return new PriorityTask<>(runnable, value, DEFAULT_PRIORITY, sequence.getAndIncrement());
    }

    /*
    Ordered by priority, then by submission sequence.
     */
    static class PriorityTask<T> extends FutureTask<T> implements Comparable<PriorityTask<?>> {
        private final int priority;
        private final long sequenceNumber;

        PriorityTask(Callable<T> callable, int priority, long sequenceNumber) {
            super(callable);
            this.priority = priority;
            this.sequenceNumber = sequenceNumber;
        }

        PriorityTask(Runnable runnable, T value, int priority, long sequenceNumber) {
            super(runnable, value);
            this.priority = priority;
            this.sequenceNumber = sequenceNumber;
        }

        @Override
        public int compareTo(PriorityTask<?> other) {
            int result = Integer.compare(priority, other.priority);
            if (result == 0) {
                result = Long.compare(sequenceNumber, other.sequenceNumber);
            }
            return result;
        }
    }
}
