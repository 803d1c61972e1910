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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

/**
 * Reads a set of partitions concurrently and fans their batches into a single iterator.
 *
 * Each partition is drained on its own worker thread. The batches are buffered in a shared queue and returned
 * in arrival order. There is no ordering across partitions, but the order within a partition is kept.
 *
 * <p>Memory is bounded by backpressure: when the buffer holds {@code P} (number of partitions) or more batches,
 * a worker sleeps for a random duration between zero and {@code P x backpressureUnit} before checking again.
 * The buffer never holds more than {@code 2P} batches.
 *
 * <p>When a limit is set, the batch reaching the limit is trimmed and the workers are told to stop. A worker
 * finishes its in-flight request but does not start a new one. Calls to {@code next()} never return more than
 * {@code limit} elements in total.
 *
 * <p>When the iteration completes, each worker's outcome is checked. Cancelled workers are ignored, a failed
 * worker raises a {@link RuntimeException} carrying the failure as its cause.
 *
 * <p>The workers run on a shared executor and only stop when the iteration completes. A caller that stops
 * reading before the end must call {@link #close()}, otherwise the workers keep their threads while they wait
 * for the buffer to drain.
 *
 * @param <T> the element type
 */
@AutoValue
public abstract class FanOutIterator<T> implements CloseableIterator<List<T>> {
    private static final Duration DEFAULT_BACKPRESSURE_UNIT = Duration.ofSeconds(1);
    private static final long POLL_INTERVAL_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    protected final Logger LOG = LoggerFactory.getLogger(this.getClass());
    private final String loggingPrefix = "FanOutIterator [" + RandomStringUtils.randomAlphanumeric(5) + "] -";

    private final Queue<List<T>> results = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean quitEarly = new AtomicBoolean(false);
    private final AtomicInteger bufferedBatches = new AtomicInteger(0);
    private final AtomicInteger peakBufferedBatches = new AtomicInteger(0);

    private List<Future<?>> futures = null;
    private List<T> nextBatch = null;
    private long noElementsReturned = 0L;
    private boolean exhausted = false;
    private boolean completionChecked = false;
    private Instant startInstant = null;

    private static <T> Builder<T> builder() {
        return new AutoValue_FanOutIterator.Builder<T>()
                .setBackpressureUnit(DEFAULT_BACKPRESSURE_UNIT);
    }

    /**
     * Creates an iterator reading the partitions on the given executor.
     *
     * The executor must be able to run all partitions concurrently for the backpressure to work as intended.
     *
     * @param partitions the partitions to read.
     * @param executor the executor to run the partition workers on.
     * @param <T> the element type
     * @return the iterator.
     */
    public static <T> FanOutIterator<T> of(List<? extends Iterator<List<T>>> partitions, ExecutorService executor) {
        Preconditions.checkNotNull(partitions, "The partitions cannot be null.");
        Preconditions.checkNotNull(executor, "The executor cannot be null.");
        return FanOutIterator.<T>builder()
                .setPartitions(ImmutableList.copyOf(partitions))
                .setExecutor(executor)
                .build();
    }

    abstract Builder<T> toBuilder();
    abstract ImmutableList<Iterator<List<T>>> getPartitions();
    abstract ExecutorService getExecutor();
    @Nullable
    abstract Long getLimit();
    abstract Duration getBackpressureUnit();

    /**
     * Caps the total number of elements returned.
     *
     * @param limit the max number of elements. {@code null} means no cap.
     * @return the iterator with the limit applied.
     */
    public FanOutIterator<T> withLimit(@Nullable Long limit) {
        Preconditions.checkArgument(null == limit || limit >= 0, "The limit cannot be negative.");
        return toBuilder().setLimit(limit).build();
    }

    /**
     * Sets the unit of the randomized backpressure sleep.
     *
     * @param unit the backpressure unit.
     * @return the iterator with the setting applied.
     */
    public FanOutIterator<T> withBackpressureUnit(Duration unit) {
        Preconditions.checkArgument(null != unit && !unit.isNegative() && !unit.isZero(),
                "The backpressure unit must be positive.");
        return toBuilder().setBackpressureUnit(unit).build();
    }

    /**
     * Stops the partition workers. Workers finish their in-flight request, but do not issue new ones.
     * Batches already buffered are still returned.
     */
    public void cancel() {
        quitEarly.set(true);
        if (null != futures) {
            for (Future<?> future : futures) {
                future.cancel(false);
            }
        }
    }

    /**
     * Stops the partition workers and discards the buffered batches. Further calls to {@code hasNext()} return
     * {@code false}. Worker failures are not reported after closing.
     */
    @Override
    public void close() {
        if (exhausted && (completionChecked || null == futures) && null == nextBatch) {
            return;
        }
        LOG.debug(loggingPrefix + "Closing the iterator after {} elements.", noElementsReturned);
        cancel();
        exhausted = true;
        completionChecked = true;
        nextBatch = null;
        results.clear();
        bufferedBatches.set(0);
    }

    /**
     * The max number of unconsumed batches observed in the buffer.
     */
    int getPeakBufferedBatches() {
        return peakBufferedBatches.get();
    }

    @Override
    public boolean hasNext() {
        if (null != nextBatch) {
            return true;
        }
        if (exhausted) {
            checkCompletion();
            return false;
        }
        if (null == futures) {
            if (null != getLimit() && getLimit() == 0L) {
                exhausted = true;
                return false;
            }
            start();
        }

        while (true) {
            List<T> batch = results.poll();
            if (null != batch) {
                bufferedBatches.decrementAndGet();
                if (accept(batch)) {
                    return true;
                }
                if (exhausted) {
                    checkCompletion();
                    return false;
                }
            } else if (allWorkersDone()) {
                // A worker may have added a batch right before completing.
                if (results.isEmpty()) {
                    exhausted = true;
                    LOG.info(loggingPrefix + "All partitions read. Returned {} elements. Duration: {}",
                            noElementsReturned, Duration.between(startInstant, Instant.now()));
                    checkCompletion();
                    return false;
                }
            } else {
                LockSupport.parkNanos(POLL_INTERVAL_NANOS);
            }
        }
    }

    @Override
    public List<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more elements to iterate over.");
        }
        List<T> batch = nextBatch;
        nextBatch = null;
        return batch;
    }

    private void start() {
        startInstant = Instant.now();
        LOG.debug(loggingPrefix + "Starting {} partition workers. Limit: {}", getPartitions().size(), getLimit());
        List<Future<?>> submitted = new ArrayList<>(getPartitions().size());
        for (Iterator<List<T>> partition : getPartitions()) {
            submitted.add(getExecutor().submit(() -> {
                exhaust(partition);
                return null;
            }));
        }
        futures = submitted;
    }

    /*
    Registers a batch as the next batch to return. Returns false if the batch is empty.
     */
    private boolean accept(List<T> batch) {
        if (null == getLimit()) {
            if (batch.isEmpty()) {
                return false;
            }
            noElementsReturned += batch.size();
            nextBatch = batch;
            return true;
        }

        long remaining = getLimit() - noElementsReturned;
        if (batch.size() < remaining) {
            if (batch.isEmpty()) {
                return false;
            }
            noElementsReturned += batch.size();
            nextBatch = batch;
            return true;
        }

        // This batch reaches the limit.
        LOG.info(loggingPrefix + "Limit of {} elements reached. Stopping the partition workers. Duration: {}",
                getLimit(), Duration.between(startInstant, Instant.now()));
        cancel();
        exhausted = true;
        List<T> trimmed = new ArrayList<>(batch.subList(0, (int) remaining));
        noElementsReturned += trimmed.size();
        if (trimmed.isEmpty()) {
            return false;
        }
        nextBatch = trimmed;
        return true;
    }

    /*
    Drains a partition into the shared buffer. Runs on a worker thread.
     */
    private void exhaust(Iterator<List<T>> partition) throws InterruptedException {
        final int noPartitions = getPartitions().size();
        final long maxSleepNanos = getBackpressureUnit().toNanos() * noPartitions;

        while (!quitEarly.get() && partition.hasNext()) {
            List<T> batch = partition.next();
            results.add(batch);
            peakBufferedBatches.accumulateAndGet(bufferedBatches.incrementAndGet(), Math::max);
            if (quitEarly.get()) {
                return;
            }
            while (bufferedBatches.get() >= noPartitions) {
                TimeUnit.NANOSECONDS.sleep(ThreadLocalRandom.current().nextLong(maxSleepNanos + 1));
                if (quitEarly.get()) {
                    return;
                }
            }
        }
    }

    private boolean allWorkersDone() {
        for (Future<?> future : futures) {
            if (!future.isDone()) {
                return false;
            }
        }
        return true;
    }

    /*
    Surfaces worker failures. Cancelled workers are not failures.
     */
    private void checkCompletion() {
        if (completionChecked || null == futures) {
            return;
        }
        completionChecked = true;
        for (Future<?> future : futures) {
            if (future.isCancelled()) {
                continue;
            }
            try {
                future.get();
            } catch (ExecutionException e) {
                String message = loggingPrefix + "A partition failed: " + e.getCause().getMessage();
                LOG.error(message);
                throw new RuntimeException(message, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException(loggingPrefix + "Interrupted while checking the partition workers.", e);
            }
        }
    }

    @AutoValue.Builder
    abstract static class Builder<T> {
        abstract Builder<T> setPartitions(ImmutableList<Iterator<List<T>>> value);
        abstract Builder<T> setExecutor(ExecutorService value);
        abstract Builder<T> setLimit(Long value);
        abstract Builder<T> setBackpressureUnit(Duration value);

        abstract FanOutIterator<T> build();
    }
}
