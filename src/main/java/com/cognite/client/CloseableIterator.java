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

import com.google.common.base.Preconditions;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An {@link Iterator} which holds resources until it is exhausted or closed.
 *
 * Close the iterator when you stop reading before the end, for example with try-with-resources.
 *
 * @param <T> the element type
 */
public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {

    /**
     * Releases the resources held by the iterator. Further calls to {@code hasNext()} return {@code false}.
     * Closing an iterator more than once has no effect.
     */
    @Override
    void close();

    /**
     * Wraps an iterator. When the iterator is not closeable, {@code close()} only ends the iteration.
     *
     * @param iterator the iterator to wrap.
     * @param <T> the element type
     * @return the closeable iterator.
     */
    static <T> CloseableIterator<T> wrap(Iterator<T> iterator) {
        Preconditions.checkNotNull(iterator, "The iterator cannot be null.");
        if (iterator instanceof CloseableIterator) {
            return (CloseableIterator<T>) iterator;
        }
        return new CloseableIterator<T>() {
            private boolean closed = false;

            @Override
            public boolean hasNext() {
                return !closed && iterator.hasNext();
            }

            @Override
            public T next() {
                if (closed) {
                    throw new NoSuchElementException("The iterator is closed.");
                }
                return iterator.next();
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }
}
