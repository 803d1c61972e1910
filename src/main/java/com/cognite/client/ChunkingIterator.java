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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Re-batches an iterator of lists into lists of exactly {@code chunkSize} elements. The last batch may be
 * smaller.
 *
 * @param <T> the element type
 */
public class ChunkingIterator<T> implements Iterator<List<T>> {
    private final Iterator<List<T>> source;
    private final int chunkSize;
    private final Deque<T> buffer = new ArrayDeque<>();

    private ChunkingIterator(Iterator<List<T>> source, int chunkSize) {
        this.source = source;
        this.chunkSize = chunkSize;
    }

    public static <T> ChunkingIterator<T> of(Iterator<List<T>> source, int chunkSize) {
        Preconditions.checkNotNull(source, "The source iterator cannot be null.");
        Preconditions.checkArgument(chunkSize >= 1, "Chunk size must be >= 1");
        return new ChunkingIterator<>(source, chunkSize);
    }

    @Override
    public boolean hasNext() {
        while (buffer.isEmpty() && source.hasNext()) {
            buffer.addAll(source.next());
        }
        return !buffer.isEmpty();
    }

    @Override
    public List<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more elements to iterate over.");
        }
        while (buffer.size() < chunkSize && source.hasNext()) {
            buffer.addAll(source.next());
        }
        List<T> chunk = new ArrayList<>(Math.min(chunkSize, buffer.size()));
        while (chunk.size() < chunkSize && !buffer.isEmpty()) {
            chunk.add(buffer.pollFirst());
        }
        return chunk;
    }
}
