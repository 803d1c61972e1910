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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Maps the elements of each batch from an underlying iterator. Used for parsing Json items into typed objects.
 *
 * @param <T> the source element type
 * @param <R> the target element type
 */
public class AdapterIterator<T, R> implements Iterator<List<R>> {
    private final Iterator<List<T>> source;
    private final Function<? super T, ? extends R> mapper;

    private AdapterIterator(Iterator<List<T>> source, Function<? super T, ? extends R> mapper) {
        this.source = source;
        this.mapper = mapper;
    }

    public static <T, R> AdapterIterator<T, R> of(Iterator<List<T>> source, Function<? super T, ? extends R> mapper) {
        Preconditions.checkNotNull(source, "The source iterator cannot be null.");
        Preconditions.checkNotNull(mapper, "The mapper cannot be null.");
        return new AdapterIterator<>(source, mapper);
    }

    @Override
    public boolean hasNext() {
        return source.hasNext();
    }

    @Override
    public List<R> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more elements to iterate over.");
        }
        List<T> batch = source.next();
        List<R> results = new ArrayList<>(batch.size());
        for (T element : batch) {
            results.add(mapper.apply(element));
        }
        return results;
    }
}
