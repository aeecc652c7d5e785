/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.typedkv;

import java.util.Iterator;
import java.util.function.Function;

/**
 * An iterator consumable from both ends. Both ends share the remaining elements and never yield the same one.
 *
 * @param <T> the element type
 */
public interface DoubleEndedIterator<T> extends Iterator<T>, AutoCloseable {
    boolean hasNextBack();

    T nextBack();

    /**
     * Release the underlying cursor.
     */
    @Override
    void close();

    default <R> DoubleEndedIterator<R> map(Function<? super T, ? extends R> mapper) {
        DoubleEndedIterator<T> self = this;
        return new DoubleEndedIterator<>() {
            @Override
            public boolean hasNextBack() {
                return self.hasNextBack();
            }

            @Override
            public R nextBack() {
                return mapper.apply(self.nextBack());
            }

            @Override
            public void close() {
                self.close();
            }

            @Override
            public boolean hasNext() {
                return self.hasNext();
            }

            @Override
            public R next() {
                return mapper.apply(self.next());
            }
        };
    }
}
