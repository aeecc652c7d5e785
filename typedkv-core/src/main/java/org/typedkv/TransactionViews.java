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

import java.util.List;

/**
 * The transactional views of one attempt, in the order the collections were joined.
 */
public final class TransactionViews {
    private final List<TypedCollection<?, ?>> collections;
    private final List<TransactionalCollection<?, ?>> views;
    private final TransactionAttempt attempt;

    TransactionViews(List<TypedCollection<?, ?>> collections,
                     List<TransactionalCollection<?, ?>> views,
                     TransactionAttempt attempt) {
        this.collections = collections;
        this.views = views;
        this.attempt = attempt;
    }

    public int size() {
        return views.size();
    }

    public TransactionalCollection<?, ?> get(int index) {
        return views.get(index);
    }

    /**
     * The view of a joined collection.
     *
     * @param collection the joined collection
     * @param <K> the key type
     * @param <V> the value type
     * @return the view of the collection in this attempt
     * @throws IllegalArgumentException if the collection was not joined
     */
    @SuppressWarnings("unchecked")
    public <K, V> TransactionalCollection<K, V> of(TypedCollection<K, V> collection) {
        for (int i = 0; i < collections.size(); i++) {
            if (collections.get(i) == collection) {
                return (TransactionalCollection<K, V>) views.get(i);
            }
        }
        throw new IllegalArgumentException("Collection not joined: " + collection.name());
    }

    /**
     * Engine-wide monotonic id, same as asking any of the views.
     *
     * @return the id
     */
    public long generateId() {
        return StorageGuard.call(() -> attempt.txn().generateId());
    }
}
