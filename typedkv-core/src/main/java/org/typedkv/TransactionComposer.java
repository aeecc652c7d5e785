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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.typedkv.exception.TypedKVException;
import org.typedkv.localengine.IKVEngine;
import org.typedkv.localengine.IKVPartition;
import org.typedkv.localengine.IKVTransaction;
import org.typedkv.localengine.IKVTransactionalPartition;
import org.typedkv.localengine.KVEngineException;
import org.typedkv.localengine.KVTransactionConflictException;

/**
 * Runs a callback as one atomic transaction over several collections of the same engine.
 *
 * <p>Every invocation of the callback is one attempt with fresh views. When the attempt conflicts with a concurrent
 * writer the callback runs again from scratch, as many times as it takes.
 */
@Slf4j
public final class TransactionComposer {
    private final IKVEngine engine;
    private final List<TypedCollection<?, ?>> collections;
    private final List<IKVPartition> partitions;
    private final Timer txTimer;
    private final Counter conflictCounter;

    private TransactionComposer(IKVEngine engine, List<TypedCollection<?, ?>> collections) {
        this.engine = engine;
        this.collections = collections;
        this.partitions = collections.stream().<IKVPartition>map(TypedCollection::partition).toList();
        this.txTimer = Timer.builder("typedkv.tx.time")
            .tags("engine", engine.id())
            .register(Metrics.globalRegistry);
        this.conflictCounter = Counter.builder("typedkv.tx.conflict")
            .tags("engine", engine.id())
            .register(Metrics.globalRegistry);
    }

    /**
     * Join collections into one transaction scope.
     *
     * @param first the first collection
     * @param rest the other collections
     * @return the composer
     * @throws IllegalArgumentException if a collection is joined twice or the collections span several engines
     */
    public static TransactionComposer join(TypedCollection<?, ?> first, TypedCollection<?, ?>... rest) {
        List<TypedCollection<?, ?>> collections = new ArrayList<>(rest.length + 1);
        collections.add(first);
        Collections.addAll(collections, rest);
        Set<IKVPartition> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (TypedCollection<?, ?> collection : collections) {
            if (collection.engine() != first.engine()) {
                throw new IllegalArgumentException("Collections belong to different engines: "
                    + first + ", " + collection);
            }
            if (!seen.add(collection.partition())) {
                throw new IllegalArgumentException("Collection joined more than once: " + collection);
            }
        }
        return new TransactionComposer(first.engine(), List.copyOf(collections));
    }

    public int size() {
        return collections.size();
    }

    /**
     * Run the callback until one attempt commits.
     *
     * @param callback the transaction body
     * @param <R> the result type
     * @param <E> the abort type
     * @return the result of the committed attempt
     * @throws E the abort thrown by the callback, nothing was committed
     * @throws TypedKVException.UnabortableEncodingException if a value could not be encoded inside the transaction
     * @throws TypedKVException.StorageException if the engine failed
     */
    public <R, E extends Exception> R transact(TransactionCallback<R, E> callback) throws E {
        Timer.Sample sample = Timer.start();
        try {
            for (int seq = 0; ; seq++) {
                IKVTransaction txn = StorageGuard.call(() -> engine.beginTransaction(partitions));
                TransactionAttempt attempt = new TransactionAttempt(txn, seq);
                try {
                    R result;
                    try {
                        result = callback.apply(newViews(txn, attempt));
                    } finally {
                        attempt.end();
                    }
                    txn.commit();
                    return result;
                } catch (KVTransactionConflictException e) {
                    conflictCounter.increment();
                    log.debug("Transaction conflicted, retry: engine={}, attempt={}, collections={}",
                        engine.id(), seq, collections, e);
                } catch (KVEngineException e) {
                    throw TypedKVException.storage(e);
                } finally {
                    txn.close();
                }
            }
        } finally {
            sample.stop(txTimer);
        }
    }

    private TransactionViews newViews(IKVTransaction txn, TransactionAttempt attempt) {
        List<IKVTransactionalPartition> txPartitions = txn.partitions();
        List<TransactionalCollection<?, ?>> views = new ArrayList<>(collections.size());
        for (int i = 0; i < collections.size(); i++) {
            views.add(newView(collections.get(i), txPartitions.get(i), attempt));
        }
        return new TransactionViews(collections, views, attempt);
    }

    private static <K, V> TransactionalCollection<K, V> newView(TypedCollection<K, V> collection,
                                                                IKVTransactionalPartition partition,
                                                                TransactionAttempt attempt) {
        return new TransactionalCollection<>(collection, partition, attempt);
    }
}
