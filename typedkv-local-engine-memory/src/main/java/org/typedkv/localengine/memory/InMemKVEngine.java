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

package org.typedkv.localengine.memory;

import com.google.protobuf.ByteString;
import com.google.protobuf.Struct;
import io.micrometer.core.instrument.Tags;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.typedkv.localengine.AbstractKVEngine;
import org.typedkv.localengine.BoundaryUtil;
import org.typedkv.localengine.IKVTransaction;

/**
 * Engine keeping every partition in an ordered skip-list. Data outlives partition handles until the partition is
 * destroyed or the engine is garbage collected.
 *
 * <p>Single-key reads and writes share the engine lock, batches, pops, clears and commits hold it exclusively so
 * none of them is ever observed half-applied.
 */
@Slf4j
public class InMemKVEngine extends AbstractKVEngine<InMemKVPartition> {
    final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final Map<String, ConcurrentSkipListMap<ByteString, ByteString>> dataMaps = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong();

    public InMemKVEngine(String overrideIdentity, Struct conf) {
        super(overrideIdentity, conf);
    }

    @Override
    protected void doStart() {

    }

    @Override
    protected void doStop() {

    }

    @Override
    protected InMemKVPartition doCreatePartition(String id, Tags metricTags, Runnable onClose) {
        ConcurrentSkipListMap<ByteString, ByteString> data =
            dataMaps.computeIfAbsent(id, k -> new ConcurrentSkipListMap<>(BoundaryUtil.KEY_ORDER));
        return new InMemKVPartition(id, data, this, onClose, metricTags);
    }

    @Override
    protected IKVTransaction doBeginTransaction(List<InMemKVPartition> partitions) {
        return new InMemKVTransaction(this, partitions);
    }

    @Override
    protected long doGenerateId() {
        return idGenerator.incrementAndGet();
    }

    @Override
    protected CompletableFuture<Void> doFlush() {
        return CompletableFuture.completedFuture(null);
    }

    void checkStarted() {
        checkState();
    }

    void drop(String partitionId) {
        dataMaps.remove(partitionId);
        log.debug("KVEngine[{}] dropped data of partition[{}]", id(), partitionId);
    }
}
