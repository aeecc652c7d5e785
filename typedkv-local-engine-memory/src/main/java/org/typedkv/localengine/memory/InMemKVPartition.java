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
import io.micrometer.core.instrument.Tags;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import org.slf4j.LoggerFactory;
import org.typedkv.localengine.AbstractKVPartition;
import org.typedkv.localengine.Boundary;
import org.typedkv.localengine.IKVCursor;
import org.typedkv.localengine.KVPair;
import org.typedkv.localengine.KVWriteBatch;

public class InMemKVPartition extends AbstractKVPartition {
    private final ConcurrentSkipListMap<ByteString, ByteString> data;
    private final InMemKVEngine engine;

    InMemKVPartition(String id,
                     ConcurrentSkipListMap<ByteString, ByteString> data,
                     InMemKVEngine engine,
                     Runnable onClose,
                     Tags engineTags) {
        super(id, onClose, LoggerFactory.getLogger(InMemKVPartition.class), engineTags);
        this.data = data;
        this.engine = engine;
    }

    @Override
    protected boolean doExist(ByteString key) {
        return shared(() -> data.containsKey(key));
    }

    @Override
    protected Optional<ByteString> doGet(ByteString key) {
        return shared(() -> Optional.ofNullable(data.get(key)));
    }

    @Override
    protected Optional<ByteString> doInsert(ByteString key, ByteString value) {
        return shared(() -> Optional.ofNullable(data.put(key, value)));
    }

    @Override
    protected Optional<ByteString> doRemove(ByteString key) {
        return shared(() -> Optional.ofNullable(data.remove(key)));
    }

    @Override
    protected IKVCursor doNewCursor(Boundary boundary) {
        return new InMemKVCursor(data, boundary);
    }

    @Override
    protected void doApply(KVWriteBatch batch) {
        exclusive(() -> {
            applyActions(batch);
            return null;
        });
    }

    @Override
    protected Optional<KVPair> doPop(boolean min) {
        return exclusive(() -> {
            Map.Entry<ByteString, ByteString> entry = min ? data.pollFirstEntry() : data.pollLastEntry();
            return Optional.ofNullable(entry).map(e -> new KVPair(e.getKey(), e.getValue()));
        });
    }

    @Override
    protected long doCount() {
        return data.size();
    }

    @Override
    protected void doClear() {
        exclusive(() -> {
            data.clear();
            return null;
        });
    }

    @Override
    protected CompletableFuture<Void> doFlush() {
        return engine.flush();
    }

    @Override
    protected void doDestroy() {
        engine.drop(id);
    }

    Optional<ByteString> committed(ByteString key) {
        return Optional.ofNullable(data.get(key));
    }

    // caller must hold the exclusive lock
    void applyActions(KVWriteBatch batch) {
        for (KVWriteBatch.KVAction action : batch.actions()) {
            switch (action.type()) {
                case Put -> data.put(action.key(), action.value());
                case Delete -> data.remove(action.key());
                default -> throw new UnsupportedOperationException("Unknown action type: " + action.type());
            }
        }
    }

    private <T> T shared(Supplier<T> op) {
        return locked(engine.rwLock.readLock(), op);
    }

    private <T> T exclusive(Supplier<T> op) {
        return locked(engine.rwLock.writeLock(), op);
    }

    private static <T> T locked(Lock lock, Supplier<T> op) {
        lock.lock();
        try {
            return op.get();
        } finally {
            lock.unlock();
        }
    }
}
