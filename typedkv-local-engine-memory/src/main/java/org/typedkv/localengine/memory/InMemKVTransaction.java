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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import lombok.extern.slf4j.Slf4j;
import org.typedkv.localengine.BoundaryUtil;
import org.typedkv.localengine.IKVTransaction;
import org.typedkv.localengine.IKVTransactionalPartition;
import org.typedkv.localengine.KVEngineException;
import org.typedkv.localengine.KVTransactionConflictException;
import org.typedkv.localengine.KVWriteBatch;

/**
 * Optimistic transaction over in-memory partitions. Writes are buffered per partition, every key read or written
 * remembers the committed value it was based on, and commit re-checks those values under the exclusive engine lock.
 */
@Slf4j
class InMemKVTransaction implements IKVTransaction {
    private final InMemKVEngine engine;
    private final List<IKVTransactionalPartition> txPartitions;
    private final List<TxPartition> tracked;
    private State state = State.Active;
    private boolean flushRequested;

    InMemKVTransaction(InMemKVEngine engine, List<InMemKVPartition> partitions) {
        this.engine = engine;
        this.tracked = new ArrayList<>(partitions.size());
        for (InMemKVPartition partition : partitions) {
            tracked.add(new TxPartition(partition));
        }
        this.txPartitions = Collections.unmodifiableList(tracked);
    }

    @Override
    public List<IKVTransactionalPartition> partitions() {
        return txPartitions;
    }

    @Override
    public long generateId() {
        checkActive();
        return engine.generateId();
    }

    @Override
    public void requestFlush() {
        checkActive();
        flushRequested = true;
    }

    @Override
    public void commit() {
        checkActive();
        engine.checkStarted();
        Lock lock = engine.rwLock.writeLock();
        lock.lock();
        try {
            for (TxPartition txPartition : tracked) {
                if (!txPartition.partition.isOpen()) {
                    state = State.RolledBack;
                    throw new KVEngineException("Partition[" + txPartition.partition.id() + "] is not open");
                }
                for (Map.Entry<ByteString, Optional<ByteString>> observed : txPartition.observed.entrySet()) {
                    if (!txPartition.partition.committed(observed.getKey()).equals(observed.getValue())) {
                        state = State.RolledBack;
                        throw new KVTransactionConflictException(
                            "Conflict detected on partition[" + txPartition.partition.id() + "]");
                    }
                }
            }
            for (TxPartition txPartition : tracked) {
                txPartition.partition.applyActions(txPartition.toBatch());
            }
            state = State.Committed;
        } finally {
            lock.unlock();
        }
        if (flushRequested) {
            engine.flush().whenComplete((v, e) -> {
                if (e != null) {
                    log.error("Flush after commit failed", e);
                }
            });
        }
    }

    @Override
    public void rollback() {
        if (state == State.Active) {
            state = State.RolledBack;
            tracked.forEach(TxPartition::reset);
        }
    }

    @Override
    public void close() {
        rollback();
    }

    private void checkActive() {
        if (state != State.Active) {
            throw new IllegalStateException("Transaction is " + state);
        }
    }

    private enum State {
        Active, Committed, RolledBack
    }

    private class TxPartition implements IKVTransactionalPartition {
        private final InMemKVPartition partition;
        // empty means deleted
        private final TreeMap<ByteString, Optional<ByteString>> writes = new TreeMap<>(BoundaryUtil.KEY_ORDER);
        private final Map<ByteString, Optional<ByteString>> observed = new HashMap<>();

        TxPartition(InMemKVPartition partition) {
            this.partition = partition;
        }

        @Override
        public String id() {
            return partition.id();
        }

        @Override
        public Optional<ByteString> get(ByteString key) {
            checkActive();
            Optional<ByteString> written = writes.get(key);
            if (written != null) {
                return written;
            }
            return observe(key);
        }

        @Override
        public Optional<ByteString> insert(ByteString key, ByteString value) {
            Optional<ByteString> prev = get(key);
            writes.put(key, Optional.of(value));
            return prev;
        }

        @Override
        public Optional<ByteString> remove(ByteString key) {
            Optional<ByteString> prev = get(key);
            writes.put(key, Optional.empty());
            return prev;
        }

        @Override
        public void apply(KVWriteBatch batch) {
            checkActive();
            for (KVWriteBatch.KVAction action : batch.actions()) {
                if (!writes.containsKey(action.key())) {
                    observe(action.key());
                }
                switch (action.type()) {
                    case Put -> writes.put(action.key(), Optional.of(action.value()));
                    case Delete -> writes.put(action.key(), Optional.empty());
                    default -> throw new UnsupportedOperationException("Unknown action type: " + action.type());
                }
            }
        }

        private Optional<ByteString> observe(ByteString key) {
            Optional<ByteString> seen = observed.get(key);
            if (seen == null) {
                Lock lock = engine.rwLock.readLock();
                lock.lock();
                try {
                    seen = partition.committed(key);
                } finally {
                    lock.unlock();
                }
                observed.put(key, seen);
            }
            return seen;
        }

        private KVWriteBatch toBatch() {
            KVWriteBatch batch = new KVWriteBatch();
            writes.forEach((k, v) -> {
                if (v.isPresent()) {
                    batch.put(k, v.get());
                } else {
                    batch.delete(k);
                }
            });
            return batch;
        }

        private void reset() {
            writes.clear();
            observed.clear();
        }
    }
}
