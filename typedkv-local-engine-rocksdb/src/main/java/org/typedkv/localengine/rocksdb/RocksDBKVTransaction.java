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

package org.typedkv.localengine.rocksdb;

import static com.google.protobuf.UnsafeByteOperations.unsafeWrap;

import com.google.protobuf.ByteString;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDBException;
import org.rocksdb.Transaction;
import org.typedkv.localengine.IKVTransaction;
import org.typedkv.localengine.IKVTransactionalPartition;
import org.typedkv.localengine.KVEngineException;
import org.typedkv.localengine.KVTransactionConflictException;
import org.typedkv.localengine.KVWriteBatch;

/**
 * One attempt of an optimistic RocksDB transaction. Every key read or written is tracked, commit fails with a
 * conflict if any of them was changed by someone else since it was first touched.
 */
@Slf4j
class RocksDBKVTransaction implements IKVTransaction {
    private final RocksDBKVEngine engine;
    private final List<RocksDBKVPartition> joined;
    private final List<IKVTransactionalPartition> txPartitions;
    private final Transaction txn;
    private final ReadOptions readOptions;
    private State state = State.Active;
    private boolean flushRequested;

    RocksDBKVTransaction(RocksDBKVEngine engine, List<RocksDBKVPartition> partitions) {
        this.engine = engine;
        this.joined = partitions;
        this.txn = engine.db().beginTransaction(engine.writeOptions());
        this.readOptions = new ReadOptions();
        List<IKVTransactionalPartition> views = new ArrayList<>(partitions.size());
        for (RocksDBKVPartition partition : partitions) {
            views.add(new TxPartition(partition.id(), partition.cf()));
        }
        this.txPartitions = Collections.unmodifiableList(views);
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
        for (RocksDBKVPartition partition : joined) {
            if (!partition.isOpen()) {
                rollback();
                throw new KVEngineException("Partition[" + partition.id() + "] is not open");
            }
        }
        try {
            txn.commit();
            state = State.Committed;
        } catch (RocksDBException e) {
            // a failed commit leaves nothing applied
            state = State.RolledBack;
            if (RocksDBHelper.isConflict(e)) {
                throw new KVTransactionConflictException("Transaction conflict", e);
            }
            throw new KVEngineException("Transaction commit failed", e);
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
            try {
                txn.rollback();
            } catch (RocksDBException e) {
                throw new KVEngineException("Transaction rollback failed", e);
            }
        }
    }

    @Override
    public void close() {
        try {
            rollback();
        } finally {
            txn.close();
            readOptions.close();
        }
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
        private final String id;
        private final ColumnFamilyHandle cf;

        TxPartition(String id, ColumnFamilyHandle cf) {
            this.id = id;
            this.cf = cf;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public Optional<ByteString> get(ByteString key) {
            checkActive();
            try {
                return Optional.ofNullable(txn.getForUpdate(readOptions, cf, key.toByteArray(), true))
                    .map(v -> unsafeWrap(v));
            } catch (RocksDBException e) {
                throw new KVEngineException("Get in transaction failed", e);
            }
        }

        @Override
        public Optional<ByteString> insert(ByteString key, ByteString value) {
            Optional<ByteString> prev = get(key);
            try {
                txn.put(cf, key.toByteArray(), value.toByteArray());
            } catch (RocksDBException e) {
                throw new KVEngineException("Put in transaction failed", e);
            }
            return prev;
        }

        @Override
        public Optional<ByteString> remove(ByteString key) {
            Optional<ByteString> prev = get(key);
            if (prev.isPresent()) {
                try {
                    txn.delete(cf, key.toByteArray());
                } catch (RocksDBException e) {
                    throw new KVEngineException("Delete in transaction failed", e);
                }
            }
            return prev;
        }

        @Override
        public void apply(KVWriteBatch batch) {
            checkActive();
            try {
                for (KVWriteBatch.KVAction action : batch.actions()) {
                    switch (action.type()) {
                        case Put -> txn.put(cf, action.key().toByteArray(), action.value().toByteArray());
                        case Delete -> txn.delete(cf, action.key().toByteArray());
                        default -> throw new UnsupportedOperationException("Unknown action type: " + action.type());
                    }
                }
            } catch (RocksDBException e) {
                throw new KVEngineException("Batch in transaction failed", e);
            }
        }
    }
}
