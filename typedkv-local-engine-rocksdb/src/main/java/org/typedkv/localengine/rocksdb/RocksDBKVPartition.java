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
import static org.typedkv.localengine.metrics.GeneralKVPartitionMetric.EstimatedKeysGauge;

import com.google.protobuf.ByteString;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Tags;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.OptimisticTransactionDB;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Transaction;
import org.rocksdb.WriteBatch;
import org.slf4j.LoggerFactory;
import org.typedkv.localengine.AbstractKVPartition;
import org.typedkv.localengine.Boundary;
import org.typedkv.localengine.IKVCursor;
import org.typedkv.localengine.KVEngineException;
import org.typedkv.localengine.KVPair;
import org.typedkv.localengine.KVWriteBatch;
import org.typedkv.localengine.metrics.KVPartitionMeters;

public class RocksDBKVPartition extends AbstractKVPartition {
    private final RocksDBKVEngine engine;
    private final OptimisticTransactionDB db;
    private final ColumnFamilyHandle cf;
    private final Set<RocksDBKVCursor> openCursors = ConcurrentHashMap.newKeySet();
    private final Gauge estimatedKeysGauge;

    RocksDBKVPartition(String id, RocksDBKVEngine engine, ColumnFamilyHandle cf, Runnable onClose, Tags engineTags) {
        super(id, onClose, LoggerFactory.getLogger(RocksDBKVPartition.class), engineTags);
        this.engine = engine;
        this.db = engine.db();
        this.cf = cf;
        estimatedKeysGauge = KVPartitionMeters.getGauge(id, EstimatedKeysGauge, this::estimatedKeys, engineTags);
    }

    ColumnFamilyHandle cf() {
        return cf;
    }

    @Override
    protected boolean doExist(ByteString key) {
        return doGet(key).isPresent();
    }

    @Override
    protected Optional<ByteString> doGet(ByteString key) {
        try {
            byte[] value = db.get(cf, key.toByteArray());
            return Optional.ofNullable(value).map(v -> unsafeWrap(v));
        } catch (RocksDBException e) {
            throw new KVEngineException("Get failed", e);
        }
    }

    @Override
    protected Optional<ByteString> doInsert(ByteString key, ByteString value) {
        byte[] k = key.toByteArray();
        byte[] v = value.toByteArray();
        return inTransaction((txn, readOptions) -> {
            byte[] prev = txn.getForUpdate(readOptions, cf, k, true);
            txn.put(cf, k, v);
            return Optional.ofNullable(prev).map(p -> unsafeWrap(p));
        });
    }

    @Override
    protected Optional<ByteString> doRemove(ByteString key) {
        byte[] k = key.toByteArray();
        return inTransaction((txn, readOptions) -> {
            byte[] prev = txn.getForUpdate(readOptions, cf, k, true);
            if (prev != null) {
                txn.delete(cf, k);
            }
            return Optional.ofNullable(prev).map(p -> unsafeWrap(p));
        });
    }

    @Override
    protected IKVCursor doNewCursor(Boundary boundary) {
        RocksDBKVCursor cursor = new RocksDBKVCursor(db, cf, boundary, openCursors::remove);
        openCursors.add(cursor);
        return cursor;
    }

    @Override
    protected void doApply(KVWriteBatch batch) {
        try (WriteBatch writeBatch = new WriteBatch()) {
            for (KVWriteBatch.KVAction action : batch.actions()) {
                switch (action.type()) {
                    case Put -> writeBatch.put(cf, action.key().toByteArray(), action.value().toByteArray());
                    case Delete -> writeBatch.delete(cf, action.key().toByteArray());
                    default -> throw new UnsupportedOperationException("Unknown action type: " + action.type());
                }
            }
            db.write(engine.writeOptions(), writeBatch);
        } catch (RocksDBException e) {
            logger.error("Write Batch commit failed", e);
            throw new KVEngineException("Batch commit failed", e);
        }
    }

    @Override
    protected Optional<KVPair> doPop(boolean min) {
        while (true) {
            byte[] key;
            try (ReadOptions readOptions = new ReadOptions(); RocksIterator itr = db.newIterator(cf, readOptions)) {
                if (min) {
                    itr.seekToFirst();
                } else {
                    itr.seekToLast();
                }
                if (!itr.isValid()) {
                    itr.status();
                    return Optional.empty();
                }
                key = itr.key();
            } catch (RocksDBException e) {
                throw new KVEngineException("Pop failed", e);
            }
            Optional<KVPair> popped = inTransaction((txn, readOptions) -> {
                byte[] value = txn.getForUpdate(readOptions, cf, key, true);
                if (value == null) {
                    return Optional.empty();
                }
                txn.delete(cf, key);
                return Optional.of(new KVPair(unsafeWrap(key), unsafeWrap(value)));
            });
            if (popped.isPresent()) {
                return popped;
            }
            logger.debug("Entry removed concurrently while popping from partition[{}], retry", id);
        }
    }

    @Override
    protected long doCount() {
        long count = 0;
        try (RocksDBKVIterator itr = new RocksDBKVIterator(db, cf, null, null, null)) {
            for (itr.seekToFirst(); itr.isValid(); itr.next()) {
                count++;
            }
        }
        return count;
    }

    @Override
    protected void doClear() {
        try (RocksDBKVIterator itr = new RocksDBKVIterator(db, cf, null, null, null);
             WriteBatch writeBatch = new WriteBatch()) {
            for (itr.seekToFirst(); itr.isValid(); itr.next()) {
                writeBatch.delete(cf, itr.key());
            }
            db.write(engine.writeOptions(), writeBatch);
        } catch (RocksDBException e) {
            throw new KVEngineException("Clear failed", e);
        }
    }

    @Override
    protected CompletableFuture<Void> doFlush() {
        return engine.flush();
    }

    @Override
    protected void doClose() {
        estimatedKeysGauge.close();
        openCursors.forEach(RocksDBKVCursor::close);
    }

    @Override
    protected void doDestroy() {
        engine.drop(id);
    }

    private long estimatedKeys() {
        if (!isOpen()) {
            return 0;
        }
        try {
            return db.getLongProperty(cf, "rocksdb.estimate-num-keys");
        } catch (Throwable e) {
            return 0;
        }
    }

    private <T> T inTransaction(TxnOp<T> op) {
        while (true) {
            try (Transaction txn = db.beginTransaction(engine.writeOptions());
                 ReadOptions readOptions = new ReadOptions()) {
                T result = op.run(txn, readOptions);
                txn.commit();
                return result;
            } catch (RocksDBException e) {
                if (RocksDBHelper.isConflict(e)) {
                    logger.debug("Write conflict on partition[{}], retry", id);
                    continue;
                }
                throw new KVEngineException("Write failed", e);
            }
        }
    }

    private interface TxnOp<T> {
        T run(Transaction txn, ReadOptions readOptions) throws RocksDBException;
    }
}
