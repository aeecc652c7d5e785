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

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDB;
import org.rocksdb.Snapshot;
import org.typedkv.localengine.Boundary;
import org.typedkv.localengine.BoundaryUtil;
import org.typedkv.localengine.IKVCursor;
import org.typedkv.localengine.KVPair;

/**
 * Double-ended cursor reading from one pinned snapshot through two bounded iterators, one per end.
 */
class RocksDBKVCursor implements IKVCursor {
    private final RocksDB db;
    private final Snapshot snapshot;
    private final RocksDBKVIterator frontItr;
    private final RocksDBKVIterator backItr;
    private final Consumer<RocksDBKVCursor> onClose;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final boolean emptyRange;
    private byte[] frontKey;
    private byte[] backKey;
    private boolean frontStarted;
    private boolean backStarted;

    RocksDBKVCursor(RocksDB db, ColumnFamilyHandle cf, Boundary boundary, Consumer<RocksDBKVCursor> onClose) {
        this.db = db;
        this.onClose = onClose;
        this.emptyRange = BoundaryUtil.isEmptyRange(boundary);
        byte[] startKey = boundary.hasStartKey() ? boundary.startKey().toByteArray() : null;
        byte[] endKey = boundary.hasEndKey() ? boundary.endKey().toByteArray() : null;
        snapshot = db.getSnapshot();
        frontItr = new RocksDBKVIterator(db, cf, snapshot, startKey, endKey);
        backItr = new RocksDBKVIterator(db, cf, snapshot, startKey, endKey);
    }

    @Override
    public Optional<KVPair> nextFront() {
        if (closed.get() || emptyRange) {
            return Optional.empty();
        }
        if (frontStarted) {
            if (frontItr.isValid()) {
                frontItr.next();
            }
        } else {
            frontItr.seekToFirst();
            frontStarted = true;
        }
        if (!frontItr.isValid()) {
            return Optional.empty();
        }
        byte[] key = frontItr.key();
        if (backKey != null && BoundaryUtil.compare(key, backKey) >= 0) {
            return Optional.empty();
        }
        frontKey = key;
        return Optional.of(new KVPair(unsafeWrap(key), unsafeWrap(frontItr.value())));
    }

    @Override
    public Optional<KVPair> nextBack() {
        if (closed.get() || emptyRange) {
            return Optional.empty();
        }
        if (backStarted) {
            if (backItr.isValid()) {
                backItr.prev();
            }
        } else {
            backItr.seekToLast();
            backStarted = true;
        }
        if (!backItr.isValid()) {
            return Optional.empty();
        }
        byte[] key = backItr.key();
        if (frontKey != null && BoundaryUtil.compare(key, frontKey) <= 0) {
            return Optional.empty();
        }
        backKey = key;
        return Optional.of(new KVPair(unsafeWrap(key), unsafeWrap(backItr.value())));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            frontItr.close();
            backItr.close();
            db.releaseSnapshot(snapshot);
            onClose.accept(this);
        }
    }
}
