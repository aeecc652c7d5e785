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

import com.google.common.primitives.Longs;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteOptions;
import org.typedkv.localengine.KVEngineException;

/**
 * Monotonic id generator which leases blocks of ids. The upper end of the current lease is persisted before any id of
 * the lease is handed out, a restarted engine continues after the last lease.
 */
@Slf4j
class RocksDBIdGenerator {
    private static final byte[] LEASE_KEY = "typedkv:id_lease".getBytes(StandardCharsets.UTF_8);
    private final RocksDB db;
    private final ColumnFamilyHandle cf;
    private final long leaseSize;
    private long lastId;
    private long leasedUpTo;

    RocksDBIdGenerator(RocksDB db, ColumnFamilyHandle cf, long leaseSize) {
        this.db = db;
        this.cf = cf;
        this.leaseSize = Math.max(1, leaseSize);
        try {
            byte[] persisted = db.get(cf, LEASE_KEY);
            leasedUpTo = persisted == null ? 0 : Longs.fromByteArray(persisted);
            lastId = leasedUpTo;
        } catch (RocksDBException e) {
            throw new KVEngineException("Failed to load id lease", e);
        }
    }

    synchronized long next() {
        long id = lastId + 1;
        if (id > leasedUpTo) {
            long newLease = id + leaseSize - 1;
            try (WriteOptions writeOptions = new WriteOptions().setSync(true)) {
                db.put(cf, writeOptions, LEASE_KEY, Longs.toByteArray(newLease));
            } catch (RocksDBException e) {
                throw new KVEngineException("Failed to persist id lease", e);
            }
            log.debug("Leased ids up to {}", newLease);
            leasedUpTo = newLease;
        }
        lastId = id;
        return id;
    }
}
