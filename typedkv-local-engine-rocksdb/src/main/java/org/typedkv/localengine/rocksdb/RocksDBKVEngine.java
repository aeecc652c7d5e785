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

import static org.typedkv.localengine.StructUtil.boolVal;
import static org.typedkv.localengine.StructUtil.longVal;
import static org.typedkv.localengine.StructUtil.strVal;
import static org.typedkv.localengine.rocksdb.RocksDBDefaultConfigs.BLOCK_CACHE_SIZE;
import static org.typedkv.localengine.rocksdb.RocksDBDefaultConfigs.DB_ROOT_DIR;
import static org.typedkv.localengine.rocksdb.RocksDBDefaultConfigs.FSYNC_WAL;
import static org.typedkv.localengine.rocksdb.RocksDBDefaultConfigs.ID_LEASE_SIZE;
import static org.typedkv.localengine.rocksdb.RocksDBOptionsUtil.buildCFOptions;
import static org.typedkv.localengine.rocksdb.RocksDBOptionsUtil.buildDBOptions;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.protobuf.Struct;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.BloomFilter;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.LRUCache;
import org.rocksdb.OptimisticTransactionDB;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteOptions;
import org.typedkv.localengine.AbstractKVEngine;
import org.typedkv.localengine.IKVTransaction;
import org.typedkv.localengine.KVEngineException;

/**
 * Engine backed by one optimistic transaction RocksDB instance, every partition lives in its own column family.
 */
@Slf4j
public class RocksDBKVEngine extends AbstractKVEngine<RocksDBKVPartition> {
    static final String PARTITION_CF_PREFIX = "p:";

    static {
        RocksDB.loadLibrary();
    }

    private final File dbRootDir;
    private final Map<String, ColumnFamilyHandle> cfHandles = new ConcurrentHashMap<>();
    private final AtomicReference<CompletableFuture<Void>> flushFutureRef = new AtomicReference<>();
    private final List<AutoCloseable> nativeResources = new ArrayList<>();
    private DBOptions dbOptions;
    private ColumnFamilyOptions cfOptions;
    private WriteOptions writeOptions;
    private OptimisticTransactionDB db;
    private ColumnFamilyHandle defaultCF;
    private RocksDBIdGenerator idGenerator;
    private ExecutorService flushExecutor;
    private Timer flushTimer;

    public RocksDBKVEngine(String overrideIdentity, Struct conf) {
        super(overrideIdentity, conf);
        String rootDir = strVal(conf, DB_ROOT_DIR);
        if (rootDir.isEmpty()) {
            throw new IllegalArgumentException("'" + DB_ROOT_DIR + "' must be specified");
        }
        try {
            dbRootDir = Paths.get(rootDir).toFile();
        } catch (Throwable t) {
            throw new IllegalArgumentException("Invalid '" + DB_ROOT_DIR + "' path", t);
        }
    }

    @Override
    protected void doStart() {
        try {
            Files.createDirectories(dbRootDir.getAbsoluteFile().toPath());
            LRUCache blockCache = new LRUCache(longVal(conf, BLOCK_CACHE_SIZE), 8);
            BloomFilter bloomFilter = new BloomFilter(16, false);
            nativeResources.add(blockCache);
            nativeResources.add(bloomFilter);
            dbOptions = buildDBOptions(conf);
            cfOptions = buildCFOptions(conf, blockCache, bloomFilter);
            writeOptions = new WriteOptions();

            List<ColumnFamilyDescriptor> cfDescs = new ArrayList<>();
            cfDescs.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions));
            for (byte[] cfName : listColumnFamilies()) {
                if (new String(cfName, StandardCharsets.UTF_8).startsWith(PARTITION_CF_PREFIX)) {
                    cfDescs.add(new ColumnFamilyDescriptor(cfName, cfOptions));
                }
            }
            List<ColumnFamilyHandle> handles = new ArrayList<>();
            db = OptimisticTransactionDB.open(dbOptions, dbRootDir.getAbsolutePath(), cfDescs, handles);
            defaultCF = handles.get(0);
            for (int i = 1; i < handles.size(); i++) {
                String cfName = new String(cfDescs.get(i).getName(), StandardCharsets.UTF_8);
                cfHandles.put(cfName.substring(PARTITION_CF_PREFIX.length()), handles.get(i));
            }
            idGenerator = new RocksDBIdGenerator(db, defaultCF, longVal(conf, ID_LEASE_SIZE));
            flushExecutor = ExecutorServiceMetrics.monitor(Metrics.globalRegistry, new ThreadPoolExecutor(1, 1,
                    0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(),
                    new ThreadFactoryBuilder().setNameFormat("kvengine-flusher-" + id() + "-%d").setDaemon(true)
                        .build()),
                "flusher", "typedkv", metricTags());
            flushTimer = Timer.builder("typedkv.le.flush.time")
                .tags(metricTags())
                .register(Metrics.globalRegistry);
            log.debug("RocksDB opened at {} with {} partitions", dbRootDir.getAbsolutePath(), cfHandles.size());
        } catch (Throwable e) {
            throw new KVEngineException("Failed to open RocksDB at " + dbRootDir.getAbsolutePath(), e);
        }
    }

    @Override
    protected void doStop() {
        flushExecutor.shutdown();
        try {
            if (!flushExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Flusher of KVEngine[{}] not terminated in time", id());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            db.flushWal(true);
        } catch (Throwable e) {
            log.error("Failed to sync WAL before closing", e);
        }
        Metrics.globalRegistry.remove(flushTimer);
        idGenerator = null;
        cfHandles.values().forEach(ColumnFamilyHandle::close);
        cfHandles.clear();
        defaultCF.close();
        db.close();
        writeOptions.close();
        cfOptions.close();
        dbOptions.close();
        for (AutoCloseable resource : nativeResources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.error("Failed to release native resource", e);
            }
        }
        nativeResources.clear();
    }

    @Override
    protected RocksDBKVPartition doCreatePartition(String id, Tags metricTags, Runnable onClose) {
        ColumnFamilyHandle cf = cfHandles.computeIfAbsent(id, k -> {
            try {
                ColumnFamilyHandle handle = db.createColumnFamily(
                    new ColumnFamilyDescriptor((PARTITION_CF_PREFIX + k).getBytes(StandardCharsets.UTF_8),
                        cfOptions));
                log.info("KVEngine[{}] created partition[{}]", id(), k);
                return handle;
            } catch (RocksDBException e) {
                throw new KVEngineException("Failed to create partition[" + k + "]", e);
            }
        });
        return new RocksDBKVPartition(id, this, cf, onClose, metricTags);
    }

    @Override
    protected IKVTransaction doBeginTransaction(List<RocksDBKVPartition> partitions) {
        return new RocksDBKVTransaction(this, partitions);
    }

    @Override
    protected long doGenerateId() {
        return idGenerator.next();
    }

    @Override
    protected CompletableFuture<Void> doFlush() {
        CompletableFuture<Void> flushFuture;
        if (flushFutureRef.compareAndSet(null, flushFuture = new CompletableFuture<>())) {
            submitFlush(flushFuture);
        } else {
            flushFuture = flushFutureRef.get();
            if (flushFuture == null) {
                // try again
                return doFlush();
            }
        }
        return flushFuture;
    }

    OptimisticTransactionDB db() {
        return db;
    }

    WriteOptions writeOptions() {
        return writeOptions;
    }

    void checkStarted() {
        checkState();
    }

    void drop(String partitionId) {
        ColumnFamilyHandle cf = cfHandles.remove(partitionId);
        if (cf == null) {
            return;
        }
        try {
            db.dropColumnFamily(cf);
            log.info("KVEngine[{}] dropped partition[{}]", id(), partitionId);
        } catch (RocksDBException e) {
            throw new KVEngineException("Failed to drop partition[" + partitionId + "]", e);
        } finally {
            cf.close();
        }
    }

    private List<byte[]> listColumnFamilies() throws RocksDBException {
        if (!new File(dbRootDir, "CURRENT").exists()) {
            return List.of();
        }
        try (Options options = new Options()) {
            return RocksDB.listColumnFamilies(options, dbRootDir.getAbsolutePath());
        }
    }

    private void submitFlush(CompletableFuture<Void> onDone) {
        boolean sync = boolVal(conf, FSYNC_WAL);
        try {
            flushExecutor.submit(() -> {
                // requests arriving from now on queue a new flush
                flushFutureRef.compareAndSet(onDone, null);
                try {
                    log.trace("KVEngine[{}] flush wal start", id());
                    Timer.Sample start = Timer.start();
                    db.flushWal(sync);
                    start.stop(flushTimer);
                    log.trace("KVEngine[{}] flush complete", id());
                    onDone.complete(null);
                } catch (Throwable e) {
                    log.error("KVEngine[{}] flush error", id(), e);
                    onDone.completeExceptionally(new KVEngineException("KVEngine flush error", e));
                }
            });
        } catch (Throwable e) {
            flushFutureRef.compareAndSet(onDone, null);
            onDone.completeExceptionally(new KVEngineException("KVEngine flush rejected", e));
        }
    }
}
