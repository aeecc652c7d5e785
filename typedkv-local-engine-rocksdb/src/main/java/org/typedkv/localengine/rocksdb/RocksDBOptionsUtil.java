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

import static org.typedkv.localengine.StructUtil.intVal;
import static org.typedkv.localengine.StructUtil.longVal;
import static org.typedkv.localengine.rocksdb.RocksDBDefaultConfigs.MAX_BACKGROUND_JOBS;
import static org.typedkv.localengine.rocksdb.RocksDBDefaultConfigs.MAX_WRITE_BUFFER_NUMBER;
import static org.typedkv.localengine.rocksdb.RocksDBDefaultConfigs.WRITE_BUFFER_SIZE;

import com.google.protobuf.Struct;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.Cache;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompactionStyle;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.Env;
import org.rocksdb.util.SizeUnit;

/**
 * Build RocksDB options from Struct configuration.
 */
final class RocksDBOptionsUtil {
    static DBOptions buildDBOptions(Struct conf) {
        return new DBOptions()
            .setEnv(Env.getDefault())
            .setCreateIfMissing(true)
            .setCreateMissingColumnFamilies(true)
            .setAvoidUnnecessaryBlockingIO(true)
            .setMaxManifestFileSize(64 * SizeUnit.MB)
            // info log file settings
            .setMaxLogFileSize(128 * SizeUnit.MB)
            .setKeepLogFileNum(4)
            .setMaxOpenFiles(256)
            .setAllowConcurrentMemtableWrite(true)
            .setBytesPerSync(1048576)
            .setMaxBackgroundJobs(intVal(conf, MAX_BACKGROUND_JOBS));
    }

    /**
     * Column family options sharing the engine wide block cache and bloom filter.
     */
    static ColumnFamilyOptions buildCFOptions(Struct conf, Cache blockCache, BloomFilter bloomFilter) {
        return new ColumnFamilyOptions()
            .setTableFormatConfig(new BlockBasedTableConfig()
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true)
                .setBlockSize(4 * SizeUnit.KB)
                .setBlockCache(blockCache))
            .setForceConsistencyChecks(true)
            .setCompactionStyle(CompactionStyle.LEVEL)
            .setCompressionType(CompressionType.LZ4_COMPRESSION)
            .setBottommostCompressionType(CompressionType.ZSTD_COMPRESSION)
            .setWriteBufferSize(longVal(conf, WRITE_BUFFER_SIZE))
            .setMaxWriteBufferNumber(intVal(conf, MAX_WRITE_BUFFER_NUMBER));
    }
}
