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

import static org.typedkv.localengine.StructUtil.toValue;

import com.google.protobuf.Struct;
import org.rocksdb.util.SizeUnit;

/**
 * Default configuration constants for the RocksDB engine.
 */
public final class RocksDBDefaultConfigs {
    public static final String DB_ROOT_DIR = "dbRootDir";
    public static final String BLOCK_CACHE_SIZE = "blockCacheSize";
    public static final String WRITE_BUFFER_SIZE = "writeBufferSize";
    public static final String MAX_WRITE_BUFFER_NUMBER = "maxWriteBufferNumber";
    public static final String MAX_BACKGROUND_JOBS = "maxBackgroundJobs";
    public static final String FSYNC_WAL = "fsyncWAL";
    public static final String ID_LEASE_SIZE = "idLeaseSize";
    public static final Struct DEFAULT;

    static {
        Struct.Builder configBuilder = Struct.newBuilder();
        configBuilder.putFields(DB_ROOT_DIR, toValue(""));
        configBuilder.putFields(BLOCK_CACHE_SIZE, toValue(32 * SizeUnit.MB));
        configBuilder.putFields(WRITE_BUFFER_SIZE, toValue(64 * SizeUnit.MB));
        configBuilder.putFields(MAX_WRITE_BUFFER_NUMBER, toValue(4));
        configBuilder.putFields(MAX_BACKGROUND_JOBS,
            toValue(Math.max(Runtime.getRuntime().availableProcessors() / 4, 2)));
        configBuilder.putFields(FSYNC_WAL, toValue(true));
        configBuilder.putFields(ID_LEASE_SIZE, toValue(1024));
        DEFAULT = configBuilder.build();
    }
}
