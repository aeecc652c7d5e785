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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.typedkv.localengine.rocksdb.RocksDBDefaultConfigs.DB_ROOT_DIR;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.protobuf.Struct;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.testng.annotations.Test;
import org.typedkv.localengine.IKVEngine;
import org.typedkv.localengine.KVEngineFactory;
import org.typedkv.localengine.StructUtil;

public class RocksDBKVEngineProviderTest {
    @Test
    public void createWithMergedDefaults() throws Exception {
        Path dir = Files.createTempDirectory("typedkv-provider-");
        try {
            Struct conf = StructUtil.fromMap(Map.of(DB_ROOT_DIR, dir.toString()));
            IKVEngine engine = KVEngineFactory.create("rocksdb", conf);
            assertTrue(engine instanceof RocksDBKVEngine);
            engine.start();
            try {
                assertEquals(engine.createIfMissing("p1").count(), 0);
                assertTrue(dir.resolve("CURRENT").toFile().exists());
            } finally {
                engine.stop();
            }
        } finally {
            MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
        }
    }
}
