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

import static com.google.protobuf.ByteString.copyFromUtf8;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertThrows;

import com.google.protobuf.Struct;
import java.util.List;
import org.testng.annotations.Test;
import org.typedkv.localengine.AbstractKVEngineTest;
import org.typedkv.localengine.IKVEngine;
import org.typedkv.localengine.IKVPartition;
import org.typedkv.localengine.IKVTransaction;
import org.typedkv.localengine.KVTransactionConflictException;
import org.typedkv.localengine.KVWriteBatch;

public class InMemKVEngineTest extends AbstractKVEngineTest {
    @Override
    protected IKVEngine newEngine() {
        return new InMemKVEngine(null, Struct.getDefaultInstance());
    }

    @Test
    public void blindBatchWriteConflicts() {
        IKVPartition p1 = engine.createIfMissing("p1");
        try (IKVTransaction txn = engine.beginTransaction(List.of(p1))) {
            txn.partitions().get(0).apply(new KVWriteBatch()
                .put(copyFromUtf8("k"), copyFromUtf8("tx")));
            p1.insert(copyFromUtf8("k"), copyFromUtf8("outside"));
            assertThrows(KVTransactionConflictException.class, txn::commit);
        }
        assertEquals(p1.get(copyFromUtf8("k")).get(), copyFromUtf8("outside"));
    }
}
