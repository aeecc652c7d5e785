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

package org.typedkv;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.expectThrows;

import com.google.protobuf.ByteString;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.mockito.Mock;
import org.testng.annotations.Test;
import org.typedkv.codec.KVCodecs;
import org.typedkv.exception.TypedKVException.StorageException;
import org.typedkv.localengine.IKVEngine;
import org.typedkv.localengine.IKVPartition;
import org.typedkv.localengine.IKVTransaction;
import org.typedkv.localengine.IKVTransactionalPartition;
import org.typedkv.localengine.KVEngineException;
import org.typedkv.localengine.KVTransactionConflictException;
import org.typedkv.localengine.MockableTest;

public class TransactionComposerTest extends MockableTest {
    private static final KVSchema<String, String> SCHEMA = KVSchema.of(KVCodecs.utf8(), KVCodecs.utf8());

    @Mock
    private IKVEngine engine;
    @Mock
    private IKVEngine otherEngine;
    @Mock
    private IKVPartition partition;
    @Mock
    private IKVPartition otherPartition;
    @Mock
    private IKVTransaction txn;
    @Mock
    private IKVTransactionalPartition txPartition;
    private SimpleMeterRegistry meterRegistry;
    private TypedCollection<String, String> collection;

    @Override
    protected void doSetup(Method method) {
        meterRegistry = new SimpleMeterRegistry();
        Metrics.addRegistry(meterRegistry);
        when(engine.id()).thenReturn("engine-" + method.getName());
        when(otherEngine.id()).thenReturn("other");
        when(partition.id()).thenReturn("p1");
        when(otherPartition.id()).thenReturn("p2");
        when(engine.createIfMissing("p1")).thenReturn(partition);
        when(engine.createIfMissing("p2")).thenReturn(otherPartition);
        when(otherEngine.createIfMissing("p2")).thenReturn(otherPartition);
        when(engine.beginTransaction(anyList())).thenReturn(txn);
        when(txn.partitions()).thenReturn(List.of(txPartition));
        collection = TypedCollection.open(engine, "p1", SCHEMA);
    }

    @Override
    protected void doTeardown(Method method) {
        Metrics.removeRegistry(meterRegistry);
        meterRegistry.close();
    }

    @Test
    public void retryOnCommitConflict() throws Exception {
        doThrow(new KVTransactionConflictException("conflict")).doNothing().when(txn).commit();
        AtomicInteger invocations = new AtomicInteger();
        String result = collection.transaction(tx -> {
            tx.insert("k", "v" + invocations.incrementAndGet());
            return "ok";
        });
        assertEquals(result, "ok");
        assertEquals(invocations.get(), 2);
        verify(engine, times(2)).beginTransaction(List.of(partition));
        verify(txPartition).insert(ByteString.copyFromUtf8("k"), ByteString.copyFromUtf8("v1"));
        verify(txPartition).insert(ByteString.copyFromUtf8("k"), ByteString.copyFromUtf8("v2"));
        verify(txn, times(2)).commit();
        verify(txn, times(2)).close();
        assertEquals(meterRegistry.get("typedkv.tx.conflict")
            .tag("engine", "engine-retryOnCommitConflict").counter().count(), 1.0, 0.0);
        assertEquals(meterRegistry.get("typedkv.tx.time")
            .tag("engine", "engine-retryOnCommitConflict").timer().count(), 1);
    }

    @Test
    public void retryOnConflictingRead() throws Exception {
        when(txPartition.get(any()))
            .thenThrow(new KVTransactionConflictException("busy"))
            .thenReturn(Optional.of(ByteString.copyFromUtf8("v")));
        AtomicInteger invocations = new AtomicInteger();
        String value = collection.transaction(tx -> {
            invocations.incrementAndGet();
            return tx.get("k").get().get();
        });
        assertEquals(value, "v");
        assertEquals(invocations.get(), 2);
        verify(txn, times(1)).commit();
    }

    @Test
    public void domainAbortRollsBack() {
        AtomicInteger invocations = new AtomicInteger();
        Exception e = expectThrows(Exception.class, () -> collection.transaction(tx -> {
            invocations.incrementAndGet();
            tx.insert("k", "v");
            throw new Exception("abort");
        }));
        assertEquals(e.getMessage(), "abort");
        assertEquals(invocations.get(), 1);
        verify(txn, never()).commit();
        verify(txn).close();
    }

    @Test
    public void commitFailureIsStorageFailure() {
        doThrow(new KVEngineException("disk full")).when(txn).commit();
        AtomicInteger invocations = new AtomicInteger();
        StorageException e = expectThrows(StorageException.class, () -> collection.transaction(tx -> {
            invocations.incrementAndGet();
            return null;
        }));
        assertEquals(e.getCause().getMessage(), "disk full");
        assertEquals(invocations.get(), 1);
        verify(txn).close();
    }

    @Test
    public void readFailureIsStorageFailure() {
        when(txPartition.get(any())).thenThrow(new KVEngineException("corrupted"));
        assertThrows(StorageException.class, () -> collection.transaction(tx -> tx.get("k")));
        verify(txn, never()).commit();
        verify(txn).close();
    }

    @Test
    public void beginFailureIsStorageFailure() {
        when(engine.beginTransaction(anyList())).thenThrow(new KVEngineException("stopped"));
        assertThrows(StorageException.class, () -> collection.transaction(tx -> null));
    }

    @Test
    public void joinRejectsOtherEngine() {
        TypedCollection<String, String> foreign = TypedCollection.open(otherEngine, "p2", SCHEMA);
        assertThrows(IllegalArgumentException.class, () -> TransactionComposer.join(collection, foreign));
    }

    @Test
    public void viewsFollowJoinOrder() throws Exception {
        IKVTransactionalPartition otherTxPartition = mock(IKVTransactionalPartition.class);
        when(txn.partitions()).thenReturn(List.of(otherTxPartition, txPartition));
        TypedCollection<String, String> other = TypedCollection.open(engine, "p2", SCHEMA);
        TransactionComposer.join(other, collection).<Void, Exception>transact(views -> {
            assertEquals(views.size(), 2);
            assertEquals(views.get(0).name(), "p2");
            assertEquals(views.get(1).name(), "p1");
            views.of(collection).remove("k");
            views.of(other).remove("j");
            return null;
        });
        verify(engine).beginTransaction(List.of(otherPartition, partition));
        verify(txPartition).remove(ByteString.copyFromUtf8("k"));
        verify(otherTxPartition).remove(ByteString.copyFromUtf8("j"));
    }
}
