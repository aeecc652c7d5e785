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

import com.google.protobuf.ByteString;
import java.util.Optional;
import org.typedkv.codec.CodecBridge;
import org.typedkv.codec.IKVCodec;
import org.typedkv.exception.TypedKVException;
import org.typedkv.exception.TypedKVException.EncodeException;
import org.typedkv.localengine.IKVTransactionalPartition;

/**
 * A collection as seen by one transaction attempt. Reads observe the writes made earlier in the same attempt. The view
 * is dead once its attempt ends, and every call then throws {@link IllegalStateException}.
 *
 * <p>Encoding failures throw {@link TypedKVException.UnabortableEncodingException}: the attempt is rolled back and the
 * transaction is not retried.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class TransactionalCollection<K, V> {
    private final TypedCollection<K, V> collection;
    private final IKVTransactionalPartition partition;
    private final TransactionAttempt attempt;

    TransactionalCollection(TypedCollection<K, V> collection,
                            IKVTransactionalPartition partition,
                            TransactionAttempt attempt) {
        this.collection = collection;
        this.partition = partition;
        this.attempt = attempt;
    }

    public String name() {
        return collection.name();
    }

    public Optional<ValueView<V>> get(K key) {
        attempt.checkActive();
        ByteString k = encode(collection.schema().keyCodec(), key);
        return StorageGuard.call(() -> partition.get(k)).map(this::valueView);
    }

    public boolean containsKey(K key) {
        return get(key).isPresent();
    }

    public Optional<ValueView<V>> insert(K key, V value) {
        attempt.checkActive();
        ByteString k = encode(collection.schema().keyCodec(), key);
        ByteString v = encode(collection.schema().valueCodec(), value);
        return StorageGuard.call(() -> partition.insert(k, v)).map(this::valueView);
    }

    public Optional<ValueView<V>> remove(K key) {
        attempt.checkActive();
        ByteString k = encode(collection.schema().keyCodec(), key);
        return StorageGuard.call(() -> partition.remove(k)).map(this::valueView);
    }

    /**
     * Stage the batch in this attempt. The batch is left intact so a retried callback can apply it again.
     *
     * @param batch the batch
     */
    public void applyBatch(TypedBatch<K, V> batch) {
        attempt.checkActive();
        collection.checkSchema(batch);
        StorageGuard.run(() -> partition.apply(batch.staged()));
    }

    /**
     * Ask for a flush once the transaction commits. Does not block.
     */
    public void flush() {
        attempt.txn().requestFlush();
    }

    public long generateId() {
        return StorageGuard.call(() -> attempt.txn().generateId());
    }

    private <T> ByteString encode(IKVCodec<T> codec, T value) {
        try {
            return CodecBridge.encode(codec, value);
        } catch (EncodeException e) {
            throw TypedKVException.unabortable(e);
        }
    }

    private ValueView<V> valueView(ByteString bytes) {
        return new ValueView<>(bytes, collection.schema().valueCodec());
    }
}
