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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.protobuf.ByteString;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.typedkv.codec.CodecBridge;
import org.typedkv.localengine.Boundary;
import org.typedkv.localengine.IKVEngine;
import org.typedkv.localengine.IKVPartition;

/**
 * A named partition of an engine viewed through a schema. Handles are thread-safe and add no locking of their own.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
@Slf4j
public final class TypedCollection<K, V> {
    private final IKVEngine engine;
    private final IKVPartition partition;
    private final KVSchema<K, V> schema;

    private TypedCollection(IKVEngine engine, IKVPartition partition, KVSchema<K, V> schema) {
        this.engine = engine;
        this.partition = partition;
        this.schema = schema;
    }

    /**
     * Open the collection with the given name, creating its partition if missing.
     *
     * @param engine the started engine
     * @param name the name of the collection
     * @param schema the schema of the entries
     * @param <K> the key type
     * @param <V> the value type
     * @return the collection
     * @throws IllegalArgumentException if the name is null or empty
     * @throws org.typedkv.exception.TypedKVException.StorageException if the partition cannot be opened
     */
    public static <K, V> TypedCollection<K, V> open(IKVEngine engine, String name, KVSchema<K, V> schema) {
        checkArgument(name != null && !name.isEmpty(), "Collection name must not be empty");
        IKVPartition partition = StorageGuard.call(() -> engine.createIfMissing(name));
        log.debug("Collection opened: engine={}, name={}", engine.id(), name);
        return new TypedCollection<>(engine, partition, schema);
    }

    public String name() {
        return partition.id();
    }

    public KVSchema<K, V> schema() {
        return schema;
    }

    public Optional<ValueView<V>> insert(K key, V value) {
        ByteString k = encodeKey(key);
        ByteString v = CodecBridge.encode(schema.valueCodec(), value);
        return StorageGuard.call(() -> partition.insert(k, v)).map(this::valueView);
    }

    public Optional<ValueView<V>> get(K key) {
        ByteString k = encodeKey(key);
        return StorageGuard.call(() -> partition.get(k)).map(this::valueView);
    }

    public Optional<ValueView<V>> remove(K key) {
        ByteString k = encodeKey(key);
        return StorageGuard.call(() -> partition.remove(k)).map(this::valueView);
    }

    public boolean containsKey(K key) {
        ByteString k = encodeKey(key);
        return StorageGuard.call(() -> partition.exist(k));
    }

    public TypedIterator<K, V> range(KeyRange<K> range) {
        Boundary boundary = range.toBoundary(schema.keyCodec());
        return new TypedIterator<>(StorageGuard.call(() -> partition.newCursor(boundary)), schema);
    }

    /**
     * Iterate over the entries whose encoded key starts with the encoding of the given key.
     *
     * @param prefix the key whose encoding is the prefix
     * @return the iterator
     */
    public TypedIterator<K, V> scanPrefix(K prefix) {
        ByteString p = encodeKey(prefix);
        return new TypedIterator<>(StorageGuard.call(() -> partition.scanPrefix(p)), schema);
    }

    public TypedIterator<K, V> iter() {
        return new TypedIterator<>(StorageGuard.call(() -> partition.newCursor(Boundary.FULL)), schema);
    }

    public TypedBatch<K, V> newBatch() {
        return new TypedBatch<>(schema);
    }

    /**
     * Apply the batch atomically. The batch is consumed and cannot be applied again.
     *
     * @param batch the batch
     */
    public void applyBatch(TypedBatch<K, V> batch) {
        checkSchema(batch);
        StorageGuard.run(() -> partition.apply(batch.consume()));
    }

    public Optional<KeyValueView<K, V>> popMin() {
        return StorageGuard.call(partition::popMin).map(pair -> new KeyValueView<>(pair, schema));
    }

    public Optional<KeyValueView<K, V>> popMax() {
        return StorageGuard.call(partition::popMax).map(pair -> new KeyValueView<>(pair, schema));
    }

    public long size() {
        return StorageGuard.call(partition::count);
    }

    public boolean isEmpty() {
        return StorageGuard.call(partition::isEmpty);
    }

    public void clear() {
        StorageGuard.run(partition::clear);
    }

    /**
     * Request a durability barrier covering every write completed so far. Callers needing durability join the
     * returned future.
     *
     * @return the future of the barrier
     */
    public CompletableFuture<Void> flushAsync() {
        return StorageGuard.future(partition::flush);
    }

    /**
     * Run the callback as an atomic transaction over this collection only.
     *
     * @param callback the transaction body
     * @param <R> the result type
     * @param <E> the abort type
     * @return the result of the committed invocation
     * @throws E if the callback aborted
     */
    public <R, E extends Exception> R transaction(SingleTransactionCallback<K, V, R, E> callback) throws E {
        return TransactionComposer.join(this).<R, E>transact(views -> callback.apply(views.of(this)));
    }

    IKVEngine engine() {
        return engine;
    }

    IKVPartition partition() {
        return partition;
    }

    void checkSchema(TypedBatch<K, V> batch) {
        if (!batch.schema().equals(schema)) {
            throw new IllegalArgumentException("Batch schema does not match collection " + name());
        }
    }

    private ByteString encodeKey(K key) {
        return CodecBridge.encode(schema.keyCodec(), key);
    }

    private ValueView<V> valueView(ByteString bytes) {
        return new ValueView<>(bytes, schema.valueCodec());
    }

    @Override
    public String toString() {
        return "TypedCollection{engine=" + engine.id() + ", name=" + name() + "}";
    }
}
