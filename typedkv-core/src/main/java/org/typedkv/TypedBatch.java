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

import org.typedkv.codec.CodecBridge;
import org.typedkv.localengine.KVWriteBatch;

/**
 * Staged inserts and removes, applied in order and atomically. Encoding happens while staging, so applying never fails
 * for encoding reasons.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class TypedBatch<K, V> {
    private final KVSchema<K, V> schema;
    private final KVWriteBatch staged = new KVWriteBatch();
    private boolean consumed;

    public TypedBatch(KVSchema<K, V> schema) {
        this.schema = schema;
    }

    /**
     * Stage an insert.
     *
     * @param key the key
     * @param value the value
     * @return this batch
     * @throws org.typedkv.exception.TypedKVException.EncodeException if the key or value cannot be encoded, nothing is
     *                                                                 staged then
     */
    public TypedBatch<K, V> insert(K key, V value) {
        checkNotConsumed();
        staged.put(CodecBridge.encode(schema.keyCodec(), key), CodecBridge.encode(schema.valueCodec(), value));
        return this;
    }

    public TypedBatch<K, V> remove(K key) {
        checkNotConsumed();
        staged.delete(CodecBridge.encode(schema.keyCodec(), key));
        return this;
    }

    public int size() {
        return staged.count();
    }

    public boolean isEmpty() {
        return staged.isEmpty();
    }

    KVSchema<K, V> schema() {
        return schema;
    }

    KVWriteBatch staged() {
        checkNotConsumed();
        return staged;
    }

    KVWriteBatch consume() {
        checkNotConsumed();
        consumed = true;
        return staged;
    }

    private void checkNotConsumed() {
        if (consumed) {
            throw new IllegalStateException("Batch already applied");
        }
    }
}
