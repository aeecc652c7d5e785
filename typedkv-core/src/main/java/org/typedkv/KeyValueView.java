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

import org.typedkv.localengine.KVPair;

/**
 * A stored entry. Key and value decode independently, so a broken value does not hide its key.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class KeyValueView<K, V> {
    private final KeyView<K> key;
    private final ValueView<V> value;

    KeyValueView(KVPair pair, KVSchema<K, V> schema) {
        this.key = new KeyView<>(pair.key(), schema.keyCodec());
        this.value = new ValueView<>(pair.value(), schema.valueCodec());
    }

    public K key() {
        return key.get();
    }

    public V value() {
        return value.get();
    }

    public KeyView<K> keyView() {
        return key;
    }

    public ValueView<V> valueView() {
        return value;
    }

    @Override
    public String toString() {
        return "KeyValueView{key=" + key + ", value=" + value + "}";
    }
}
