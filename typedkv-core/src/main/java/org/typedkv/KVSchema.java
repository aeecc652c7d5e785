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

import org.typedkv.codec.IKVCodec;

/**
 * Binds the key type and the value type of a collection to their codecs. Declare one constant per collection kind and
 * share it.
 *
 * @param keyCodec the key codec
 * @param valueCodec the value codec
 * @param <K> the key type
 * @param <V> the value type
 */
public record KVSchema<K, V>(IKVCodec<K> keyCodec, IKVCodec<V> valueCodec) {
    public static <K, V> KVSchema<K, V> of(IKVCodec<K> keyCodec, IKVCodec<V> valueCodec) {
        return new KVSchema<>(keyCodec, valueCodec);
    }
}
