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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.protobuf.ByteString;
import org.typedkv.codec.CodecBridge;
import org.typedkv.codec.IKVCodec;

/**
 * A stored key, decoded on first access.
 *
 * @param <K> the key type
 */
public final class KeyView<K> {
    private final ByteString bytes;
    private final Supplier<K> decoded;

    KeyView(ByteString bytes, IKVCodec<K> codec) {
        this.bytes = bytes;
        this.decoded = Suppliers.memoize(() -> CodecBridge.decode(codec, bytes));
    }

    public K get() {
        return decoded.get();
    }

    public ByteString bytes() {
        return bytes;
    }

    @Override
    public String toString() {
        return "KeyView{size=" + bytes.size() + "}";
    }
}
