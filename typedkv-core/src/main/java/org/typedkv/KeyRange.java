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

import static org.typedkv.localengine.BoundaryUtil.successor;

import com.google.protobuf.ByteString;
import javax.annotation.Nullable;
import org.typedkv.codec.CodecBridge;
import org.typedkv.codec.IKVCodec;
import org.typedkv.localengine.Boundary;

/**
 * A range of keys, each side inclusive, exclusive or unbounded. The range is resolved against the encoded keys, so it
 * follows the byte order of the key codec.
 *
 * @param <K> the key type
 */
public final class KeyRange<K> {
    @Nullable
    private final Bound<K> lower;
    @Nullable
    private final Bound<K> upper;

    private KeyRange(@Nullable Bound<K> lower, @Nullable Bound<K> upper) {
        this.lower = lower;
        this.upper = upper;
    }

    public static <K> KeyRange<K> all() {
        return new KeyRange<>(null, null);
    }

    public static <K> KeyRange<K> closed(K from, K to) {
        return new KeyRange<>(new Bound<>(from, true), new Bound<>(to, true));
    }

    public static <K> KeyRange<K> closedOpen(K from, K to) {
        return new KeyRange<>(new Bound<>(from, true), new Bound<>(to, false));
    }

    public static <K> KeyRange<K> openClosed(K from, K to) {
        return new KeyRange<>(new Bound<>(from, false), new Bound<>(to, true));
    }

    public static <K> KeyRange<K> open(K from, K to) {
        return new KeyRange<>(new Bound<>(from, false), new Bound<>(to, false));
    }

    public static <K> KeyRange<K> atLeast(K from) {
        return new KeyRange<>(new Bound<>(from, true), null);
    }

    public static <K> KeyRange<K> greaterThan(K from) {
        return new KeyRange<>(new Bound<>(from, false), null);
    }

    public static <K> KeyRange<K> atMost(K to) {
        return new KeyRange<>(null, new Bound<>(to, true));
    }

    public static <K> KeyRange<K> lessThan(K to) {
        return new KeyRange<>(null, new Bound<>(to, false));
    }

    Boundary toBoundary(IKVCodec<K> codec) {
        ByteString startKey = null;
        ByteString endKey = null;
        if (lower != null) {
            ByteString key = CodecBridge.encode(codec, lower.key);
            startKey = lower.inclusive ? key : successor(key);
        }
        if (upper != null) {
            ByteString key = CodecBridge.encode(codec, upper.key);
            endKey = upper.inclusive ? successor(key) : key;
        }
        return new Boundary(startKey, endKey);
    }

    @Override
    public String toString() {
        return (lower == null ? "(-inf" : (lower.inclusive ? "[" : "(") + lower.key)
            + ".."
            + (upper == null ? "+inf)" : upper.key + (upper.inclusive ? "]" : ")"));
    }

    private record Bound<K>(K key, boolean inclusive) {
    }
}
