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

package org.typedkv.localengine;

import com.google.protobuf.ByteString;
import java.util.Comparator;
import javax.annotation.Nullable;

/**
 * Helpers for working with raw keys and boundaries. Keys are ordered by unsigned lexicographic byte order.
 */
public class BoundaryUtil {
    public static final Comparator<ByteString> KEY_ORDER = ByteString.unsignedLexicographicalComparator();
    private static final ByteString ZERO = ByteString.copyFrom(new byte[] {0});

    public static int compare(ByteString a, ByteString b) {
        return KEY_ORDER.compare(a, b);
    }

    public static int compare(byte[] a, byte[] b) {
        int len = Math.min(a.length, b.length);
        for (int i = 0; i < len; i++) {
            int c = Integer.compare(a[i] & 0xFF, b[i] & 0xFF);
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.length, b.length);
    }

    /**
     * The smallest key ordered after the given key.
     *
     * @param key the key
     * @return the immediate successor
     */
    public static ByteString successor(ByteString key) {
        return key.concat(ZERO);
    }

    /**
     * The smallest key ordered after every key that starts with the prefix.
     *
     * @param prefix the prefix
     * @return the upper bound, or null if no such key exists
     */
    @Nullable
    public static ByteString prefixUpperBound(ByteString prefix) {
        byte[] bytes = prefix.toByteArray();
        for (int i = bytes.length - 1; i >= 0; i--) {
            if (bytes[i] != (byte) 0xFF) {
                bytes[i]++;
                return ByteString.copyFrom(bytes, 0, i + 1);
            }
        }
        return null;
    }

    public static Boundary prefix(ByteString prefix) {
        if (prefix.isEmpty()) {
            return Boundary.FULL;
        }
        return new Boundary(prefix, prefixUpperBound(prefix));
    }

    public static boolean isEmptyRange(Boundary boundary) {
        return boundary.hasStartKey() && boundary.hasEndKey()
            && compare(boundary.startKey(), boundary.endKey()) >= 0;
    }
}
