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

package org.typedkv.codec;

import com.google.protobuf.ByteString;
import com.google.protobuf.UnsafeByteOperations;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * Output of one encoding. Bytes go to a per-thread inline array first and move to a heap array once the encoding
 * outgrows it.
 */
public final class EncodeBuffer extends OutputStream {
    public static final int INLINE_CAPACITY = 64;

    private static final ThreadLocal<EncodeBuffer> LOCAL = ThreadLocal.withInitial(EncodeBuffer::new);

    private final byte[] inline = new byte[INLINE_CAPACITY];
    private byte[] heap;
    private int size;
    private boolean acquired;

    private EncodeBuffer() {
    }

    static EncodeBuffer acquire() {
        EncodeBuffer buffer = LOCAL.get();
        if (buffer.acquired) {
            // a codec encoding a nested value through the bridge
            buffer = new EncodeBuffer();
        }
        buffer.acquired = true;
        return buffer;
    }

    void release() {
        heap = null;
        size = 0;
        acquired = false;
    }

    @Override
    public void write(int b) {
        ensureCapacity(size + 1);
        array()[size++] = (byte) b;
    }

    @Override
    public void write(byte[] b, int off, int len) {
        if (off < 0 || len < 0 || off + len > b.length) {
            throw new IndexOutOfBoundsException();
        }
        ensureCapacity(size + len);
        System.arraycopy(b, off, array(), size, len);
        size += len;
    }

    public void write(ByteString bytes) {
        ensureCapacity(size + bytes.size());
        bytes.copyTo(array(), size);
        size += bytes.size();
    }

    public int size() {
        return size;
    }

    public boolean isInline() {
        return heap == null;
    }

    ByteString toByteString() {
        if (heap == null) {
            return ByteString.copyFrom(inline, 0, size);
        }
        // the heap array is dropped on release and never written again
        return UnsafeByteOperations.unsafeWrap(heap, 0, size);
    }

    private byte[] array() {
        return heap == null ? inline : heap;
    }

    private void ensureCapacity(int required) {
        if (required < 0) {
            throw new OutOfMemoryError("Encoding too large");
        }
        byte[] current = array();
        if (required <= current.length) {
            return;
        }
        int newCapacity = Math.max(current.length << 1, required);
        heap = Arrays.copyOf(current, newCapacity);
    }
}
