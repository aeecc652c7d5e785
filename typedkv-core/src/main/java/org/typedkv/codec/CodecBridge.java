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
import org.typedkv.exception.TypedKVException;
import org.typedkv.exception.TypedKVException.DecodeException;
import org.typedkv.exception.TypedKVException.EncodeException;

/**
 * Runs codecs and normalizes their failures into {@link EncodeException} and {@link DecodeException}.
 */
public final class CodecBridge {
    private CodecBridge() {
    }

    public static <T> ByteString encode(IKVCodec<T> codec, T value) {
        if (value == null) {
            throw TypedKVException.encode("Null is not representable");
        }
        EncodeBuffer buffer = EncodeBuffer.acquire();
        try {
            codec.encode(value, buffer);
            return buffer.toByteString();
        } catch (EncodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw TypedKVException.encode("Failed to encode " + value.getClass().getSimpleName(), e);
        } finally {
            buffer.release();
        }
    }

    public static <T> T decode(IKVCodec<T> codec, ByteString bytes) {
        try {
            T value = codec.decode(bytes);
            if (value == null) {
                throw TypedKVException.decode("Codec decoded null");
            }
            return value;
        } catch (DecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw TypedKVException.decode("Failed to decode " + bytes.size() + " bytes", e);
        }
    }
}
