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

/**
 * The fixed byte representation of one type.
 *
 * <p>Implementations are stateless. Encoding must be deterministic, and when the type is used as a key the unsigned
 * lexicographic order of the encodings is the iteration order of the collection.
 *
 * @param <T> the encoded type
 */
public interface IKVCodec<T> {
    /**
     * Write the encoding of the value.
     *
     * @param value the value, never null
     * @param buffer the buffer to write into
     */
    void encode(T value, EncodeBuffer buffer);

    /**
     * Decode a value. The result may keep referencing the given bytes.
     *
     * @param bytes the encoded bytes
     * @return the value
     */
    T decode(ByteString bytes);
}
