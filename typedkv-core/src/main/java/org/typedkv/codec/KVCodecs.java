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

import com.google.common.base.Utf8;
import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.typedkv.exception.TypedKVException;

/**
 * The built-in codecs. Fixed width integers are big-endian with the sign bit flipped, so the byte order of the
 * encodings matches the numeric order.
 */
public final class KVCodecs {
    private static final IKVCodec<String> UTF8 = new IKVCodec<>() {
        @Override
        public void encode(String value, EncodeBuffer buffer) {
            try {
                Utf8.encodedLength(value);
            } catch (IllegalArgumentException e) {
                throw TypedKVException.encode("Malformed string", e);
            }
            byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            buffer.write(bytes, 0, bytes.length);
        }

        @Override
        public String decode(ByteString bytes) {
            if (!bytes.isValidUtf8()) {
                throw TypedKVException.decode("Invalid UTF-8");
            }
            return bytes.toStringUtf8();
        }
    };

    private static final IKVCodec<Long> INT64 = new IKVCodec<>() {
        @Override
        public void encode(Long value, EncodeBuffer buffer) {
            writeFixed(value ^ Long.MIN_VALUE, Long.BYTES, buffer);
        }

        @Override
        public Long decode(ByteString bytes) {
            return readFixed(bytes, Long.BYTES) ^ Long.MIN_VALUE;
        }
    };

    private static final IKVCodec<Integer> INT32 = new IKVCodec<>() {
        @Override
        public void encode(Integer value, EncodeBuffer buffer) {
            writeFixed(value ^ Integer.MIN_VALUE, Integer.BYTES, buffer);
        }

        @Override
        public Integer decode(ByteString bytes) {
            return (int) readFixed(bytes, Integer.BYTES) ^ Integer.MIN_VALUE;
        }
    };

    private static final IKVCodec<ByteString> BYTES = new IKVCodec<>() {
        @Override
        public void encode(ByteString value, EncodeBuffer buffer) {
            buffer.write(value);
        }

        @Override
        public ByteString decode(ByteString bytes) {
            return bytes;
        }
    };

    private KVCodecs() {
    }

    public static IKVCodec<String> utf8() {
        return UTF8;
    }

    public static IKVCodec<Long> int64() {
        return INT64;
    }

    public static IKVCodec<Integer> int32() {
        return INT32;
    }

    public static IKVCodec<ByteString> bytes() {
        return BYTES;
    }

    /**
     * Codec of a protobuf message type. Decoding aliases the stored bytes, bytes fields of the decoded message share
     * the buffer of the view holding it.
     *
     * @param parser the parser of the message type
     * @param <M> the message type
     * @return the codec
     */
    public static <M extends Message> IKVCodec<M> protobuf(Parser<M> parser) {
        return new IKVCodec<>() {
            @Override
            public void encode(M value, EncodeBuffer buffer) {
                if (!value.isInitialized()) {
                    throw TypedKVException.encode("Uninitialized message: "
                        + value.getDescriptorForType().getFullName());
                }
                try {
                    // map entries in key order, equal messages must encode to equal bytes
                    CodedOutputStream output = CodedOutputStream.newInstance(buffer);
                    output.useDeterministicSerialization();
                    value.writeTo(output);
                    output.flush();
                } catch (IOException e) {
                    throw TypedKVException.encode("Failed to write message", e);
                }
            }

            @Override
            public M decode(ByteString bytes) {
                CodedInputStream input = bytes.newCodedInput();
                input.enableAliasing(true);
                try {
                    return parser.parseFrom(input);
                } catch (InvalidProtocolBufferException e) {
                    throw TypedKVException.decode("Invalid message", e);
                }
            }
        };
    }

    private static void writeFixed(long bits, int width, EncodeBuffer buffer) {
        for (int shift = (width - 1) * Byte.SIZE; shift >= 0; shift -= Byte.SIZE) {
            buffer.write((int) (bits >>> shift));
        }
    }

    private static long readFixed(ByteString bytes, int width) {
        if (bytes.size() != width) {
            throw TypedKVException.decode("Expect " + width + " bytes but got " + bytes.size());
        }
        long bits = 0;
        for (int i = 0; i < width; i++) {
            bits = (bits << Byte.SIZE) | (bytes.byteAt(i) & 0xFF);
        }
        return bits;
    }
}
