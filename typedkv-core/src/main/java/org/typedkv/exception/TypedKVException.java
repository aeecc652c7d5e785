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

package org.typedkv.exception;

import org.typedkv.localengine.KVEngineException;

/**
 * Failures surfaced by the typed layer. Transaction conflicts never escape the composer, and domain aborts travel as
 * the callback's own exception type.
 */
public class TypedKVException extends RuntimeException {
    private TypedKVException(String message) {
        super(message);
    }

    private TypedKVException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StorageException storage(KVEngineException cause) {
        return new StorageException(cause);
    }

    public static EncodeException encode(String message) {
        return new EncodeException(message, null);
    }

    public static EncodeException encode(String message, Throwable cause) {
        return new EncodeException(message, cause);
    }

    public static DecodeException decode(String message) {
        return new DecodeException(message, null);
    }

    public static DecodeException decode(String message, Throwable cause) {
        return new DecodeException(message, cause);
    }

    public static UnabortableEncodingException unabortable(EncodeException cause) {
        return new UnabortableEncodingException(cause);
    }

    /**
     * The underlying engine failed.
     */
    public static class StorageException extends TypedKVException {
        private StorageException(KVEngineException cause) {
            super("Storage failure: " + cause.getMessage(), cause);
        }
    }

    /**
     * A value could not be turned into bytes.
     */
    public static class EncodeException extends TypedKVException {
        private EncodeException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Stored bytes are not a valid encoding of the expected type.
     */
    public static class DecodeException extends TypedKVException {
        private DecodeException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * An encoding failure inside a transaction attempt. The attempt is rolled back and the failure is never retried.
     */
    public static class UnabortableEncodingException extends TypedKVException {
        private UnabortableEncodingException(EncodeException cause) {
            super("Encoding failed inside transaction: " + cause.getMessage(), cause);
        }

        @Override
        public synchronized EncodeException getCause() {
            return (EncodeException) super.getCause();
        }
    }
}
