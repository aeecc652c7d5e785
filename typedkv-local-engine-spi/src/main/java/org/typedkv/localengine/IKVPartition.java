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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The interface of a named partition, which is an ordered set of raw key-value pairs.
 */
public interface IKVPartition {
    /**
     * The id of the partition.
     *
     * @return the id
     */
    String id();

    /**
     * Check if a key exists.
     *
     * @param key the key
     * @return true if the key exists, false otherwise
     */
    boolean exist(ByteString key);

    /**
     * Get the value of a key.
     *
     * @param key the key
     * @return the value of the key, or empty if the key does not exist
     */
    Optional<ByteString> get(ByteString key);

    /**
     * Insert or overwrite a key.
     *
     * @param key the key
     * @param value the value
     * @return the value displaced by the insert, or empty if there was none
     */
    Optional<ByteString> insert(ByteString key, ByteString value);

    /**
     * Remove a key.
     *
     * @param key the key
     * @return the removed value, or empty if the key does not exist
     */
    Optional<ByteString> remove(ByteString key);

    /**
     * Create a double-ended cursor over the given boundary.
     *
     * @param boundary the boundary
     * @return the cursor
     */
    IKVCursor newCursor(Boundary boundary);

    /**
     * Create a double-ended cursor over all keys sharing the given prefix.
     *
     * @param prefix the prefix
     * @return the cursor
     */
    default IKVCursor scanPrefix(ByteString prefix) {
        return newCursor(BoundaryUtil.prefix(prefix));
    }

    /**
     * Apply the batch atomically.
     *
     * @param batch the batch
     */
    void apply(KVWriteBatch batch);

    /**
     * Atomically remove and return the entry with the smallest key.
     *
     * @return the removed entry, or empty if the partition is empty
     */
    Optional<KVPair> popMin();

    /**
     * Atomically remove and return the entry with the largest key.
     *
     * @return the removed entry, or empty if the partition is empty
     */
    Optional<KVPair> popMax();

    /**
     * Count the entries in the partition.
     *
     * @return the number of entries
     */
    long count();

    /**
     * Check if the partition holds no entry.
     *
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Remove all entries.
     */
    void clear();

    /**
     * Request a durability barrier, shared with the whole engine.
     *
     * @return the future completed when the barrier is reached
     */
    CompletableFuture<Void> flush();

    /**
     * Detach the partition handle from the engine, the data is kept.
     */
    void close();

    /**
     * Close the partition and drop all its data.
     */
    void destroy();
}
