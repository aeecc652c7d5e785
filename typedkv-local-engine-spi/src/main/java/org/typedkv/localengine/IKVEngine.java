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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The interface of a local KV engine, which hosts a set of independently named, ordered partitions.
 */
public interface IKVEngine {
    /**
     * The identity of the engine.
     *
     * @return the identity
     */
    String id();

    /**
     * Start the engine.
     *
     * @param metricTags the key-value pairs attached to the metrics reported by the engine
     */
    void start(String... metricTags);

    /**
     * Stop the engine, all opened partitions will be closed.
     */
    void stop();

    /**
     * Open the partition with the given id, the partition will be created if missing. Opening the same id twice
     * returns the same partition.
     *
     * @param partitionId the id of the partition
     * @return the partition
     */
    IKVPartition createIfMissing(String partitionId);

    /**
     * Get all partitions opened so far.
     *
     * @return the partitions keyed by id
     */
    Map<String, ? extends IKVPartition> partitions();

    /**
     * Begin one attempt of a transaction spanning the given partitions. All partitions must be owned by this engine.
     *
     * @param partitions the partitions joined into the transaction in order
     * @return the transaction
     */
    IKVTransaction beginTransaction(List<? extends IKVPartition> partitions);

    /**
     * Generate a process-wide monotonically increasing id.
     *
     * @return the id
     */
    long generateId();

    /**
     * Request a durability barrier for everything written so far.
     *
     * @return the future completed when the barrier is reached
     */
    CompletableFuture<Void> flush();
}
