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

/**
 * One attempt of an optimistic transaction spanning one or more partitions of the same engine.
 */
public interface IKVTransaction extends AutoCloseable {
    /**
     * The transactional handles of the joined partitions, in the order they were joined.
     *
     * @return the handles
     */
    List<IKVTransactionalPartition> partitions();

    /**
     * Generate a process-wide monotonically increasing id.
     *
     * @return the id
     */
    long generateId();

    /**
     * Schedule a flush once the transaction is committed; does not block.
     */
    void requestFlush();

    /**
     * Commit the attempt.
     *
     * @throws KVTransactionConflictException if a concurrent transaction invalidated what this attempt read or wrote
     * @throws KVEngineException if the engine failed
     */
    void commit();

    /**
     * Discard every mutation of the attempt.
     */
    void rollback();

    /**
     * Release the resources of the attempt, rolling it back if it was neither committed nor rolled back.
     */
    @Override
    void close();
}
