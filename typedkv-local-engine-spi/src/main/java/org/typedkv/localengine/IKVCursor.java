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

import java.util.Optional;

/**
 * A double-ended cursor over an ordered range of a partition. The front and the back end step towards each other,
 * they never yield the same entry and together exhaust the range exactly once.
 *
 * <p>A cursor is not thread-safe.
 */
public interface IKVCursor extends AutoCloseable {
    /**
     * Step the front end.
     *
     * @return the next entry in ascending order, or empty if the range is exhausted
     */
    Optional<KVPair> nextFront();

    /**
     * Step the back end.
     *
     * @return the next entry in descending order, or empty if the range is exhausted
     */
    Optional<KVPair> nextBack();

    /**
     * Close the cursor and release associated resources.
     */
    @Override
    void close();
}
