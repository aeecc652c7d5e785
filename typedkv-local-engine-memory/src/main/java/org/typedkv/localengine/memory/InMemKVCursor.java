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

package org.typedkv.localengine.memory;

import com.google.protobuf.ByteString;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import org.typedkv.localengine.Boundary;
import org.typedkv.localengine.BoundaryUtil;
import org.typedkv.localengine.IKVCursor;
import org.typedkv.localengine.KVPair;

/**
 * Weakly consistent double-ended cursor over a skip-list. Each end remembers the last key it yielded, the ends stop
 * as soon as they would cross.
 */
class InMemKVCursor implements IKVCursor {
    private final NavigableMap<ByteString, ByteString> dataSource;
    private ByteString frontKey;
    private ByteString backKey;
    private boolean closed;

    InMemKVCursor(NavigableMap<ByteString, ByteString> data, Boundary boundary) {
        if (BoundaryUtil.isEmptyRange(boundary)) {
            dataSource = Collections.emptyNavigableMap();
        } else if (!boundary.hasStartKey() && !boundary.hasEndKey()) {
            dataSource = data;
        } else if (!boundary.hasStartKey()) {
            dataSource = data.headMap(boundary.endKey(), false);
        } else if (!boundary.hasEndKey()) {
            dataSource = data.tailMap(boundary.startKey(), true);
        } else {
            dataSource = data.subMap(boundary.startKey(), true, boundary.endKey(), false);
        }
    }

    @Override
    public Optional<KVPair> nextFront() {
        if (closed) {
            return Optional.empty();
        }
        Map.Entry<ByteString, ByteString> entry =
            frontKey == null ? dataSource.firstEntry() : dataSource.higherEntry(frontKey);
        if (entry == null || (backKey != null && BoundaryUtil.compare(entry.getKey(), backKey) >= 0)) {
            return Optional.empty();
        }
        frontKey = entry.getKey();
        return Optional.of(new KVPair(entry.getKey(), entry.getValue()));
    }

    @Override
    public Optional<KVPair> nextBack() {
        if (closed) {
            return Optional.empty();
        }
        Map.Entry<ByteString, ByteString> entry =
            backKey == null ? dataSource.lastEntry() : dataSource.lowerEntry(backKey);
        if (entry == null || (frontKey != null && BoundaryUtil.compare(entry.getKey(), frontKey) <= 0)) {
            return Optional.empty();
        }
        backKey = entry.getKey();
        return Optional.of(new KVPair(entry.getKey(), entry.getValue()));
    }

    @Override
    public void close() {
        closed = true;
    }
}
