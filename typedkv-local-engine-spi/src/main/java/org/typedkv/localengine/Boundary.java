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
import javax.annotation.Nullable;

/**
 * A half-open range of raw keys: startKey inclusive, endKey exclusive. A null side is unbounded.
 *
 * @param startKey the inclusive start key, null means unbounded
 * @param endKey the exclusive end key, null means unbounded
 */
public record Boundary(@Nullable ByteString startKey, @Nullable ByteString endKey) {
    public static final Boundary FULL = new Boundary(null, null);

    public boolean hasStartKey() {
        return startKey != null;
    }

    public boolean hasEndKey() {
        return endKey != null;
    }
}
