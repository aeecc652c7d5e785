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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * An ordered list of raw mutations applied to one partition as a single atomic unit.
 */
public final class KVWriteBatch {
    private final List<KVAction> actions = new ArrayList<>();

    public KVWriteBatch put(ByteString key, ByteString value) {
        actions.add(new KVAction(KVAction.Type.Put, key, value));
        return this;
    }

    public KVWriteBatch delete(ByteString key) {
        actions.add(new KVAction(KVAction.Type.Delete, key, null));
        return this;
    }

    public List<KVAction> actions() {
        return Collections.unmodifiableList(actions);
    }

    public int count() {
        return actions.size();
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    /**
     * A staged mutation, value is null for deletes.
     *
     * @param type the type of the mutation
     * @param key the key
     * @param value the value to put
     */
    public record KVAction(Type type, ByteString key, @Nullable ByteString value) {
        public enum Type { Put, Delete }
    }
}
