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

package org.typedkv;

import java.util.NoSuchElementException;
import java.util.Optional;
import org.typedkv.localengine.IKVCursor;
import org.typedkv.localengine.KVPair;

/**
 * Typed traversal over a raw cursor in ascending key order. Not thread-safe.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class TypedIterator<K, V> implements DoubleEndedIterator<KeyValueView<K, V>> {
    private final IKVCursor cursor;
    private final KVSchema<K, V> schema;
    // entries pulled from the cursor by hasNext/hasNextBack but not handed out yet
    private KVPair front;
    private KVPair back;
    private boolean frontDone;
    private boolean backDone;
    private boolean closed;

    TypedIterator(IKVCursor cursor, KVSchema<K, V> schema) {
        this.cursor = cursor;
        this.schema = schema;
    }

    @Override
    public boolean hasNext() {
        return peekFront() != null;
    }

    @Override
    public KeyValueView<K, V> next() {
        KVPair pair = peekFront();
        if (pair == null) {
            throw new NoSuchElementException();
        }
        if (pair == front) {
            front = null;
        } else {
            back = null;
        }
        return new KeyValueView<>(pair, schema);
    }

    @Override
    public boolean hasNextBack() {
        return peekBack() != null;
    }

    @Override
    public KeyValueView<K, V> nextBack() {
        KVPair pair = peekBack();
        if (pair == null) {
            throw new NoSuchElementException();
        }
        if (pair == back) {
            back = null;
        } else {
            front = null;
        }
        return new KeyValueView<>(pair, schema);
    }

    /**
     * Project the traversal to keys, values are never decoded.
     *
     * @return the key iterator sharing this cursor
     */
    public DoubleEndedIterator<KeyView<K>> keys() {
        return map(KeyValueView::keyView);
    }

    /**
     * Project the traversal to values, keys are never decoded.
     *
     * @return the value iterator sharing this cursor
     */
    public DoubleEndedIterator<ValueView<V>> values() {
        return map(KeyValueView::valueView);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            front = null;
            back = null;
            StorageGuard.run(cursor::close);
        }
    }

    private KVPair peekFront() {
        checkOpen();
        if (front == null && !frontDone) {
            Optional<KVPair> pair = StorageGuard.call(cursor::nextFront);
            if (pair.isPresent()) {
                front = pair.get();
            } else {
                frontDone = true;
            }
        }
        // the cursor hands out the last entry to one end only
        return front != null ? front : back;
    }

    private KVPair peekBack() {
        checkOpen();
        if (back == null && !backDone) {
            Optional<KVPair> pair = StorageGuard.call(cursor::nextBack);
            if (pair.isPresent()) {
                back = pair.get();
            } else {
                backDone = true;
            }
        }
        return back != null ? back : front;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Iterator closed");
        }
    }
}
