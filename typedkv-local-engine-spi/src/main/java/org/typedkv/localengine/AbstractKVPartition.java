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
import io.micrometer.core.instrument.Tags;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.typedkv.localengine.metrics.KVPartitionOpMeters;

/**
 * Base implementation of IKVPartition with lifecycle checking and operation metrics.
 */
public abstract class AbstractKVPartition implements IKVPartition {
    protected final String id;
    protected final KVPartitionOpMeters opMeters;
    protected final Logger logger;
    protected final Tags tags;
    private final AtomicReference<State> state = new AtomicReference<>(State.Open);
    private final Runnable onClose;

    protected AbstractKVPartition(String id, Runnable onClose, Logger logger, Tags engineTags) {
        this.id = id;
        this.onClose = onClose;
        this.logger = logger;
        this.tags = engineTags;
        this.opMeters = new KVPartitionOpMeters(id, engineTags);
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final boolean exist(ByteString key) {
        checkOpen();
        return opMeters.existCallTimer.record(() -> doExist(key));
    }

    @Override
    public final Optional<ByteString> get(ByteString key) {
        checkOpen();
        return opMeters.getCallTimer.record(() -> doGet(key).map(v -> {
            opMeters.readBytesSummary.record(v.size());
            return v;
        }));
    }

    @Override
    public final Optional<ByteString> insert(ByteString key, ByteString value) {
        checkOpen();
        return opMeters.insertCallTimer.record(() -> doInsert(key, value));
    }

    @Override
    public final Optional<ByteString> remove(ByteString key) {
        checkOpen();
        return opMeters.removeCallTimer.record(() -> doRemove(key));
    }

    @Override
    public final IKVCursor newCursor(Boundary boundary) {
        checkOpen();
        return opMeters.cursorNewCallTimer.record(() -> new MonitoredCursor(doNewCursor(boundary)));
    }

    @Override
    public final void apply(KVWriteBatch batch) {
        checkOpen();
        if (batch.isEmpty()) {
            return;
        }
        opMeters.batchWriteCallTimer.record(() -> {
            opMeters.writeBatchSizeSummary.record(batch.count());
            doApply(batch);
        });
    }

    @Override
    public final Optional<KVPair> popMin() {
        checkOpen();
        return opMeters.popCallTimer.record(() -> doPop(true));
    }

    @Override
    public final Optional<KVPair> popMax() {
        checkOpen();
        return opMeters.popCallTimer.record(() -> doPop(false));
    }

    @Override
    public final long count() {
        checkOpen();
        return opMeters.countCallTimer.record(this::doCount);
    }

    @Override
    public final boolean isEmpty() {
        try (IKVCursor cursor = newCursor(Boundary.FULL)) {
            return cursor.nextFront().isEmpty();
        }
    }

    @Override
    public final void clear() {
        checkOpen();
        opMeters.clearCallTimer.record(this::doClear);
    }

    @Override
    public final CompletableFuture<Void> flush() {
        checkOpen();
        return doFlush();
    }

    @Override
    public final void close() {
        if (state.compareAndSet(State.Open, State.Closing)) {
            try {
                logger.debug("Close partition[{}]", id);
                doClose();
                opMeters.close();
            } finally {
                state.set(State.Closed);
                onClose.run();
            }
        }
    }

    @Override
    public final void destroy() {
        close();
        if (state.compareAndSet(State.Closed, State.Destroying)) {
            try {
                doDestroy();
            } catch (Throwable e) {
                throw new KVEngineException("Destroy partition error", e);
            } finally {
                state.set(State.Terminated);
            }
        }
    }

    public final boolean isOpen() {
        return state.get() == State.Open;
    }

    protected final void checkOpen() {
        if (state.get() != State.Open) {
            throw new KVEngineException("Partition[" + id + "] is not open");
        }
    }

    protected abstract boolean doExist(ByteString key);

    protected abstract Optional<ByteString> doGet(ByteString key);

    protected abstract Optional<ByteString> doInsert(ByteString key, ByteString value);

    protected abstract Optional<ByteString> doRemove(ByteString key);

    protected abstract IKVCursor doNewCursor(Boundary boundary);

    protected abstract void doApply(KVWriteBatch batch);

    protected abstract Optional<KVPair> doPop(boolean min);

    protected abstract long doCount();

    protected abstract void doClear();

    protected abstract CompletableFuture<Void> doFlush();

    protected void doClose() {
    }

    protected void doDestroy() {
    }

    protected enum State {
        Open, Closing, Closed, Destroying, Terminated
    }

    private class MonitoredCursor implements IKVCursor {
        final IKVCursor delegate;

        private MonitoredCursor(IKVCursor delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<KVPair> nextFront() {
            return record(opMeters.cursorStepCallTimer.record(delegate::nextFront));
        }

        @Override
        public Optional<KVPair> nextBack() {
            return record(opMeters.cursorStepCallTimer.record(delegate::nextBack));
        }

        @Override
        public void close() {
            delegate.close();
        }

        private Optional<KVPair> record(Optional<KVPair> pair) {
            pair.ifPresent(kv -> opMeters.readBytesSummary.record(kv.key().size() + kv.value().size()));
            return pair;
        }
    }
}
