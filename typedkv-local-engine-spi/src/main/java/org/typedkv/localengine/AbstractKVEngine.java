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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.protobuf.Struct;
import io.micrometer.core.instrument.Tags;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Base implementation of IKVEngine which manages the engine lifecycle and the registry of opened partitions.
 *
 * @param <P> the type of partition
 */
@Slf4j
public abstract class AbstractKVEngine<P extends AbstractKVPartition> implements IKVEngine {
    protected final Struct conf;
    private final String identity;
    private final AtomicReference<State> state = new AtomicReference<>(State.INIT);
    private final Map<String, P> partitions = new ConcurrentHashMap<>();
    private Tags metricTags = Tags.empty();

    protected AbstractKVEngine(@Nullable String overrideIdentity, Struct conf) {
        this.conf = conf;
        if (overrideIdentity != null && !overrideIdentity.trim().isEmpty()) {
            identity = overrideIdentity;
        } else {
            identity = UUID.randomUUID().toString();
        }
    }

    @Override
    public final String id() {
        return identity;
    }

    @Override
    public final void start(String... metricTags) {
        if (state.compareAndSet(State.INIT, State.STARTING)) {
            try {
                this.metricTags = Tags.of(metricTags).and("engine", identity);
                doStart();
                state.set(State.STARTED);
                log.info("KVEngine[{}] started: type={}", identity, getClass().getSimpleName());
            } catch (Throwable e) {
                state.set(State.FATAL_FAILURE);
                throw e instanceof KVEngineException ? (KVEngineException) e
                    : new KVEngineException("Failed to start engine", e);
            }
        }
    }

    @Override
    public final void stop() {
        if (state.compareAndSet(State.STARTED, State.STOPPING)) {
            try {
                new ArrayList<>(partitions.values()).forEach(AbstractKVPartition::close);
                doStop();
                log.info("KVEngine[{}] stopped", identity);
            } finally {
                state.set(State.STOPPED);
            }
        }
    }

    @Override
    public final P createIfMissing(String partitionId) {
        checkArgument(partitionId != null && !partitionId.isEmpty(), "Partition id must not be empty");
        checkState();
        return partitions.computeIfAbsent(partitionId, id -> {
            AtomicReference<P> self = new AtomicReference<>();
            P partition = doCreatePartition(id, metricTags, () -> partitions.remove(id, self.get()));
            self.set(partition);
            log.debug("KVEngine[{}] opened partition[{}]", identity, id);
            return partition;
        });
    }

    @Override
    public final Map<String, P> partitions() {
        return Collections.unmodifiableMap(partitions);
    }

    @Override
    public final IKVTransaction beginTransaction(List<? extends IKVPartition> joined) {
        checkState();
        checkArgument(!joined.isEmpty(), "At least one partition must join the transaction");
        List<P> owned = new ArrayList<>(joined.size());
        Set<IKVPartition> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (IKVPartition partition : joined) {
            P mine = partitions.get(partition.id());
            checkArgument(mine == partition, "Partition[%s] is not opened by engine[%s]", partition.id(), identity);
            checkArgument(seen.add(partition), "Partition[%s] joined the transaction twice", partition.id());
            owned.add(mine);
        }
        return doBeginTransaction(owned);
    }

    @Override
    public final long generateId() {
        checkState();
        return doGenerateId();
    }

    @Override
    public final CompletableFuture<Void> flush() {
        checkState();
        return doFlush();
    }

    protected final Tags metricTags() {
        return metricTags;
    }

    protected final void checkState() {
        if (state.get() != State.STARTED) {
            throw new KVEngineException("KVEngine[" + identity + "] is not started");
        }
    }

    protected abstract void doStart();

    protected abstract void doStop();

    protected abstract P doCreatePartition(String id, Tags metricTags, Runnable onClose);

    protected abstract IKVTransaction doBeginTransaction(List<P> partitions);

    protected abstract long doGenerateId();

    protected abstract CompletableFuture<Void> doFlush();

    private enum State {
        INIT, STARTING, STARTED, FATAL_FAILURE, STOPPING, STOPPED
    }
}
