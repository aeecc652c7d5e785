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

package org.typedkv.localengine.metrics;

import static org.typedkv.localengine.metrics.GeneralKVPartitionMetric.CallTimer;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Per-operation meters of one partition.
 */
public class KVPartitionOpMeters {
    public final Timer existCallTimer;
    public final Timer getCallTimer;
    public final Timer insertCallTimer;
    public final Timer removeCallTimer;
    public final Timer batchWriteCallTimer;
    public final Timer popCallTimer;
    public final Timer countCallTimer;
    public final Timer clearCallTimer;
    public final Timer cursorNewCallTimer;
    public final Timer cursorStepCallTimer;
    public final DistributionSummary readBytesSummary;
    public final DistributionSummary writeBatchSizeSummary;

    public KVPartitionOpMeters(String id, Tags tags) {
        existCallTimer = KVPartitionMeters.getTimer(id, CallTimer, tags.and("op", "exist"));
        getCallTimer = KVPartitionMeters.getTimer(id, CallTimer, tags.and("op", "get"));
        insertCallTimer = KVPartitionMeters.getTimer(id, CallTimer, tags.and("op", "insert"));
        removeCallTimer = KVPartitionMeters.getTimer(id, CallTimer, tags.and("op", "remove"));
        batchWriteCallTimer = KVPartitionMeters.getTimer(id, CallTimer, tags.and("op", "batch"));
        popCallTimer = KVPartitionMeters.getTimer(id, CallTimer, tags.and("op", "pop"));
        countCallTimer = KVPartitionMeters.getTimer(id, CallTimer, tags.and("op", "count"));
        clearCallTimer = KVPartitionMeters.getTimer(id, CallTimer, tags.and("op", "clear"));
        cursorNewCallTimer = KVPartitionMeters.getTimer(id, CallTimer, tags.and("op", "cursor_new"));
        cursorStepCallTimer = KVPartitionMeters.getTimer(id, CallTimer, tags.and("op", "cursor_step"));
        readBytesSummary =
            KVPartitionMeters.getSummary(id, GeneralKVPartitionMetric.ReadBytesDistribution, tags);
        writeBatchSizeSummary =
            KVPartitionMeters.getSummary(id, GeneralKVPartitionMetric.WriteBatchSizeDistribution, tags);
    }

    public void close() {
        existCallTimer.close();
        getCallTimer.close();
        insertCallTimer.close();
        removeCallTimer.close();
        batchWriteCallTimer.close();
        popCallTimer.close();
        countCallTimer.close();
        clearCallTimer.close();
        cursorNewCallTimer.close();
        cursorStepCallTimer.close();
        readBytesSummary.close();
        writeBatchSizeSummary.close();
    }
}
