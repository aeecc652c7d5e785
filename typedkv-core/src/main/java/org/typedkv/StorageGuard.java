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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import org.typedkv.exception.TypedKVException;
import org.typedkv.localengine.KVEngineException;
import org.typedkv.localengine.KVTransactionConflictException;

final class StorageGuard {
    private StorageGuard() {
    }

    static <T> T call(Supplier<T> op) {
        try {
            return op.get();
        } catch (KVTransactionConflictException e) {
            throw e;
        } catch (KVEngineException e) {
            throw TypedKVException.storage(e);
        }
    }

    static void run(Runnable op) {
        call(() -> {
            op.run();
            return null;
        });
    }

    static CompletableFuture<Void> future(Supplier<CompletableFuture<Void>> op) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        call(op).whenComplete((v, e) -> {
            if (e == null) {
                result.complete(null);
                return;
            }
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            result.completeExceptionally(cause instanceof KVEngineException engineException
                ? TypedKVException.storage(engineException) : cause);
        });
        return result;
    }
}
