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

/**
 * Body of a transaction. It may be invoked several times: once per attempt until one commits, so it must not have side
 * effects outside the views it is given. Throwing the abort type discards the attempt and the exception reaches the
 * caller of {@link TransactionComposer#transact}.
 *
 * @param <R> the result type
 * @param <E> the abort type
 */
@FunctionalInterface
public interface TransactionCallback<R, E extends Exception> {
    R apply(TransactionViews views) throws E;
}
