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

import com.google.protobuf.Struct;
import org.typedkv.localengine.IKVEngine;
import org.typedkv.localengine.spi.IKVEngineProvider;

/**
 * Provider for in-memory engine implementation.
 */
public class InMemKVEngineProvider implements IKVEngineProvider {

    @Override
    public String type() {
        return "memory";
    }

    @Override
    public Struct defaults() {
        return InMemDefaultConfigs.DEFAULT;
    }

    @Override
    public IKVEngine create(String overrideIdentity, Struct conf) {
        return new InMemKVEngine(overrideIdentity, conf);
    }
}
