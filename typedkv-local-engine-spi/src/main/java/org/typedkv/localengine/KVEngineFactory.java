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

import com.google.protobuf.Struct;
import java.util.ServiceLoader;
import javax.annotation.Nullable;
import org.typedkv.localengine.spi.IKVEngineProvider;

public class KVEngineFactory {
    public static IKVEngine create(String type, Struct conf) {
        return create(null, type, conf);
    }

    public static IKVEngine create(@Nullable String overrideIdentity, String type, Struct conf) {
        for (IKVEngineProvider provider : ServiceLoader.load(IKVEngineProvider.class)) {
            if (provider.type().equalsIgnoreCase(type)) {
                Struct merged = provider.defaults().toBuilder()
                    .putAllFields(conf.getFieldsMap())
                    .build();
                return provider.create(overrideIdentity, merged);
            }
        }
        throw new UnsupportedOperationException("No KVEngineProvider found for type: " + type);
    }
}
