/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.pkisession.internal.settings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.pkisession.internal.logging.DevNullLogging.DEV_NULL_LOGGING;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.pkisession.ConfigStore;

class ConfigStoreProviderTest {
    @Test
    void asksSupplierAgainUntilStoreIsAvailable() {
        var store = new InMemoryConfigStore(Map.of(), DEV_NULL_LOGGING);
        var calls = new AtomicInteger();
        var provider = new ConfigStoreProvider(
                () -> switch (calls.incrementAndGet()) {
                    case 1 -> throw new IllegalStateException("settings not loaded yet");
                    case 2 -> null;
                    default -> store;
                },
                DEV_NULL_LOGGING);

        assertTrue(provider.get().isEmpty());
        assertTrue(provider.get().isEmpty());
        assertSame(store, provider.get().orElseThrow());
        assertSame(store, provider.get().orElseThrow());
        assertEquals(3, calls.get());
    }

    @Test
    void wrapsAvailableStore() {
        ConfigStore store = new InMemoryConfigStore(Map.of(), DEV_NULL_LOGGING);

        assertSame(store, ConfigStoreProvider.of(store, DEV_NULL_LOGGING).get().orElseThrow());
    }
}
