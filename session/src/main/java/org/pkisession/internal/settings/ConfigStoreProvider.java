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

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.pkisession.ConfigStore;
import org.pkisession.Logger;
import org.pkisession.Logging;

/**
 * Hands out the {@link ConfigStore} once it can be obtained. A supplier that throws or returns {@code null} is asked
 * again on the next call; the first store it returns is kept.
 */
public final class ConfigStoreProvider {
    private final Supplier<ConfigStore> supplier;
    private final Logger log;
    private volatile ConfigStore store;

    public ConfigStoreProvider(Supplier<ConfigStore> supplier, Logging logging) {
        this.supplier = Objects.requireNonNull(supplier, "supplier");
        this.log = logging.getLog(getClass());
    }

    public static ConfigStoreProvider of(ConfigStore store, Logging logging) {
        Objects.requireNonNull(store, "store");
        return new ConfigStoreProvider(() -> store, logging);
    }

    public Optional<ConfigStore> get() {
        var current = store;
        if (current != null) {
            return Optional.of(current);
        }
        synchronized (this) {
            if (store == null) {
                try {
                    store = supplier.get();
                } catch (RuntimeException e) {
                    log.debug("Settings are not available yet: %s", e.getMessage());
                }
            }
            return Optional.ofNullable(store);
        }
    }
}
