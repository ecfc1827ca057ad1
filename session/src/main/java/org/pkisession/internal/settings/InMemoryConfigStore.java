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

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.pkisession.ConfigStore;
import org.pkisession.Logger;
import org.pkisession.Logging;
import org.pkisession.SettingsListener;

/**
 * {@link ConfigStore} keeping settings in memory. Listeners run synchronously after the value is stored; a failing
 * listener is logged and does not stop the others.
 */
public class InMemoryConfigStore implements ConfigStore {
    private final Map<String, Object> values = new ConcurrentHashMap<>();
    private final List<SettingsListener> listeners = new CopyOnWriteArrayList<>();
    private final Logger log;

    public InMemoryConfigStore(Map<String, ?> initialValues, Logging logging) {
        Objects.requireNonNull(initialValues, "initialValues");
        initialValues.forEach((key, value) -> {
            if (value != null) {
                values.put(key, value);
            }
        });
        this.log = logging.getLog(getClass());
    }

    @Override
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        var previous = value == null ? values.remove(key) : values.put(key, value);
        if (!Objects.equals(previous, value)) {
            log.debug("Setting '%s' changed", key);
            notifyListeners(key, value);
        }
    }

    @Override
    public void remove(String key) {
        set(key, null);
    }

    @Override
    public void onChange(SettingsListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(SettingsListener listener) {
        listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }

    private void notifyListeners(String key, Object value) {
        for (var listener : listeners) {
            try {
                listener.settingChanged(key, value);
            } catch (RuntimeException e) {
                log.warn(String.format("Settings listener failed for key '%s'", key), e);
            }
        }
    }
}
