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
package org.pkisession.internal;

import static org.pkisession.internal.settings.SettingsKeys.affectsSecurity;

import java.util.concurrent.atomic.AtomicBoolean;
import org.pkisession.ConfigStore;
import org.pkisession.Logger;
import org.pkisession.Logging;
import org.pkisession.SettingsListener;
import org.pkisession.internal.settings.ConfigStoreProvider;

/**
 * Registers a listener that triggers a security reconfiguration on changes to security relevant keys. Registration
 * waits until the config store is available and happens at most once.
 */
final class SettingsSubscription implements SettingsListener {
    private final ConfigStoreProvider settings;
    private final Runnable reconfiguration;
    private final Logger log;
    private final AtomicBoolean registered = new AtomicBoolean();

    SettingsSubscription(ConfigStoreProvider settings, Runnable reconfiguration, Logging logging) {
        this.settings = settings;
        this.reconfiguration = reconfiguration;
        this.log = logging.getLog(getClass());
    }

    boolean bind() {
        if (registered.get()) {
            return true;
        }
        var store = settings.get();
        if (store.isEmpty()) {
            log.debug("Settings not available, change notifications not registered yet");
            return false;
        }
        if (registered.compareAndSet(false, true)) {
            store.get().onChange(this);
            log.debug("Registered for security settings changes");
        }
        return true;
    }

    void unbind() {
        if (registered.compareAndSet(true, false)) {
            settings.get().ifPresent(store -> store.removeListener(this));
        }
    }

    boolean isBound() {
        return registered.get();
    }

    @Override
    public void settingChanged(String key, Object value) {
        if (affectsSecurity(key)) {
            log.debug("Security setting %s changed, reconfiguring", key);
            reconfiguration.run();
        }
    }

    ConfigStore storeOrNull() {
        return settings.get().orElse(null);
    }
}
