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
package org.pkisession;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;
import org.pkisession.exceptions.ConfigurationException;
import org.pkisession.internal.InternalSessionManager;
import org.pkisession.internal.pki.SettingsCertificateStore;
import org.pkisession.internal.security.SecurityConfigResolver;
import org.pkisession.internal.security.TlsMaterialsFactory;
import org.pkisession.internal.settings.ConfigStoreProvider;

/**
 * Creates {@link SessionManager} instances.
 * <p>
 * Applications that cannot pass a manager around use the process wide instance:
 * <pre>{@code
 * SessionManagers.init(configStore, Logging.slf4j());
 * SessionManagers.global().configure();
 * ...
 * SessionManagers.shutdown();
 * }</pre>
 */
public final class SessionManagers {
    private static final Object GLOBAL_LOCK = new Object();
    private static SessionManager global;
    private static ConfigStore globalConfigStore;

    private SessionManagers() {}

    /**
     * Creates a manager reading its security settings from the given store.
     *
     * @param configStore the settings
     * @param logging the logging
     * @return a new manager, not configured yet
     */
    public static SessionManager create(ConfigStore configStore, Logging logging) {
        Objects.requireNonNull(configStore, "configStore");
        return create(() -> configStore, logging);
    }

    /**
     * Creates a manager whose settings may not be available yet. The supplier is asked again on {@code configure},
     * {@code reconfigureSecurity} and {@code bindSettings} until it returns a store; a supplier that throws or
     * returns {@code null} counts as not available.
     *
     * @param configStore the settings supplier
     * @param logging the logging
     * @return a new manager, not configured yet
     */
    public static SessionManager create(Supplier<ConfigStore> configStore, Logging logging) {
        var settings = new ConfigStoreProvider(configStore, logging);
        return create(settings, new SettingsCertificateStore(settings, Clock.systemUTC(), logging), logging);
    }

    /**
     * Creates a manager that takes the client identity and CA chain from a custom certificate store.
     *
     * @param configStore the settings supplier
     * @param certificateStore the certificate store
     * @param logging the logging
     * @return a new manager, not configured yet
     */
    public static SessionManager create(
            Supplier<ConfigStore> configStore, CertificateStore certificateStore, Logging logging) {
        return create(new ConfigStoreProvider(configStore, logging), certificateStore, logging);
    }

    private static SessionManager create(
            ConfigStoreProvider settings, CertificateStore certificateStore, Logging logging) {
        Objects.requireNonNull(certificateStore, "certificateStore");
        Objects.requireNonNull(logging, "logging");
        return new InternalSessionManager(
                settings,
                certificateStore,
                new SecurityConfigResolver(logging),
                new TlsMaterialsFactory(logging),
                logging);
    }

    /**
     * Creates the process wide manager. Calling it again with the same settings without {@link #shutdown()} returns
     * the existing one.
     *
     * @param configStore the settings
     * @param logging the logging
     * @return the process wide manager
     * @throws ConfigurationException if the manager was already initialized with other settings
     */
    public static SessionManager init(ConfigStore configStore, Logging logging) {
        Objects.requireNonNull(configStore, "configStore");
        synchronized (GLOBAL_LOCK) {
            if (global == null) {
                global = create(configStore, logging);
                globalConfigStore = configStore;
            } else if (globalConfigStore != configStore) {
                throw new ConfigurationException("SessionManager already initialized with other settings. "
                        + "Call SessionManagers.shutdown() first.");
            }
            return global;
        }
    }

    /**
     * @return the process wide manager
     * @throws ConfigurationException if {@link #init(ConfigStore, Logging)} was not called
     */
    public static SessionManager global() {
        synchronized (GLOBAL_LOCK) {
            if (global == null) {
                throw new ConfigurationException("SessionManager not initialized. Call SessionManagers.init() first.");
            }
            return global;
        }
    }

    /**
     * Closes and forgets the process wide manager. Does nothing if there is none.
     */
    public static void shutdown() {
        SessionManager current;
        synchronized (GLOBAL_LOCK) {
            current = global;
            global = null;
            globalConfigStore = null;
        }
        if (current != null) {
            current.close();
        }
    }
}
