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
import org.pkisession.internal.pki.SettingsCertificateStore;
import org.pkisession.internal.settings.ConfigStoreProvider;

/**
 * Implementations of {@link CertificateStore}.
 */
public final class CertificateStores {
    private CertificateStores() {}

    /**
     * Creates a store reading the {@code pki.*} keys of the given settings:
     * {@code pki.enabled}, {@code pki.client_cert_path}, {@code pki.client_key_path} and {@code pki.ca_chain_path}.
     *
     * @param configStore the settings
     * @param logging the logging
     * @return the store
     */
    public static CertificateStore fromSettings(ConfigStore configStore, Logging logging) {
        return new SettingsCertificateStore(ConfigStoreProvider.of(configStore, logging), Clock.systemUTC(), logging);
    }
}
