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

import org.pkisession.internal.pki.InternalPkiService;

/**
 * Creates {@link PkiService} instances.
 */
public final class PkiServices {
    private PkiServices() {}

    /**
     * Creates a service storing the certificate paths in the {@code pki.*} settings.
     *
     * @param configStore the settings, shared with the session manager
     * @param sessionManager the session to reconfigure
     * @param logging the logging
     * @return the service
     */
    public static PkiService create(ConfigStore configStore, SessionManager sessionManager, Logging logging) {
        return create(configStore, CertificateStores.fromSettings(configStore, logging), sessionManager, logging);
    }

    public static PkiService create(
            ConfigStore configStore,
            CertificateStore certificateStore,
            SessionManager sessionManager,
            Logging logging) {
        return new InternalPkiService(configStore, certificateStore, sessionManager, logging);
    }
}
