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

import static org.pkisession.internal.settings.SettingsKeys.CUSTOM_CA_PATH;
import static org.pkisession.internal.settings.SettingsKeys.IGNORE_SSL_VERIFICATION;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.pkisession.CertificateStore;
import org.pkisession.ClientCertificate;
import org.pkisession.ConfigStore;

/**
 * Typed snapshot of every setting the security resolution reads. Paths are as configured; existence is checked at
 * resolution time.
 *
 * @param pkiEnabled {@code pki.enabled}
 * @param clientCertificate {@code pki.client_cert_path} and {@code pki.client_key_path}, {@code null} unless both set
 * @param caChainPath {@code pki.ca_chain_path}, {@code null} if blank
 * @param customCaPath {@code advanced.custom_ca_path}, {@code null} if blank
 * @param ignoreSslVerification {@code advanced.ignore_ssl_verification}
 */
public record SecuritySettings(
        boolean pkiEnabled,
        ClientCertificate clientCertificate,
        Path caChainPath,
        Path customCaPath,
        boolean ignoreSslVerification) {
    public static final SecuritySettings DEFAULT = new SecuritySettings(false, null, null, null, false);

    /**
     * Captures the current settings. The config store may be {@code null} while it is not available yet, the
     * {@code advanced.*} settings then keep their defaults.
     */
    public static SecuritySettings capture(CertificateStore certificateStore, ConfigStore configStore) {
        var ignoreSsl = configStore != null && configStore.getBoolean(IGNORE_SSL_VERIFICATION, false);
        var customCa = configStore == null
                ? null
                : configStore
                        .getString(CUSTOM_CA_PATH)
                        .map(String::trim)
                        .filter(value -> !value.isEmpty())
                        .map(SecuritySettings::toPathOrNull)
                        .orElse(null);
        return new SecuritySettings(
                certificateStore.isPkiEnabled(),
                certificateStore.clientCertificatePaths().orElse(null),
                certificateStore.caChainPath().orElse(null),
                customCa,
                ignoreSsl);
    }

    public static SecuritySettingsBuilder builder() {
        return new SecuritySettingsBuilder();
    }

    private static Path toPathOrNull(String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            return null;
        }
    }

    public static class SecuritySettingsBuilder {
        private boolean pkiEnabled;
        private ClientCertificate clientCertificate;
        private Path caChainPath;
        private Path customCaPath;
        private boolean ignoreSslVerification;

        public SecuritySettingsBuilder withPkiEnabled(boolean pkiEnabled) {
            this.pkiEnabled = pkiEnabled;
            return this;
        }

        public SecuritySettingsBuilder withClientCertificate(Path certificate, Path privateKey) {
            this.clientCertificate = new ClientCertificate(certificate, privateKey);
            return this;
        }

        public SecuritySettingsBuilder withCaChain(Path caChainPath) {
            this.caChainPath = caChainPath;
            return this;
        }

        public SecuritySettingsBuilder withCustomCa(Path customCaPath) {
            this.customCaPath = customCaPath;
            return this;
        }

        public SecuritySettingsBuilder withIgnoreSslVerification(boolean ignoreSslVerification) {
            this.ignoreSslVerification = ignoreSslVerification;
            return this;
        }

        public SecuritySettings build() {
            return new SecuritySettings(
                    pkiEnabled, clientCertificate, caChainPath, customCaPath, ignoreSslVerification);
        }
    }
}
