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
package org.pkisession.internal.pki;

import static org.pkisession.internal.settings.SettingsKeys.PKI_CA_CHAIN_PATH;
import static org.pkisession.internal.settings.SettingsKeys.PKI_CLIENT_CERT_PATH;
import static org.pkisession.internal.settings.SettingsKeys.PKI_CLIENT_KEY_PATH;
import static org.pkisession.internal.settings.SettingsKeys.PKI_ENABLED;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.pkisession.CertificateInfo;
import org.pkisession.CertificateStore;
import org.pkisession.CertificateValidation;
import org.pkisession.ClientCertificate;
import org.pkisession.Logger;
import org.pkisession.Logging;
import org.pkisession.internal.settings.ConfigStoreProvider;

/**
 * {@link CertificateStore} backed by the {@code pki.*} settings. While the settings are not available PKI reads as
 * disabled and unconfigured.
 */
public class SettingsCertificateStore implements CertificateStore {
    static final int EXPIRY_WARNING_DAYS = 30;

    private final ConfigStoreProvider settings;
    private final Clock clock;
    private final Logger log;

    public SettingsCertificateStore(ConfigStoreProvider settings, Clock clock, Logging logging) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.log = logging.getLog(getClass());
    }

    @Override
    public boolean isPkiEnabled() {
        return settings.get()
                .map(configStore -> configStore.getBoolean(PKI_ENABLED, false))
                .orElse(false);
    }

    @Override
    public Optional<ClientCertificate> clientCertificatePaths() {
        var certificate = path(PKI_CLIENT_CERT_PATH);
        var privateKey = path(PKI_CLIENT_KEY_PATH);
        if (certificate.isPresent() && privateKey.isPresent()) {
            return Optional.of(new ClientCertificate(certificate.get(), privateKey.get()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<Path> caChainPath() {
        return path(PKI_CA_CHAIN_PATH);
    }

    @Override
    public CertificateValidation validate() {
        var paths = clientCertificatePaths();
        if (paths.isEmpty()) {
            return CertificateValidation.invalid("Client certificate is not configured");
        }
        var certificatePath = paths.get().certificate();
        var keyPath = paths.get().privateKey();

        var errors = new ArrayList<String>();
        if (!Files.isRegularFile(certificatePath)) {
            errors.add("Certificate file not found: " + certificatePath);
        }
        if (!Files.isRegularFile(keyPath)) {
            errors.add("Private key file not found: " + keyPath);
        }
        if (!errors.isEmpty()) {
            return new CertificateValidation(false, OptionalLong.empty(), errors, List.of());
        }

        CertificateInfo info;
        try {
            var chain = CertificateInspector.readCertificates(certificatePath);
            info = CertificateInspector.inspect(chain.get(0), clock.instant());
            var privateKey = PemPrivateKeys.read(keyPath);
            if (!CertificateInspector.matches(privateKey, chain.get(0))) {
                errors.add("Private key does not match certificate");
            }
        } catch (IOException | GeneralSecurityException e) {
            log.debug("Client certificate validation failed: %s", e.getMessage());
            return CertificateValidation.invalid("Unable to read client certificate: " + e.getMessage());
        }

        var now = clock.instant();
        if (now.isAfter(info.notValidAfter())) {
            errors.add("Certificate has expired");
        } else if (now.isBefore(info.notValidBefore())) {
            errors.add("Certificate is not yet valid");
        }

        var warnings = new ArrayList<String>();
        if (errors.isEmpty() && info.daysUntilExpiry() <= EXPIRY_WARNING_DAYS) {
            warnings.add("Certificate expires in " + info.daysUntilExpiry() + " days");
            log.warn("Certificate expires in %s days", info.daysUntilExpiry());
        }
        return new CertificateValidation(errors.isEmpty(), OptionalLong.of(info.daysUntilExpiry()), errors, warnings);
    }

    @Override
    public Optional<CertificateInfo> certificateInfo() {
        var paths = clientCertificatePaths();
        if (paths.isEmpty() || !Files.isRegularFile(paths.get().certificate())) {
            return Optional.empty();
        }
        try {
            var chain = CertificateInspector.readCertificates(paths.get().certificate());
            return Optional.of(CertificateInspector.inspect(chain.get(0), clock.instant()));
        } catch (IOException | GeneralSecurityException e) {
            log.debug("Unable to read client certificate %s: %s", paths.get().certificate(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Path> path(String key) {
        var value = settings.get()
                .flatMap(configStore -> configStore.getString(key))
                .map(String::trim)
                .filter(s -> !s.isEmpty());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(value.get()));
        } catch (InvalidPathException e) {
            log.warn("Setting '%s' is not a valid path: %s", key, value.get());
            return Optional.empty();
        }
    }
}
