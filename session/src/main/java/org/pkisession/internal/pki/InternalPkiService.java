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

import static org.pkisession.CertificateSlotState.ACTIVE;
import static org.pkisession.CertificateSlotState.DISABLED;
import static org.pkisession.CertificateSlotState.IMPORTING;
import static org.pkisession.CertificateSlotState.UNCONFIGURED;
import static org.pkisession.CertificateSlotState.VALIDATED;
import static org.pkisession.internal.settings.SettingsKeys.PKI_CA_CHAIN_PATH;
import static org.pkisession.internal.settings.SettingsKeys.PKI_CLIENT_CERT_PATH;
import static org.pkisession.internal.settings.SettingsKeys.PKI_CLIENT_KEY_PATH;
import static org.pkisession.internal.settings.SettingsKeys.PKI_ENABLED;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.pkisession.CertificateSlotState;
import org.pkisession.CertificateStatus;
import org.pkisession.CertificateStore;
import org.pkisession.CertificateValidation;
import org.pkisession.ClientCertificate;
import org.pkisession.ConfigStore;
import org.pkisession.Logger;
import org.pkisession.Logging;
import org.pkisession.PkiService;
import org.pkisession.SessionManager;

public class InternalPkiService implements PkiService {
    private final ConfigStore configStore;
    private final CertificateStore certificateStore;
    private final SessionManager sessionManager;
    private final Logger log;

    private CertificateSlotState state;

    public InternalPkiService(
            ConfigStore configStore,
            CertificateStore certificateStore,
            SessionManager sessionManager,
            Logging logging) {
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.certificateStore = Objects.requireNonNull(certificateStore, "certificateStore");
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.log = logging.getLog(getClass());
        this.state = initialState();
    }

    private CertificateSlotState initialState() {
        if (certificateStore.clientCertificatePaths().isEmpty()) {
            return UNCONFIGURED;
        }
        return certificateStore.isPkiEnabled() ? ACTIVE : DISABLED;
    }

    @Override
    public synchronized CertificateSlotState state() {
        return state;
    }

    @Override
    public synchronized CertificateValidation register(ClientCertificate clientCertificate, Path caChain) {
        Objects.requireNonNull(clientCertificate, "clientCertificate");
        requireState("register a certificate", EnumSet.of(UNCONFIGURED));
        state = IMPORTING;

        configStore.set(PKI_ENABLED, false);
        configStore.set(PKI_CLIENT_CERT_PATH, clientCertificate.certificate().toString());
        configStore.set(PKI_CLIENT_KEY_PATH, clientCertificate.privateKey().toString());
        configStore.set(PKI_CA_CHAIN_PATH, caChain != null ? caChain.toString() : "");

        var validation = certificateStore.validate();
        if (validation.valid()) {
            state = VALIDATED;
            log.info("Client certificate registered: %s", clientCertificate.certificate());
        } else {
            clearPaths();
            state = UNCONFIGURED;
            log.warn("Client certificate rejected: %s", String.join("; ", validation.errors()));
        }
        return validation;
    }

    @Override
    public synchronized void enable() {
        requireState("enable PKI", EnumSet.of(VALIDATED, DISABLED));
        configStore.set(PKI_ENABLED, true);
        sessionManager.reconfigureSecurity();
        state = ACTIVE;
        log.info("PKI authentication enabled");
    }

    @Override
    public synchronized void disable() {
        requireState("disable PKI", EnumSet.of(ACTIVE));
        configStore.set(PKI_ENABLED, false);
        sessionManager.reconfigureSecurity();
        state = DISABLED;
        log.info("PKI authentication disabled");
    }

    @Override
    public synchronized void remove() {
        requireState("remove the certificate", EnumSet.of(VALIDATED, ACTIVE, DISABLED));
        var files = new ArrayList<Path>();
        certificateStore.clientCertificatePaths().ifPresent(paths -> {
            files.add(paths.certificate());
            files.add(paths.privateKey());
        });
        certificateStore.caChainPath().ifPresent(files::add);

        configStore.set(PKI_ENABLED, false);
        clearPaths();
        sessionManager.reconfigureSecurity();
        deleteAll(files);
        state = UNCONFIGURED;
        log.info("Client certificate removed");
    }

    @Override
    public synchronized CertificateStatus certificateStatus() {
        var configured = certificateStore.clientCertificatePaths().isPresent();
        var validation = configured ? certificateStore.validate() : null;
        return new CertificateStatus(
                state,
                certificateStore.isPkiEnabled(),
                configured,
                validation != null && validation.valid(),
                sessionManager.getPkiInfo().pkiEnabled(),
                certificateStore.certificateInfo().orElse(null),
                validation != null ? validation.warnings() : List.of(),
                validation != null ? validation.errors() : List.of());
    }

    @Override
    public Optional<String> expiryWarning() {
        return certificateStore
                .certificateInfo()
                .filter(info -> info.daysUntilExpiry() <= SettingsCertificateStore.EXPIRY_WARNING_DAYS)
                .map(info -> "Certificate expires in " + info.daysUntilExpiry() + " days");
    }

    private void requireState(String action, EnumSet<CertificateSlotState> allowed) {
        if (!allowed.contains(state)) {
            throw new IllegalStateException("Cannot " + action + " while the certificate slot is " + state);
        }
    }

    private void clearPaths() {
        configStore.remove(PKI_CLIENT_CERT_PATH);
        configStore.remove(PKI_CLIENT_KEY_PATH);
        configStore.remove(PKI_CA_CHAIN_PATH);
    }

    private void deleteAll(List<Path> files) {
        for (var file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("Unable to delete " + file, e);
            }
        }
    }
}
