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
package org.pkisession.internal.security;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import org.pkisession.ClientCertificate;
import org.pkisession.Logger;
import org.pkisession.Logging;
import org.pkisession.SecurityConfig;
import org.pkisession.VerifyMode;
import org.pkisession.exceptions.CaCertificateFileMissingException;
import org.pkisession.exceptions.CertificateFileMissingException;
import org.pkisession.exceptions.SessionException;
import org.pkisession.internal.SecuritySettings;

/**
 * Maps a settings snapshot and the runtime override to the {@link SecurityConfig} to apply.
 * <p>
 * Disabled verification wins over a custom CA chain. A client certificate is only resolved when PKI is enabled and
 * both of its files exist, independently of the verify mode. A custom CA chain is only resolved when PKI is enabled
 * and the chain file exists. Missing files never fail the resolution, they degrade it and are reported as warnings.
 */
public class SecurityConfigResolver {
    private final Predicate<Path> fileExists;
    private final Logger log;

    public SecurityConfigResolver(Logging logging) {
        this(Files::isRegularFile, logging);
    }

    SecurityConfigResolver(Predicate<Path> fileExists, Logging logging) {
        this.fileExists = Objects.requireNonNull(fileExists);
        this.log = logging.getLog(getClass());
    }

    public SecurityConfig compute(SecuritySettings settings, boolean runtimeIgnoreSsl) {
        return resolve(settings, runtimeIgnoreSsl).config();
    }

    public Resolution resolve(SecuritySettings settings, boolean runtimeIgnoreSsl) {
        var warnings = new ArrayList<SessionException>();
        var ignoreSsl = settings.ignoreSslVerification() || runtimeIgnoreSsl;

        ClientCertificate clientCertificate = null;
        VerifyMode verify;
        if (settings.pkiEnabled()) {
            clientCertificate = resolveClientCertificate(settings, warnings);
            verify = ignoreSsl ? VerifyMode.disabled() : resolveCaChain(settings, warnings);
        } else {
            verify = ignoreSsl ? VerifyMode.disabled() : VerifyMode.systemCa();
        }

        for (var warning : warnings) {
            log.warn(warning.getMessage());
        }
        return new Resolution(new SecurityConfig(verify, clientCertificate), warnings);
    }

    private ClientCertificate resolveClientCertificate(SecuritySettings settings, List<SessionException> warnings) {
        var configured = settings.clientCertificate();
        if (configured == null) {
            warnings.add(new CertificateFileMissingException(
                    "PKI enabled but no client certificate is configured", List.of()));
            return null;
        }
        var missing = new ArrayList<Path>();
        var details = new ArrayList<String>();
        if (!fileExists.test(configured.certificate())) {
            missing.add(configured.certificate());
            details.add("cert=" + configured.certificate());
        }
        if (!fileExists.test(configured.privateKey())) {
            missing.add(configured.privateKey());
            details.add("key=" + configured.privateKey());
        }
        if (!missing.isEmpty()) {
            warnings.add(new CertificateFileMissingException(
                    "PKI enabled but client certificate files not found: " + String.join(", ", details), missing));
            return null;
        }
        return configured;
    }

    private VerifyMode resolveCaChain(SecuritySettings settings, List<SessionException> warnings) {
        // a configured PKI chain supersedes advanced.custom_ca_path, even when its file is missing
        var caChain = settings.caChainPath() != null ? settings.caChainPath() : settings.customCaPath();
        if (caChain == null) {
            return VerifyMode.systemCa();
        }
        if (!fileExists.test(caChain)) {
            warnings.add(new CaCertificateFileMissingException(
                    "PKI CA chain file not found: " + caChain + ", falling back to system CA bundle", caChain));
            return VerifyMode.systemCa();
        }
        return VerifyMode.customCa(caChain);
    }

    /**
     * @param config the resolved configuration
     * @param warnings the recovered problems, in the order they were found
     */
    public record Resolution(SecurityConfig config, List<SessionException> warnings) {
        public Resolution {
            warnings = List.copyOf(warnings);
        }
    }
}
