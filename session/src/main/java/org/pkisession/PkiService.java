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

import java.nio.file.Path;
import java.util.Optional;

/**
 * Manages the client certificate slot: registering extracted certificate files, switching PKI on and off and removing
 * the certificate again. Every transition that changes what the session presents reconfigures its security.
 * <p>
 * Transitions not allowed by {@link CertificateSlotState} fail with {@link IllegalStateException}.
 */
public interface PkiService {
    CertificateSlotState state();

    /**
     * Registers extracted PEM files as the client certificate. PKI stays disabled. The slot ends in
     * {@link CertificateSlotState#VALIDATED}, or in {@link CertificateSlotState#UNCONFIGURED} if validation fails.
     *
     * @param clientCertificate the certificate and private key files
     * @param caChain the CA chain file, may be {@code null}
     * @return the validation outcome
     * @throws IllegalStateException unless the slot is {@link CertificateSlotState#UNCONFIGURED}
     */
    CertificateValidation register(ClientCertificate clientCertificate, Path caChain);

    /**
     * Sets {@code pki.enabled} and reconfigures the session.
     *
     * @throws IllegalStateException unless the slot is {@link CertificateSlotState#VALIDATED} or
     * {@link CertificateSlotState#DISABLED}
     */
    void enable();

    /**
     * Clears {@code pki.enabled} and reconfigures the session.
     *
     * @throws IllegalStateException unless the slot is {@link CertificateSlotState#ACTIVE}
     */
    void disable();

    /**
     * Disables PKI, deletes the registered files and clears the {@code pki.*} paths.
     *
     * @throws IllegalStateException if nothing is registered or a registration is in progress
     */
    void remove();

    CertificateStatus certificateStatus();

    /**
     * @return {@code Certificate expires in <n> days} if the certificate expires within 30 days
     */
    Optional<String> expiryWarning();
}
