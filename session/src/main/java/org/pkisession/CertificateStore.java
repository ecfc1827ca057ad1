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
 * Source of the client identity and CA chain used for mutual TLS. Extracting keys and certificates from PKCS#12
 * bundles happens elsewhere; a store only exposes the resulting PEM files.
 */
public interface CertificateStore {
    /**
     * @return {@code true} if mutual TLS is switched on
     */
    boolean isPkiEnabled();

    /**
     * Returns the configured client certificate and private key files. The files are not checked for existence.
     *
     * @return the configured files, empty unless both paths are configured
     */
    Optional<ClientCertificate> clientCertificatePaths();

    /**
     * Returns the configured CA chain file. The file is not checked for existence.
     *
     * @return the configured file, empty if none is configured
     */
    Optional<Path> caChainPath();

    /**
     * Checks that the configured client certificate exists, is readable, matches its private key and is within its
     * validity period.
     *
     * @return the validation outcome
     */
    CertificateValidation validate();

    /**
     * @return metadata of the configured client certificate, empty if it cannot be read
     */
    Optional<CertificateInfo> certificateInfo();
}
