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
import java.util.List;

/**
 * Snapshot of the applied client identity and trust.
 *
 * @param pkiEnabled {@code true} if a client certificate is presented
 * @param certificatePath the presented certificate, {@code null} if none
 * @param keyPath the private key of the presented certificate, {@code null} if none
 * @param caChainPath the trusted CA chain, {@code null} unless verification uses a custom CA
 * @param verifyMode the applied verify mode
 * @param warnings problems recovered during the last resolution, like missing certificate files
 */
public record PkiInfo(
        boolean pkiEnabled,
        Path certificatePath,
        Path keyPath,
        Path caChainPath,
        VerifyMode verifyMode,
        List<String> warnings) {
    public PkiInfo {
        warnings = List.copyOf(warnings);
    }

    public static PkiInfo of(SecurityConfig applied, List<String> warnings) {
        var clientCertificate = applied.clientCertificate();
        var caChain = applied.verify() instanceof VerifyMode.CustomCa customCa ? customCa.caChainPath() : null;
        return new PkiInfo(
                clientCertificate != null,
                clientCertificate != null ? clientCertificate.certificate() : null,
                clientCertificate != null ? clientCertificate.privateKey() : null,
                caChain,
                applied.verify(),
                warnings);
    }
}
