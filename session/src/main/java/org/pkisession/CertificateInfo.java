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

import java.time.Instant;
import java.util.List;

/**
 * Metadata of a client certificate.
 *
 * @param subject the subject distinguished name (RFC 2253)
 * @param issuer the issuer distinguished name (RFC 2253)
 * @param serialNumber the serial number in decimal
 * @param notValidBefore start of the validity period
 * @param notValidAfter end of the validity period
 * @param fingerprint the SHA-256 fingerprint of the encoded certificate, lower case hex
 * @param keyUsage the key usages among {@code Digital Signature}, {@code Key Encipherment} and {@code Key Agreement}
 * @param valid {@code true} if the certificate was within its validity period when inspected
 * @param daysUntilExpiry whole days from inspection until {@code notValidAfter}, negative once expired
 */
public record CertificateInfo(
        String subject,
        String issuer,
        String serialNumber,
        Instant notValidBefore,
        Instant notValidAfter,
        String fingerprint,
        List<String> keyUsage,
        boolean valid,
        long daysUntilExpiry) {
    public CertificateInfo {
        keyUsage = List.copyOf(keyUsage);
    }
}
