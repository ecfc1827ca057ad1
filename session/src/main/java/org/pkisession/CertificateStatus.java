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

import java.util.List;

/**
 * Status of the registered client certificate.
 *
 * @param state the slot state
 * @param enabled the {@code pki.enabled} setting
 * @param configured {@code true} if certificate and key paths are set
 * @param valid {@code true} if the certificate passed validation
 * @param sessionPkiEnabled {@code true} if the session currently presents a client certificate
 * @param certificateInfo the certificate metadata, {@code null} if it cannot be read
 * @param warnings validation warnings
 * @param errors validation errors
 */
public record CertificateStatus(
        CertificateSlotState state,
        boolean enabled,
        boolean configured,
        boolean valid,
        boolean sessionPkiEnabled,
        CertificateInfo certificateInfo,
        List<String> warnings,
        List<String> errors) {
    public CertificateStatus {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }
}
