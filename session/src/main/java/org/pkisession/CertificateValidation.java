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
import java.util.OptionalLong;

/**
 * Outcome of {@link CertificateStore#validate()}.
 *
 * @param valid {@code true} when the configured client certificate can be used
 * @param daysUntilExpiry days until the certificate expires, empty when it could not be read
 * @param errors problems that make the certificate unusable
 * @param warnings problems that do not, like an expiry within 30 days
 */
public record CertificateValidation(
        boolean valid, OptionalLong daysUntilExpiry, List<String> errors, List<String> warnings) {
    public CertificateValidation {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static CertificateValidation invalid(String error) {
        return new CertificateValidation(false, OptionalLong.empty(), List.of(error), List.of());
    }
}
