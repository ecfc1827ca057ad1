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

import java.util.Objects;
import java.util.Optional;

/**
 * The security policy applied to the pooled HTTP client: how the server is verified and which client identity, if
 * any, is presented.
 * <p>
 * A configuration is never changed in place. Each reconfiguration computes a new value which is either discarded,
 * when it {@link #equals(Object) equals} the applied one, or replaces it as a whole.
 *
 * @param verify the server verification mode
 * @param clientCertificate the client identity, {@code null} when none is presented
 */
public record SecurityConfig(VerifyMode verify, ClientCertificate clientCertificate) {
    public static final SecurityConfig DEFAULT = new SecurityConfig(VerifyMode.systemCa(), null);

    public SecurityConfig {
        Objects.requireNonNull(verify, "verify");
    }

    /**
     * @return the client identity, if one is presented
     */
    public Optional<ClientCertificate> clientCertificateIfPresent() {
        return Optional.ofNullable(clientCertificate);
    }

    /**
     * @return {@code true} if a client identity is presented
     */
    public boolean hasClientCertificate() {
        return clientCertificate != null;
    }

    /**
     * Returns the human readable summary used in logs, like {@code custom CA=/etc/ca.pem, PKI=Yes}.
     *
     * @return the summary
     */
    public String describe() {
        var pki = hasClientCertificate() ? "Yes" : "No";
        return switch (verify.strategy()) {
            case DISABLED -> "SSL verification DISABLED, PKI=" + pki;
            case CUSTOM_CA -> "custom CA=" + ((VerifyMode.CustomCa) verify).caChainPath() + ", PKI=" + pki;
            case SYSTEM_CA -> "system CA bundle, PKI=" + pki;
        };
    }
}
