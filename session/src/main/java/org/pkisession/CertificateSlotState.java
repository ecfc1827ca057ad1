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

/**
 * Lifecycle of the client certificate slot of a {@link PkiService}.
 * <pre>
 * UNCONFIGURED -&gt; IMPORTING -&gt; VALIDATED -&gt; ACTIVE &lt;-&gt; DISABLED
 *       ^              |            |                      |
 *       +--------------+------------+----- remove() -------+
 * </pre>
 */
public enum CertificateSlotState {
    /**
     * No client certificate is registered.
     */
    UNCONFIGURED,
    /**
     * A registration is validating the certificate files.
     */
    IMPORTING,
    /**
     * The registered certificate is valid, PKI is not enabled yet.
     */
    VALIDATED,
    /**
     * PKI is enabled and the session presents the certificate.
     */
    ACTIVE,
    /**
     * PKI was disabled, the certificate stays registered.
     */
    DISABLED
}
