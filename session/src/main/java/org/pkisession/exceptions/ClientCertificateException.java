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
package org.pkisession.exceptions;

import java.io.Serial;

/**
 * The TLS handshake failed on the client certificate side: the server required a certificate and none was presented,
 * or it rejected the one that was.
 */
public class ClientCertificateException extends SecurityException {
    @Serial
    private static final long serialVersionUID = 5570380418021906914L;

    private final boolean clientCertificatePresented;

    public ClientCertificateException(
            String method, String url, String message, boolean clientCertificatePresented, Throwable cause) {
        super(method, url, message, cause);
        this.clientCertificatePresented = clientCertificatePresented;
    }

    /**
     * @return {@code true} if a client certificate was configured for the failed handshake
     */
    public boolean clientCertificatePresented() {
        return clientCertificatePresented;
    }
}
