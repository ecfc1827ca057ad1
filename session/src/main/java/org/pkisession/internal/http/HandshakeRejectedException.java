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
package org.pkisession.internal.http;

import java.io.Serial;
import javax.net.ssl.SSLHandshakeException;

/**
 * The server closed a freshly negotiated TLS connection before answering.
 */
public class HandshakeRejectedException extends SSLHandshakeException {
    @Serial
    private static final long serialVersionUID = -2093415762287381196L;

    public HandshakeRejectedException(Throwable cause) {
        super("Server closed the connection after the TLS handshake: " + cause.getMessage());
        initCause(cause);
    }
}
