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
 * The server certificate could not be verified against the active trust, the system CA bundle or the configured CA
 * chain.
 */
public class ServerCertificateException extends SecurityException {
    @Serial
    private static final long serialVersionUID = -1056470826416829335L;

    public ServerCertificateException(String method, String url, String message, Throwable cause) {
        super(method, url, message, cause);
    }
}
