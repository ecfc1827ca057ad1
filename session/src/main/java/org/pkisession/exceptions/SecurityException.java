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
 * Failed to communicate with the server due to a TLS error.
 * When this type of error happens, the security cause should be fixed, the request is never retried.
 */
public class SecurityException extends RequestException {
    @Serial
    private static final long serialVersionUID = 2384690157426001432L;

    /**
     * Creates a new instance.
     *
     * @param method the HTTP method
     * @param url the URL
     * @param message the message
     * @param cause the cause
     */
    public SecurityException(String method, String url, String message, Throwable cause) {
        super(method, url, message, cause);
    }
}
