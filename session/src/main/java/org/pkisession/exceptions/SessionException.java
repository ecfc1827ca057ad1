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
 * This is the base class for all exceptions thrown by the session layer.
 */
public class SessionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 6912184374207342391L;

    /**
     * Creates a new instance.
     *
     * @param message the message
     */
    public SessionException(String message) {
        super(message);
    }

    /**
     * Creates a new instance.
     *
     * @param message the message
     * @param cause the cause
     */
    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
