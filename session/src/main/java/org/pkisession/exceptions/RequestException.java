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
 * A request could not be completed. Subclasses name the cause when the transport makes it known.
 */
public class RequestException extends SessionException {
    @Serial
    private static final long serialVersionUID = -2204710921760036527L;

    private final String method;
    private final String url;

    /**
     * Creates a new instance.
     *
     * @param method the HTTP method of the failed request
     * @param url the URL of the failed request
     * @param message the message
     * @param cause the cause
     */
    public RequestException(String method, String url, String message, Throwable cause) {
        super(message, cause);
        this.method = method;
        this.url = url;
    }

    /**
     * @return the HTTP method of the failed request
     */
    public String method() {
        return method;
    }

    /**
     * @return the URL of the failed request
     */
    public String url() {
        return url;
    }
}
