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
 * The server kept answering with a retryable status until no retries were left.
 */
public class RetriesExhaustedException extends RequestException {
    @Serial
    private static final long serialVersionUID = -6384436106541245027L;

    private final int statusCode;
    private final int attempts;

    public RetriesExhaustedException(String method, String url, int statusCode, int attempts) {
        super(
                method,
                url,
                String.format("%s %s answered HTTP %d after %d attempts", method, url, statusCode, attempts),
                null);
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    /**
     * @return the status of the last attempt
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * @return the number of attempts made
     */
    public int attempts() {
        return attempts;
    }
}
