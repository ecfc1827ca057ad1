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
 * The connection failed, was reset or timed out, and kept failing after all retries. Failures of earlier attempts are
 * attached as suppressed exceptions.
 */
public class TransientNetworkException extends RequestException {
    @Serial
    private static final long serialVersionUID = 8815063391738219046L;

    private final Kind kind;

    public TransientNetworkException(String method, String url, Kind kind, String message, Throwable cause) {
        super(method, url, message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public enum Kind {
        CONNECTION,
        DNS,
        TIMEOUT
    }
}
