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
import java.nio.file.Path;

/**
 * A CA chain is configured but its file is not on disk. Verification falls back to the system CA bundle and this
 * exception is only ever logged.
 */
public class CaCertificateFileMissingException extends SessionException {
    @Serial
    private static final long serialVersionUID = -4520771839032278812L;

    private final transient Path caChainPath;

    public CaCertificateFileMissingException(String message, Path caChainPath) {
        super(message);
        this.caChainPath = caChainPath;
    }

    public Path caChainPath() {
        return caChainPath;
    }
}
