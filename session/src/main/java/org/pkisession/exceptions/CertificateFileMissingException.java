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
import java.util.List;

/**
 * PKI is enabled but the client certificate or its private key is not on disk.
 * <p>
 * Never thrown to request callers. The client certificate is dropped from the resolved configuration and this
 * exception is logged as the cause of the warning.
 */
public class CertificateFileMissingException extends SessionException {
    @Serial
    private static final long serialVersionUID = 3157245528913601022L;

    private final transient List<Path> missingFiles;

    /**
     * Creates a new instance.
     *
     * @param message the message
     * @param missingFiles the files that were not found
     */
    public CertificateFileMissingException(String message, List<Path> missingFiles) {
        super(message);
        this.missingFiles = List.copyOf(missingFiles);
    }

    /**
     * @return the files that were not found
     */
    public List<Path> missingFiles() {
        return missingFiles;
    }
}
