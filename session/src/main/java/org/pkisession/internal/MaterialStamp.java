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
package org.pkisession.internal;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import org.pkisession.SecurityConfig;
import org.pkisession.VerifyMode;

/**
 * Modification times of the certificate files a security configuration loads. Material replaced in place under the
 * same paths changes the stamp while the configuration itself stays equal.
 */
record MaterialStamp(List<FileTime> modified) {
    private static final FileTime ABSENT = FileTime.fromMillis(0);

    MaterialStamp {
        modified = List.copyOf(modified);
    }

    static MaterialStamp of(SecurityConfig config) {
        var files = new ArrayList<Path>();
        if (config.hasClientCertificate()) {
            files.add(config.clientCertificate().certificate());
            files.add(config.clientCertificate().privateKey());
        }
        if (config.verify() instanceof VerifyMode.CustomCa customCa) {
            files.add(customCa.caChainPath());
        }
        var modified = new ArrayList<FileTime>(files.size());
        for (var file : files) {
            modified.add(lastModified(file));
        }
        return new MaterialStamp(modified);
    }

    private static FileTime lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return ABSENT;
        }
    }
}
