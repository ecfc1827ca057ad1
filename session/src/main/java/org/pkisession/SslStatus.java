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
package org.pkisession;

import java.nio.file.Path;

/**
 * Snapshot of SSL verification.
 *
 * @param sslVerificationEnabled {@code false} when the applied verify mode is {@link VerifyMode.Disabled}
 * @param persistedIgnoreSsl the {@code advanced.ignore_ssl_verification} setting
 * @param runtimeOverride {@code true} while an {@link SslOverride} is open
 * @param customCaConfigured {@code true} if the applied verify mode trusts a custom CA chain
 * @param customCaPath the CA chain of the applied verify mode, {@code null} unless it is {@link VerifyMode.CustomCa}
 * @param customCaExists {@code true} if that CA chain file exists
 * @param verifyMode the applied verify mode
 */
public record SslStatus(
        boolean sslVerificationEnabled,
        boolean persistedIgnoreSsl,
        boolean runtimeOverride,
        boolean customCaConfigured,
        Path customCaPath,
        boolean customCaExists,
        VerifyMode verifyMode) {}
