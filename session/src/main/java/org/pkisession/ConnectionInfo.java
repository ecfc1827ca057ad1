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

import java.time.Duration;
import java.util.Map;

/**
 * Snapshot of the session and its connection pool.
 *
 * @param sessionConfigured {@code true} between {@code configure} and {@code close}
 * @param defaultTimeout the default request timeout
 * @param maxRetries retries after the first attempt
 * @param backoffFactor the backoff factor in seconds
 * @param poolConnections the number of hosts connections are pooled for
 * @param poolMaxSize the maximum number of connections per host
 * @param headers the default headers
 * @param pkiInfo the applied security
 * @param appliedReconfigurations security configurations applied since creation
 * @param skippedReconfigurations reconfigurations skipped because nothing changed
 * @param idleConnections idle pooled connections
 * @param connections all pooled connections
 */
public record ConnectionInfo(
        boolean sessionConfigured,
        Duration defaultTimeout,
        int maxRetries,
        double backoffFactor,
        int poolConnections,
        int poolMaxSize,
        Map<String, String> headers,
        PkiInfo pkiInfo,
        long appliedReconfigurations,
        long skippedReconfigurations,
        int idleConnections,
        int connections) {
    public ConnectionInfo {
        headers = Map.copyOf(headers);
    }
}
