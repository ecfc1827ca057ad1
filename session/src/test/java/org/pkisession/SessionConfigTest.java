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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

class SessionConfigTest {
    @Test
    void shouldDefaultToTimeoutRetriesAndPoolSizes() {
        var config = SessionConfig.defaultConfig();

        assertEquals(Duration.ofSeconds(30), config.timeout());
        assertEquals(3, config.maxRetries());
        assertEquals(0.3, config.backoffFactor());
        assertEquals(10, config.poolConnections());
        assertEquals(20, config.poolMaxSize());
        assertEquals("pki-session/1.0", config.userAgent());
    }

    @Test
    void shouldSendJsonHeadersByDefault() {
        var headers = SessionConfig.builder()
                .withUserAgent("ghost/2.0")
                .withDefaultHeader("Authorization", "Bearer token")
                .build()
                .defaultHeaders();

        assertEquals(
                List.of("User-Agent", "Accept", "Content-Type", "Authorization"), List.copyOf(headers.keySet()));
        assertEquals("ghost/2.0", headers.get("User-Agent"));
        assertEquals("application/json", headers.get("Accept"));
        assertEquals("application/json", headers.get("Content-Type"));
    }

    @Test
    void defaultHeaderMayReplaceBuiltInOnes() {
        var headers = SessionConfig.builder()
                .withDefaultHeader("Accept", "text/plain")
                .build()
                .defaultHeaders();

        assertEquals("text/plain", headers.get("Accept"));
        assertEquals(LinkedHashMap.class, headers.getClass());
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        var builder = SessionConfig.builder();

        var error = assertThrows(IllegalArgumentException.class, () -> builder.withTimeout(Duration.ZERO));
        assertEquals("The timeout must be positive, but was PT0S.", error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> builder.withTimeout(Duration.ofSeconds(-1)));
    }

    @Test
    void shouldRejectNegativeRetriesAndBackoff() {
        var builder = SessionConfig.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.withMaxRetries(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.withBackoffFactor(-0.5));
        assertThrows(IllegalArgumentException.class, () -> builder.withBackoffFactor(Double.NaN));
    }

    @Test
    void shouldRejectEmptyPools() {
        var builder = SessionConfig.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.withPoolConnections(0));
        assertThrows(IllegalArgumentException.class, () -> builder.withPoolMaxSize(0));
    }

    @Test
    void zeroRetriesIsAllowed() {
        assertEquals(0, SessionConfig.builder().withMaxRetries(0).build().maxRetries());
    }
}
