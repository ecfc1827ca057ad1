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

import java.net.ConnectException;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pkisession.exceptions.ClientCertificateException;
import org.pkisession.exceptions.ConfigurationException;
import org.pkisession.exceptions.RetriesExhaustedException;
import org.pkisession.exceptions.ServerCertificateException;
import org.pkisession.exceptions.TransientNetworkException;
import org.pkisession.exceptions.TransientNetworkException.Kind;

class RequestFailuresTest {
    private static final String URL = "https://api.example.com";

    @Test
    void describesCertificateFailures() {
        var handshake = new SSLHandshakeException("bad_certificate");

        assertEquals(
                "PKI client certificate error - check that the certificate is valid and accepted by the server",
                RequestFailures.describe(new ClientCertificateException("GET", URL, "rejected", true, handshake)));
        assertEquals(
                "Server certificate verification failed - check the CA chain or disable SSL verification",
                RequestFailures.describe(new ServerCertificateException("GET", URL, "untrusted", handshake)));
    }

    @Test
    void describesNetworkFailures() {
        var cause = new ConnectException();

        assertEquals(
                "Server not found - check the base URL",
                RequestFailures.describe(new TransientNetworkException("GET", URL, Kind.DNS, "dns", cause)));
        assertEquals(
                "Connection timed out - server may be slow or unreachable",
                RequestFailures.describe(new TransientNetworkException("GET", URL, Kind.TIMEOUT, "timeout", cause)));
        assertEquals(
                "Cannot connect to server - check URL and network connection",
                RequestFailures.describe(new TransientNetworkException("GET", URL, Kind.CONNECTION, "refused", cause)));
    }

    @Test
    void describesExhaustedRetriesByStatus() {
        assertEquals(
                "Rate limited - too many requests, try again later",
                RequestFailures.describe(new RetriesExhaustedException("GET", URL, 429, 4)));
    }

    @Test
    void describesMissingConfiguration() {
        assertEquals(
                "Session is not configured",
                RequestFailures.describe(new ConfigurationException("Session not configured")));
    }

    @Test
    void fallsBackToMessage() {
        assertEquals("boom", RequestFailures.describe(new IllegalStateException("boom")));
        assertEquals("IllegalStateException", RequestFailures.describe(new IllegalStateException()));
    }

    @ParameterizedTest
    @CsvSource({
        "401, Authentication failed - check your credentials",
        "403, Authentication failed - check your credentials",
        "429, 'Rate limited - too many requests, try again later'",
        "502, Server error - the API service is having issues",
        "404, HTTP 404"
    })
    void describesStatuses(int statusCode, String description) {
        assertEquals(description, RequestFailures.describeStatus(statusCode));
    }
}
