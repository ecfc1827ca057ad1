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
package org.pkisession.internal.http;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateException;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLPeerUnverifiedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pkisession.exceptions.ClientCertificateException;
import org.pkisession.exceptions.RequestException;
import org.pkisession.exceptions.SecurityException;
import org.pkisession.exceptions.ServerCertificateException;
import org.pkisession.exceptions.TransientNetworkException;
import org.pkisession.exceptions.TransientNetworkException.Kind;

class IOExceptionTranslatorTest {
    private static final String URL = "https://api.example.com/v1/models";

    @Test
    void connectionDroppedAfterHandshakeIsClientCertificateRejection() {
        var rejected = new HandshakeRejectedException(new SocketException("Broken pipe"));

        var error = IOExceptionTranslator.translate("GET", URL, rejected, false);

        assertThat(error, instanceOf(ClientCertificateException.class));
        assertFalse(((ClientCertificateException) error).clientCertificatePresented());
        assertEquals("Server requires a client certificate for " + URL, error.getMessage());
    }

    @Test
    void untrustedServerCertificate() {
        var handshakeFailure = new SSLHandshakeException("PKIX path building failed");
        handshakeFailure.initCause(new CertificateException(new CertPathValidatorException("untrusted")));

        var error = IOExceptionTranslator.translate("GET", URL, handshakeFailure, false);

        assertThat(error, instanceOf(ServerCertificateException.class));
        assertSame(handshakeFailure, error.getCause());
        assertEquals("GET", error.method());
        assertEquals(URL, error.url());
    }

    @Test
    void hostnameMismatch() {
        var error = IOExceptionTranslator.translate(
                "GET", URL, new SSLPeerUnverifiedException("Hostname api.example.com not verified"), false);

        assertThat(error, instanceOf(ServerCertificateException.class));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "Received fatal alert: bad_certificate",
                "Received fatal alert: certificate_required",
                "Received fatal alert: unknown_ca"
            })
    void rejectedClientCertificate(String alert) {
        var error = IOExceptionTranslator.translate("POST", URL, new SSLHandshakeException(alert), true);

        assertThat(error, instanceOf(ClientCertificateException.class));
        assertTrue(((ClientCertificateException) error).clientCertificatePresented());
        assertEquals("Server rejected the client certificate for " + URL, error.getMessage());
    }

    @Test
    void missingClientCertificate() {
        var error = IOExceptionTranslator.translate(
                "GET", URL, new SSLHandshakeException("Received fatal alert: certificate_required"), false);

        assertFalse(((ClientCertificateException) error).clientCertificatePresented());
        assertEquals("Server requires a client certificate for " + URL, error.getMessage());
    }

    @Test
    void otherTlsFailure() {
        var error = IOExceptionTranslator.translate("GET", URL, new SSLException("Unsupported protocol"), false);

        assertEquals(SecurityException.class, error.getClass());
    }

    @Test
    void timeout() {
        var error = IOExceptionTranslator.translate("GET", URL, new SocketTimeoutException("Read timed out"), false);

        assertEquals(Kind.TIMEOUT, ((TransientNetworkException) error).kind());
    }

    @Test
    void unknownHost() {
        var error = IOExceptionTranslator.translate("GET", URL, new UnknownHostException("api.example.com"), false);

        assertEquals(Kind.DNS, ((TransientNetworkException) error).kind());
    }

    @Test
    void connectionFailure() {
        IOException failure = new ConnectException("Connection refused");

        var error = IOExceptionTranslator.translate("GET", URL, failure, false);

        assertEquals(Kind.CONNECTION, ((TransientNetworkException) error).kind());
        assertEquals("Unable to connect to " + URL + ": Connection refused", error.getMessage());
    }

    @Test
    void interruption() {
        var error = IOExceptionTranslator.translate("GET", URL, new InterruptedIOException("interrupted"), false);

        assertEquals(RequestException.class, error.getClass());
    }
}
