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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.security.cert.CertPathBuilderException;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateException;
import java.util.List;
import java.util.Locale;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLPeerUnverifiedException;
import org.pkisession.exceptions.ClientCertificateException;
import org.pkisession.exceptions.RequestException;
import org.pkisession.exceptions.SecurityException;
import org.pkisession.exceptions.ServerCertificateException;
import org.pkisession.exceptions.TransientNetworkException;
import org.pkisession.exceptions.TransientNetworkException.Kind;

/**
 * Turns transport failures into typed request exceptions.
 */
public final class IOExceptionTranslator {
    // TLS alerts a server sends when it does not accept the client identity
    private static final List<String> CLIENT_CERTIFICATE_ALERTS =
            List.of("bad_certificate", "certificate_required", "unknown_ca", "certificate_unknown", "access_denied");

    private IOExceptionTranslator() {}

    public static RequestException translate(
            String method, String url, IOException error, boolean clientCertificatePresented) {
        if (error instanceof SSLException sslError) {
            return translateTls(method, url, sslError, clientCertificatePresented);
        } else if (error instanceof SocketTimeoutException) {
            return new TransientNetworkException(method, url, Kind.TIMEOUT, "Request to " + url + " timed out", error);
        } else if (error instanceof UnknownHostException) {
            return new TransientNetworkException(
                    method, url, Kind.DNS, "Unable to resolve host of " + url + ": " + error.getMessage(), error);
        } else if (error instanceof InterruptedIOException) {
            return new RequestException(method, url, "Request to " + url + " was interrupted", error);
        }
        return new TransientNetworkException(
                method, url, Kind.CONNECTION, "Unable to connect to " + url + ": " + error.getMessage(), error);
    }

    private static SecurityException translateTls(
            String method, String url, SSLException error, boolean clientCertificatePresented) {
        if (error instanceof SSLPeerUnverifiedException) {
            return new ServerCertificateException(
                    method, url, "Server certificate does not match host of " + url + ": " + error.getMessage(), error);
        }
        if (error instanceof HandshakeRejectedException) {
            return clientCertificateRejected(method, url, clientCertificatePresented, error);
        }
        if (hasCertificateCause(error)) {
            return new ServerCertificateException(
                    method, url, "Server certificate verification failed for " + url, error);
        }
        var message = String.valueOf(error.getMessage()).toLowerCase(Locale.ROOT);
        if (CLIENT_CERTIFICATE_ALERTS.stream().anyMatch(message::contains)) {
            return clientCertificateRejected(method, url, clientCertificatePresented, error);
        }
        return new SecurityException(
                method, url, "TLS handshake with " + url + " failed: " + error.getMessage(), error);
    }

    private static ClientCertificateException clientCertificateRejected(
            String method, String url, boolean clientCertificatePresented, SSLException error) {
        var text = clientCertificatePresented
                ? "Server rejected the client certificate for " + url
                : "Server requires a client certificate for " + url;
        return new ClientCertificateException(method, url, text, clientCertificatePresented, error);
    }

    private static boolean hasCertificateCause(Throwable error) {
        for (var cause = error.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof CertificateException
                    || cause instanceof CertPathBuilderException
                    || cause instanceof CertPathValidatorException) {
                return true;
            }
        }
        return false;
    }
}
