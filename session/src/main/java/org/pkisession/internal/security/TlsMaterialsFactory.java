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
package org.pkisession.internal.security;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import org.pkisession.ClientCertificate;
import org.pkisession.Logger;
import org.pkisession.Logging;
import org.pkisession.SecurityConfig;
import org.pkisession.VerifyMode;
import org.pkisession.internal.pki.CertificateInspector;
import org.pkisession.internal.pki.PemPrivateKeys;

/**
 * Builds the TLS materials for a {@link SecurityConfig}.
 * <p>
 * Unreadable certificate material degrades the configuration instead of failing: a client identity that cannot be
 * loaded is dropped and a custom CA chain that cannot be loaded is replaced by the system CA bundle.
 */
public class TlsMaterialsFactory {
    private static final char[] KEY_STORE_PASSWORD = "pki-session".toCharArray();
    private static final HostnameVerifier ACCEPT_ALL_HOSTNAMES = (hostname, session) -> true;

    private final Logger log;

    public TlsMaterialsFactory(Logging logging) {
        this.log = logging.getLog(getClass());
    }

    public TlsMaterials create(SecurityConfig requested) {
        var effective = requested;

        var keyManagers = new KeyManager[0];
        if (requested.hasClientCertificate()) {
            try {
                keyManagers = createKeyManagers(requested.clientCertificate());
            } catch (IOException | GeneralSecurityException e) {
                log.error(
                        "Unable to load client certificate " + requested.clientCertificate().certificate()
                                + ", continuing without client certificate",
                        e);
                effective = new SecurityConfig(effective.verify(), null);
            }
        }

        X509TrustManager trustManager;
        try {
            trustManager = trustManager(effective.verify());
        } catch (IOException | GeneralSecurityException e) {
            log.error("Unable to load CA chain for " + effective.verify() + ", falling back to system CA bundle", e);
            effective = new SecurityConfig(VerifyMode.systemCa(), effective.clientCertificate());
            trustManager = systemTrustManager();
        }

        try {
            var sslContext = SSLContext.getInstance("TLS");
            sslContext.init(keyManagers, new TrustManager[] {trustManager}, null);
            var hostnameVerifier =
                    effective.verify().strategy() == VerifyMode.Strategy.DISABLED ? ACCEPT_ALL_HOSTNAMES : null;
            return new TlsMaterials(effective, sslContext.getSocketFactory(), trustManager, hostnameVerifier);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to create TLS context", e);
        }
    }

    private X509TrustManager trustManager(VerifyMode verify) throws IOException, GeneralSecurityException {
        return switch (verify.strategy()) {
            case DISABLED -> new TrustAllTrustManager();
            case CUSTOM_CA -> customTrustManager((VerifyMode.CustomCa) verify);
            case SYSTEM_CA -> systemTrustManager();
        };
    }

    private static X509TrustManager customTrustManager(VerifyMode.CustomCa verify)
            throws IOException, GeneralSecurityException {
        var trustedKeyStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustedKeyStore.load(null, null);
        var certificates = CertificateInspector.readCertificates(verify.caChainPath());
        for (var i = 0; i < certificates.size(); i++) {
            trustedKeyStore.setCertificateEntry("pki-session.trusted." + i, certificates.get(i));
        }
        var trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        trustManagerFactory.init(trustedKeyStore);
        return x509TrustManager(trustManagerFactory);
    }

    private static X509TrustManager systemTrustManager() {
        try {
            var trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagerFactory.init((KeyStore) null);
            return x509TrustManager(trustManagerFactory);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("No system certificates found", e);
        }
    }

    private static X509TrustManager x509TrustManager(TrustManagerFactory factory) throws CertificateException {
        return Arrays.stream(factory.getTrustManagers())
                .filter(X509TrustManager.class::isInstance)
                .map(X509TrustManager.class::cast)
                .findFirst()
                .orElseThrow(() -> new CertificateException("No X.509 trust manager available"));
    }

    private static KeyManager[] createKeyManagers(ClientCertificate clientCertificate)
            throws IOException, GeneralSecurityException {
        var chain = CertificateInspector.readCertificates(clientCertificate.certificate());
        var key = PemPrivateKeys.read(clientCertificate.privateKey());

        var clientKeyStore = KeyStore.getInstance("PKCS12");
        clientKeyStore.load(null, null);
        clientKeyStore.setKeyEntry(
                "pki-session.clientcert", key, KEY_STORE_PASSWORD, chain.toArray(new X509Certificate[0]));

        var keyManagerFactory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        keyManagerFactory.init(clientKeyStore, KEY_STORE_PASSWORD);
        return keyManagerFactory.getKeyManagers();
    }

    static class TrustAllTrustManager implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            throw new CertificateException("All client connections to this client are forbidden.");
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // all fine, pass through
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
