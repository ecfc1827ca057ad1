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
package org.pkisession.internal.pki;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import javax.security.auth.x500.X500Principal;
import org.pkisession.CertificateInfo;

public final class CertificateInspector {
    private static final byte[] CHALLENGE = "pki-session key match".getBytes(StandardCharsets.US_ASCII);

    private CertificateInspector() {}

    /**
     * Reads every certificate of a PEM or DER file.
     *
     * @param path the file
     * @return the certificates in file order, never empty
     * @throws CertificateException if the file holds no certificate or a malformed one
     * @throws IOException if the file cannot be read
     */
    public static List<X509Certificate> readCertificates(Path path) throws CertificateException, IOException {
        var certificateFactory = CertificateFactory.getInstance("X.509");
        try (InputStream in = Files.newInputStream(path)) {
            var certificates = new ArrayList<X509Certificate>();
            for (var certificate : certificateFactory.generateCertificates(in)) {
                certificates.add((X509Certificate) certificate);
            }
            if (certificates.isEmpty()) {
                throw new CertificateException("No certificate found in " + path);
            }
            return certificates;
        }
    }

    public static CertificateInfo inspect(X509Certificate certificate, Instant now) throws CertificateException {
        var notBefore = certificate.getNotBefore().toInstant();
        var notAfter = certificate.getNotAfter().toInstant();
        return new CertificateInfo(
                certificate.getSubjectX500Principal().getName(X500Principal.RFC2253),
                certificate.getIssuerX500Principal().getName(X500Principal.RFC2253),
                certificate.getSerialNumber().toString(),
                notBefore,
                notAfter,
                fingerprint(certificate),
                keyUsage(certificate),
                !now.isBefore(notBefore) && !now.isAfter(notAfter),
                Duration.between(now, notAfter).toDays());
    }

    /**
     * Checks that the private key belongs to the certificate by signing a fixed challenge and verifying it with the
     * certificate's public key.
     */
    public static boolean matches(PrivateKey privateKey, X509Certificate certificate) throws GeneralSecurityException {
        var algorithm =
                switch (privateKey.getAlgorithm()) {
                    case "RSA" -> "SHA256withRSA";
                    case "EC" -> "SHA256withECDSA";
                    case "Ed25519", "EdDSA" -> "Ed25519";
                    case "DSA" -> "SHA256withDSA";
                    default -> throw new GeneralSecurityException(
                            "Unsupported private key algorithm: " + privateKey.getAlgorithm());
                };
        var signer = Signature.getInstance(algorithm);
        signer.initSign(privateKey);
        signer.update(CHALLENGE);
        var signature = signer.sign();

        var verifier = Signature.getInstance(algorithm);
        verifier.initVerify(certificate.getPublicKey());
        verifier.update(CHALLENGE);
        return verifier.verify(signature);
    }

    private static String fingerprint(X509Certificate certificate) throws CertificateException {
        try {
            var digest = MessageDigest.getInstance("SHA-256").digest(certificate.getEncoded());
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new CertificateException("Unable to compute certificate fingerprint", e);
        }
    }

    private static List<String> keyUsage(X509Certificate certificate) {
        var usage = certificate.getKeyUsage();
        if (usage == null) {
            return List.of();
        }
        var result = new ArrayList<String>();
        if (usage[0]) {
            result.add("Digital Signature");
        }
        if (usage.length > 2 && usage[2]) {
            result.add("Key Encipherment");
        }
        if (usage.length > 4 && usage[4]) {
            result.add("Key Agreement");
        }
        return result;
    }
}
