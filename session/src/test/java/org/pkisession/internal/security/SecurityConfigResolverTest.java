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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.pkisession.internal.logging.DevNullLogging.DEV_NULL_LOGGING;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.pkisession.ClientCertificate;
import org.pkisession.SecurityConfig;
import org.pkisession.VerifyMode;
import org.pkisession.exceptions.CaCertificateFileMissingException;
import org.pkisession.exceptions.CertificateFileMissingException;
import org.pkisession.internal.SecuritySettings;
import org.pkisession.testutil.RecordingLogging;

class SecurityConfigResolverTest {
    private static final Path CERT = Path.of("/pki/client.crt");
    private static final Path KEY = Path.of("/pki/client.key");
    private static final Path CA_CHAIN = Path.of("/pki/ca-chain.pem");
    private static final Path CUSTOM_CA = Path.of("/etc/ssl/custom-ca.pem");

    private static SecurityConfigResolver resolver(Set<Path> existingFiles) {
        return new SecurityConfigResolver(existingFiles::contains, DEV_NULL_LOGGING);
    }

    @Nested
    class Scenarios {
        @Test
        void pkiDisabledUsesSystemCaWithoutClientCertificate() {
            var settings = SecuritySettings.builder().build();

            var config = resolver(Set.of(CERT, KEY, CA_CHAIN)).compute(settings, false);

            assertEquals(new SecurityConfig(VerifyMode.systemCa(), null), config);
            assertEquals(SecurityConfig.DEFAULT, config);
        }

        @Test
        void missingCaChainFallsBackToSystemCaAndKeepsClientCertificate() {
            var logging = new RecordingLogging();
            var settings = SecuritySettings.builder()
                    .withPkiEnabled(true)
                    .withClientCertificate(CERT, KEY)
                    .withCaChain(CA_CHAIN)
                    .build();

            var resolution = new SecurityConfigResolver(Set.of(CERT, KEY)::contains, logging).resolve(settings, false);

            assertEquals(
                    new SecurityConfig(VerifyMode.systemCa(), new ClientCertificate(CERT, KEY)), resolution.config());
            assertThat(resolution.warnings(), contains(instanceOf(CaCertificateFileMissingException.class)));
            assertThat(
                    logging.lines("WARN"),
                    contains("PKI CA chain file not found: " + CA_CHAIN + ", falling back to system CA bundle"));
        }

        @Test
        void ignoreSslWinsOverCaChainAndKeepsClientCertificate() {
            var settings = SecuritySettings.builder()
                    .withPkiEnabled(true)
                    .withClientCertificate(CERT, KEY)
                    .withCaChain(CA_CHAIN)
                    .withIgnoreSslVerification(true)
                    .build();

            var config = resolver(Set.of(CERT, KEY, CA_CHAIN)).compute(settings, false);

            assertEquals(new SecurityConfig(VerifyMode.disabled(), new ClientCertificate(CERT, KEY)), config);
        }

        @Test
        void missingCertificateDropsClientCertificateAndWarns() {
            var logging = new RecordingLogging();
            var settings = SecuritySettings.builder()
                    .withPkiEnabled(true)
                    .withClientCertificate(CERT, KEY)
                    .withCaChain(CA_CHAIN)
                    .build();

            var resolution =
                    new SecurityConfigResolver(Set.of(KEY, CA_CHAIN)::contains, logging).resolve(settings, false);

            assertNull(resolution.config().clientCertificate());
            assertEquals(VerifyMode.customCa(CA_CHAIN), resolution.config().verify());
            assertThat(resolution.warnings(), contains(instanceOf(CertificateFileMissingException.class)));
            var missing = (CertificateFileMissingException) resolution.warnings().get(0);
            assertEquals(List.of(CERT), missing.missingFiles());
            assertThat(
                    logging.lines("WARN"),
                    contains("PKI enabled but client certificate files not found: cert=" + CERT));
        }

        @Test
        void listsEveryMissingClientCertificateFile() {
            var logging = new RecordingLogging();
            var settings = SecuritySettings.builder()
                    .withPkiEnabled(true)
                    .withClientCertificate(CERT, KEY)
                    .build();

            new SecurityConfigResolver(Set.<Path>of()::contains, logging).resolve(settings, false);

            assertThat(
                    logging.lines("WARN"),
                    contains("PKI enabled but client certificate files not found: cert=" + CERT + ", key=" + KEY));
        }

        @Test
        void warnsWhenPkiEnabledWithoutConfiguredCertificate() {
            var settings = SecuritySettings.builder().withPkiEnabled(true).build();

            var resolution = resolver(Set.of()).resolve(settings, false);

            assertEquals(SecurityConfig.DEFAULT, resolution.config());
            assertThat(resolution.warnings(), contains(instanceOf(CertificateFileMissingException.class)));
        }
    }

    @Nested
    class CustomCa {
        @Test
        void usedWhenPkiEnabledAndNoCaChainConfigured() {
            var settings = SecuritySettings.builder()
                    .withPkiEnabled(true)
                    .withClientCertificate(CERT, KEY)
                    .withCustomCa(CUSTOM_CA)
                    .build();

            var config = resolver(Set.of(CERT, KEY, CUSTOM_CA)).compute(settings, false);

            assertEquals(VerifyMode.customCa(CUSTOM_CA), config.verify());
        }

        @Test
        void ignoredWhenPkiDisabled() {
            var settings = SecuritySettings.builder().withCustomCa(CUSTOM_CA).build();

            var config = resolver(Set.of(CUSTOM_CA)).compute(settings, false);

            assertEquals(VerifyMode.systemCa(), config.verify());
        }

        @Test
        void neverReplacesMissingCaChain() {
            var settings = SecuritySettings.builder()
                    .withPkiEnabled(true)
                    .withCaChain(CA_CHAIN)
                    .withCustomCa(CUSTOM_CA)
                    .build();

            var config = resolver(Set.of(CUSTOM_CA)).compute(settings, false);

            assertEquals(VerifyMode.systemCa(), config.verify());
        }
    }

    @ParameterizedTest
    @MethodSource("allCombinations")
    void runtimeOverrideAlwaysDisablesVerification(SecuritySettings settings, Set<Path> existingFiles) {
        var config = resolver(existingFiles).compute(settings, true);

        assertEquals(VerifyMode.disabled(), config.verify());
    }

    @ParameterizedTest
    @MethodSource("allCombinations")
    void persistedIgnoreSslAlwaysDisablesVerification(SecuritySettings settings, Set<Path> existingFiles) {
        var ignoring = new SecuritySettings(
                settings.pkiEnabled(),
                settings.clientCertificate(),
                settings.caChainPath(),
                settings.customCaPath(),
                true);

        var config = resolver(existingFiles).compute(ignoring, false);

        assertEquals(VerifyMode.disabled(), config.verify());
    }

    @ParameterizedTest
    @MethodSource("allCombinations")
    void clientCertificateOnlyWhenPkiEnabledAndBothFilesExist(SecuritySettings settings, Set<Path> existingFiles) {
        for (var runtimeIgnoreSsl : new boolean[] {false, true}) {
            var config = resolver(existingFiles).compute(settings, runtimeIgnoreSsl);

            var expected = settings.pkiEnabled()
                    && settings.clientCertificate() != null
                    && existingFiles.contains(CERT)
                    && existingFiles.contains(KEY);
            assertEquals(expected, config.hasClientCertificate(), () -> settings + " " + existingFiles);
            if (expected) {
                assertEquals(new ClientCertificate(CERT, KEY), config.clientCertificate());
            }
        }
    }

    @ParameterizedTest
    @MethodSource("allCombinations")
    void customCaOnlyWhenPkiEnabledAndChainExists(SecuritySettings settings, Set<Path> existingFiles) {
        var config = resolver(existingFiles).compute(settings, false);

        if (config.verify() instanceof VerifyMode.CustomCa customCa) {
            assertTrue(settings.pkiEnabled());
            assertTrue(existingFiles.contains(customCa.caChainPath()));
            assertEquals(false, settings.ignoreSslVerification());
        } else if (!settings.ignoreSslVerification()) {
            assertEquals(VerifyMode.systemCa(), config.verify());
        }
    }

    @ParameterizedTest
    @MethodSource("randomCombinations")
    void identicalInputsResolveIdentically(SecuritySettings settings, Set<Path> existingFiles, boolean runtimeIgnore) {
        var first = resolver(existingFiles).compute(settings, runtimeIgnore);
        var second = resolver(new HashSet<>(existingFiles)).compute(settings, runtimeIgnore);
        var copy = new SecuritySettings(
                settings.pkiEnabled(),
                settings.clientCertificate(),
                settings.caChainPath(),
                settings.customCaPath(),
                settings.ignoreSslVerification());

        assertEquals(first, second);
        assertEquals(first, resolver(existingFiles).compute(copy, runtimeIgnore));
        assertNotNull(first.verify());
    }

    @Test
    void resolutionWithoutProblemsHasNoWarnings() {
        var settings = SecuritySettings.builder()
                .withPkiEnabled(true)
                .withClientCertificate(CERT, KEY)
                .withCaChain(CA_CHAIN)
                .build();

        var resolution = resolver(Set.of(CERT, KEY, CA_CHAIN)).resolve(settings, false);

        assertThat(resolution.warnings(), empty());
        assertEquals(
                new SecurityConfig(VerifyMode.customCa(CA_CHAIN), new ClientCertificate(CERT, KEY)),
                resolution.config());
    }

    static Stream<Arguments> allCombinations() {
        var arguments = new ArrayList<Arguments>();
        for (var pkiEnabled : new boolean[] {false, true}) {
            for (var ignoreSsl : new boolean[] {false, true}) {
                for (var certificateConfigured : new boolean[] {false, true}) {
                    for (var caChainConfigured : new boolean[] {false, true}) {
                        for (var customCaConfigured : new boolean[] {false, true}) {
                            var settings = new SecuritySettings(
                                    pkiEnabled,
                                    certificateConfigured ? new ClientCertificate(CERT, KEY) : null,
                                    caChainConfigured ? CA_CHAIN : null,
                                    customCaConfigured ? CUSTOM_CA : null,
                                    ignoreSsl);
                            for (var existingFiles : fileCombinations()) {
                                arguments.add(Arguments.of(settings, existingFiles));
                            }
                        }
                    }
                }
            }
        }
        return arguments.stream();
    }

    static Stream<Arguments> randomCombinations() {
        var random = new Random(20241018L);
        var files = fileCombinations();
        return Stream.generate(() -> Arguments.of(
                        new SecuritySettings(
                                random.nextBoolean(),
                                random.nextBoolean() ? new ClientCertificate(CERT, KEY) : null,
                                random.nextBoolean() ? CA_CHAIN : null,
                                random.nextBoolean() ? CUSTOM_CA : null,
                                random.nextBoolean()),
                        files.get(random.nextInt(files.size())),
                        random.nextBoolean()))
                .limit(200);
    }

    private static List<Set<Path>> fileCombinations() {
        var all = List.of(CERT, KEY, CA_CHAIN, CUSTOM_CA);
        var combinations = new ArrayList<Set<Path>>();
        for (var mask = 0; mask < 1 << all.size(); mask++) {
            var existing = new HashSet<Path>();
            for (var i = 0; i < all.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    existing.add(all.get(i));
                }
            }
            combinations.add(Set.copyOf(existing));
        }
        return combinations;
    }
}
