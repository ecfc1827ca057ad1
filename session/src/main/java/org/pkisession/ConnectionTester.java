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

import static java.util.concurrent.TimeUnit.SECONDS;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import org.pkisession.exceptions.RequestException;
import org.pkisession.exceptions.RetriesExhaustedException;
import org.pkisession.exceptions.TransientNetworkException;

/**
 * Tests a URL through the session to check that the current PKI and SSL settings work against it.
 * <p>
 * A test is a {@code GET} with a 10 second timeout. Transient failures are tried up to three times, two seconds
 * apart; TLS failures and error statuses end the test at once.
 */
public final class ConnectionTester {
    static final int MAX_ATTEMPTS = 3;
    static final long DELAY_BETWEEN_ATTEMPTS_MS = SECONDS.toMillis(2);
    private static final Duration TEST_TIMEOUT = Duration.ofSeconds(10);

    private final SessionManager sessionManager;
    private final CertificateStore certificateStore;
    private final Pause pause;
    private final Logger log;

    public ConnectionTester(SessionManager sessionManager, CertificateStore certificateStore, Logging logging) {
        this(sessionManager, certificateStore, Thread::sleep, logging);
    }

    ConnectionTester(
            SessionManager sessionManager, CertificateStore certificateStore, Pause pause, Logging logging) {
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.certificateStore = Objects.requireNonNull(certificateStore, "certificateStore");
        this.pause = pause;
        this.log = logging.getLog(getClass());
    }

    /**
     * Tests the URL presenting the client certificate. Fails without a request when PKI is disabled.
     *
     * @param url the URL
     * @return the outcome
     * @throws org.pkisession.exceptions.ConfigurationException if the session is not configured
     */
    public ConnectionTestResult testPkiConnection(String url) {
        if (!certificateStore.isPkiEnabled()) {
            return ConnectionTestResult.failed(url, OptionalInt.empty(), "PKI is not enabled");
        }
        log.info("Testing PKI connection to %s", url);
        return attempt(url);
    }

    /**
     * Tests the URL with the current SSL verification settings.
     *
     * @param url the URL
     * @return the outcome
     */
    public ConnectionTestResult testSslConfiguration(String url) {
        log.info("Testing SSL configuration against %s", url);
        return attempt(url);
    }

    private ConnectionTestResult attempt(String url) {
        var options = RequestOptions.builder().withTimeout(TEST_TIMEOUT).build();
        var lastStatus = OptionalInt.empty();
        String lastError = null;
        for (var attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                var response = sessionManager.makeRequest("GET", url, options);
                if (response.statusCode() < 400) {
                    log.info("Connection test to %s succeeded on attempt %s", url, attempt);
                    return ConnectionTestResult.succeeded(url, response.statusCode());
                }
                log.warn("Connection test to %s answered HTTP %s", url, response.statusCode());
                var status = response.statusCode();
                return ConnectionTestResult.failed(url, OptionalInt.of(status), RequestFailures.describeStatus(status));
            } catch (TransientNetworkException | RetriesExhaustedException e) {
                log.warn("Connection test attempt %s/%s to %s failed: %s", attempt, MAX_ATTEMPTS, url, e.getMessage());
                lastError = RequestFailures.describe(e);
                if (e instanceof RetriesExhaustedException retriesExhausted) {
                    lastStatus = OptionalInt.of(retriesExhausted.statusCode());
                }
            } catch (RequestException e) {
                log.warn("Connection test to %s failed: %s", url, e.getMessage());
                return ConnectionTestResult.failed(url, OptionalInt.empty(), RequestFailures.describe(e));
            }
            if (attempt < MAX_ATTEMPTS && !pauseBetweenAttempts()) {
                break;
            }
        }
        return ConnectionTestResult.failed(
                url, lastStatus, "Connection failed after " + MAX_ATTEMPTS + " attempts: " + lastError);
    }

    private boolean pauseBetweenAttempts() {
        try {
            pause.sleep(DELAY_BETWEEN_ATTEMPTS_MS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @FunctionalInterface
    interface Pause {
        void sleep(long millis) throws InterruptedException;
    }
}
